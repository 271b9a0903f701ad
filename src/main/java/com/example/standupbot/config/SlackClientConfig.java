package com.example.standupbot.config;

import com.slack.api.Slack;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Shared Slack SDK entry point for Web API calls and webhooks.
 */
@Configuration
public class SlackClientConfig {

    @Bean
    public Slack slack() {
        return Slack.getInstance();
    }
}
