package com.example.standupbot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Slack configuration properties
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "slack")
public class SlackProperties {
    private String botToken;
    private String channelId;
    private String webhookUrl;
    private String alertChannel = "#standup-bot-ops";
    private boolean enabled = true;

    public boolean isWebhookConfigured() {
        return enabled && webhookUrl != null && !webhookUrl.isBlank();
    }
}
