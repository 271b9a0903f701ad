package com.example.standupbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Standup Bot Application
 * <p>
 * Notification engine behind a workplace chat bot: fires the daily standup and
 * health-check prompts, tracks who has answered, and escalates with a reminder
 * once a standup thread stays incomplete for too long.
 * <p>
 * Features:
 * - Fixed-time and fixed-interval jobs evaluated against an injectable clock
 * - Single scheduling thread owning all prompt and response state
 * - Once-per-day prompt deduplication with an explicit midnight reset
 * - Best-effort per-user broadcast with bounded Slack calls
 * - Slack alerting for failed jobs and failed broadcasts
 */
@SpringBootApplication
public class StandupBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(StandupBotApplication.class, args);
    }
}
