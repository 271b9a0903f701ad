package com.example.standupbot.domain.enums;

/**
 * Daily prompts tracked by the prompt cycle.
 * Each kind is sent at most once per calendar day.
 */
public enum PromptKind {

    /**
     * Standup announcement in the team channel plus a direct prompt to each user
     */
    STANDUP,

    /**
     * Direct "how are you feeling" prompt with three answer buttons
     */
    HEALTH_CHECK
}
