package com.example.standupbot.dto;

import com.example.standupbot.domain.enums.HealthCheckAnswer;
import com.example.standupbot.domain.enums.PromptKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Map;

/**
 * Prompt and response state of one day, for reporting consumers
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailySummary {

    private LocalDate date;

    /**
     * Sent flag per prompt kind
     */
    private Map<PromptKind, Boolean> prompts;

    private int activeStandups;
    private int standupExpected;
    private int standupResponded;
    private int standupPending;
    private int remindersSent;

    /**
     * Number of users per health-check answer
     */
    private Map<HealthCheckAnswer, Long> healthCheckAnswers;

    public boolean isSent(PromptKind kind) {
        return prompts != null && Boolean.TRUE.equals(prompts.get(kind));
    }
}
