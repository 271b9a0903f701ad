package com.example.standupbot.dto;

import com.example.standupbot.domain.enums.TriggerType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Response DTO for a registered job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResponse {

    private String name;
    private TriggerType triggerType;
    private String schedule;
    private LocalDate lastRunDate;
    private Instant lastRunAt;
    private long runCount;
    private long failureCount;
    private String lastError;
}
