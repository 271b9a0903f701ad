package com.example.standupbot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of a single job invocation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobRunResult {

    private String jobName;
    private boolean success;
    private String errorMessage;
    private Instant startedAt;
    private long durationMs;
    private boolean manual;
}
