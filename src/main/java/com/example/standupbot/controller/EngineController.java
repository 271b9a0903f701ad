package com.example.standupbot.controller;

import com.example.standupbot.config.StandupBotProperties;
import com.example.standupbot.dto.ApiResponse;
import com.example.standupbot.dto.DailySummary;
import com.example.standupbot.dto.HealthCheckAnswerRequest;
import com.example.standupbot.dto.JobResponse;
import com.example.standupbot.dto.JobRunResult;
import com.example.standupbot.dto.StandupResponseRequest;
import com.example.standupbot.service.NotificationEngineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * REST API controller for the notification engine.
 * <p>
 * Provides endpoints for:
 * - Listing and manually triggering jobs
 * - Ingesting standup responses and health-check answers
 * - The daily summary
 * - Health
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/engine")
@Tag(name = "Notification Engine", description = "APIs for the standup and health-check prompt engine")
public class EngineController {

    private final NotificationEngineService engineService;
    private final StandupBotProperties properties;

    // === Jobs ===

    @GetMapping("/jobs")
    @Operation(summary = "List jobs", description = "List registered jobs with their run bookkeeping")
    public ResponseEntity<ApiResponse<List<JobResponse>>> listJobs() {
        return ResponseEntity.ok(ApiResponse.success(engineService.listJobs()));
    }

    @PostMapping("/jobs/{name}/trigger")
    @Operation(summary = "Trigger a job",
            description = "Run a job now on the dispatch thread, leaving its schedule untouched. "
                    + "Answers 202 when the job has not finished within the trigger wait")
    public ResponseEntity<ApiResponse<JobRunResult>> triggerJob(@Parameter(description = "Job name") @PathVariable String name) {
        log.info("API: Trigger job {}", name);

        var waitSeconds = properties.getDispatch().getTriggerWaitSeconds();
        try {
            var result = engineService.triggerNow(name).orTimeout(waitSeconds, TimeUnit.SECONDS).join();
            var message = result.isSuccess() ? "Job executed" : "Job failed: " + result.getErrorMessage();
            return ResponseEntity.ok(ApiResponse.success(result, message));
        } catch (CompletionException e) {
            var cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TimeoutException) {
                log.info("Job {} still queued or running after {}s", name, waitSeconds);
                return ResponseEntity.status(HttpStatus.ACCEPTED)
                        .body(ApiResponse.success(null, "Job still running after " + waitSeconds + "s"));
            }
            log.warn("Trigger of job {} rejected: {}", name, cause.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ApiResponse.error(cause.getMessage()));
        }
    }

    // === Responses ===

    @PostMapping("/responses/standup")
    @Operation(summary = "Record a standup response", description = "Queue a user's answer in a standup thread")
    public ResponseEntity<ApiResponse<Void>> recordStandupResponse(@Valid @RequestBody StandupResponseRequest request) {
        log.debug("API: Standup response from {} in thread {}", request.getUserId(), request.getThreadId());

        var outcome = engineService.recordResponse(request.getThreadId(), request.getUserId());
        if (outcome.isCompletedExceptionally()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ApiResponse.error("Engine is shut down"));
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.success(null, "Response accepted"));
    }

    @PostMapping("/responses/health-check")
    @Operation(summary = "Record a health-check answer", description = "Queue a user's health-check button click")
    public ResponseEntity<ApiResponse<Void>> recordHealthCheckAnswer(@Valid @RequestBody HealthCheckAnswerRequest request) {
        log.debug("API: Health check answer {} from {}", request.getAnswer(), request.getUserId());

        var applied = engineService.recordHealthCheckAnswer(request.getUserId(), request.getAnswer());
        if (applied.isCompletedExceptionally()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ApiResponse.error("Engine is shut down"));
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.success(null, "Answer accepted"));
    }

    // === Summary ===

    @GetMapping("/summary")
    @Operation(summary = "Daily summary", description = "Sent prompts and response counts of a day; defaults to today")
    public ResponseEntity<ApiResponse<DailySummary>> getSummary(
            @Parameter(description = "Date (yyyy-MM-dd)")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {

        var summary = date != null ? engineService.getDailySummary(date) : engineService.getTodaySummary();
        return ResponseEntity.ok(ApiResponse.success(summary));
    }

    // === Health Check ===

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Check if the notification engine is up")
    public ResponseEntity<ApiResponse<String>> healthCheck() {
        return ResponseEntity.ok(ApiResponse.success("OK", "Notification engine is running"));
    }
}
