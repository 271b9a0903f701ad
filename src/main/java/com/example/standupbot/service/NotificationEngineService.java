package com.example.standupbot.service;

import com.example.standupbot.domain.enums.HealthCheckAnswer;
import com.example.standupbot.domain.model.JobAction;
import com.example.standupbot.domain.model.JobTrigger;
import com.example.standupbot.dto.DailySummary;
import com.example.standupbot.dto.JobResponse;
import com.example.standupbot.dto.JobRunResult;
import com.example.standupbot.mapper.JobMapper;
import com.example.standupbot.service.scheduler.DispatchLoop;
import com.example.standupbot.service.scheduler.JobRegistry;
import com.example.standupbot.service.tracker.DailyPromptTracker;
import com.example.standupbot.service.tracker.ResponseOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point of the notification engine for the API layer.
 * <p>
 * Provides:
 * - Job registration and manual triggering
 * - Response ingestion, funnelled onto the dispatch thread
 * - Daily summary and job listing
 */
@Service
@RequiredArgsConstructor
public class NotificationEngineService {

    private final JobRegistry jobRegistry;
    private final DispatchLoop dispatchLoop;
    private final DailyPromptTracker tracker;
    private final JobMapper jobMapper;

    // === Jobs ===

    /**
     * Register an additional recurring job
     *
     * @throws com.example.standupbot.exception.DuplicateJobException if the name is taken
     */
    public JobResponse registerJob(String name, JobTrigger trigger, JobAction action) {
        return jobMapper.toResponse(jobRegistry.register(name, trigger, action));
    }

    /**
     * Fire a job now, outside its schedule
     *
     * @throws com.example.standupbot.exception.JobNotFoundException if no job has that name
     */
    public CompletableFuture<JobRunResult> triggerNow(String jobName) {
        return dispatchLoop.triggerNow(jobName);
    }

    public List<JobResponse> listJobs() {
        return jobMapper.toResponseList(jobRegistry.getJobs());
    }

    // === Responses ===

    /**
     * Queue a standup response for the dispatch thread.
     * The future completes with the outcome once the tracker has applied it.
     */
    public CompletableFuture<ResponseOutcome> recordResponse(String threadId, String userId) {
        var outcome = new CompletableFuture<ResponseOutcome>();
        var accepted = dispatchLoop.submit("standup response of " + userId + " in " + threadId,
                () -> {
                    try {
                        outcome.complete(tracker.recordResponse(threadId, userId));
                    } catch (RuntimeException e) {
                        outcome.completeExceptionally(e);
                        throw e;
                    }
                });
        if (!accepted) {
            outcome.completeExceptionally(new IllegalStateException("Engine is shut down, response dropped"));
        }
        return outcome;
    }

    /**
     * Queue a health-check answer for the dispatch thread
     */
    public CompletableFuture<Void> recordHealthCheckAnswer(String userId, HealthCheckAnswer answer) {
        var applied = new CompletableFuture<Void>();
        var accepted = dispatchLoop.submit("health check answer of " + userId,
                () -> {
                    try {
                        tracker.recordHealthCheckAnswer(userId, answer);
                        applied.complete(null);
                    } catch (RuntimeException e) {
                        applied.completeExceptionally(e);
                        throw e;
                    }
                });
        if (!accepted) {
            applied.completeExceptionally(new IllegalStateException("Engine is shut down, answer dropped"));
        }
        return applied;
    }

    // === Reporting ===

    public DailySummary getDailySummary(LocalDate date) {
        return tracker.getDailySummary(date);
    }

    public DailySummary getTodaySummary() {
        return tracker.getDailySummary(tracker.getCurrentDate());
    }
}
