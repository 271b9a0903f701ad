package com.example.standupbot.service.scheduler;

import com.example.standupbot.config.MetricsConfig;
import com.example.standupbot.config.StandupBotProperties;
import com.example.standupbot.domain.model.ScheduledJob;
import com.example.standupbot.dto.JobRunResult;
import com.example.standupbot.exception.JobNotFoundException;
import com.example.standupbot.service.alert.OperatorAlertService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The engine's control loop.
 * <p>
 * Owns the single dispatch thread. Every tick asks the {@link JobRegistry}
 * which jobs are due and runs them one after the other; a failing job is
 * logged and alerted but never keeps the remaining due jobs from running.
 * Response events and manual triggers are submitted to the same thread, so
 * all prompt state is mutated from one place.
 * <p>
 * Flow per tick:
 * 1. Read the clock
 * 2. Collect due jobs in registration order
 * 3. Run each job, then mark it as run (also when it failed)
 * 4. Stop early once shutdown has been requested
 * <p>
 * Run bookkeeping lives in memory only. After a restart every job starts with
 * empty bookkeeping, so a fixed-time job that already fired earlier that day
 * fires again on the first tick.
 */
@Slf4j
@Service
public class DispatchLoop implements SmartLifecycle {

    private final JobRegistry registry;
    private final MetricsConfig metricsConfig;
    private final OperatorAlertService alertService;
    private final StandupBotProperties properties;
    private final ScheduledExecutorService dispatchExecutor;
    private final Clock clock;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> tickHandle;
    private volatile boolean running;

    public DispatchLoop(JobRegistry registry, MetricsConfig metricsConfig, OperatorAlertService alertService,
                        StandupBotProperties properties,
                        @Qualifier("dispatchExecutor") ScheduledExecutorService dispatchExecutor, Clock clock) {
        this.registry = registry;
        this.metricsConfig = metricsConfig;
        this.alertService = alertService;
        this.properties = properties;
        this.dispatchExecutor = dispatchExecutor;
        this.clock = clock;
    }

    // === Lifecycle ===

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        var interval = properties.tickInterval();
        stopRequested.set(false);
        tickHandle = dispatchExecutor.scheduleWithFixedDelay(this::tick, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        running = true;
        log.info("Dispatch loop started with {} registered jobs, ticking every {}s", registry.size(), interval.toSeconds());
    }

    /**
     * Let the in-flight job finish, start no further job, and wait for the dispatch thread to drain.
     */
    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        log.info("Stopping dispatch loop");
        stopRequested.set(true);
        if (tickHandle != null) {
            tickHandle.cancel(false);
        }
        dispatchExecutor.shutdown();
        try {
            var timeout = properties.getShutdownTimeoutSeconds();
            if (!dispatchExecutor.awaitTermination(timeout, TimeUnit.SECONDS)) {
                log.warn("Dispatch thread still busy after {}s, leaving it behind", timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the dispatch thread");
        } finally {
            running = false;
        }
        log.info("Dispatch loop stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.getDispatch().isAutoStart();
    }

    // === Ticks ===

    /**
     * Scheduled entry point. Never throws, so the periodic schedule is never cancelled by an error.
     */
    void tick() {
        try {
            runDueJobs(clock.instant());
        } catch (Exception e) {
            log.error("Error in dispatch tick: {}", e.getMessage(), e);
        }
    }

    /**
     * Run every job due at {@code now}.
     *
     * @return number of jobs invoked
     */
    public int runDueJobs(Instant now) {
        var due = registry.dueJobs(now);
        if (due.isEmpty()) {
            log.trace("No jobs due at {}", now);
            return 0;
        }

        log.debug("{} jobs due at {}", due.size(), now);
        var invoked = 0;
        for (var job : due) {
            if (stopRequested.get()) {
                log.info("Stop requested, leaving {} due jobs unstarted", due.size() - invoked);
                break;
            }
            execute(job, now, false);
            invoked++;
        }
        return invoked;
    }

    // === Manual triggers and events ===

    /**
     * Run a job right away on the dispatch thread. Its schedule is left untouched.
     *
     * @throws JobNotFoundException if no job has that name
     */
    public CompletableFuture<JobRunResult> triggerNow(String jobName) {
        var job = registry.find(jobName).orElseThrow(() -> new JobNotFoundException(jobName));
        log.info("Manual trigger of job {}", jobName);
        try {
            return CompletableFuture.supplyAsync(() -> execute(job, clock.instant(), true), dispatchExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new IllegalStateException("Dispatch loop is shut down", e));
        }
    }

    /**
     * Hand an external event to the dispatch thread.
     *
     * @return false if the loop has shut down and the event was dropped
     */
    public boolean submit(String description, Runnable event) {
        try {
            dispatchExecutor.execute(() -> {
                try {
                    event.run();
                } catch (Exception e) {
                    log.error("Error applying {}: {}", description, e.getMessage(), e);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("Dispatch loop is shut down, dropped {}", description);
            return false;
        }
    }

    private JobRunResult execute(ScheduledJob job, Instant startedAt, boolean manual) {
        var timerSample = metricsConfig.startJobTimer();
        var start = System.nanoTime();
        Exception failure = null;

        try {
            log.info("Running job {}{}", job.getName(), manual ? " (manual)" : "");
            job.getAction().run();
        } catch (Exception e) {
            failure = e;
            log.error("Job {} failed: {}", job.getName(), e.getMessage(), e);
            metricsConfig.recordJobFailure(job.getName(), e.getClass().getSimpleName());
            alertService.sendJobFailureAlert(job.getName(), e);
        } finally {
            if (!manual) {
                registry.markRun(job, startedAt, failure);
            }
        }

        var durationMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
        metricsConfig.recordJobExecution(timerSample, job.getName(), failure == null);
        log.debug("Job {} finished in {}ms", job.getName(), durationMs);

        return JobRunResult.builder()
                .jobName(job.getName())
                .success(failure == null)
                .errorMessage(failure != null ? failure.getMessage() : null)
                .startedAt(startedAt)
                .durationMs(durationMs)
                .manual(manual)
                .build();
    }
}
