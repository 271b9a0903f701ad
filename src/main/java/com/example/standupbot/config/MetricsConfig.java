package com.example.standupbot.config;

import com.example.standupbot.service.tracker.DailyPromptTracker;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics configuration for monitoring the notification engine.
 * <p>
 * Exposes Prometheus metrics for:
 * - Job execution times and failures
 * - Deliveries by purpose and outcome
 * - Reminders sent
 * - Active standup threads
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final DailyPromptTracker tracker;

    @PostConstruct
    public void initializeMetrics() {
        Gauge.builder("standup_bot_active_standups", tracker, DailyPromptTracker::activeStandupCount)
                .description("Standup threads tracked for the current day")
                .register(meterRegistry);
    }

    /**
     * Create a timer for a job execution
     */
    public Timer.Sample startJobTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record job execution time
     */
    public void recordJobExecution(Timer.Sample sample, String jobName, boolean success) {
        sample.stop(Timer.builder("standup_bot_job_execution_time")
                .tag("job", jobName)
                .tag("success", String.valueOf(success))
                .description("Job execution time")
                .register(meterRegistry));
    }

    /**
     * Record job failure
     */
    public void recordJobFailure(String jobName, String errorType) {
        meterRegistry.counter("standup_bot_job_failures",
                "job", jobName,
                "error_type", errorType != null ? errorType : "unknown"
        ).increment();
    }

    /**
     * Record one delivery attempt
     */
    public void recordDelivery(String purpose, boolean success) {
        meterRegistry.counter("standup_bot_deliveries",
                "purpose", purpose,
                "success", String.valueOf(success)
        ).increment();
    }

    /**
     * Record a failed Slack call
     */
    public void recordDeliveryFailure(String errorType) {
        meterRegistry.counter("standup_bot_delivery_failures",
                "error_type", errorType != null ? errorType : "unknown"
        ).increment();
    }

    /**
     * Record reminder sent to a standup thread
     */
    public void recordReminderSent(boolean delivered) {
        meterRegistry.counter("standup_bot_reminders", "delivered", String.valueOf(delivered)).increment();
    }
}
