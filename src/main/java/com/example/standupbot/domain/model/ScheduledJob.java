package com.example.standupbot.domain.model;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;

/**
 * A named recurring job and its run bookkeeping.
 * <p>
 * Bookkeeping is only written by the dispatch loop through the job registry.
 * A fixed-time job remembers the calendar date of its last run, a fixed-interval
 * job the instant of its last run.
 */
@Getter
public class ScheduledJob {

    private final String name;
    private final JobTrigger trigger;
    private final JobAction action;

    private volatile LocalDate lastRunDate;
    private volatile Instant lastRunInstant;
    private volatile long runCount;
    private volatile long failureCount;
    private volatile String lastError;

    public ScheduledJob(String name, JobTrigger trigger, JobAction action) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Job name is required");
        }
        this.name = name;
        this.trigger = Objects.requireNonNull(trigger, "trigger");
        this.action = Objects.requireNonNull(action, "action");
    }

    /**
     * Whether the trigger holds at {@code now} and the job has not run yet for the current period.
     * The fixed-time check compares calendar dates, so a skipped minute still fires on the next tick.
     */
    public boolean isDue(Instant now, ZoneId zone) {
        if (trigger.isFixedTime()) {
            var local = now.atZone(zone);
            return !local.toLocalTime().isBefore(trigger.getTimeOfDay())
                    && !local.toLocalDate().equals(lastRunDate);
        }
        return lastRunInstant == null
                || Duration.between(lastRunInstant, now).compareTo(trigger.getInterval()) >= 0;
    }

    /**
     * Record a run that started at {@code now}; {@code failure} is null when the action completed.
     */
    public void recordRun(Instant now, ZoneId zone, Exception failure) {
        lastRunInstant = now;
        lastRunDate = now.atZone(zone).toLocalDate();
        runCount++;
        if (failure != null) {
            failureCount++;
            lastError = failure.getClass().getSimpleName() + ": " + failure.getMessage();
        } else {
            lastError = null;
        }
    }
}
