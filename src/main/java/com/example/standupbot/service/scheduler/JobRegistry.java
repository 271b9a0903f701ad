package com.example.standupbot.service.scheduler;

import com.example.standupbot.domain.model.JobAction;
import com.example.standupbot.domain.model.JobTrigger;
import com.example.standupbot.domain.model.ScheduledJob;
import com.example.standupbot.exception.DuplicateJobException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of recurring jobs.
 * <p>
 * Decides which jobs are due for a given instant. Times of day and calendar
 * days are evaluated in the zone of the engine clock. Jobs keep their
 * registration order, which is also the order in which due jobs run.
 */
@Slf4j
@Component
public class JobRegistry {

    private final Map<String, ScheduledJob> jobs = new LinkedHashMap<>();

    @Getter
    private final ZoneId zone;

    public JobRegistry(Clock clock) {
        this.zone = clock.getZone();
    }

    /**
     * Register a job under its unique name
     *
     * @throws DuplicateJobException if the name is taken
     */
    public synchronized ScheduledJob register(ScheduledJob job) {
        if (jobs.containsKey(job.getName())) {
            throw new DuplicateJobException(job.getName());
        }
        jobs.put(job.getName(), job);
        log.info("Registered job {} ({})", job.getName(), job.getTrigger().describe());
        return job;
    }

    public ScheduledJob register(String name, JobTrigger trigger, JobAction action) {
        return register(new ScheduledJob(name, trigger, action));
    }

    /**
     * Jobs whose trigger holds at {@code now} and that have not run for the current period, in registration order
     */
    public synchronized List<ScheduledJob> dueJobs(Instant now) {
        return jobs.values().stream()
                .filter(job -> job.isDue(now, zone))
                .toList();
    }

    /**
     * Record that {@code job} ran at {@code now}. Called after every invocation, failed ones included.
     */
    public synchronized void markRun(ScheduledJob job, Instant now, Exception failure) {
        job.recordRun(now, zone, failure);
    }

    public void markRun(ScheduledJob job, Instant now) {
        markRun(job, now, null);
    }

    public synchronized Optional<ScheduledJob> find(String name) {
        return Optional.ofNullable(jobs.get(name));
    }

    public synchronized List<ScheduledJob> getJobs() {
        return List.copyOf(jobs.values());
    }

    public synchronized int size() {
        return jobs.size();
    }
}
