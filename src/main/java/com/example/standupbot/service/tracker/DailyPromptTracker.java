package com.example.standupbot.service.tracker;

import com.example.standupbot.domain.enums.HealthCheckAnswer;
import com.example.standupbot.domain.enums.PromptKind;
import com.example.standupbot.domain.model.ActiveStandup;
import com.example.standupbot.domain.model.PromptCycle;
import com.example.standupbot.dto.DailySummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Per-day prompt and response state.
 * <p>
 * Holds the current {@link PromptCycle}, the active standup threads and the
 * health-check answers of the day. Mutations come from the dispatch thread;
 * every method synchronizes on the tracker so reporting reads from request
 * threads observe a consistent state.
 */
@Slf4j
@Component
public class DailyPromptTracker {

    private static final Comparator<ActiveStandup> ISSUE_ORDER = Comparator
            .comparing(ActiveStandup::getIssuedAt)
            .thenComparing(ActiveStandup::getThreadId);

    private PromptCycle cycle;
    private final Map<String, ActiveStandup> activeStandups = new LinkedHashMap<>();
    private final Map<String, HealthCheckAnswer> healthCheckAnswers = new LinkedHashMap<>();

    public DailyPromptTracker(Clock clock) {
        this.cycle = new PromptCycle(LocalDate.now(clock));
    }

    // === Day boundary ===

    /**
     * Start a new cycle for {@code date}, dropping the previous day's flags, threads and answers.
     *
     * @return false when the cycle already belongs to {@code date} and nothing changed
     */
    public synchronized boolean resetForNewDay(LocalDate date) {
        if (cycle.getDate().equals(date)) {
            log.debug("Prompt cycle already at {}, reset skipped", date);
            return false;
        }
        var previous = cycle.getDate();
        var droppedThreads = activeStandups.size();

        cycle = new PromptCycle(date);
        activeStandups.clear();
        healthCheckAnswers.clear();

        log.info("Daily prompts reset for {} (previous cycle {}, {} standup threads closed)", date, previous, droppedThreads);
        return true;
    }

    public synchronized LocalDate getCurrentDate() {
        return cycle.getDate();
    }

    // === Sent flags ===

    public synchronized void markSent(PromptKind kind) {
        cycle.markSent(kind);
        log.debug("Marked {} as sent for {}", kind, cycle.getDate());
    }

    public synchronized boolean isSent(PromptKind kind) {
        return cycle.isSent(kind);
    }

    // === Standup threads ===

    public synchronized void recordStandupIssued(String threadId, Collection<String> expectedUsers, Instant issuedAt) {
        if (activeStandups.containsKey(threadId)) {
            log.warn("Standup thread {} is already active, keeping the original", threadId);
            return;
        }
        activeStandups.put(threadId, new ActiveStandup(threadId, expectedUsers, issuedAt));
        log.info("Standup thread {} issued at {} awaiting {} users", threadId, issuedAt, expectedUsers.size());
    }

    public synchronized ResponseOutcome recordResponse(String threadId, String userId) {
        var standup = activeStandups.get(threadId);
        if (standup == null) {
            log.debug("Response from {} for unknown thread {} ignored", userId, threadId);
            return ResponseOutcome.UNKNOWN_THREAD;
        }
        if (!standup.recordResponse(userId)) {
            return ResponseOutcome.ALREADY_RECORDED;
        }
        log.debug("Recorded standup response from {} in thread {}", userId, threadId);
        return ResponseOutcome.RECORDED;
    }

    public synchronized Optional<ActiveStandup> findStandup(String threadId) {
        return Optional.ofNullable(activeStandups.get(threadId));
    }

    /**
     * Threads neither reminded nor resolved, oldest first
     */
    public synchronized List<ActiveStandup> standupsAwaitingReminder() {
        return activeStandups.values().stream()
                .filter(ActiveStandup::awaitsReminder)
                .sorted(ISSUE_ORDER)
                .toList();
    }

    /**
     * Every active thread of the day, oldest first
     */
    public synchronized List<ActiveStandup> activeStandups() {
        return activeStandups.values().stream()
                .sorted(ISSUE_ORDER)
                .toList();
    }

    public synchronized void markReminded(String threadId) {
        findStandup(threadId).ifPresent(ActiveStandup::markReminded);
    }

    public synchronized void markResolved(String threadId) {
        findStandup(threadId).ifPresent(ActiveStandup::markResolved);
    }

    public synchronized int activeStandupCount() {
        return activeStandups.size();
    }

    // === Health check ===

    public synchronized void recordHealthCheckAnswer(String userId, HealthCheckAnswer answer) {
        var previous = healthCheckAnswers.put(userId, answer);
        if (previous != null && previous != answer) {
            log.debug("Health check answer of {} changed from {} to {}", userId, previous, answer);
        }
    }

    // === Reporting ===

    /**
     * Summary of {@code date}. Only the current day is tracked; any other date reports nothing sent.
     */
    public synchronized DailySummary getDailySummary(LocalDate date) {
        if (!cycle.getDate().equals(date)) {
            return emptySummary(date);
        }

        var standups = activeStandups.values();
        var answers = zeroAnswers();
        answers.putAll(healthCheckAnswers.values().stream()
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting())));

        return DailySummary.builder()
                .date(date)
                .prompts(cycle.getSentFlags())
                .activeStandups(standups.size())
                .standupExpected(standups.stream().mapToInt(s -> s.getExpectedUsers().size()).sum())
                .standupResponded(standups.stream().mapToInt(ActiveStandup::expectedResponseCount).sum())
                .standupPending(standups.stream().mapToInt(s -> s.pendingUsers().size()).sum())
                .remindersSent((int) standups.stream().filter(ActiveStandup::isReminded).count())
                .healthCheckAnswers(answers)
                .build();
    }

    private DailySummary emptySummary(LocalDate date) {
        return DailySummary.builder()
                .date(date)
                .prompts(new PromptCycle(date).getSentFlags())
                .healthCheckAnswers(zeroAnswers())
                .build();
    }

    private static Map<HealthCheckAnswer, Long> zeroAnswers() {
        var answers = new EnumMap<HealthCheckAnswer, Long>(HealthCheckAnswer.class);
        for (var answer : HealthCheckAnswer.values()) {
            answers.put(answer, 0L);
        }
        return answers;
    }
}
