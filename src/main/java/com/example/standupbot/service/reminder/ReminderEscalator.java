package com.example.standupbot.service.reminder;

import com.example.standupbot.config.MetricsConfig;
import com.example.standupbot.config.StandupBotProperties;
import com.example.standupbot.service.notification.OutboundNotifier;
import com.example.standupbot.service.prompt.PromptMessages;
import com.example.standupbot.service.tracker.DailyPromptTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Escalates standup threads that stay incomplete past the reminder threshold.
 * <p>
 * Each active thread gets at most one reminder per day. Threads are scanned
 * oldest first. A thread everybody answered is marked resolved and never
 * reminded. The reminded flag is set even when the send fails; the thread is
 * not retried before the day resets.
 */
@Slf4j
@Service
public class ReminderEscalator {

    private final DailyPromptTracker tracker;
    private final OutboundNotifier notifier;
    private final MetricsConfig metricsConfig;
    private final StandupBotProperties properties;
    private final Clock clock;

    public ReminderEscalator(DailyPromptTracker tracker, OutboundNotifier notifier, MetricsConfig metricsConfig,
                             StandupBotProperties properties, Clock clock) {
        this.tracker = tracker;
        this.notifier = notifier;
        this.metricsConfig = metricsConfig;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Job entry point, evaluated against the engine clock
     */
    public int escalate() {
        return escalate(clock.instant());
    }

    /**
     * @return number of threads reminded by this scan
     */
    public int escalate(Instant now) {
        var threshold = properties.reminderThreshold();
        var reminded = 0;

        for (var standup : tracker.standupsAwaitingReminder()) {
            var threadId = standup.getThreadId();

            if (standup.isComplete()) {
                tracker.markResolved(threadId);
                log.debug("Standup thread {} complete, no reminder needed", threadId);
                continue;
            }

            var elapsed = Duration.between(standup.getIssuedAt(), now);
            if (elapsed.compareTo(threshold) < 0) {
                continue;
            }

            var pending = standup.pendingUsers();
            var result = notifier.sendToThread(threadId, PromptMessages.threadReminder(pending));
            tracker.markReminded(threadId);
            metricsConfig.recordReminderSent(result.isSuccess());
            reminded++;

            if (result.isSuccess()) {
                log.info("Reminder sent for standup {} after {} min, {} users pending", threadId, elapsed.toMinutes(), pending.size());
            } else {
                log.warn("Reminder for standup {} failed: {} ({})", threadId, result.getErrorMessage(), result.getErrorType());
            }

            if (properties.hasEscalationChannel()) {
                var notice = notifier.sendToChannel(properties.getEscalationChannel(), PromptMessages.escalationNotice(threadId, pending));
                if (!notice.isSuccess()) {
                    log.warn("Escalation notice for standup {} failed: {}", threadId, notice.getErrorMessage());
                }
            }
        }
        return reminded;
    }
}
