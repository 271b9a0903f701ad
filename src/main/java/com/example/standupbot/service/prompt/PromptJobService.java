package com.example.standupbot.service.prompt;

import com.example.standupbot.config.SlackProperties;
import com.example.standupbot.config.StandupBotProperties;
import com.example.standupbot.domain.enums.PromptKind;
import com.example.standupbot.service.directory.UserDirectory;
import com.example.standupbot.service.notification.BroadcastResult;
import com.example.standupbot.service.notification.NotificationFanout;
import com.example.standupbot.service.notification.OutboundNotifier;
import com.example.standupbot.service.tracker.DailyPromptTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Actions of the daily prompt jobs.
 * <p>
 * Every action runs on the dispatch thread. The tracker's sent flags make the
 * standup and health-check prompts idempotent within a day, so a manual
 * trigger after the scheduled run sends nothing.
 */
@Slf4j
@Service
public class PromptJobService {

    static final String STANDUP_PURPOSE = "standup";
    static final String HEALTH_CHECK_PURPOSE = "health_check";
    static final String REMINDER_PURPOSE = "missing_response_reminder";

    private final DailyPromptTracker tracker;
    private final UserDirectory userDirectory;
    private final NotificationFanout fanout;
    private final OutboundNotifier notifier;
    private final SlackProperties slackProperties;
    private final StandupBotProperties properties;
    private final Clock clock;

    public PromptJobService(DailyPromptTracker tracker, UserDirectory userDirectory, NotificationFanout fanout,
                            OutboundNotifier notifier, SlackProperties slackProperties,
                            StandupBotProperties properties, Clock clock) {
        this.tracker = tracker;
        this.userDirectory = userDirectory;
        this.fanout = fanout;
        this.notifier = notifier;
        this.slackProperties = slackProperties;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Start the prompt cycle of the current calendar day
     */
    public void resetDay() {
        tracker.resetForNewDay(LocalDate.now(clock));
    }

    /**
     * Announce the standup in the team channel and prompt every active user directly.
     * <p>
     * The prompt counts as sent once the announcement or at least one direct
     * message went out. When nothing could be delivered the job fails and the
     * flag stays unset, so a manual trigger can retry the same day.
     */
    public void sendDailyStandup() {
        if (tracker.isSent(PromptKind.STANDUP)) {
            log.info("Standup already sent today, skipping");
            return;
        }
        var today = LocalDate.now(clock);
        if (properties.isSkipWeekends() && isWeekend(today)) {
            log.info("Skipping standup on {}", today.getDayOfWeek());
            return;
        }

        var users = userDirectory.listActiveUsers();
        if (users.isEmpty()) {
            log.info("No active users, standup not sent");
            return;
        }

        var threadId = announceStandup(users);
        var result = fanout.broadcast(users, STANDUP_PURPOSE, user -> PromptMessages.standupDirectPrompt(threadId));

        if (threadId == null && result.isTotalFailure()) {
            throw new IllegalStateException("Standup could not be delivered to any of " + users.size() + " users");
        }
        tracker.markSent(PromptKind.STANDUP);
        log.info("Daily standup sent: thread {}, {} of {} direct prompts delivered",
                threadId, result.getSucceeded(), result.getAttempted());
    }

    /**
     * Send the health-check prompt to every active user
     */
    public void sendHealthCheck() {
        if (tracker.isSent(PromptKind.HEALTH_CHECK)) {
            log.info("Health check already sent today, skipping");
            return;
        }

        var users = userDirectory.listActiveUsers();
        if (users.isEmpty()) {
            log.info("No active users, health check not sent");
            return;
        }

        var result = fanout.broadcast(users, HEALTH_CHECK_PURPOSE, PromptMessages.healthCheckPrompt());
        if (result.isTotalFailure()) {
            throw new IllegalStateException("Health check could not be delivered to any of " + users.size() + " users");
        }
        tracker.markSent(PromptKind.HEALTH_CHECK);
        log.info("Health check sent to {} of {} users", result.getSucceeded(), result.getAttempted());
    }

    /**
     * Direct reminder to every user still pending in one of today's standup threads.
     * A user pending in several threads gets a single message.
     */
    public BroadcastResult remindMissingResponders() {
        Set<String> pending = new LinkedHashSet<>();
        for (var standup : tracker.activeStandups()) {
            pending.addAll(standup.pendingUsers());
        }
        if (pending.isEmpty()) {
            log.info("Everybody answered today's standup, no reminders needed");
            return BroadcastResult.empty(REMINDER_PURPOSE);
        }
        return fanout.broadcast(pending, REMINDER_PURPOSE, PromptMessages::missingResponseReminder);
    }

    /**
     * @return thread id of the announcement, or null when it could not be posted
     */
    private String announceStandup(List<String> users) {
        var channelId = slackProperties.getChannelId();
        if (channelId == null || channelId.isBlank()) {
            log.warn("No standup channel configured, sending direct prompts only");
            return null;
        }

        var result = notifier.sendToChannel(channelId, PromptMessages.standupAnnouncement());
        if (!result.isSuccess() || result.getMessageTs() == null) {
            log.warn("Standup announcement in {} failed: {} ({})", channelId, result.getErrorMessage(), result.getErrorType());
            return null;
        }

        tracker.recordStandupIssued(result.getMessageTs(), users, clock.instant());
        return result.getMessageTs();
    }

    private static boolean isWeekend(LocalDate date) {
        var day = date.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }
}
