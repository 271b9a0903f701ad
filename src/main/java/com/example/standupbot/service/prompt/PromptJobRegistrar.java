package com.example.standupbot.service.prompt;

import com.example.standupbot.config.StandupBotProperties;
import com.example.standupbot.domain.model.JobTrigger;
import com.example.standupbot.service.reminder.ReminderEscalator;
import com.example.standupbot.service.scheduler.JobRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalTime;

/**
 * Registers the bot's recurring jobs before the dispatch loop starts.
 * <p>
 * Registration order is run order within a tick, so the daily reset always
 * runs ahead of the prompts due on the same tick.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PromptJobRegistrar {

    public static final String DAILY_RESET = "daily-reset";
    public static final String STANDUP = "standup";
    public static final String HEALTH_CHECK = "health-check";
    public static final String MISSING_RESPONSE_REMINDER = "missing-response-reminder";
    public static final String REMINDER_ESCALATION = "reminder-escalation";

    private final JobRegistry registry;
    private final PromptJobService promptJobService;
    private final ReminderEscalator reminderEscalator;
    private final StandupBotProperties properties;

    @PostConstruct
    public void registerJobs() {
        registry.register(DAILY_RESET, JobTrigger.dailyAt(LocalTime.MIDNIGHT), promptJobService::resetDay);
        registry.register(STANDUP, JobTrigger.dailyAt(properties.standupLocalTime()), promptJobService::sendDailyStandup);
        registry.register(HEALTH_CHECK, JobTrigger.dailyAt(properties.healthCheckLocalTime()), promptJobService::sendHealthCheck);

        properties.reminderLocalTime().ifPresentOrElse(
                time -> registry.register(MISSING_RESPONSE_REMINDER, JobTrigger.dailyAt(time),
                        promptJobService::remindMissingResponders),
                () -> log.info("No reminder time configured, direct missing-response reminders disabled"));

        registry.register(REMINDER_ESCALATION, JobTrigger.every(properties.escalationCheckInterval()),
                reminderEscalator::escalate);

        log.info("Registered {} prompt jobs in zone {}", registry.size(), registry.getZone());
    }
}
