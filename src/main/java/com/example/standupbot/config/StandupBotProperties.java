package com.example.standupbot.config;

import com.example.standupbot.exception.ConfigurationException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Configuration properties for the notification engine.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "standup-bot")
public class StandupBotProperties {

    private static final String HH_MM = "^([01]\\d|2[0-3]):[0-5]\\d$";
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    /**
     * Local time the standup prompt goes out (HH:MM)
     */
    @NotBlank
    @Pattern(regexp = HH_MM)
    private String standupTime;

    /**
     * Local time the health-check prompt goes out (HH:MM)
     */
    @NotBlank
    @Pattern(regexp = HH_MM)
    private String healthCheckTime;

    /**
     * Local time pending standup users get a direct reminder (HH:MM, optional)
     */
    @Pattern(regexp = "^$|" + HH_MM)
    private String reminderTime;

    /**
     * Seconds after a standup is issued before its thread gets a reminder
     */
    @Min(1)
    private long reminderThresholdSeconds = 7200;

    /**
     * Dispatch loop tick. A fixed-time job can fire up to one tick late.
     */
    @Min(1)
    private long tickIntervalSeconds = 60;

    /**
     * How often active standups are checked against the reminder threshold
     */
    @Min(1)
    private long escalationCheckIntervalSeconds = 60;

    /**
     * Channel receiving a notice whenever a standup thread is escalated (optional)
     */
    private String escalationChannel;

    /**
     * Zone used for calendar days and times of day
     */
    @NotBlank
    private String zoneId = "America/New_York";

    /**
     * Skip the standup on Saturdays and Sundays
     */
    private boolean skipWeekends = true;

    /**
     * Delay between two sends of the same broadcast
     */
    @Min(0)
    private long sendPacingMs = 500;

    /**
     * Upper bound for a single Slack call
     */
    @Min(1)
    private long sendTimeoutSeconds = 10;

    /**
     * How long the user directory keeps the fetched user list
     */
    @Min(0)
    private long userCacheSeconds = 600;

    /**
     * Threads available for outbound Slack calls
     */
    @Min(1)
    private int notifierPoolSize = 4;

    /**
     * How long shutdown waits for the in-flight job
     */
    @Min(0)
    private long shutdownTimeoutSeconds = 30;

    @Valid
    private Dispatch dispatch = new Dispatch();

    @Data
    public static class Dispatch {
        /**
         * Start ticking with the application context
         */
        private boolean autoStart = true;

        /**
         * How long a manual trigger request waits for the job before answering 202
         */
        @Min(1)
        private long triggerWaitSeconds = 30;
    }

    public LocalTime standupLocalTime() {
        return parseTime("standup-time", standupTime)
                .orElseThrow(() -> new ConfigurationException("standup-time", "a standup time is required"));
    }

    public LocalTime healthCheckLocalTime() {
        return parseTime("health-check-time", healthCheckTime)
                .orElseThrow(() -> new ConfigurationException("health-check-time", "a health check time is required"));
    }

    public Optional<LocalTime> reminderLocalTime() {
        return parseTime("reminder-time", reminderTime);
    }

    public Duration reminderThreshold() {
        return Duration.ofSeconds(reminderThresholdSeconds);
    }

    public Duration tickInterval() {
        return Duration.ofSeconds(tickIntervalSeconds);
    }

    public Duration escalationCheckInterval() {
        return Duration.ofSeconds(escalationCheckIntervalSeconds);
    }

    public Duration sendTimeout() {
        return Duration.ofSeconds(sendTimeoutSeconds);
    }

    public ZoneId zone() {
        try {
            return ZoneId.of(zoneId);
        } catch (DateTimeException e) {
            throw new ConfigurationException("zone-id", "unknown zone '" + zoneId + "'", e);
        }
    }

    public boolean hasEscalationChannel() {
        return escalationChannel != null && !escalationChannel.isBlank();
    }

    private static Optional<LocalTime> parseTime(String key, String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalTime.parse(value.trim(), TIME_FORMAT));
        } catch (DateTimeParseException e) {
            throw new ConfigurationException(key, "expected HH:MM but got '" + value + "'", e);
        }
    }
}
