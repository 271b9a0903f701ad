package com.example.standupbot.domain.model;

import com.example.standupbot.domain.enums.TriggerType;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.Duration;
import java.time.LocalTime;
import java.util.Objects;

/**
 * Trigger condition of a scheduled job: a daily time of day or a fixed interval.
 */
@Getter
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class JobTrigger {

    private final TriggerType type;
    private final LocalTime timeOfDay;
    private final Duration interval;

    public static JobTrigger dailyAt(LocalTime timeOfDay) {
        Objects.requireNonNull(timeOfDay, "timeOfDay");
        return new JobTrigger(TriggerType.FIXED_TIME, timeOfDay.withSecond(0).withNano(0), null);
    }

    public static JobTrigger every(Duration interval) {
        Objects.requireNonNull(interval, "interval");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive: " + interval);
        }
        return new JobTrigger(TriggerType.FIXED_INTERVAL, null, interval);
    }

    public boolean isFixedTime() {
        return type == TriggerType.FIXED_TIME;
    }

    public String describe() {
        return isFixedTime() ? "daily at " + timeOfDay : "every " + interval.toSeconds() + "s";
    }

    @Override
    public String toString() {
        return describe();
    }
}
