package com.example.standupbot.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * How a scheduled job decides it is due.
 */
@Getter
@RequiredArgsConstructor
public enum TriggerType {

    /**
     * Once per calendar day, at or after a local time of day
     */
    FIXED_TIME("fixed-time"),

    /**
     * Whenever the configured interval has elapsed since the previous run
     */
    FIXED_INTERVAL("fixed-interval");

    private final String code;
}
