package com.example.standupbot.service.tracker;

/**
 * Effect of recording a standup response.
 */
public enum ResponseOutcome {
    RECORDED,
    ALREADY_RECORDED,
    /**
     * The thread is not active, usually because the day was reset before the response arrived
     */
    UNKNOWN_THREAD
}
