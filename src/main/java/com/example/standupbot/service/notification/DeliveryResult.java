package com.example.standupbot.service.notification;

import lombok.Builder;
import lombok.Data;

/**
 * Result of one outbound Slack call.
 */
@Data
@Builder
public class DeliveryResult {

    public static final String TIMEOUT = "TIMEOUT";
    public static final String DISABLED = "DISABLED";

    /**
     * Whether Slack accepted the message
     */
    private boolean success;

    /**
     * Timestamp of the posted message, which is also its thread id
     */
    private String messageTs;

    /**
     * Error message if failed
     */
    private String errorMessage;

    /**
     * Error type/classification for analysis
     */
    private String errorType;

    /**
     * Create a success result
     */
    public static DeliveryResult success(String messageTs) {
        return DeliveryResult.builder().success(true).messageTs(messageTs).build();
    }

    /**
     * Create a failure result with type
     */
    public static DeliveryResult failure(String errorMessage, String errorType) {
        return DeliveryResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .errorType(errorType)
                .build();
    }

    /**
     * Create a failure result from exception
     */
    public static DeliveryResult failure(Exception e) {
        return failure(e.getMessage(), e.getClass().getSimpleName());
    }

    /**
     * Create a failure result for a call cut off by the send timeout
     */
    public static DeliveryResult timeout(long timeoutMs) {
        return failure("No response within " + timeoutMs + "ms", TIMEOUT);
    }
}
