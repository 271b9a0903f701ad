package com.example.standupbot.exception;

import lombok.Getter;

/**
 * Exception for Slack communication failures
 */
@Getter
public class TransportException extends RuntimeException {

    private final String operation;
    private final String slackError;

    public TransportException(String operation, String slackError) {
        super(String.format("[%s] Slack returned error: %s", operation, slackError));
        this.operation = operation;
        this.slackError = slackError;
    }

    public TransportException(String operation, Exception cause) {
        super(String.format("[%s] %s", operation, cause.getMessage()), cause);
        this.operation = operation;
        this.slackError = null;
    }
}
