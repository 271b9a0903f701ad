package com.example.standupbot.exception;

import lombok.Getter;

/**
 * Exception for a job registered twice under the same name
 */
@Getter
public class DuplicateJobException extends RuntimeException {

    private final String jobName;

    public DuplicateJobException(String jobName) {
        super(String.format("A job named '%s' is already registered", jobName));
        this.jobName = jobName;
    }
}
