package com.example.standupbot.domain.model;

/**
 * Work performed when a scheduled job fires.
 */
@FunctionalInterface
public interface JobAction {

    void run() throws Exception;
}
