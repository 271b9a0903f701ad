package com.example.standupbot.service.directory;

import java.util.List;

/**
 * Source of the users who receive the daily prompts.
 */
public interface UserDirectory {

    /**
     * Active human users. An empty list means there is nobody to notify.
     */
    List<String> listActiveUsers();
}
