package com.example.standupbot.service.directory;

import com.example.standupbot.config.SlackProperties;
import com.example.standupbot.config.StandupBotProperties;
import com.example.standupbot.exception.TransportException;
import com.slack.api.Slack;
import com.slack.api.methods.SlackApiException;
import com.slack.api.model.User;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Workspace members from Slack's {@code users.list}, minus bots, deactivated
 * accounts and Slackbot. The list is cached for {@code user-cache-seconds}.
 * <p>
 * Uses:
 * - Resilience4j Retry for transient Slack failures
 * - Circuit Breaker falling back to the last fetched list while Slack is down
 */
@Slf4j
@Component
public class SlackUserDirectory implements UserDirectory {

    static final String SLACKBOT_ID = "USLACKBOT";
    private static final int PAGE_SIZE = 200;

    private final Slack slack;
    private final SlackProperties slackProperties;
    private final Clock clock;
    private final Duration cacheTtl;

    private List<String> cachedUsers;
    private Instant cachedAt;

    public SlackUserDirectory(Slack slack, SlackProperties slackProperties, StandupBotProperties properties, Clock clock) {
        this.slack = slack;
        this.slackProperties = slackProperties;
        this.clock = clock;
        this.cacheTtl = Duration.ofSeconds(properties.getUserCacheSeconds());
    }

    /**
     * @throws TransportException when Slack cannot be reached or rejects the call
     */
    @Override
    @CircuitBreaker(name = "slackDirectory", fallbackMethod = "listActiveUsersFallback")
    @Retry(name = "slackDirectory")
    public synchronized List<String> listActiveUsers() {
        var now = clock.instant();
        if (cachedUsers != null && Duration.between(cachedAt, now).compareTo(cacheTtl) < 0) {
            return cachedUsers;
        }
        if (!slackProperties.isEnabled() || slackProperties.getBotToken() == null || slackProperties.getBotToken().isBlank()) {
            log.warn("Slack is disabled or bot token not configured, no users to notify");
            return List.of();
        }

        var users = fetchUsers();
        cachedUsers = users;
        cachedAt = now;
        log.info("Fetched {} active users from Slack", users.size());
        return users;
    }

    /**
     * Fallback when users.list keeps failing. An expired list is better than no prompts at all.
     */
    @SuppressWarnings("unused")
    private synchronized List<String> listActiveUsersFallback(Exception e) {
        if (cachedUsers != null) {
            log.warn("Slack user directory unavailable, reusing list fetched at {}: {}", cachedAt, e.getMessage());
            return cachedUsers;
        }
        log.warn("Slack user directory unavailable and nothing cached: {}", e.getMessage());
        if (e instanceof TransportException transportException) {
            throw transportException;
        }
        throw new TransportException("users.list", e);
    }

    /**
     * Drop the cached list so the next lookup asks Slack again
     */
    public synchronized void invalidate() {
        cachedUsers = null;
        cachedAt = null;
    }

    private List<String> fetchUsers() {
        var methods = slack.methods(slackProperties.getBotToken());
        var active = new ArrayList<String>();
        String cursor = null;
        try {
            do {
                var nextCursor = cursor;
                var response = methods.usersList(r -> r.limit(PAGE_SIZE).cursor(nextCursor));
                if (!response.isOk()) {
                    throw new TransportException("users.list", response.getError());
                }
                for (var member : response.getMembers()) {
                    if (isActiveHuman(member)) {
                        active.add(member.getId());
                    }
                }
                cursor = response.getResponseMetadata() != null ? response.getResponseMetadata().getNextCursor() : null;
            } while (cursor != null && !cursor.isBlank());
        } catch (IOException | SlackApiException e) {
            throw new TransportException("users.list", e);
        }
        return List.copyOf(active);
    }

    static boolean isActiveHuman(User member) {
        return !member.isBot() && !member.isDeleted() && !SLACKBOT_ID.equals(member.getId());
    }
}
