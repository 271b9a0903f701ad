package com.example.standupbot.domain.model;

import lombok.Getter;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One outstanding standup thread and the users expected to answer in it.
 * <p>
 * {@code issuedAt} is fixed at creation. The reminder flag is set at most once;
 * after that the thread is never reminded again until the day resets.
 */
@Getter
public class ActiveStandup {

    private final String threadId;
    private final Instant issuedAt;
    private final Set<String> expectedUsers;
    private final Set<String> respondedUsers = new LinkedHashSet<>();
    private boolean reminded;
    private boolean resolved;

    public ActiveStandup(String threadId, Collection<String> expectedUsers, Instant issuedAt) {
        if (threadId == null || threadId.isBlank()) {
            throw new IllegalArgumentException("Thread id is required");
        }
        this.threadId = threadId;
        this.issuedAt = Objects.requireNonNull(issuedAt, "issuedAt");
        this.expectedUsers = Collections.unmodifiableSet(new LinkedHashSet<>(expectedUsers));
    }

    /**
     * Users outside {@code expectedUsers} are recorded too but never count towards completion.
     *
     * @return false when the user had already been recorded
     */
    public boolean recordResponse(String userId) {
        return respondedUsers.add(userId);
    }

    public List<String> pendingUsers() {
        return expectedUsers.stream()
                .filter(user -> !respondedUsers.contains(user))
                .toList();
    }

    /**
     * Number of expected users who answered
     */
    public int expectedResponseCount() {
        return (int) expectedUsers.stream().filter(respondedUsers::contains).count();
    }

    public boolean isComplete() {
        return respondedUsers.containsAll(expectedUsers);
    }

    public Set<String> getRespondedUsers() {
        return Collections.unmodifiableSet(respondedUsers);
    }

    public void markReminded() {
        this.reminded = true;
    }

    public void markResolved() {
        this.resolved = true;
    }

    public boolean awaitsReminder() {
        return !reminded && !resolved;
    }
}
