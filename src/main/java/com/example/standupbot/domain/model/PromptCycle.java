package com.example.standupbot.domain.model;

import com.example.standupbot.domain.enums.PromptKind;
import lombok.Getter;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Sent flags of the daily prompts for one calendar day.
 * A new day gets a new cycle; cycles are never merged.
 */
public class PromptCycle {

    @Getter
    private final LocalDate date;

    private final Map<PromptKind, Boolean> sent = new EnumMap<>(PromptKind.class);

    public PromptCycle(LocalDate date) {
        this.date = Objects.requireNonNull(date, "date");
        for (var kind : PromptKind.values()) {
            sent.put(kind, false);
        }
    }

    public boolean isSent(PromptKind kind) {
        return sent.get(kind);
    }

    public void markSent(PromptKind kind) {
        sent.put(kind, true);
    }

    public Map<PromptKind, Boolean> getSentFlags() {
        return Collections.unmodifiableMap(new EnumMap<>(sent));
    }
}
