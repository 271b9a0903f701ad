package com.example.standupbot.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Answers offered by the health-check prompt buttons.
 * The code doubles as the Slack action id and button value.
 */
@Getter
@RequiredArgsConstructor
public enum HealthCheckAnswer {

    GREAT("great", ":blush: Great"),
    OKAY("okay", ":neutral_face: Okay"),
    NOT_GREAT("not_great", ":pensive: Not Great");

    private final String code;
    private final String label;

    /**
     * Resolve a button value. The enum name is accepted as well, so callers may send either form.
     */
    @JsonCreator
    public static HealthCheckAnswer fromCode(String code) {
        for (var answer : values()) {
            if (answer.getCode().equals(code) || answer.name().equals(code)) {
                return answer;
            }
        }
        throw new IllegalArgumentException("Unknown health check answer: " + code);
    }
}
