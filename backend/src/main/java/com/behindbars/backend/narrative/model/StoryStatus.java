package com.behindbars.backend.narrative.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

@Getter
public enum StoryStatus {
    ACTIVE("active"),
    DORMANT("dormant"),
    RESOLVED("resolved");

    @JsonValue
    private final String value;

    StoryStatus(String value) {
        this.value = value;
    }

    /**
     * Find StoryStatus by its stored value (case-insensitive)
     */
    @JsonCreator
    public static StoryStatus fromValue(String value) {
        if (value == null) return ACTIVE;
        for (StoryStatus status : values()) {
            if (status.value.equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown story status: " + value);
    }
}
