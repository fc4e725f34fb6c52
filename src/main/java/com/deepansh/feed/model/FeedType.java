package com.deepansh.feed.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of feed a session is planned for. FOR_YOU mixes all buckets,
 * TRENDING plans from the trending bucket only.
 */
public enum FeedType {

    FOR_YOU("for_you"),
    TRENDING("trending");

    private final String value;

    FeedType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static FeedType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return FOR_YOU;
        }
        for (FeedType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown feed type: " + value);
    }
}
