package com.airouter.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Policy used to pick the next provider for an attempt.
 */
public enum RoutingStrategy {
    PRIORITY("priority"),
    INTELLIGENT("intelligent"),
    ROUND_ROBIN("round_robin"),
    FASTEST("fastest");

    private final String value;

    RoutingStrategy(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static RoutingStrategy fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase().replace('-', '_');
        return Arrays.stream(values())
                .filter(s -> s.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown routing strategy: " + value));
    }
}
