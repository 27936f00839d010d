package com.airouter.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AttemptOutcome {
    SUCCESS("success"),
    TIMEOUT("timeout"),
    RATE_LIMITED("rate_limited"),
    AUTH_ERROR("auth_error"),
    NETWORK_ERROR("network_error");

    private final String value;

    AttemptOutcome(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
