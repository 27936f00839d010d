package com.airouter.registry;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProviderStatus {
    ACTIVE("active"),
    CIRCUIT_OPEN("circuit_open"),
    RATE_LIMITED("rate_limited"),
    DISABLED("disabled");

    private final String value;

    ProviderStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
