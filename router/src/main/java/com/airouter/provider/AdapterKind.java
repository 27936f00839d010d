package com.airouter.provider;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Wire format spoken by a provider. Each kind has exactly one {@link ProviderAdapter}.
 */
public enum AdapterKind {
    OPENAI_COMPATIBLE("openai-compatible"),
    ANTHROPIC("anthropic"),
    GEMINI("gemini"),
    COHERE("cohere");

    private final String value;

    AdapterKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
