package com.airouter.provider;

import lombok.Builder;
import lombok.Value;

/**
 * Uniform single-turn completion request handed to every adapter. Defaults from the
 * provider's configuration are already applied.
 */
@Value
@Builder
public class ProviderRequest {
    String prompt;
    String systemPrompt;
    String model;
    int maxTokens;
    double temperature;

    public boolean hasSystemPrompt() {
        return systemPrompt != null && !systemPrompt.isBlank();
    }
}
