package com.airouter.registry;

import com.airouter.provider.AdapterKind;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.time.Duration;

/**
 * Static, read-only description of one provider. Built once at startup.
 */
@Value
@Builder
public class ProviderConfig {
    String id;
    String displayName;
    AdapterKind adapterKind;
    String baseUrl;
    String credentialEnv;

    @ToString.Exclude
    String apiKey;

    String defaultModel;
    int priority;
    Duration timeout;
    int maxTokens;
    double temperature;

    public boolean hasCredential() {
        return apiKey != null && !apiKey.isBlank();
    }
}
