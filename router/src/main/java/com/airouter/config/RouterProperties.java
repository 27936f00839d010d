package com.airouter.config;

import com.airouter.model.RoutingStrategy;
import com.airouter.provider.AdapterKind;
import com.airouter.selection.LatencyNormalization;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "ai")
public class RouterProperties {

    private Map<String, ProviderSettings> providers = new LinkedHashMap<>();
    private RoutingSettings routing = new RoutingSettings();
    private ClientQuotaSettings clientQuota = new ClientQuotaSettings();

    @Data
    public static class ProviderSettings {
        private boolean enabled = true;
        private String displayName;
        private AdapterKind adapter = AdapterKind.OPENAI_COMPATIBLE;
        private String baseUrl;
        // Name of the environment variable holding the key; apiKey wins when both are set
        private String credentialEnv;
        private String apiKey;
        private boolean credentialRequired = true;
        private String defaultModel;
        private int priority = 10;
        private Duration timeout = Duration.ofSeconds(30);
        private int maxTokens = 4096;
        private double temperature = 0.7;
    }

    @Data
    public static class RoutingSettings {
        private RoutingStrategy defaultStrategy = RoutingStrategy.INTELLIGENT;
        private int maxAttemptsCeiling = 5;
        private int failureThreshold = 5;
        private Duration circuitCooldown = Duration.ofMinutes(10);
        private Duration rateLimitCooldown = Duration.ofMinutes(5);
        private Duration maxRateLimitCooldown = Duration.ofHours(1);
        private double latencySmoothing = 0.1;
        private LatencyNormalization latencyNormalization = LatencyNormalization.FASTEST_ELIGIBLE;
        private Duration latencyReference = Duration.ofSeconds(10);
    }

    @Data
    public static class ClientQuotaSettings {
        private boolean enabled = true;
        private int requestsPerMinute = 60;
    }
}
