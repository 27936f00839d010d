package com.airouter.model;

import com.airouter.provider.AdapterKind;
import com.airouter.registry.ProviderStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

public class StatsModels {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AggregateStats {
        @JsonProperty("total_requests")
        private long totalRequests;

        @JsonProperty("successful_requests")
        private long successfulRequests;

        @JsonProperty("failed_requests")
        private long failedRequests;

        // Fraction in [0, 1]
        @JsonProperty("success_rate")
        private double successRate;

        @JsonProperty("total_fallbacks")
        private long totalFallbacks;

        @JsonProperty("average_response_time_seconds")
        private double averageResponseTimeSeconds;

        private Map<String, ProviderRollup> providers;

        @JsonProperty("uptime_seconds")
        private long uptimeSeconds;

        @JsonProperty("last_reset")
        private Instant lastReset;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ProviderRollup {
        private long attempts;
        private long successes;
        private long failures;

        @JsonProperty("rate_limited")
        private long rateLimited;

        private long timeouts;

        @JsonProperty("average_latency_seconds")
        private double averageLatencySeconds;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class HealthSnapshot {
        @JsonProperty("provider_id")
        private String providerId;

        @JsonProperty("display_name")
        private String displayName;

        private AdapterKind adapter;
        private String model;
        private int priority;
        private ProviderStatus status;

        @JsonProperty("success_rate")
        private double successRate;

        @JsonProperty("success_count")
        private long successCount;

        @JsonProperty("failure_count")
        private long failureCount;

        @JsonProperty("average_response_time_seconds")
        private double averageResponseTimeSeconds;

        @JsonProperty("consecutive_failures")
        private int consecutiveFailures;

        @JsonProperty("circuit_state")
        private String circuitState;

        @JsonProperty("last_used")
        private Instant lastUsed;

        @JsonProperty("available_after")
        private Instant availableAfter;

        @JsonProperty("last_error")
        private String lastError;
    }
}
