package com.airouter.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

public class GenerationModels {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GenerationRequest {
        @NotBlank(message = "Prompt cannot be blank")
        private String prompt;

        @JsonProperty("system_prompt")
        private String systemPrompt;

        // Falls back to ai.routing.default-strategy
        private RoutingStrategy strategy;

        @Min(value = 1, message = "max_attempts must be at least 1")
        @JsonProperty("max_attempts")
        private Integer maxAttempts;

        @Min(value = 1, message = "max_tokens must be at least 1")
        @JsonProperty("max_tokens")
        private Integer maxTokens;

        @DecimalMin(value = "0.0", message = "temperature must be >= 0")
        @DecimalMax(value = "2.0", message = "temperature must be <= 2")
        private Double temperature;

        // Overrides the provider's default model
        private String model;

        @JsonProperty("preferred_providers")
        private List<String> preferredProviders;

        @JsonProperty("allowed_providers")
        private List<String> allowedProviders;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class GenerationResult {
        private boolean success;
        private String content;

        @JsonProperty("provider_id")
        private String providerId;

        @JsonProperty("provider_name")
        private String providerName;

        private String model;
        private RoutingStrategy strategy;

        @JsonProperty("response_time_seconds")
        private double responseTimeSeconds;

        @JsonProperty("tokens_used")
        private Integer tokensUsed;

        private List<AttemptRecord> attempts;
        private String error;

        @JsonProperty("error_code")
        private GenerationErrorCode errorCode;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class AttemptRecord {
        @JsonProperty("provider_id")
        private String providerId;

        private AttemptOutcome outcome;

        @JsonProperty("started_at")
        private Instant startedAt;

        @JsonProperty("response_time_seconds")
        private double responseTimeSeconds;

        private String error;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorResponse {
        private Error error;

        @Data
        @Builder
        @NoArgsConstructor
        @AllArgsConstructor
        public static class Error {
            private String message;
            private String type;
            private String code;
        }
    }
}
