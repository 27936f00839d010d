package com.airouter.provider;

import com.airouter.registry.ProviderConfig;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@Slf4j
@Component
public class GeminiAdapter implements ProviderAdapter {

    private final WebClient webClient;

    public GeminiAdapter(WebClient.Builder webClientBuilder) {
        this.webClient = webClientBuilder.build();
    }

    @Override
    public AdapterKind getKind() {
        return AdapterKind.GEMINI;
    }

    @Override
    public Mono<ProviderResponse> send(ProviderConfig config, ProviderRequest request) {
        log.debug("Gemini request: provider={}, model={}", config.getId(), request.getModel());

        // Key goes in a header so it never shows up in a logged URL
        return webClient.post()
                .uri(URI.create(config.getBaseUrl() + "/models/" + request.getModel() + ":generateContent"))
                .headers(headers -> {
                    headers.setContentType(MediaType.APPLICATION_JSON);
                    headers.set("x-goog-api-key", config.getApiKey());
                })
                .bodyValue(toGenerateRequest(request))
                .retrieve()
                .bodyToMono(GenerateResponse.class)
                .switchIfEmpty(Mono.error(() -> new ProviderException(ProviderErrorType.TRANSPORT, "Empty response body")))
                .map(response -> toProviderResponse(response, request.getModel()));
    }

    private GenerateRequest toGenerateRequest(ProviderRequest request) {
        GenerateRequest generateRequest = new GenerateRequest();
        generateRequest.setContents(List.of(
                new GenerateRequest.Content("user", List.of(new GenerateRequest.Part(request.getPrompt())))));
        if (request.hasSystemPrompt()) {
            generateRequest.setSystemInstruction(
                    new GenerateRequest.Content(null, List.of(new GenerateRequest.Part(request.getSystemPrompt()))));
        }
        generateRequest.setGenerationConfig(
                new GenerateRequest.GenerationConfig(request.getTemperature(), request.getMaxTokens()));
        return generateRequest;
    }

    private ProviderResponse toProviderResponse(GenerateResponse response, String requestedModel) {
        if (response.getCandidates() == null || response.getCandidates().isEmpty()) {
            String reason = response.getPromptFeedback() != null ? response.getPromptFeedback().getBlockReason() : null;
            throw new ProviderException(ProviderErrorType.TRANSPORT,
                    "Response contained no candidates" + (reason != null ? " (blocked: " + reason + ")" : ""));
        }

        GenerateResponse.Candidate candidate = response.getCandidates().get(0);
        if (candidate.getContent() == null || candidate.getContent().getParts() == null) {
            throw new ProviderException(ProviderErrorType.TRANSPORT,
                    "Candidate had no content (finishReason=" + candidate.getFinishReason() + ")");
        }
        String text = candidate.getContent().getParts().stream()
                .map(GenerateResponse.Part::getText)
                .filter(Objects::nonNull)
                .collect(Collectors.joining());

        return ProviderResponse.builder()
                .content(text)
                .model(requestedModel)
                .tokensUsed(response.getUsageMetadata() != null ? response.getUsageMetadata().getTotalTokenCount() : null)
                .build();
    }

    // Gemini API DTOs
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class GenerateRequest {
        private List<Content> contents;
        private Content systemInstruction;
        private GenerationConfig generationConfig;

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        @JsonInclude(JsonInclude.Include.NON_NULL)
        public static class Content {
            private String role;
            private List<Part> parts;
        }

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        public static class Part {
            private String text;
        }

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        @JsonInclude(JsonInclude.Include.NON_NULL)
        public static class GenerationConfig {
            private Double temperature;
            private Integer maxOutputTokens;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GenerateResponse {
        private List<Candidate> candidates;
        private UsageMetadata usageMetadata;
        private PromptFeedback promptFeedback;

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        @JsonIgnoreProperties(ignoreUnknown = true)
        public static class Candidate {
            private Content content;
            private String finishReason;
        }

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        @JsonIgnoreProperties(ignoreUnknown = true)
        public static class Content {
            private String role;
            private List<Part> parts;
        }

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        @JsonIgnoreProperties(ignoreUnknown = true)
        public static class Part {
            private String text;
        }

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        @JsonIgnoreProperties(ignoreUnknown = true)
        public static class UsageMetadata {
            private Integer promptTokenCount;
            private Integer candidatesTokenCount;
            private Integer totalTokenCount;
        }

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        @JsonIgnoreProperties(ignoreUnknown = true)
        public static class PromptFeedback {
            private String blockReason;
        }
    }
}
