package com.airouter.provider;

import com.airouter.registry.ProviderConfig;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * Cohere v1 {@code /chat}: the prompt is a single {@code message}, the system prompt
 * travels as {@code preamble}.
 */
@Slf4j
@Component
public class CohereAdapter implements ProviderAdapter {

    private final WebClient webClient;

    public CohereAdapter(WebClient.Builder webClientBuilder) {
        this.webClient = webClientBuilder.build();
    }

    @Override
    public AdapterKind getKind() {
        return AdapterKind.COHERE;
    }

    @Override
    public Mono<ProviderResponse> send(ProviderConfig config, ProviderRequest request) {
        log.debug("Cohere request: provider={}, model={}", config.getId(), request.getModel());

        ChatRequest chatRequest = new ChatRequest(
                request.getModel(),
                request.getPrompt(),
                request.hasSystemPrompt() ? request.getSystemPrompt() : null,
                request.getMaxTokens(),
                request.getTemperature());

        return webClient.post()
                .uri(URI.create(config.getBaseUrl() + "/chat"))
                .headers(headers -> {
                    headers.setContentType(MediaType.APPLICATION_JSON);
                    headers.set(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey());
                })
                .bodyValue(chatRequest)
                .retrieve()
                .bodyToMono(ChatResponse.class)
                .switchIfEmpty(Mono.error(() -> new ProviderException(ProviderErrorType.TRANSPORT, "Empty response body")))
                .map(response -> {
                    if (response.getText() == null) {
                        throw new ProviderException(ProviderErrorType.TRANSPORT, "Response contained no text");
                    }
                    Integer tokens = null;
                    if (response.getMeta() != null && response.getMeta().getTokens() != null) {
                        ChatResponse.Tokens t = response.getMeta().getTokens();
                        tokens = (t.getInputTokens() != null ? t.getInputTokens() : 0)
                                + (t.getOutputTokens() != null ? t.getOutputTokens() : 0);
                    }
                    return ProviderResponse.builder()
                            .content(response.getText())
                            .model(request.getModel())
                            .tokensUsed(tokens)
                            .build();
                });
    }

    // Cohere API DTOs
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ChatRequest {
        private String model;
        private String message;
        private String preamble;

        @JsonProperty("max_tokens")
        private Integer maxTokens;

        private Double temperature;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChatResponse {
        private String text;
        private Meta meta;

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        @JsonIgnoreProperties(ignoreUnknown = true)
        public static class Meta {
            private Tokens tokens;
        }

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        @JsonIgnoreProperties(ignoreUnknown = true)
        public static class Tokens {
            @JsonProperty("input_tokens")
            private Integer inputTokens;

            @JsonProperty("output_tokens")
            private Integer outputTokens;
        }
    }
}
