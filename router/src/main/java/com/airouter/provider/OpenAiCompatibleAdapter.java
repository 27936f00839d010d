package com.airouter.provider;

import com.airouter.registry.ProviderConfig;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code POST /chat/completions} with a bearer token. Covers OpenAI itself and the many
 * services that copy its API (OpenRouter, Groq, Cerebras, NVIDIA, Mistral, DeepSeek,
 * local servers).
 */
@Slf4j
@Component
public class OpenAiCompatibleAdapter implements ProviderAdapter {

    private final WebClient webClient;

    public OpenAiCompatibleAdapter(WebClient.Builder webClientBuilder) {
        this.webClient = webClientBuilder.build();
    }

    @Override
    public AdapterKind getKind() {
        return AdapterKind.OPENAI_COMPATIBLE;
    }

    @Override
    public Mono<ProviderResponse> send(ProviderConfig config, ProviderRequest request) {
        log.debug("OpenAI-compatible request: provider={}, model={}", config.getId(), request.getModel());

        return webClient.post()
                .uri(URI.create(config.getBaseUrl() + "/chat/completions"))
                .headers(headers -> {
                    headers.setContentType(MediaType.APPLICATION_JSON);
                    // Keyless local servers are allowed
                    if (config.hasCredential()) {
                        headers.set(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey());
                    }
                })
                .bodyValue(toRequestBody(request))
                .retrieve()
                .bodyToMono(ChatCompletionResponse.class)
                .switchIfEmpty(Mono.error(() -> new ProviderException(ProviderErrorType.TRANSPORT, "Empty response body")))
                .map(response -> toProviderResponse(response, request.getModel()));
    }

    private Map<String, Object> toRequestBody(ProviderRequest request) {
        List<Message> messages = new ArrayList<>();
        if (request.hasSystemPrompt()) {
            messages.add(new Message("system", request.getSystemPrompt()));
        }
        messages.add(new Message("user", request.getPrompt()));

        Map<String, Object> body = new HashMap<>();
        body.put("model", request.getModel());
        body.put("messages", messages);
        body.put("max_tokens", request.getMaxTokens());
        body.put("temperature", request.getTemperature());
        body.put("stream", false);
        return body;
    }

    private ProviderResponse toProviderResponse(ChatCompletionResponse response, String requestedModel) {
        if (response.getError() != null) {
            Object code = response.getError().getCode();
            throw ProviderErrorClassifier.fromErrorBody(code != null ? String.valueOf(code) : null,
                    response.getError().getMessage());
        }
        if (response.getChoices() == null || response.getChoices().isEmpty()
                || response.getChoices().get(0).getMessage() == null
                || response.getChoices().get(0).getMessage().getContent() == null) {
            throw new ProviderException(ProviderErrorType.TRANSPORT, "Response contained no choices");
        }

        return ProviderResponse.builder()
                .content(response.getChoices().get(0).getMessage().getContent())
                .model(response.getModel() != null ? response.getModel() : requestedModel)
                .tokensUsed(response.getUsage() != null ? response.getUsage().getTotalTokens() : null)
                .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Message {
        private String role;
        private String content;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChatCompletionResponse {
        private String id;
        private String model;
        private List<Choice> choices;
        private Usage usage;
        private Error error;

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        @JsonIgnoreProperties(ignoreUnknown = true)
        public static class Choice {
            private Integer index;
            private Message message;

            @JsonProperty("finish_reason")
            private String finishReason;
        }

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        @JsonIgnoreProperties(ignoreUnknown = true)
        public static class Usage {
            @JsonProperty("total_tokens")
            private Integer totalTokens;
        }

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        @JsonIgnoreProperties(ignoreUnknown = true)
        public static class Error {
            // Number on OpenRouter, string on OpenAI
            private Object code;
            private String message;
            private String type;
        }
    }
}
