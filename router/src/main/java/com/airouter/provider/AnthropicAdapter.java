package com.airouter.provider;

import com.airouter.registry.ProviderConfig;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
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
import java.util.stream.Collectors;

@Slf4j
@Component
public class AnthropicAdapter implements ProviderAdapter {

    static final String API_VERSION = "2023-06-01";

    private final WebClient webClient;

    public AnthropicAdapter(WebClient.Builder webClientBuilder) {
        this.webClient = webClientBuilder.build();
    }

    @Override
    public AdapterKind getKind() {
        return AdapterKind.ANTHROPIC;
    }

    @Override
    public Mono<ProviderResponse> send(ProviderConfig config, ProviderRequest request) {
        log.debug("Anthropic request: provider={}, model={}", config.getId(), request.getModel());

        return webClient.post()
                .uri(URI.create(config.getBaseUrl() + "/messages"))
                .headers(headers -> {
                    headers.setContentType(MediaType.APPLICATION_JSON);
                    headers.set("x-api-key", config.getApiKey());
                    headers.set("anthropic-version", API_VERSION);
                })
                .bodyValue(toMessagesRequest(request))
                .retrieve()
                .bodyToMono(MessagesResponse.class)
                .switchIfEmpty(Mono.error(() -> new ProviderException(ProviderErrorType.TRANSPORT, "Empty response body")))
                .map(response -> toProviderResponse(response, request.getModel()));
    }

    private MessagesRequest toMessagesRequest(ProviderRequest request) {
        MessagesRequest messagesRequest = new MessagesRequest();
        messagesRequest.setModel(request.getModel());
        messagesRequest.setMaxTokens(request.getMaxTokens());
        messagesRequest.setTemperature(request.getTemperature());
        // System prompt is a top-level field, not a message role
        if (request.hasSystemPrompt()) {
            messagesRequest.setSystem(request.getSystemPrompt());
        }
        messagesRequest.setMessages(List.of(new MessagesRequest.Message("user", request.getPrompt())));
        return messagesRequest;
    }

    private ProviderResponse toProviderResponse(MessagesResponse response, String requestedModel) {
        if (response.getError() != null) {
            throw ProviderErrorClassifier.fromErrorBody(response.getError().getType(), response.getError().getMessage());
        }
        if (response.getContent() == null || response.getContent().isEmpty()) {
            throw new ProviderException(ProviderErrorType.TRANSPORT, "Response contained no content blocks");
        }

        String text = response.getContent().stream()
                .filter(block -> "text".equals(block.getType()))
                .map(MessagesResponse.ContentBlock::getText)
                .collect(Collectors.joining());

        Integer tokens = null;
        if (response.getUsage() != null) {
            tokens = (response.getUsage().getInputTokens() != null ? response.getUsage().getInputTokens() : 0)
                    + (response.getUsage().getOutputTokens() != null ? response.getUsage().getOutputTokens() : 0);
        }

        return ProviderResponse.builder()
                .content(text)
                .model(response.getModel() != null ? response.getModel() : requestedModel)
                .tokensUsed(tokens)
                .build();
    }

    // Anthropic API DTOs
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class MessagesRequest {
        private String model;

        @JsonProperty("max_tokens")
        private Integer maxTokens;

        private String system;
        private List<Message> messages;
        private Double temperature;

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        public static class Message {
            private String role;
            private String content;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MessagesResponse {
        private String id;
        private String type;
        private String model;
        private List<ContentBlock> content;

        @JsonProperty("stop_reason")
        private String stopReason;

        private Usage usage;
        private ErrorBody error;

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        @JsonIgnoreProperties(ignoreUnknown = true)
        public static class ContentBlock {
            private String type;
            private String text;
        }

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        @JsonIgnoreProperties(ignoreUnknown = true)
        public static class Usage {
            @JsonProperty("input_tokens")
            private Integer inputTokens;

            @JsonProperty("output_tokens")
            private Integer outputTokens;
        }

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        @JsonIgnoreProperties(ignoreUnknown = true)
        public static class ErrorBody {
            private String type;
            private String message;
        }
    }
}
