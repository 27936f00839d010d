package com.airouter.provider;

import com.airouter.registry.ProviderConfig;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CohereAdapterTest {

    private static final ProviderConfig CONFIG = ProviderConfig.builder()
            .id("cohere")
            .displayName("Cohere Command A")
            .adapterKind(AdapterKind.COHERE)
            .baseUrl("https://api.cohere.ai/v1")
            .apiKey("co-key")
            .defaultModel("command-a-03-2025")
            .priority(10)
            .timeout(Duration.ofSeconds(30))
            .maxTokens(4096)
            .temperature(0.7)
            .build();

    private static final ProviderRequest REQUEST = ProviderRequest.builder()
            .prompt("Say hello")
            .model("command-a-03-2025")
            .maxTokens(64)
            .temperature(0.2)
            .build();

    @Test
    void readsTextAndTokenCounts() {
        StubExchange exchange = new StubExchange(HttpStatus.OK, """
                {"response_id":"r1","text":"Hello from Cohere","finish_reason":"COMPLETE",
                 "meta":{"api_version":{"version":"1"},"tokens":{"input_tokens":8,"output_tokens":4}}}
                """);
        CohereAdapter adapter = new CohereAdapter(exchange.builder());

        StepVerifier.create(adapter.send(CONFIG, REQUEST))
                .assertNext(response -> {
                    assertEquals("Hello from Cohere", response.getContent());
                    assertEquals(12, response.getTokensUsed());
                })
                .verifyComplete();

        assertEquals("https://api.cohere.ai/v1/chat", exchange.lastRequest.get().url().toString());
        assertEquals("Bearer co-key", exchange.lastRequest.get().headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void unauthorizedIsAnAuthenticationFailure() {
        StubExchange exchange = new StubExchange(HttpStatus.UNAUTHORIZED, "{\"message\":\"invalid api token\"}");
        CohereAdapter adapter = new CohereAdapter(exchange.builder());

        StepVerifier.create(adapter.send(CONFIG, REQUEST))
                .expectErrorSatisfies(e ->
                        assertEquals(ProviderErrorType.AUTHENTICATION, ProviderErrorClassifier.classify(e).getType()))
                .verify();
    }
}
