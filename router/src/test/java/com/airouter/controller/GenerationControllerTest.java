package com.airouter.controller;

import com.airouter.model.AttemptOutcome;
import com.airouter.model.GenerationErrorCode;
import com.airouter.model.GenerationModels;
import com.airouter.model.RoutingStrategy;
import com.airouter.service.ClientQuotaService;
import com.airouter.service.RoutingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = GenerationController.class)
class GenerationControllerTest {

    @TestConfiguration
    static class Meters {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private RoutingService routingService;

    @MockBean
    private ClientQuotaService quotaService;

    @BeforeEach
    void setUp() {
        when(quotaService.tryConsume(anyString())).thenReturn(true);
        when(quotaService.getQuotaInfo(anyString())).thenReturn(new ClientQuotaService.QuotaInfo(60, 59, 60));
    }

    @Test
    void successIsOk() {
        when(routingService.generate(any())).thenReturn(Mono.just(GenerationModels.GenerationResult.builder()
                .success(true)
                .content("Hello!")
                .providerId("deepseek")
                .providerName("DeepSeek Chat v3.1")
                .model("deepseek/deepseek-chat-v3.1:free")
                .strategy(RoutingStrategy.INTELLIGENT)
                .responseTimeSeconds(1.2)
                .attempts(List.of(GenerationModels.AttemptRecord.builder()
                        .providerId("deepseek")
                        .outcome(AttemptOutcome.SUCCESS)
                        .responseTimeSeconds(1.2)
                        .build()))
                .build()));

        webTestClient.post().uri("/v1/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Api-Key", "caller-key")
                .bodyValue(Map.of("prompt", "Say hello", "strategy", "round-robin", "max_attempts", 3))
                .exchange()
                .expectStatus().isOk()
                .expectHeader().valueEquals("X-RateLimit-Remaining", "59")
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.provider_id").isEqualTo("deepseek")
                .jsonPath("$.strategy").isEqualTo("intelligent")
                .jsonPath("$.attempts[0].outcome").isEqualTo("success")
                .jsonPath("$.error_code").doesNotExist();

        verify(quotaService).tryConsume("caller-key");
        verify(routingService).generate(argThat(request ->
                request.getStrategy() == RoutingStrategy.ROUND_ROBIN && request.getMaxAttempts() == 3));
    }

    @Test
    void exhaustionIsServiceUnavailableWithTheResult() {
        when(routingService.generate(any())).thenReturn(Mono.just(GenerationModels.GenerationResult.builder()
                .success(false)
                .strategy(RoutingStrategy.PRIORITY)
                .error("All providers failed: a: timeout (Timed out waiting for response)")
                .errorCode(GenerationErrorCode.ALL_PROVIDERS_EXHAUSTED)
                .attempts(List.of())
                .build()));

        webTestClient.post().uri("/v1/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("prompt", "Say hello"))
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.error_code").isEqualTo("all_providers_exhausted");
    }

    @Test
    void spentQuotaIsTooManyRequests() {
        when(quotaService.tryConsume("Bearer-token")).thenReturn(false);

        webTestClient.post().uri("/v1/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .header("Authorization", "Bearer Bearer-token")
                .bodyValue(Map.of("prompt", "Say hello"))
                .exchange()
                .expectStatus().isEqualTo(429)
                .expectHeader().exists("Retry-After")
                .expectBody()
                .jsonPath("$.error.code").isEqualTo("client_quota_exceeded");

        verify(routingService, never()).generate(any());
    }

    @Test
    void blankPromptIsRejected() {
        webTestClient.post().uri("/v1/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("prompt", "  "))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.code").isEqualTo("validation_error");

        verify(routingService, never()).generate(any());
    }

    @Test
    void unknownStrategyIsRejected() {
        webTestClient.post().uri("/v1/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("prompt", "Say hello", "strategy", "cheapest"))
                .exchange()
                .expectStatus().isBadRequest();

        verify(routingService, never()).generate(any());
    }

    @Test
    void unexpectedRouterFailureIsReportedInRouterTerms() {
        when(routingService.generate(any())).thenReturn(Mono.error(new IllegalStateException("selection blew up")));

        webTestClient.post().uri("/v1/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("prompt", "Say hello"))
                .exchange()
                .expectStatus().isEqualTo(500)
                .expectBody()
                .jsonPath("$.error.type").isEqualTo("router_error")
                .jsonPath("$.error.code").isEqualTo("routing_failed")
                .jsonPath("$.error.message").isEqualTo("The router could not complete the request");
    }
}
