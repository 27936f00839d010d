package com.airouter;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class AiRouterApplicationTests {

    @Autowired
    private WebTestClient webTestClient;

    @Test
    void startsWithTheLocalProvider() {
        webTestClient.get().uri("/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.service").isEqualTo("ai-router")
                .jsonPath("$.eligible_providers").isNumber();

        webTestClient.get().uri("/v1/providers/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.local.status").isEqualTo("active")
                .jsonPath("$.local.adapter").isEqualTo("openai-compatible");
    }

    @Test
    void statsCanBeReset() {
        webTestClient.post().uri("/admin/stats/reset")
                .exchange()
                .expectStatus().isOk();

        webTestClient.get().uri("/v1/stats")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.total_requests").isEqualTo(0)
                .jsonPath("$.last_reset").exists();
    }

    @Test
    void quotaCanBeInspectedAndReset() {
        webTestClient.get().uri("/admin/quota/some-caller")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.limit").isEqualTo(100)
                .jsonPath("$.remaining").isEqualTo(100);

        webTestClient.delete().uri("/admin/quota/some-caller")
                .exchange()
                .expectStatus().isOk();
    }
}
