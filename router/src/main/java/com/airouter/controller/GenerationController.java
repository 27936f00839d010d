package com.airouter.controller;

import com.airouter.model.GenerationModels;
import com.airouter.service.ClientQuotaService;
import com.airouter.service.RoutingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class GenerationController {

    private final RoutingService routingService;
    private final ClientQuotaService quotaService;
    private final MeterRegistry meterRegistry;

    /**
     * Generates a completion, falling back across providers. Answers 503 with the full
     * attempt history when every provider failed.
     */
    @PostMapping("/generate")
    public Mono<ResponseEntity<Object>> generate(
            @Valid @RequestBody GenerationModels.GenerationRequest request,
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @RequestHeader(value = "X-Api-Key", required = false) String apiKey) {

        String identifier = extractIdentifier(authorization, apiKey);

        log.info("Generation request received: strategy={}, maxAttempts={}, promptLength={}",
                request.getStrategy(), request.getMaxAttempts(), request.getPrompt().length());

        if (!quotaService.tryConsume(identifier)) {
            ClientQuotaService.QuotaInfo quota = quotaService.getQuotaInfo(identifier);
            return Mono.just(ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .header("X-RateLimit-Limit", String.valueOf(quota.limit()))
                    .header("X-RateLimit-Remaining", "0")
                    .header("Retry-After", String.valueOf(quota.resetSeconds()))
                    .<Object>body(createError("Client quota exceeded. Please try again later.",
                            "rate_limit_error", "client_quota_exceeded")));
        }

        Timer.Sample sample = Timer.start(meterRegistry);

        return routingService.generate(request)
                .map(result -> {
                    sample.stop(meterRegistry.timer("ai.request.latency", "operation", "generate"));
                    ClientQuotaService.QuotaInfo quota = quotaService.getQuotaInfo(identifier);

                    return ResponseEntity.status(result.isSuccess() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                            .header("X-RateLimit-Limit", String.valueOf(quota.limit()))
                            .header("X-RateLimit-Remaining", String.valueOf(quota.remaining()))
                            .header("X-RateLimit-Reset", String.valueOf(quota.resetSeconds()))
                            .<Object>body(result);
                });
    }

    private String extractIdentifier(String authorization, String apiKey) {
        if (apiKey != null && !apiKey.isEmpty()) {
            return apiKey;
        }
        if (authorization != null && authorization.startsWith("Bearer ")) {
            return authorization.substring(7);
        }
        return "anonymous";
    }

    private GenerationModels.ErrorResponse createError(String message, String type, String code) {
        return GenerationModels.ErrorResponse.builder()
                .error(GenerationModels.ErrorResponse.Error.builder()
                        .message(message)
                        .type(type)
                        .code(code)
                        .build())
                .build();
    }
}
