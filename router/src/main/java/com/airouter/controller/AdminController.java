package com.airouter.controller;

import com.airouter.model.StatsModels;
import com.airouter.registry.ProviderRegistry;
import com.airouter.service.ClientQuotaService;
import com.airouter.service.RoutingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
public class AdminController {

    private final RoutingService routingService;
    private final ProviderRegistry registry;
    private final ClientQuotaService quotaService;
    private final Clock clock;

    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        int eligible = registry.eligibleAt(clock.instant()).size();
        return Mono.just(ResponseEntity.ok(Map.of(
                "status", eligible > 0 ? "healthy" : "degraded",
                "timestamp", clock.instant().toString(),
                "service", "ai-router",
                "configured_providers", registry.configuredCount(),
                "eligible_providers", eligible
        )));
    }

    @GetMapping("/v1/stats")
    public Mono<StatsModels.AggregateStats> stats() {
        return Mono.fromSupplier(routingService::getStats);
    }

    @GetMapping("/v1/providers/health")
    public Mono<Map<String, StatsModels.HealthSnapshot>> providerHealth() {
        return Mono.fromSupplier(routingService::getProviderHealth);
    }

    /**
     * Zeroes statistics. Open circuits and rate-limit cooldowns stay in place.
     */
    @PostMapping("/admin/stats/reset")
    public Mono<ResponseEntity<Map<String, Object>>> resetStats() {
        routingService.resetStats();
        return Mono.just(ResponseEntity.ok(Map.of(
                "status", "success",
                "reset_at", clock.instant().toString()
        )));
    }

    @GetMapping("/admin/quota/{identifier}")
    public ResponseEntity<Map<String, Object>> getQuotaInfo(@PathVariable String identifier) {
        ClientQuotaService.QuotaInfo info = quotaService.getQuotaInfo(identifier);
        return ResponseEntity.ok(Map.of(
                "identifier", identifier,
                "limit", info.limit(),
                "remaining", info.remaining(),
                "resetSeconds", info.resetSeconds()
        ));
    }

    @DeleteMapping("/admin/quota/{identifier}")
    public ResponseEntity<Map<String, Object>> resetQuota(@PathVariable String identifier) {
        quotaService.resetLimit(identifier);
        return ResponseEntity.ok(Map.of(
                "status", "success",
                "identifier", identifier
        ));
    }
}
