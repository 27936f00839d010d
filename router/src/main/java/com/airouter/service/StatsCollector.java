package com.airouter.service;

import com.airouter.model.AttemptOutcome;
import com.airouter.model.StatsModels;
import com.airouter.registry.ProviderConfig;
import com.airouter.registry.ProviderRegistry;
import com.airouter.registry.ProviderState;
import com.airouter.resilience.ProviderCircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Aggregate request and attempt statistics. All writes are serialized on this object.
 * Micrometer meters are published alongside and are never reset.
 */
@Slf4j
@Component
public class StatsCollector {

    private final ProviderRegistry registry;
    private final ProviderCircuitBreaker circuitBreaker;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Instant startedAt;

    private final Map<String, ProviderCounters> providerCounters = new LinkedHashMap<>();
    private long totalRequests;
    private long successfulRequests;
    private long failedRequests;
    private long totalFallbacks;
    private double successfulResponseTimeTotal;
    private Instant lastReset;

    public StatsCollector(ProviderRegistry registry,
                          ProviderCircuitBreaker circuitBreaker,
                          MeterRegistry meterRegistry,
                          Clock clock) {
        this.registry = registry;
        this.circuitBreaker = circuitBreaker;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.startedAt = clock.instant();
        for (ProviderState state : registry.all()) {
            providerCounters.put(state.getId(), new ProviderCounters());
        }
    }

    /**
     * @param attemptIndex zero-based position of the attempt within its request; anything
     *                     above zero counts as a fallback
     */
    public void recordAttempt(String providerId, AttemptOutcome outcome, double responseTimeSeconds, int attemptIndex) {
        synchronized (this) {
            ProviderCounters counters = providerCounters.computeIfAbsent(providerId, id -> new ProviderCounters());
            counters.attempts++;
            switch (outcome) {
                case SUCCESS -> {
                    counters.successes++;
                    counters.latencyTotal += responseTimeSeconds;
                }
                case RATE_LIMITED -> {
                    counters.failures++;
                    counters.rateLimited++;
                }
                case TIMEOUT -> {
                    counters.failures++;
                    counters.timeouts++;
                }
                default -> counters.failures++;
            }
            if (attemptIndex > 0) {
                totalFallbacks++;
            }
        }

        meterRegistry.counter("ai.provider.requests",
                "provider", providerId, "outcome", outcome.getValue()).increment();
        meterRegistry.timer("ai.provider.latency", "provider", providerId)
                .record(Duration.ofNanos((long) (responseTimeSeconds * 1_000_000_000L)));
        if (attemptIndex > 0) {
            meterRegistry.counter("ai.routing.fallback", "to", providerId).increment();
        }
    }

    public void recordRequest(boolean success, double responseTimeSeconds) {
        synchronized (this) {
            totalRequests++;
            if (success) {
                successfulRequests++;
                successfulResponseTimeTotal += responseTimeSeconds;
            } else {
                failedRequests++;
            }
        }
        meterRegistry.counter("ai.router.requests", "status", success ? "success" : "failure").increment();
    }

    public synchronized StatsModels.AggregateStats getStats() {
        Map<String, StatsModels.ProviderRollup> rollups = new LinkedHashMap<>();
        providerCounters.forEach((id, counters) -> rollups.put(id, StatsModels.ProviderRollup.builder()
                .attempts(counters.attempts)
                .successes(counters.successes)
                .failures(counters.failures)
                .rateLimited(counters.rateLimited)
                .timeouts(counters.timeouts)
                .averageLatencySeconds(counters.successes > 0 ? counters.latencyTotal / counters.successes : 0.0)
                .build()));

        Instant now = clock.instant();
        return StatsModels.AggregateStats.builder()
                .totalRequests(totalRequests)
                .successfulRequests(successfulRequests)
                .failedRequests(failedRequests)
                .successRate(totalRequests > 0 ? (double) successfulRequests / totalRequests : 0.0)
                .totalFallbacks(totalFallbacks)
                .averageResponseTimeSeconds(successfulRequests > 0 ? successfulResponseTimeTotal / successfulRequests : 0.0)
                .providers(rollups)
                .uptimeSeconds(Duration.between(startedAt, now).getSeconds())
                .lastReset(lastReset)
                .build();
    }

    public Map<String, StatsModels.HealthSnapshot> getProviderHealth() {
        Instant now = clock.instant();
        Map<String, StatsModels.HealthSnapshot> health = new LinkedHashMap<>();
        for (ProviderState state : registry.all()) {
            ProviderState.Snapshot snapshot = state.snapshot(now);
            ProviderConfig config = state.getConfig();
            health.put(state.getId(), StatsModels.HealthSnapshot.builder()
                    .providerId(snapshot.id())
                    .displayName(config.getDisplayName())
                    .adapter(config.getAdapterKind())
                    .model(config.getDefaultModel())
                    .priority(snapshot.priority())
                    .status(snapshot.status())
                    .successRate(snapshot.successRate())
                    .successCount(snapshot.successCount())
                    .failureCount(snapshot.failureCount())
                    .averageResponseTimeSeconds(snapshot.averageResponseTime())
                    .consecutiveFailures(snapshot.consecutiveFailures())
                    .circuitState(circuitBreaker.stateOf(state).name().toLowerCase(Locale.ROOT))
                    .lastUsed(snapshot.lastUsed())
                    .availableAfter(snapshot.availableAfter())
                    .lastError(snapshot.lastError())
                    .build());
        }
        return health;
    }

    /**
     * Zeroes every counter. Circuit state, rate-limit cooldowns and consecutive-failure
     * counts are left alone.
     */
    public void reset() {
        synchronized (this) {
            providerCounters.replaceAll((id, counters) -> new ProviderCounters());
            totalRequests = 0;
            successfulRequests = 0;
            failedRequests = 0;
            totalFallbacks = 0;
            successfulResponseTimeTotal = 0;
            lastReset = clock.instant();
        }
        registry.all().forEach(ProviderState::resetCounters);
        log.info("Statistics reset");
    }

    private static final class ProviderCounters {
        long attempts;
        long successes;
        long failures;
        long rateLimited;
        long timeouts;
        double latencyTotal;
    }
}
