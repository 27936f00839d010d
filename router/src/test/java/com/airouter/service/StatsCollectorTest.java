package com.airouter.service;

import com.airouter.MutableClock;
import com.airouter.TestProviders;
import com.airouter.config.RouterProperties;
import com.airouter.model.AttemptOutcome;
import com.airouter.model.StatsModels;
import com.airouter.registry.ProviderRegistry;
import com.airouter.registry.ProviderState;
import com.airouter.registry.ProviderStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

class StatsCollectorTest {

    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private ProviderRegistry registry;
    private StatsCollector stats;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingNow();
        meterRegistry = new SimpleMeterRegistry();
        registry = TestProviders.registry(TestProviders.state("a", 1), TestProviders.state("b", 2));
        stats = new StatsCollector(registry, TestProviders.circuitBreaker(new RouterProperties(), clock),
                meterRegistry, clock);
    }

    @Test
    void aggregatesRequestsAndAttempts() {
        stats.recordAttempt("a", AttemptOutcome.TIMEOUT, 30.0, 0);
        stats.recordAttempt("b", AttemptOutcome.SUCCESS, 1.0, 1);
        stats.recordRequest(true, 31.0);
        stats.recordAttempt("a", AttemptOutcome.RATE_LIMITED, 0.1, 0);
        stats.recordAttempt("b", AttemptOutcome.SUCCESS, 3.0, 1);
        stats.recordRequest(true, 3.1);
        stats.recordAttempt("a", AttemptOutcome.NETWORK_ERROR, 0.2, 0);
        stats.recordRequest(false, 0.2);

        StatsModels.AggregateStats aggregate = stats.getStats();
        assertEquals(3, aggregate.getTotalRequests());
        assertEquals(2, aggregate.getSuccessfulRequests());
        assertEquals(1, aggregate.getFailedRequests());
        assertEquals(2.0 / 3, aggregate.getSuccessRate(), 1e-9);
        assertEquals(2, aggregate.getTotalFallbacks());
        assertEquals(17.05, aggregate.getAverageResponseTimeSeconds(), 1e-9);

        StatsModels.ProviderRollup a = aggregate.getProviders().get("a");
        assertEquals(3, a.getAttempts());
        assertEquals(3, a.getFailures());
        assertEquals(1, a.getTimeouts());
        assertEquals(1, a.getRateLimited());
        assertEquals(2.0, aggregate.getProviders().get("b").getAverageLatencySeconds(), 1e-9);
    }

    @Test
    void publishesMicrometerMeters() {
        stats.recordAttempt("a", AttemptOutcome.SUCCESS, 0.5, 0);
        stats.recordAttempt("b", AttemptOutcome.SUCCESS, 0.5, 1);
        stats.recordRequest(true, 1.0);

        assertEquals(1.0, meterRegistry.get("ai.provider.requests")
                .tags("provider", "a", "outcome", "success").counter().count());
        assertEquals(1.0, meterRegistry.get("ai.routing.fallback").tags("to", "b").counter().count());
        assertEquals(1.0, meterRegistry.get("ai.router.requests").tags("status", "success").counter().count());
        assertEquals(2, meterRegistry.get("ai.provider.latency").timers().stream().mapToLong(t -> t.count()).sum());
    }

    @Test
    void resetIsIdempotentAndLeavesCooldownsInPlace() {
        ProviderState a = registry.find("a").orElseThrow();
        a.recordFailure(clock.instant(), "down");
        a.coolDownUntil(clock.instant().plus(Duration.ofMinutes(10)), ProviderStatus.CIRCUIT_OPEN);
        stats.recordAttempt("a", AttemptOutcome.NETWORK_ERROR, 0.3, 0);
        stats.recordRequest(false, 0.3);

        clock.advance(Duration.ofSeconds(5));
        stats.reset();
        StatsModels.AggregateStats once = stats.getStats();
        stats.reset();
        StatsModels.AggregateStats twice = stats.getStats();

        assertEquals(once.getTotalRequests(), twice.getTotalRequests());
        assertEquals(0, twice.getTotalRequests());
        assertEquals(0, twice.getProviders().get("a").getAttempts());
        assertEquals(clock.instant(), twice.getLastReset());

        Map<String, StatsModels.HealthSnapshot> health = stats.getProviderHealth();
        assertEquals(ProviderStatus.CIRCUIT_OPEN, health.get("a").getStatus());
        assertEquals(1, health.get("a").getConsecutiveFailures());
        assertEquals(0, health.get("a").getFailureCount());
        assertNotNull(health.get("a").getAvailableAfter());

        // meters are monotonic
        assertEquals(1.0, meterRegistry.get("ai.router.requests").tags("status", "failure").counter().count());
    }

    @Test
    void healthSnapshotDescribesEveryProvider() {
        registry.find("b").orElseThrow().recordSuccess(clock.instant(), 1.2, 0.1);

        Map<String, StatsModels.HealthSnapshot> health = stats.getProviderHealth();

        assertEquals(2, health.size());
        StatsModels.HealthSnapshot b = health.get("b");
        assertEquals("B", b.getDisplayName());
        assertEquals("b-model", b.getModel());
        assertEquals(ProviderStatus.ACTIVE, b.getStatus());
        assertEquals(1.0, b.getSuccessRate(), 1e-9);
        assertEquals(1.2, b.getAverageResponseTimeSeconds(), 1e-9);
        assertEquals(clock.instant(), b.getLastUsed());
        assertNull(health.get("a").getLastUsed());
        assertEquals("closed", health.get("a").getCircuitState());
    }

    @Test
    void uptimeFollowsTheClock() {
        clock.advance(Duration.ofSeconds(90));

        assertEquals(90, stats.getStats().getUptimeSeconds());
    }
}
