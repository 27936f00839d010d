package com.airouter.selection;

import com.airouter.config.RouterProperties;
import com.airouter.registry.ProviderState;
import com.airouter.registry.ProviderStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;

class IntelligentStrategyTest {

    private final IntelligentStrategy strategy = new IntelligentStrategy(new RouterProperties());

    @Test
    void untestedProviderScoresNeutral() {
        assertEquals(0.5, strategy.score(snapshot("a", 1, 0, 0, 0.0, false), 1.0), 1e-9);
    }

    @Test
    void perfectAndFastestScoresOne() {
        assertEquals(1.0, strategy.score(snapshot("a", 1, 10, 0, 1.0, true), 1.0), 1e-9);
    }

    @Test
    void latencyIsNormalizedAgainstFastestEligible() {
        // twice as slow as the fastest: normalized 0.5, score 0.7 + 0.3 * 0.5
        assertEquals(0.85, strategy.score(snapshot("a", 1, 10, 0, 2.0, true), 1.0), 1e-9);
    }

    @Test
    void outcomesWithoutLatencyUseNeutralLatencyTerm() {
        // only failures so far: success rate 0, latency term 0.5
        assertEquals(0.15, strategy.score(snapshot("a", 1, 0, 4, 0.0, false), 1.0), 1e-9);
    }

    @Test
    void fixedNormalizationUsesReferenceLatency() {
        RouterProperties properties = new RouterProperties();
        properties.getRouting().setLatencyNormalization(LatencyNormalization.FIXED);
        properties.getRouting().setLatencyReference(Duration.ofSeconds(10));
        IntelligentStrategy fixed = new IntelligentStrategy(properties);

        assertEquals(0.5, fixed.normalizedLatency(5.0, 1.0), 1e-9);
        assertEquals(1.0, fixed.normalizedLatency(30.0, 1.0), 1e-9);
    }

    @Test
    void picksHighestScoreAndBreaksTiesByPriority() {
        ProviderState.Snapshot slow = snapshot("slow", 1, 10, 0, 4.0, true);
        ProviderState.Snapshot fast = snapshot("fast", 2, 10, 0, 1.0, true);
        ProviderState.Snapshot freshLow = snapshot("fresh-low", 5, 0, 0, 0.0, false);
        ProviderState.Snapshot freshHigh = snapshot("fresh-high", 4, 0, 0, 0.0, false);

        SelectionContext all = new SelectionContext(List.of(slow, fast, freshLow, freshHigh), Set.of(), 0);
        assertEquals("fast", strategy.select(all).orElseThrow().id());

        SelectionContext untested = new SelectionContext(List.of(slow, fast, freshLow, freshHigh),
                Set.of("slow", "fast"), 0);
        assertEquals("fresh-high", strategy.select(untested).orElseThrow().id());
    }

    @Test
    void fastestIsTakenFromAllEligibleIncludingAttempted() {
        ProviderState.Snapshot fast = snapshot("fast", 1, 10, 0, 1.0, true);
        ProviderState.Snapshot slow = snapshot("slow", 2, 10, 0, 4.0, true);
        ProviderState.Snapshot fresh = snapshot("fresh", 3, 0, 0, 0.0, false);

        // slow: 0.7 + 0.3 * 0.25 = 0.775 beats the neutral 0.5
        SelectionContext context = new SelectionContext(List.of(fast, slow, fresh), Set.of("fast"), 0);
        assertEquals("slow", strategy.select(context).orElseThrow().id());
    }

    private static ProviderState.Snapshot snapshot(String id, int priority, long successes, long failures,
                                                   double latency, boolean sampled) {
        return new ProviderState.Snapshot(id, priority, ProviderStatus.ACTIVE, 0, successes, failures,
                latency, sampled, null, null, null);
    }
}
