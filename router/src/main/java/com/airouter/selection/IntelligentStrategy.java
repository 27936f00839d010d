package com.airouter.selection;

import com.airouter.config.RouterProperties;
import com.airouter.model.RoutingStrategy;
import com.airouter.registry.ProviderState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Optional;

/**
 * Weighted score: {@code 0.7 * successRate + 0.3 * (1 - normalizedLatency)}.
 * Providers with no history score {@value #NEUTRAL_SCORE}.
 */
@Component
@RequiredArgsConstructor
public class IntelligentStrategy implements SelectionStrategy {

    static final double SUCCESS_WEIGHT = 0.7;
    static final double LATENCY_WEIGHT = 0.3;
    static final double NEUTRAL_SCORE = 0.5;

    private final RouterProperties properties;

    @Override
    public RoutingStrategy getStrategy() {
        return RoutingStrategy.INTELLIGENT;
    }

    @Override
    public Optional<ProviderState.Snapshot> select(SelectionContext context) {
        double fastest = context.eligible().stream()
                .filter(s -> s.latencySampled() && s.averageResponseTime() > 0)
                .mapToDouble(ProviderState.Snapshot::averageResponseTime)
                .min()
                .orElse(0.0);

        // max() keeps the greatest, so priority is reversed to let the lower number win ties
        return context.candidates().stream()
                .max(Comparator.comparingDouble((ProviderState.Snapshot s) -> score(s, fastest))
                        .thenComparing(BY_PRIORITY.reversed()));
    }

    double score(ProviderState.Snapshot snapshot, double fastestLatency) {
        if (snapshot.totalOutcomes() == 0) {
            return NEUTRAL_SCORE;
        }
        double latencyTerm = snapshot.latencySampled()
                ? 1.0 - normalizedLatency(snapshot.averageResponseTime(), fastestLatency)
                : NEUTRAL_SCORE;
        return SUCCESS_WEIGHT * snapshot.successRate() + LATENCY_WEIGHT * latencyTerm;
    }

    double normalizedLatency(double latency, double fastestLatency) {
        if (latency <= 0) {
            return 0.0;
        }
        if (properties.getRouting().getLatencyNormalization() == LatencyNormalization.FIXED) {
            double reference = properties.getRouting().getLatencyReference().toMillis() / 1000.0;
            return reference > 0 ? Math.min(latency / reference, 1.0) : 0.0;
        }
        if (fastestLatency <= 0) {
            return 0.0;
        }
        return 1.0 - Math.min(fastestLatency / latency, 1.0);
    }
}
