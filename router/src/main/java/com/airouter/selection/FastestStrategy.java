package com.airouter.selection;

import com.airouter.model.RoutingStrategy;
import com.airouter.registry.ProviderState;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Optional;

/**
 * Lowest rolling latency first. A provider without a latency sample sorts as zero so
 * that it gets measured.
 */
@Component
public class FastestStrategy implements SelectionStrategy {

    private static final Comparator<ProviderState.Snapshot> BY_LATENCY = Comparator
            .comparingDouble(FastestStrategy::latency)
            .thenComparing(BY_PRIORITY);

    @Override
    public RoutingStrategy getStrategy() {
        return RoutingStrategy.FASTEST;
    }

    @Override
    public Optional<ProviderState.Snapshot> select(SelectionContext context) {
        return context.candidates().stream().min(BY_LATENCY);
    }

    private static double latency(ProviderState.Snapshot snapshot) {
        return snapshot.latencySampled() ? snapshot.averageResponseTime() : 0.0;
    }
}
