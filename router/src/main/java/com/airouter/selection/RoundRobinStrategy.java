package com.airouter.selection;

import com.airouter.model.RoutingStrategy;
import com.airouter.registry.ProviderState;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Spreads load over the eligible list with one shared cursor. The cursor moves once per
 * request; fallbacks inside a request walk forward from the request's start position.
 */
@Component
public class RoundRobinStrategy implements SelectionStrategy {

    private final AtomicLong cursor = new AtomicLong();

    @Override
    public RoutingStrategy getStrategy() {
        return RoutingStrategy.ROUND_ROBIN;
    }

    @Override
    public long beginRequest() {
        return cursor.getAndIncrement();
    }

    @Override
    public Optional<ProviderState.Snapshot> select(SelectionContext context) {
        List<ProviderState.Snapshot> ordered = context.eligible().stream()
                .sorted(BY_PRIORITY)
                .collect(Collectors.toList());
        if (ordered.isEmpty()) {
            return Optional.empty();
        }

        int start = (int) Math.floorMod(context.sequence(), (long) ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            ProviderState.Snapshot candidate = ordered.get((start + i) % ordered.size());
            if (!context.attempted().contains(candidate.id())) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
