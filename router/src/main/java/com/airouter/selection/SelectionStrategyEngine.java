package com.airouter.selection;

import com.airouter.model.RoutingStrategy;
import com.airouter.registry.ProviderRegistry;
import com.airouter.registry.ProviderState;
import com.airouter.registry.ProviderStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Chooses the next provider for a request. Eligibility is recomputed from the registry on
 * every call, so cooldowns that expire mid-request are picked up by the next attempt.
 */
@Slf4j
@Component
public class SelectionStrategyEngine {

    private final ProviderRegistry registry;
    private final Map<RoutingStrategy, SelectionStrategy> strategies = new EnumMap<>(RoutingStrategy.class);
    private final Clock clock;

    public SelectionStrategyEngine(ProviderRegistry registry, List<SelectionStrategy> strategies, Clock clock) {
        this.registry = registry;
        this.clock = clock;
        for (SelectionStrategy strategy : strategies) {
            this.strategies.put(strategy.getStrategy(), strategy);
        }
        for (RoutingStrategy strategy : RoutingStrategy.values()) {
            if (!this.strategies.containsKey(strategy)) {
                throw new IllegalStateException("No selection strategy registered for " + strategy);
            }
        }
    }

    public SelectionCursor openCursor(RoutingStrategy strategy, List<String> preferred, List<String> allowed) {
        long sequence = strategies.get(strategy).beginRequest();
        Set<String> allowedIds = allowed != null && !allowed.isEmpty() ? new HashSet<>(allowed) : null;
        return new SelectionCursor(strategy, sequence, preferred, allowedIds);
    }

    /**
     * @return the next provider to try, or empty when no eligible provider is left for this request
     */
    public Optional<ProviderState> next(SelectionCursor cursor) {
        Instant now = clock.instant();
        List<ProviderState.Snapshot> eligible = registry.all().stream()
                .filter(state -> cursor.permits(state.getId()))
                .map(state -> state.snapshot(now))
                .filter(snapshot -> snapshot.status() == ProviderStatus.ACTIVE)
                .collect(Collectors.toList());

        Optional<ProviderState.Snapshot> preferred = cursor.getPreferred().stream()
                .filter(id -> !cursor.getAttempted().contains(id))
                .flatMap(id -> eligible.stream().filter(s -> s.id().equals(id)))
                .findFirst();
        if (preferred.isPresent()) {
            return registry.find(preferred.get().id());
        }

        SelectionContext context = new SelectionContext(eligible, cursor.getAttempted(), cursor.getSequence());
        if (context.candidates().isEmpty()) {
            log.debug("No eligible providers left (eligible={}, attempted={})",
                    eligible.size(), cursor.getAttempted().size());
            return Optional.empty();
        }

        return strategies.get(cursor.getStrategy())
                .select(context)
                .flatMap(snapshot -> registry.find(snapshot.id()));
    }
}
