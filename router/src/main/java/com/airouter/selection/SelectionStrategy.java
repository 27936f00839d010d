package com.airouter.selection;

import com.airouter.model.RoutingStrategy;
import com.airouter.registry.ProviderState;

import java.util.Comparator;
import java.util.Optional;

/**
 * One provider-picking policy. Implementations are stateless apart from what
 * {@link #beginRequest()} maintains, and are called concurrently.
 */
public interface SelectionStrategy {

    Comparator<ProviderState.Snapshot> BY_PRIORITY = Comparator
            .comparingInt(ProviderState.Snapshot::priority)
            .thenComparing(ProviderState.Snapshot::id);

    RoutingStrategy getStrategy();

    /**
     * Picks among {@link SelectionContext#candidates()}; empty only when there are none.
     */
    Optional<ProviderState.Snapshot> select(SelectionContext context);

    /**
     * Called once when a request starts; the returned value is handed back through
     * {@link SelectionContext#sequence()} on every attempt of that request.
     */
    default long beginRequest() {
        return 0;
    }
}
