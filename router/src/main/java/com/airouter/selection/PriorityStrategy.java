package com.airouter.selection;

import com.airouter.model.RoutingStrategy;
import com.airouter.registry.ProviderState;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class PriorityStrategy implements SelectionStrategy {

    @Override
    public RoutingStrategy getStrategy() {
        return RoutingStrategy.PRIORITY;
    }

    @Override
    public Optional<ProviderState.Snapshot> select(SelectionContext context) {
        return context.candidates().stream().min(BY_PRIORITY);
    }
}
