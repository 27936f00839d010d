package com.airouter.selection;

import com.airouter.model.RoutingStrategy;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Selection state of a single request. Confined to the request's own attempt chain.
 */
public class SelectionCursor {

    private final RoutingStrategy strategy;
    private final long sequence;
    private final List<String> preferred;
    private final Set<String> allowed;
    private final Set<String> attempted = new LinkedHashSet<>();

    SelectionCursor(RoutingStrategy strategy, long sequence, List<String> preferred, Set<String> allowed) {
        this.strategy = strategy;
        this.sequence = sequence;
        this.preferred = preferred != null ? List.copyOf(preferred) : List.of();
        this.allowed = allowed;
    }

    public RoutingStrategy getStrategy() {
        return strategy;
    }

    public long getSequence() {
        return sequence;
    }

    public List<String> getPreferred() {
        return preferred;
    }

    public boolean permits(String providerId) {
        return allowed == null || allowed.contains(providerId);
    }

    public void markAttempted(String providerId) {
        attempted.add(providerId);
    }

    public Set<String> getAttempted() {
        return Collections.unmodifiableSet(attempted);
    }
}
