package com.airouter.selection;

import com.airouter.registry.ProviderState;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * @param eligible  every provider eligible right now, including ones already tried by this request
 * @param attempted provider ids already tried by this request
 * @param sequence  per-request value from {@link SelectionStrategy#beginRequest()}
 */
public record SelectionContext(List<ProviderState.Snapshot> eligible, Set<String> attempted, long sequence) {

    public List<ProviderState.Snapshot> candidates() {
        return eligible.stream()
                .filter(s -> !attempted.contains(s.id()))
                .collect(Collectors.toList());
    }
}
