package com.airouter.provider;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class AdapterRegistry {

    private final Map<AdapterKind, ProviderAdapter> adapters = new EnumMap<>(AdapterKind.class);

    public AdapterRegistry(List<ProviderAdapter> adapters) {
        for (ProviderAdapter adapter : adapters) {
            ProviderAdapter previous = this.adapters.put(adapter.getKind(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Two adapters registered for " + adapter.getKind());
            }
        }
    }

    public ProviderAdapter forKind(AdapterKind kind) {
        ProviderAdapter adapter = adapters.get(kind);
        if (adapter == null) {
            throw new IllegalStateException("No adapter registered for " + kind);
        }
        return adapter;
    }

    public Set<AdapterKind> supportedKinds() {
        return Collections.unmodifiableSet(adapters.keySet());
    }
}
