package com.airouter.registry;

import com.airouter.config.RouterConfigurationException;
import com.airouter.config.RouterProperties;
import com.airouter.provider.AdapterKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Owns every {@link ProviderState}. The set of providers is fixed once the registry is built.
 */
@Slf4j
public class ProviderRegistry {

    private final Map<String, ProviderState> states;

    public ProviderRegistry(Collection<ProviderState> providerStates) {
        Map<String, ProviderState> byId = new LinkedHashMap<>();
        Set<String> seen = new HashSet<>();
        for (ProviderState state : providerStates) {
            if (!seen.add(state.getId().toLowerCase(Locale.ROOT))) {
                throw new RouterConfigurationException("Duplicate provider identifier: " + state.getId());
            }
            byId.put(state.getId(), state);
        }
        if (byId.isEmpty()) {
            throw new RouterConfigurationException("No providers configured under ai.providers");
        }
        if (byId.values().stream().allMatch(ProviderState::isDisabled)) {
            throw new RouterConfigurationException(
                    "No usable providers: every configured provider is disabled or missing its credential");
        }
        this.states = Collections.unmodifiableMap(byId);
    }

    /**
     * Builds the registry from bound properties. Credentials are resolved from the
     * environment; a provider whose credential is missing stays registered as DISABLED.
     */
    public static ProviderRegistry fromProperties(RouterProperties properties,
                                                  Environment environment,
                                                  Set<AdapterKind> supportedKinds) {
        Map<String, RouterProperties.ProviderSettings> providers = properties.getProviders();
        if (providers == null || providers.isEmpty()) {
            throw new RouterConfigurationException("No providers configured under ai.providers");
        }

        List<ProviderState> states = new ArrayList<>();
        providers.forEach((id, settings) -> {
            ProviderConfig config = toConfig(id, settings, environment, supportedKinds);
            boolean missingCredential = settings.isCredentialRequired() && !config.hasCredential();

            if (!settings.isEnabled()) {
                log.info("Provider {} is disabled by configuration", id);
            } else if (missingCredential) {
                log.info("Provider {} skipped: credential {} not set", id,
                        settings.getCredentialEnv() != null ? settings.getCredentialEnv() : "api-key");
            } else {
                log.info("Loaded provider {}: model={}, adapter={}, priority={}",
                        id, config.getDefaultModel(), config.getAdapterKind(), config.getPriority());
            }
            states.add(new ProviderState(config, !settings.isEnabled() || missingCredential));
        });

        ProviderRegistry registry = new ProviderRegistry(states);
        log.info("Provider registry ready: {} of {} providers usable",
                registry.configuredCount(), registry.size());
        return registry;
    }

    private static ProviderConfig toConfig(String id,
                                           RouterProperties.ProviderSettings settings,
                                           Environment environment,
                                           Set<AdapterKind> supportedKinds) {
        if (id == null || id.isBlank()) {
            throw new RouterConfigurationException("Provider identifier cannot be blank");
        }
        if (settings.getAdapter() == null) {
            throw new RouterConfigurationException("Provider " + id + " has no adapter kind");
        }
        if (!supportedKinds.contains(settings.getAdapter())) {
            throw new RouterConfigurationException(
                    "Provider " + id + " uses adapter " + settings.getAdapter() + " which has no implementation");
        }
        if (settings.getBaseUrl() == null || settings.getBaseUrl().isBlank()) {
            throw new RouterConfigurationException("Provider " + id + " has no base-url");
        }
        if (settings.getDefaultModel() == null || settings.getDefaultModel().isBlank()) {
            throw new RouterConfigurationException("Provider " + id + " has no default-model");
        }
        if (settings.getTimeout() == null || settings.getTimeout().isZero() || settings.getTimeout().isNegative()) {
            throw new RouterConfigurationException("Provider " + id + " needs a positive timeout");
        }

        return ProviderConfig.builder()
                .id(id)
                .displayName(settings.getDisplayName() != null ? settings.getDisplayName() : id)
                .adapterKind(settings.getAdapter())
                .baseUrl(stripTrailingSlash(settings.getBaseUrl()))
                .credentialEnv(settings.getCredentialEnv())
                .apiKey(resolveCredential(settings, environment))
                .defaultModel(settings.getDefaultModel())
                .priority(settings.getPriority())
                .timeout(settings.getTimeout())
                .maxTokens(settings.getMaxTokens())
                .temperature(settings.getTemperature())
                .build();
    }

    private static String resolveCredential(RouterProperties.ProviderSettings settings, Environment environment) {
        if (settings.getApiKey() != null && !settings.getApiKey().isBlank()) {
            return settings.getApiKey().trim();
        }
        if (settings.getCredentialEnv() != null && !settings.getCredentialEnv().isBlank()) {
            String value = environment.getProperty(settings.getCredentialEnv());
            return value != null && !value.isBlank() ? value.trim() : null;
        }
        return null;
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    public Optional<ProviderState> find(String id) {
        return Optional.ofNullable(states.get(id));
    }

    public List<ProviderState> all() {
        return List.copyOf(states.values());
    }

    /**
     * Providers that were usable at startup, regardless of their current cooldowns.
     */
    public List<ProviderState> configured() {
        return states.values().stream()
                .filter(s -> !s.isDisabled())
                .collect(Collectors.toList());
    }

    public List<ProviderState> eligibleAt(Instant now) {
        return states.values().stream()
                .filter(s -> s.isEligibleAt(now))
                .collect(Collectors.toList());
    }

    public int configuredCount() {
        return configured().size();
    }

    public int size() {
        return states.size();
    }
}
