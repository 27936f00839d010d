package com.airouter.config;

import com.airouter.provider.AdapterRegistry;
import com.airouter.registry.ProviderRegistry;
import com.airouter.resilience.ProviderCircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.micrometer.tagged.TaggedCircuitBreakerMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.time.Clock;

@Configuration
public class RouterConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProviderRegistry providerRegistry(RouterProperties properties,
                                             Environment environment,
                                             AdapterRegistry adapterRegistry) {
        return ProviderRegistry.fromProperties(properties, environment, adapterRegistry.supportedKinds());
    }

    /**
     * One breaker per provider id, all sharing the routing thresholds. Breaker state is
     * published as {@code resilience4j.circuitbreaker.*} meters.
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(RouterProperties properties, MeterRegistry meterRegistry) {
        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(
                ProviderCircuitBreaker.breakerConfig(properties.getRouting()));
        TaggedCircuitBreakerMetrics.ofCircuitBreakerRegistry(registry).bindTo(meterRegistry);
        return registry;
    }
}
