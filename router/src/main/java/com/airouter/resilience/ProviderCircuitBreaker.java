package com.airouter.resilience;

import com.airouter.config.RouterProperties;
import com.airouter.provider.ProviderException;
import com.airouter.registry.ProviderState;
import com.airouter.registry.ProviderStatus;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Per-provider Resilience4j circuit breaker.
 *
 * <p>Each provider gets a count-based breaker whose window equals {@code failure-threshold}
 * and which trips only at a 100% failure rate, so it opens on that many failures in a row.
 * The open window is mirrored onto {@link ProviderState} with the injected {@link Clock}; once it
 * has elapsed the breaker is moved to half-open and the next outcome alone decides whether it
 * closes or reopens. Rate-limit outcomes are never recorded here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProviderCircuitBreaker {

    // Slow calls must never trip the breaker; attempt timeouts already turn into failures
    private static final Duration SLOW_CALL_CEILING = Duration.ofDays(1);

    private final RouterProperties properties;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final Clock clock;

    public static CircuitBreakerConfig breakerConfig(RouterProperties.RoutingSettings routing) {
        int threshold = routing.getFailureThreshold();
        return CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(threshold)
                .minimumNumberOfCalls(threshold)
                .failureRateThreshold(100)
                .slowCallRateThreshold(100)
                .slowCallDurationThreshold(SLOW_CALL_CEILING)
                .waitDurationInOpenState(routing.getCircuitCooldown())
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .permittedNumberOfCallsInHalfOpenState(1)
                .build();
    }

    public boolean isOpen(ProviderState state) {
        return state.statusAt(clock.instant()) == ProviderStatus.CIRCUIT_OPEN;
    }

    public CircuitBreaker.State stateOf(ProviderState state) {
        return breakerFor(state).getState();
    }

    public void recordSuccess(ProviderState state, double responseTimeSeconds) {
        Instant now = clock.instant();
        CircuitBreaker breaker = breakerFor(state);
        synchronized (state) {
            halfOpenIfCooledDown(breaker, state, now);
            breaker.onSuccess(toNanos(responseTimeSeconds), TimeUnit.NANOSECONDS);
            state.recordSuccess(now, responseTimeSeconds, properties.getRouting().getLatencySmoothing());
        }
    }

    /**
     * @return true when this failure opened (or re-opened) the circuit
     */
    public boolean recordFailure(ProviderState state, ProviderException error, double responseTimeSeconds) {
        Instant now = clock.instant();
        Duration cooldown = properties.getRouting().getCircuitCooldown();
        CircuitBreaker breaker = breakerFor(state);

        synchronized (state) {
            halfOpenIfCooledDown(breaker, state, now);
            CircuitBreaker.State before = breaker.getState();
            breaker.onError(toNanos(responseTimeSeconds), TimeUnit.NANOSECONDS, error);
            state.recordFailure(now, error.getMessage());
            if (before == CircuitBreaker.State.OPEN || breaker.getState() != CircuitBreaker.State.OPEN) {
                return false;
            }
            state.coolDownUntil(now.plus(cooldown), ProviderStatus.CIRCUIT_OPEN);
        }
        log.warn("Circuit opened for provider {} after {} consecutive failures, cooling down for {}",
                state.getId(), properties.getRouting().getFailureThreshold(), cooldown);
        return true;
    }

    private void halfOpenIfCooledDown(CircuitBreaker breaker, ProviderState state, Instant now) {
        if (breaker.getState() == CircuitBreaker.State.OPEN && state.statusAt(now) != ProviderStatus.CIRCUIT_OPEN) {
            log.info("Circuit cooldown elapsed for provider {}, next outcome decides", state.getId());
            breaker.transitionToHalfOpenState();
        }
    }

    private CircuitBreaker breakerFor(ProviderState state) {
        return circuitBreakerRegistry.circuitBreaker(state.getId());
    }

    private static long toNanos(double seconds) {
        return (long) (seconds * 1_000_000_000L);
    }
}
