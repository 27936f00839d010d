package com.airouter.resilience;

import com.airouter.config.RouterProperties;
import com.airouter.registry.ProviderState;
import com.airouter.registry.ProviderStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Tracks provider-reported throttling. Independent of the circuit breaker: a rate limit
 * never moves the consecutive-failure count.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProviderRateLimiter {

    private final RouterProperties properties;
    private final Clock clock;

    public boolean isRateLimited(ProviderState state) {
        return state.statusAt(clock.instant()) == ProviderStatus.RATE_LIMITED;
    }

    /**
     * @param retryAfter provider hint, may be null; only honoured when longer than the configured
     *                   cooldown, and never beyond {@code max-rate-limit-cooldown}
     */
    public Instant recordRateLimit(ProviderState state, Duration retryAfter, String error) {
        Instant now = clock.instant();
        Instant until = now.plus(cooldownFor(retryAfter));

        synchronized (state) {
            state.recordRateLimited(now, error);
            state.coolDownUntil(until, ProviderStatus.RATE_LIMITED);
        }
        log.warn("Provider {} rate limited, unavailable until {}", state.getId(), until);
        return until;
    }

    Duration cooldownFor(Duration retryAfter) {
        RouterProperties.RoutingSettings routing = properties.getRouting();
        Duration cooldown = routing.getRateLimitCooldown();
        if (retryAfter != null && retryAfter.compareTo(cooldown) > 0) {
            cooldown = retryAfter;
        }
        Duration ceiling = routing.getMaxRateLimitCooldown();
        if (ceiling != null && cooldown.compareTo(ceiling) > 0) {
            log.debug("Retry-After hint {} exceeds the {} ceiling", retryAfter, ceiling);
            return ceiling.compareTo(routing.getRateLimitCooldown()) > 0 ? ceiling : routing.getRateLimitCooldown();
        }
        return cooldown;
    }
}
