package com.airouter.service;

import com.airouter.config.RouterProperties;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-caller request quota on the HTTP surface. Unrelated to provider-side rate limits.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClientQuotaService {

    static final String ANONYMOUS = "anonymous";

    private final RouterProperties properties;
    private final MeterRegistry meterRegistry;

    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        RouterProperties.ClientQuotaSettings quota = properties.getClientQuota();
        if (quota.isEnabled()) {
            log.info("Client quota enabled: {} requests/minute per caller", quota.getRequestsPerMinute());
        } else {
            log.info("Client quota disabled");
        }
    }

    public boolean tryConsume(String identifier) {
        if (!properties.getClientQuota().isEnabled()) {
            return true;
        }

        String key = keyFor(identifier);
        boolean allowed = buckets.computeIfAbsent(key, k -> createBucket()).tryConsume(1);

        // Caller identifiers are often API keys, so they stay out of meter tags
        meterRegistry.counter("ai.client.quota", "status", allowed ? "allowed" : "exceeded").increment();
        if (!allowed) {
            log.warn("Client quota exceeded for caller {}", mask(key));
        }
        return allowed;
    }

    public QuotaInfo getQuotaInfo(String identifier) {
        RouterProperties.ClientQuotaSettings quota = properties.getClientQuota();
        if (!quota.isEnabled()) {
            return new QuotaInfo(Integer.MAX_VALUE, Integer.MAX_VALUE, 0);
        }

        Bucket bucket = buckets.get(keyFor(identifier));
        long remaining = bucket != null ? bucket.getAvailableTokens() : quota.getRequestsPerMinute();
        return new QuotaInfo(quota.getRequestsPerMinute(), (int) remaining, 60);
    }

    public void resetLimit(String identifier) {
        buckets.remove(keyFor(identifier));
        log.info("Client quota reset for caller {}", mask(keyFor(identifier)));
    }

    private Bucket createBucket() {
        int requestsPerMinute = properties.getClientQuota().getRequestsPerMinute();
        Bandwidth limit = Bandwidth.classic(
                requestsPerMinute,
                Refill.greedy(requestsPerMinute, Duration.ofMinutes(1))
        );
        return Bucket.builder()
                .addLimit(limit)
                .build();
    }

    private static String keyFor(String identifier) {
        return identifier != null && !identifier.isBlank() ? identifier : ANONYMOUS;
    }

    static String mask(String identifier) {
        if (identifier.length() <= 8) {
            return identifier;
        }
        return identifier.substring(0, 4) + "..." + identifier.substring(identifier.length() - 4);
    }

    public record QuotaInfo(int limit, int remaining, int resetSeconds) {}
}
