package com.airouter.registry;

import java.time.Instant;

/**
 * Mutable runtime state of one provider, shared by every in-flight request.
 *
 * <p>All access goes through the intrinsic lock of this object. Callers that need a
 * compound transition (increment then maybe open the circuit) synchronize on the state
 * themselves; the lock is reentrant.
 *
 * <p>Status is never stored directly. It is derived from the disabled flag and the
 * available-after timestamp each time it is asked for, so an expired cooldown is
 * cleared lazily on the first read after it elapses.
 */
public class ProviderState {

    private final ProviderConfig config;
    private final boolean disabled;

    private int consecutiveFailures;
    private long successCount;
    private long failureCount;
    private double averageResponseTime;
    private boolean latencySampled;
    private Instant lastUsed;
    private Instant availableAfter;
    private ProviderStatus cooldownStatus;
    private String lastError;

    public ProviderState(ProviderConfig config, boolean disabled) {
        this.config = config;
        this.disabled = disabled;
    }

    public String getId() {
        return config.getId();
    }

    public ProviderConfig getConfig() {
        return config;
    }

    public boolean isDisabled() {
        return disabled;
    }

    public synchronized ProviderStatus statusAt(Instant now) {
        if (disabled) {
            return ProviderStatus.DISABLED;
        }
        if (availableAfter != null) {
            if (now.isBefore(availableAfter)) {
                return cooldownStatus;
            }
            availableAfter = null;
            cooldownStatus = null;
        }
        return ProviderStatus.ACTIVE;
    }

    public boolean isEligibleAt(Instant now) {
        return statusAt(now) == ProviderStatus.ACTIVE;
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized void recordSuccess(Instant now, double responseTimeSeconds, double smoothing) {
        consecutiveFailures = 0;
        successCount++;
        lastUsed = now;
        if (!latencySampled) {
            averageResponseTime = responseTimeSeconds;
            latencySampled = true;
        } else {
            averageResponseTime = smoothing * responseTimeSeconds + (1 - smoothing) * averageResponseTime;
        }
    }

    /**
     * @return the consecutive-failure count after this failure
     */
    public synchronized int recordFailure(Instant now, String error) {
        consecutiveFailures++;
        failureCount++;
        lastUsed = now;
        lastError = error;
        return consecutiveFailures;
    }

    // Counts against the success rate but leaves the consecutive-failure count alone
    public synchronized void recordRateLimited(Instant now, String error) {
        failureCount++;
        lastUsed = now;
        lastError = error;
    }

    /**
     * Makes the provider ineligible until {@code until}. An earlier deadline never
     * shortens a cooldown that is already in place.
     */
    public synchronized void coolDownUntil(Instant until, ProviderStatus reason) {
        if (availableAfter == null || until.isAfter(availableAfter)) {
            availableAfter = until;
            cooldownStatus = reason;
        }
    }

    public synchronized void resetCounters() {
        successCount = 0;
        failureCount = 0;
        averageResponseTime = 0;
        latencySampled = false;
    }

    public synchronized Snapshot snapshot(Instant now) {
        ProviderStatus status = statusAt(now);
        return new Snapshot(config.getId(), config.getPriority(), status, consecutiveFailures,
                successCount, failureCount, averageResponseTime, latencySampled,
                lastUsed, availableAfter, lastError);
    }

    /**
     * Consistent point-in-time copy used by selection and health reporting.
     */
    public record Snapshot(String id,
                           int priority,
                           ProviderStatus status,
                           int consecutiveFailures,
                           long successCount,
                           long failureCount,
                           double averageResponseTime,
                           boolean latencySampled,
                           Instant lastUsed,
                           Instant availableAfter,
                           String lastError) {

        public long totalOutcomes() {
            return successCount + failureCount;
        }

        public double successRate() {
            return (double) successCount / Math.max(totalOutcomes(), 1);
        }
    }
}
