package com.airouter.selection;

/**
 * How the intelligent strategy turns a rolling latency into a [0, 1] penalty.
 */
public enum LatencyNormalization {
    /** Penalty is {@code 1 - fastest / own} against the fastest eligible provider. */
    FASTEST_ELIGIBLE,
    /** Penalty is {@code min(own / reference, 1)} against ai.routing.latency-reference. */
    FIXED
}
