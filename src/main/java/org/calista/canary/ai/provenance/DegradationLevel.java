package org.calista.canary.ai.provenance;

/**
 * How much an answer must be hedged. Declaration order is severity order.
 */
public enum DegradationLevel {
    FULL_ANSWER,
    PARTIAL_WITH_UNCERTAINTY,
    REQUEST_MORE_INFO,
    REFUSE;

    public boolean isAtLeast(DegradationLevel other) {
        return compareTo(other) >= 0;
    }

    public static DegradationLevel worst(DegradationLevel a, DegradationLevel b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.compareTo(b) >= 0 ? a : b;
    }
}
