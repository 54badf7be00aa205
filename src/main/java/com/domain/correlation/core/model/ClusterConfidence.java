package com.domain.correlation.core.model;

/**
 * Confidence that a cluster is a single operator's network. Declared in output order.
 */
public enum ClusterConfidence {
    HIGH,
    MEDIUM,
    LOW;

    /** Likely edges needed for {@link #MEDIUM} when no edge is confirmed. */
    public static final int MEDIUM_LIKELY_THRESHOLD = 2;

    public static ClusterConfidence of(int confirmedEdges, int likelyEdges) {
        if (confirmedEdges > 0) {
            return HIGH;
        }
        if (likelyEdges >= MEDIUM_LIKELY_THRESHOLD) {
            return MEDIUM;
        }
        return LOW;
    }
}
