package com.domain.correlation.core.model;

/**
 * Overall verdict for a domain pair, derived from the tiers of its distinct evidence.
 */
public enum ConnectionClassification {
    CONFIRMED,
    LIKELY,
    NOISE;

    /** Distinct strong identifiers needed for {@link #LIKELY}. */
    public static final int LIKELY_STRONG_THRESHOLD = 2;

    /**
     * Returns true if connections with this classification become graph edges.
     */
    public boolean isEdge() {
        return this != NOISE;
    }

    /**
     * Classifies a connection from its distinct evidence counts.
     */
    public static ConnectionClassification of(int smokingGunCount, int strongCount) {
        if (smokingGunCount > 0) {
            return CONFIRMED;
        }
        if (strongCount >= LIKELY_STRONG_THRESHOLD) {
            return LIKELY;
        }
        return NOISE;
    }
}
