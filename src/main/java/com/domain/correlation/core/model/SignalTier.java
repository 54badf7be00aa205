package com.domain.correlation.core.model;

/**
 * Evidentiary strength of a shared identifier, strongest first.
 */
public enum SignalTier {
    /** One shared value alone proves a connection. */
    SMOKING_GUN(0),
    /** Needs a second distinct strong value to count. */
    STRONG(1),
    /** Context only; never creates a connection by itself. */
    WEAK(2);

    private final int rank;

    SignalTier(int rank) {
        this.rank = rank;
    }

    /**
     * Returns the ordering rank; lower is stronger.
     */
    public int rank() {
        return rank;
    }

    public boolean isStrongerThan(SignalTier other) {
        return rank < other.rank;
    }
}
