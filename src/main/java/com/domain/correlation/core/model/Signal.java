package com.domain.correlation.core.model;

import java.util.Objects;

/**
 * Pairwise evidence that two domains share one identifier.
 * {@code domainA} always sorts before {@code domainB}.
 */
public record Signal(
        String domainA,
        String domainB,
        String identifierType,
        String identifierValue,
        SignalTier tier
) {
    public Signal {
        Objects.requireNonNull(domainA, "domainA is required");
        Objects.requireNonNull(domainB, "domainB is required");
        Objects.requireNonNull(identifierType, "identifierType is required");
        Objects.requireNonNull(identifierValue, "identifierValue is required");
        Objects.requireNonNull(tier, "tier is required");
        if (domainA.compareTo(domainB) > 0) {
            String swap = domainA;
            domainA = domainB;
            domainB = swap;
        } else if (domainA.equals(domainB)) {
            throw new IllegalArgumentException("Signal requires two distinct domains, got " + domainA);
        }
    }

    /**
     * Creates a signal for a shared identifier between two domains in any order.
     */
    public static Signal between(String domainA, String domainB, IdentifierKey key, SignalTier tier) {
        return new Signal(domainA, domainB, key.identifierType(), key.identifierValue(), tier);
    }

    public DomainPair pair() {
        return DomainPair.of(domainA, domainB);
    }

    public IdentifierKey identifierKey() {
        return new IdentifierKey(identifierType, identifierValue);
    }

    public Evidence evidence() {
        return new Evidence(identifierType, identifierValue, tier);
    }
}
