package com.domain.correlation.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * A distinct shared identifier contributing to a {@link DomainConnection}.
 * The same value observed twice is equal, so repeated observations collapse in a set.
 */
public record Evidence(String identifierType, String identifierValue, SignalTier tier)
        implements Comparable<Evidence> {

    private static final Comparator<Evidence> ORDER = Comparator
            .comparing(Evidence::tier)
            .thenComparing(Evidence::identifierType)
            .thenComparing(Evidence::identifierValue);

    public Evidence {
        Objects.requireNonNull(identifierType, "identifierType is required");
        Objects.requireNonNull(identifierValue, "identifierValue is required");
        Objects.requireNonNull(tier, "tier is required");
    }

    public IdentifierKey key() {
        return new IdentifierKey(identifierType, identifierValue);
    }

    @Override
    public int compareTo(Evidence other) {
        return ORDER.compare(this, other);
    }
}
