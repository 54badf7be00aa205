package com.domain.correlation.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Bucketing key for observations: an identifier value within its identifier type.
 * Two domains are related only when they share both.
 */
public record IdentifierKey(String identifierType, String identifierValue) implements Comparable<IdentifierKey> {

    private static final Comparator<IdentifierKey> ORDER = Comparator
            .comparing(IdentifierKey::identifierType)
            .thenComparing(IdentifierKey::identifierValue);

    public IdentifierKey {
        Objects.requireNonNull(identifierType, "identifierType is required");
        Objects.requireNonNull(identifierValue, "identifierValue is required");
    }

    @Override
    public int compareTo(IdentifierKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return identifierType + "=" + identifierValue;
    }
}
