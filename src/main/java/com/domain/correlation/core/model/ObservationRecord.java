package com.domain.correlation.core.model;

import java.util.Objects;

/**
 * One raw fact discovered about a domain, e.g. "example.com carries analytics ID UA-123".
 * Produced outside the engine; the engine never mutates it.
 *
 * <p>Empty or blank values are well-typed and are skipped during extraction.
 * Null fields are an invalid shape and are rejected here.</p>
 *
 * @param domain          the observed domain
 * @param source          the collector that produced the fact (defaults to {@code "unknown"})
 * @param identifierType  the kind of identifier, e.g. {@code google_analytics}
 * @param identifierValue the identifier itself, e.g. {@code UA-123-1}
 */
public record ObservationRecord(
        String domain,
        String source,
        String identifierType,
        String identifierValue
) {
    public static final String UNKNOWN_SOURCE = "unknown";

    public ObservationRecord {
        Objects.requireNonNull(domain, "domain is required");
        Objects.requireNonNull(identifierType, "identifierType is required");
        Objects.requireNonNull(identifierValue, "identifierValue is required");
        source = source != null ? source : UNKNOWN_SOURCE;
    }

    /**
     * Creates a record with an unknown source.
     */
    public static ObservationRecord of(String domain, String identifierType, String identifierValue) {
        return new ObservationRecord(domain, UNKNOWN_SOURCE, identifierType, identifierValue);
    }
}
