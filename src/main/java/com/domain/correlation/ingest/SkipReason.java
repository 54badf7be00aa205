package com.domain.correlation.ingest;

/**
 * Why an observation record was left out of signal extraction.
 */
public enum SkipReason {
    BLANK_DOMAIN("blank domain"),
    DOMAIN_TOO_LONG("domain exceeds 253 characters"),
    BLANK_IDENTIFIER("blank identifier value"),
    CONTROL_CHARACTERS("value contains control characters"),
    SELF_REFERENCE("identifier value is the observed domain itself");

    private final String description;

    SkipReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
