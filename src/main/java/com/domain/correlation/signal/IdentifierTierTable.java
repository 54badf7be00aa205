package com.domain.correlation.signal;

import com.domain.correlation.core.model.SignalTier;
import com.domain.correlation.ingest.RecordSanitizer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Static table mapping identifier types to evidence tiers.
 * Types are normalized the same way ingested records are (case-insensitive, spaces as
 * underscores); unknown types fall back to {@link SignalTier#WEAK}.
 *
 * <p>Tables are immutable and can be inspected with {@link #asMap()} for auditing.</p>
 */
public final class IdentifierTierTable {

    /** Tier used for identifier types the table does not list. */
    public static final SignalTier UNKNOWN_TYPE_TIER = SignalTier.WEAK;

    private static final IdentifierTierTable DEFAULT = builder()
            // Unique IDs embedded by the operator
            .tier("google_analytics", SignalTier.SMOKING_GUN)
            .tier("analytics_id", SignalTier.SMOKING_GUN)
            .tier("tag_manager", SignalTier.SMOKING_GUN)
            .tier("adsense", SignalTier.SMOKING_GUN)
            .tier("ad_network_id", SignalTier.SMOKING_GUN)
            .tier("facebook_pixel", SignalTier.SMOKING_GUN)
            .tier("email", SignalTier.SMOKING_GUN)
            .tier("ssl_fingerprint", SignalTier.SMOKING_GUN)
            .tier("google_site_verification", SignalTier.SMOKING_GUN)
            .tier("atlassian_verification", SignalTier.SMOKING_GUN)
            .tier("file_metadata_fingerprint", SignalTier.SMOKING_GUN)
            // Infrastructure choices that need corroboration
            .tier("nameserver", SignalTier.STRONG)
            .tier("ssl_issuer_serial", SignalTier.STRONG)
            .tier("whois_registrant", SignalTier.STRONG)
            .tier("registrant_contact", SignalTier.STRONG)
            .tier("phone", SignalTier.STRONG)
            .tier("crypto_address", SignalTier.STRONG)
            .tier("ip_address", SignalTier.STRONG)
            // Shared hosting context
            .tier("hosting_ip", SignalTier.WEAK)
            .tier("asn", SignalTier.WEAK)
            .tier("hosting_provider", SignalTier.WEAK)
            .tier("server_banner", SignalTier.WEAK)
            .tier("country", SignalTier.WEAK)
            .tier("cms", SignalTier.WEAK)
            .build();

    private final Map<String, SignalTier> tiers;

    private IdentifierTierTable(Map<String, SignalTier> tiers) {
        this.tiers = Collections.unmodifiableMap(new TreeMap<>(tiers));
    }

    /**
     * The built-in table.
     */
    public static IdentifierTierTable defaultTable() {
        return DEFAULT;
    }

    /**
     * Looks up the tier for a type, falling back to {@link #UNKNOWN_TYPE_TIER}.
     */
    public SignalTier tierOf(String identifierType) {
        SignalTier tier = tiers.get(normalize(identifierType));
        return tier != null ? tier : UNKNOWN_TYPE_TIER;
    }

    public boolean isKnown(String identifierType) {
        return tiers.containsKey(normalize(identifierType));
    }

    /**
     * Identifier types listed for a tier, sorted.
     */
    public Set<String> typesFor(SignalTier tier) {
        Set<String> result = new TreeSet<>();
        tiers.forEach((type, t) -> {
            if (t == tier) {
                result.add(type);
            }
        });
        return Collections.unmodifiableSet(result);
    }

    /**
     * The full table, sorted by type.
     */
    public Map<String, SignalTier> asMap() {
        return tiers;
    }

    public int size() {
        return tiers.size();
    }

    static String normalize(String identifierType) {
        return RecordSanitizer.normalizeType(identifierType);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return tiers.equals(((IdentifierTierTable) o).tiers);
    }

    @Override
    public int hashCode() {
        return tiers.hashCode();
    }

    @Override
    public String toString() {
        return "IdentifierTierTable" + tiers;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts a builder pre-filled with this table, for overrides.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.tiers.putAll(tiers);
        return builder;
    }

    public static class Builder {
        private final Map<String, SignalTier> tiers = new LinkedHashMap<>();

        public Builder tier(String identifierType, SignalTier tier) {
            Objects.requireNonNull(tier, "tier is required");
            String key = normalize(identifierType);
            if (key.isEmpty()) {
                throw new IllegalArgumentException("identifierType must not be blank");
            }
            tiers.put(key, tier);
            return this;
        }

        public Builder remove(String identifierType) {
            tiers.remove(normalize(identifierType));
            return this;
        }

        public IdentifierTierTable build() {
            return new IdentifierTierTable(tiers);
        }
    }
}
