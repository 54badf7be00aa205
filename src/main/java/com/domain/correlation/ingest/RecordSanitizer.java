package com.domain.correlation.ingest;

import com.domain.correlation.core.model.ObservationRecord;

import java.util.Locale;
import java.util.Objects;

/**
 * Normalization and validation of raw observation records.
 * Malformed-but-well-typed records are reported with a {@link SkipReason}, never thrown.
 */
public final class RecordSanitizer {

    /** Maximum length of a fully qualified domain name. */
    public static final int MAX_DOMAIN_LENGTH = 253;

    private static final String WWW_PREFIX = "www.";

    private RecordSanitizer() {
        // utility class
    }

    /**
     * Outcome of sanitizing one record: either the cleaned record or the reason it was skipped.
     */
    public record Outcome(ObservationRecord record, SkipReason skipReason) {

        static Outcome accepted(ObservationRecord record) {
            return new Outcome(record, null);
        }

        static Outcome skipped(SkipReason reason) {
            return new Outcome(null, reason);
        }

        public boolean isAccepted() {
            return skipReason == null;
        }
    }

    /**
     * Cleans a record: NUL bytes removed, whitespace collapsed, domain and type lowercased,
     * trailing dot and leading {@code www.} stripped from the domain. Identifier values keep
     * their case.
     *
     * @throws NullPointerException if the record is null
     */
    public static Outcome sanitize(ObservationRecord record) {
        Objects.requireNonNull(record, "record is required");

        String domain = normalizeDomain(record.domain());
        if (domain.isEmpty()) {
            return Outcome.skipped(SkipReason.BLANK_DOMAIN);
        }
        if (domain.length() > MAX_DOMAIN_LENGTH) {
            return Outcome.skipped(SkipReason.DOMAIN_TOO_LONG);
        }

        String value = cleanText(record.identifierValue());
        if (value.isEmpty()) {
            return Outcome.skipped(SkipReason.BLANK_IDENTIFIER);
        }
        if (containsControlCharacters(domain) || containsControlCharacters(value)) {
            return Outcome.skipped(SkipReason.CONTROL_CHARACTERS);
        }
        if (normalizeDomain(value).equals(domain)) {
            return Outcome.skipped(SkipReason.SELF_REFERENCE);
        }

        String type = normalizeType(record.identifierType());
        String source = cleanText(record.source());
        return Outcome.accepted(new ObservationRecord(domain, source.isEmpty() ? null : source, type, value));
    }

    /**
     * Lowercases a domain and strips surrounding whitespace, a trailing dot and a leading {@code www.}.
     */
    public static String normalizeDomain(String domain) {
        String result = cleanText(domain).toLowerCase(Locale.ROOT);
        while (result.endsWith(".")) {
            result = result.substring(0, result.length() - 1);
        }
        if (result.startsWith(WWW_PREFIX)) {
            result = result.substring(WWW_PREFIX.length());
        }
        return result;
    }

    public static String normalizeType(String identifierType) {
        return cleanText(identifierType).toLowerCase(Locale.ROOT).replace(' ', '_');
    }

    /**
     * Removes NUL bytes and collapses runs of whitespace into single spaces.
     */
    public static String cleanText(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return text.replace("\u0000", "")
                .trim()
                .replaceAll("\\s+", " ");
    }

    /**
     * Checks whether a string contains ASCII control characters (0x00-0x1F, 0x7F).
     * Whitespace has already been collapsed by {@link #cleanText(String)} at this point.
     */
    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 || c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
