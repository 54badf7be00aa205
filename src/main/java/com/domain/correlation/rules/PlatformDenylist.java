package com.domain.correlation.rules;

import com.domain.correlation.ingest.RecordSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Exact identifier values known to belong to shared infrastructure (hosting IPs,
 * CDN certificates, platform analytics IDs). Matching is case-insensitive.
 *
 * <p>Text format for {@link #load(Reader)}: one value per line, {@code #} starts a comment,
 * blank lines are ignored.</p>
 */
public final class PlatformDenylist {
    private static final Logger log = LoggerFactory.getLogger(PlatformDenylist.class);

    private static final PlatformDenylist EMPTY = new PlatformDenylist(Set.of());

    private final Set<String> values;

    private PlatformDenylist(Set<String> values) {
        this.values = values;
    }

    public static PlatformDenylist empty() {
        return EMPTY;
    }

    public static PlatformDenylist of(String... values) {
        return of(Arrays.asList(values));
    }

    public static PlatformDenylist of(Collection<String> values) {
        Set<String> normalized = new TreeSet<>();
        for (String value : values) {
            String key = normalize(value);
            if (!key.isEmpty()) {
                normalized.add(key);
            }
        }
        return normalized.isEmpty() ? EMPTY : new PlatformDenylist(Collections.unmodifiableSet(normalized));
    }

    /**
     * Reads a denylist from text. The reader is consumed but not closed.
     *
     * @throws UncheckedIOException if reading fails
     */
    public static PlatformDenylist load(Reader reader) {
        Set<String> loaded = new TreeSet<>();
        BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        try {
            String line;
            while ((line = br.readLine()) != null) {
                int comment = line.indexOf('#');
                if (comment >= 0) {
                    line = line.substring(0, comment);
                }
                String key = normalize(line);
                if (!key.isEmpty()) {
                    loaded.add(key);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read platform denylist", e);
        }
        log.info("denylist.loaded entries={}", loaded.size());
        return loaded.isEmpty() ? EMPTY : new PlatformDenylist(Collections.unmodifiableSet(loaded));
    }

    /**
     * Returns a new denylist containing the entries of both.
     */
    public PlatformDenylist merge(PlatformDenylist other) {
        Set<String> combined = new TreeSet<>(values);
        combined.addAll(other.values);
        return combined.isEmpty() ? EMPTY : new PlatformDenylist(Collections.unmodifiableSet(combined));
    }

    public boolean contains(String identifierValue) {
        return identifierValue != null && values.contains(normalize(identifierValue));
    }

    public Set<String> getValues() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    private static String normalize(String value) {
        return RecordSanitizer.cleanText(value).toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "PlatformDenylist{entries=" + values.size() + '}';
    }
}
