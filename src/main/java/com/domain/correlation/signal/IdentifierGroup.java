package com.domain.correlation.signal;

import com.domain.correlation.core.model.IdentifierKey;
import com.domain.correlation.core.model.Signal;
import com.domain.correlation.core.model.SignalTier;

import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * The distinct domains sharing one identifier, in sorted order.
 *
 * @param key     the shared identifier
 * @param tier    tier of the identifier type
 * @param domains sorted distinct domains, at least two
 */
public record IdentifierGroup(IdentifierKey key, SignalTier tier, List<String> domains) {

    public IdentifierGroup {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(tier, "tier is required");
        domains = List.copyOf(domains);
        if (domains.size() < 2) {
            throw new IllegalArgumentException("A shared identifier needs at least two domains: " + key);
        }
    }

    public int size() {
        return domains.size();
    }

    /**
     * Number of signals this group emits: one per unordered domain pair.
     */
    public long pairCount() {
        long k = domains.size();
        return k * (k - 1) / 2;
    }

    /**
     * Lazily emits one signal per unordered domain pair.
     */
    public Stream<Signal> signals() {
        int k = domains.size();
        return IntStream.range(0, k - 1).boxed()
                .flatMap(i -> IntStream.range(i + 1, k)
                        .mapToObj(j -> new Signal(domains.get(i), domains.get(j),
                                key.identifierType(), key.identifierValue(), tier)));
    }
}
