package com.domain.correlation.signal;

import com.domain.correlation.core.model.Signal;
import com.domain.correlation.core.model.SignalTier;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Output of {@link SignalExtractor}: the shared identifier groups and the counters
 * collected on the way. Signals are generated from the groups on demand.
 */
public final class ExtractionResult {

    private final List<IdentifierGroup> groups;
    private final ExtractionStats stats;

    public ExtractionResult(List<IdentifierGroup> groups, ExtractionStats stats) {
        this.groups = List.copyOf(groups);
        this.stats = Objects.requireNonNull(stats, "stats is required");
    }

    /**
     * Shared identifier groups, sorted by identifier type then value.
     */
    public List<IdentifierGroup> getGroups() {
        return groups;
    }

    public ExtractionStats getStats() {
        return stats;
    }

    /**
     * A fresh lazy stream of every signal, in deterministic order.
     * Each call starts over; pairs are never held in memory all at once.
     */
    public Stream<Signal> signals() {
        return groups.stream().flatMap(IdentifierGroup::signals);
    }

    public Stream<Signal> signals(SignalTier tier) {
        return groups.stream()
                .filter(g -> g.tier() == tier)
                .flatMap(IdentifierGroup::signals);
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }
}
