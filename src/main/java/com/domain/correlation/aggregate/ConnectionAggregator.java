package com.domain.correlation.aggregate;

import com.domain.correlation.core.model.ConnectionClassification;
import com.domain.correlation.core.model.DomainConnection;
import com.domain.correlation.core.model.DomainPair;
import com.domain.correlation.core.model.Evidence;
import com.domain.correlation.core.model.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Folds signals into one {@link DomainConnection} per unordered domain pair.
 * Repeated signals for the same identifier collapse, so re-observing a fact never
 * raises a pair's classification.
 */
public class ConnectionAggregator {
    private static final Logger log = LoggerFactory.getLogger(ConnectionAggregator.class);

    /**
     * Aggregates a signal stream. The stream is fully consumed and closed.
     *
     * @return connections sorted by pair
     */
    public SortedMap<DomainPair, DomainConnection> aggregate(Stream<Signal> signals) {
        Objects.requireNonNull(signals, "signals is required");
        Map<DomainPair, Set<Evidence>> evidenceByPair = new HashMap<>();
        long[] seen = {0};
        try (signals) {
            signals.forEach(signal -> {
                seen[0]++;
                evidenceByPair.computeIfAbsent(signal.pair(), k -> new HashSet<>()).add(signal.evidence());
            });
        }

        SortedMap<DomainPair, DomainConnection> connections = new TreeMap<>();
        evidenceByPair.forEach((pair, evidence) -> connections.put(pair, DomainConnection.of(pair, evidence)));

        if (log.isInfoEnabled()) {
            Map<ConnectionClassification, Long> counts = countByClassification(connections);
            log.info("connections.aggregated signals={} pairs={} confirmed={} likely={} noise={}",
                    seen[0], connections.size(),
                    counts.getOrDefault(ConnectionClassification.CONFIRMED, 0L),
                    counts.getOrDefault(ConnectionClassification.LIKELY, 0L),
                    counts.getOrDefault(ConnectionClassification.NOISE, 0L));
        }
        return Collections.unmodifiableSortedMap(connections);
    }

    public SortedMap<DomainPair, DomainConnection> aggregate(Iterable<Signal> signals) {
        Objects.requireNonNull(signals, "signals is required");
        return aggregate(StreamSupport.stream(signals.spliterator(), false));
    }

    /**
     * Counts connections per classification.
     */
    public static Map<ConnectionClassification, Long> countByClassification(
            Map<DomainPair, DomainConnection> connections) {
        Map<ConnectionClassification, Long> counts = new EnumMap<>(ConnectionClassification.class);
        for (DomainConnection connection : connections.values()) {
            counts.merge(connection.getClassification(), 1L, Long::sum);
        }
        return counts;
    }
}
