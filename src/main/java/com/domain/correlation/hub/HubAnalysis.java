package com.domain.correlation.hub;

import java.util.List;
import java.util.Objects;

/**
 * Connectivity profile of one domain in the graph.
 *
 * @param domain               the domain
 * @param degree               number of incident edges
 * @param weightedDegree       sum of incident edge weights
 * @param confirmedConnections incident CONFIRMED edges
 * @param likelyConnections    incident LIKELY edges
 * @param connectedDomains     neighbors, sorted
 * @param potentialC2          true if the domain looks like a hub or controller
 */
public record HubAnalysis(
        String domain,
        int degree,
        int weightedDegree,
        int confirmedConnections,
        int likelyConnections,
        List<String> connectedDomains,
        boolean potentialC2
) {
    public HubAnalysis {
        Objects.requireNonNull(domain, "domain is required");
        connectedDomains = connectedDomains != null ? List.copyOf(connectedDomains) : List.of();
    }

    public boolean hasConfirmedConnection() {
        return confirmedConnections > 0;
    }
}
