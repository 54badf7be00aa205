package com.domain.correlation.api;

/**
 * Headline numbers of a correlation run.
 *
 * @param totalDomains         domains in the graph
 * @param totalEdges           CONFIRMED and LIKELY connections
 * @param confirmedConnections CONFIRMED connections
 * @param likelyConnections    LIKELY connections
 * @param clusters             clusters at the configured minimum size
 * @param highConfidence       HIGH confidence clusters
 * @param mediumConfidence     MEDIUM confidence clusters
 * @param potentialC2          reported hubs flagged as potential coordination points
 */
public record NetworkSummary(
        int totalDomains,
        int totalEdges,
        long confirmedConnections,
        long likelyConnections,
        int clusters,
        long highConfidence,
        long mediumConfidence,
        long potentialC2
) {
}
