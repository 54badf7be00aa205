package com.domain.correlation.api;

import com.domain.correlation.cluster.ClusterDetector;
import com.domain.correlation.cluster.DomainCluster;
import com.domain.correlation.core.model.ClusterConfidence;
import com.domain.correlation.core.model.ConnectionClassification;
import com.domain.correlation.core.model.DomainConnection;
import com.domain.correlation.core.model.DomainPair;
import com.domain.correlation.export.ExportResult;
import com.domain.correlation.export.GraphExporter;
import com.domain.correlation.graph.DomainGraph;
import com.domain.correlation.hub.HubAnalysis;
import com.domain.correlation.hub.HubIdentifier;
import com.domain.correlation.ingest.RecordSanitizer;
import com.domain.correlation.logging.LogContext;
import com.domain.correlation.signal.ExtractionResult;
import com.domain.correlation.signal.ExtractionStats;

import java.io.Writer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;

/**
 * Everything derived from one correlation run. Immutable.
 *
 * <p>Clusters and hubs at the configured thresholds are computed once; other
 * thresholds can be queried with {@link #detectClusters(int)} and {@link #identifyHubs(int)}.</p>
 */
public final class CorrelationResult {

    private final String runId;
    private final ExtractionResult extraction;
    private final SortedMap<DomainPair, DomainConnection> connections;
    private final DomainGraph graph;
    private final CorrelationOptions options;
    private final List<DomainCluster> clusters;
    private final List<HubAnalysis> hubs;

    CorrelationResult(String runId, ExtractionResult extraction,
                      SortedMap<DomainPair, DomainConnection> connections,
                      DomainGraph graph, CorrelationOptions options) {
        this.runId = Objects.requireNonNull(runId, "runId is required");
        this.extraction = Objects.requireNonNull(extraction, "extraction is required");
        this.connections = Objects.requireNonNull(connections, "connections is required");
        this.graph = Objects.requireNonNull(graph, "graph is required");
        this.options = Objects.requireNonNull(options, "options is required");
        this.clusters = detectClusters(options.getMinClusterSize());
        this.hubs = identifyHubs(options.getHubTopN());
    }

    public String getRunId() {
        return runId;
    }

    /**
     * All aggregated connections in pair order, NOISE included.
     */
    public Collection<DomainConnection> getConnections() {
        return connections.values();
    }

    public List<DomainConnection> getConfirmedConnections() {
        return connectionsClassified(ConnectionClassification.CONFIRMED);
    }

    public List<DomainConnection> getLikelyConnections() {
        return connectionsClassified(ConnectionClassification.LIKELY);
    }

    /**
     * Looks up the connection between two domains in either order.
     * Returns empty when the domains share nothing or are the same domain.
     */
    public Optional<DomainConnection> getConnection(String domainA, String domainB) {
        Objects.requireNonNull(domainA, "domainA is required");
        Objects.requireNonNull(domainB, "domainB is required");
        String a = RecordSanitizer.normalizeDomain(domainA);
        String b = RecordSanitizer.normalizeDomain(domainB);
        if (a.equals(b)) {
            return Optional.empty();
        }
        return Optional.ofNullable(connections.get(DomainPair.of(a, b)));
    }

    /**
     * Every connection involving the domain, NOISE included, in pair order.
     */
    public List<DomainConnection> getConnectionsFor(String domain) {
        Objects.requireNonNull(domain, "domain is required");
        String normalized = RecordSanitizer.normalizeDomain(domain);
        List<DomainConnection> result = new ArrayList<>();
        for (DomainConnection connection : connections.values()) {
            if (connection.getPair().contains(normalized)) {
                result.add(connection);
            }
        }
        return List.copyOf(result);
    }

    public List<DomainCluster> getClusters() {
        return clusters;
    }

    public List<DomainCluster> detectClusters(int minSize) {
        return new ClusterDetector(graph).detectClusters(minSize);
    }

    public List<HubAnalysis> getHubs() {
        return hubs;
    }

    public List<HubAnalysis> identifyHubs(int topN) {
        return new HubIdentifier(graph, options.getHubPercentile()).identifyHubs(topN);
    }

    public DomainGraph getGraph() {
        return graph;
    }

    /**
     * Writes the graph with the given exporter. The writer is left open.
     *
     * @throws com.domain.correlation.export.GraphExportException if writing fails
     */
    public ExportResult exportGraph(GraphExporter exporter, Writer writer) {
        Objects.requireNonNull(exporter, "exporter is required");
        Objects.requireNonNull(writer, "writer is required");
        try (LogContext ctx = LogContext.forExport(runId, exporter.getFormat())) {
            return exporter.export(graph, writer);
        }
    }

    public ExtractionStats getExtractionStats() {
        return extraction.getStats();
    }

    public SignalSummary getSignalSummary() {
        return SignalSummary.of(extraction.getGroups());
    }

    public NetworkSummary getNetworkSummary() {
        long confirmed = 0;
        long likely = 0;
        for (DomainConnection connection : connections.values()) {
            if (connection.isConfirmed()) {
                confirmed++;
            } else if (connection.isLikely()) {
                likely++;
            }
        }
        return new NetworkSummary(
                graph.nodeCount(),
                graph.edgeCount(),
                confirmed,
                likely,
                clusters.size(),
                clusters.stream().filter(c -> c.getConfidence() == ClusterConfidence.HIGH).count(),
                clusters.stream().filter(c -> c.getConfidence() == ClusterConfidence.MEDIUM).count(),
                hubs.stream().filter(HubAnalysis::potentialC2).count());
    }

    private List<DomainConnection> connectionsClassified(ConnectionClassification classification) {
        List<DomainConnection> result = new ArrayList<>();
        for (DomainConnection connection : connections.values()) {
            if (connection.getClassification() == classification) {
                result.add(connection);
            }
        }
        return List.copyOf(result);
    }

    @Override
    public String toString() {
        return "CorrelationResult{runId=" + runId +
                ", connections=" + connections.size() +
                ", domains=" + graph.nodeCount() +
                ", edges=" + graph.edgeCount() +
                ", clusters=" + clusters.size() +
                ", hubs=" + hubs.size() + '}';
    }
}
