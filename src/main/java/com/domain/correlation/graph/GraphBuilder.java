package com.domain.correlation.graph;

import com.domain.correlation.core.model.DomainConnection;
import com.domain.correlation.core.model.DomainPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Materializes CONFIRMED and LIKELY connections as a {@link DomainGraph}.
 * NOISE connections are dropped entirely, so they never join components.
 */
public class GraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    public DomainGraph build(Map<DomainPair, DomainConnection> connections) {
        List<GraphEdge> edges = new ArrayList<>();
        int dropped = 0;
        for (DomainConnection connection : connections.values()) {
            if (connection.getClassification().isEdge()) {
                edges.add(new GraphEdge(connection));
            } else {
                dropped++;
            }
        }

        DomainGraph graph = DomainGraph.of(edges);
        log.debug("graph.built nodes={} edges={} noiseDropped={}",
                graph.nodeCount(), graph.edgeCount(), dropped);
        return graph;
    }
}
