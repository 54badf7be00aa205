package com.domain.correlation.graph;

import com.domain.correlation.core.model.ConnectionClassification;
import com.domain.correlation.core.model.DomainConnection;
import com.domain.correlation.core.model.DomainPair;

import java.util.Comparator;
import java.util.Objects;

/**
 * Undirected edge between two domains, backed by a CONFIRMED or LIKELY connection.
 *
 * @param connection the connection this edge materializes
 */
public record GraphEdge(DomainConnection connection) {

    /**
     * CONFIRMED before LIKELY regardless of weight, then heavier first, then by pair.
     */
    public static final Comparator<GraphEdge> RANKING = Comparator
            .comparing(GraphEdge::classification)
            .thenComparing(Comparator.comparingInt(GraphEdge::weight).reversed())
            .thenComparing(GraphEdge::pair);

    public GraphEdge {
        Objects.requireNonNull(connection, "connection is required");
        if (!connection.getClassification().isEdge()) {
            throw new IllegalArgumentException("NOISE connections cannot become edges: " + connection.getPair());
        }
    }

    public DomainPair pair() {
        return connection.getPair();
    }

    public String source() {
        return connection.getDomain1();
    }

    public String target() {
        return connection.getDomain2();
    }

    public int weight() {
        return connection.getWeight();
    }

    public ConnectionClassification classification() {
        return connection.getClassification();
    }

    public boolean isConfirmed() {
        return connection.isConfirmed();
    }
}
