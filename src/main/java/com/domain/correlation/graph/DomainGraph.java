package com.domain.correlation.graph;

import com.domain.correlation.core.model.DomainPair;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable, undirected, weighted graph over domains.
 * Nodes are exactly the domains touched by at least one edge.
 */
public final class DomainGraph {

    private static final DomainGraph EMPTY = new DomainGraph(List.of());

    private final SortedSet<String> nodes;
    private final List<GraphEdge> edges;
    private final Map<DomainPair, GraphEdge> edgesByPair;
    private final Map<String, List<GraphEdge>> adjacency;

    private DomainGraph(Collection<GraphEdge> edgeSet) {
        List<GraphEdge> ranked = new ArrayList<>(edgeSet);
        ranked.sort(GraphEdge.RANKING);

        Map<DomainPair, GraphEdge> byPair = new HashMap<>();
        Map<String, List<GraphEdge>> adj = new TreeMap<>();
        for (GraphEdge edge : ranked) {
            if (byPair.putIfAbsent(edge.pair(), edge) != null) {
                throw new IllegalArgumentException("Duplicate edge for pair " + edge.pair());
            }
            adj.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge);
            adj.computeIfAbsent(edge.target(), k -> new ArrayList<>()).add(edge);
        }
        adj.replaceAll((domain, incident) -> List.copyOf(incident));

        this.edges = List.copyOf(ranked);
        this.edgesByPair = Collections.unmodifiableMap(byPair);
        this.adjacency = Collections.unmodifiableMap(adj);
        this.nodes = Collections.unmodifiableSortedSet(new TreeSet<>(adj.keySet()));
    }

    public static DomainGraph of(Collection<GraphEdge> edges) {
        return edges.isEmpty() ? EMPTY : new DomainGraph(edges);
    }

    public static DomainGraph empty() {
        return EMPTY;
    }

    /**
     * All domains, sorted.
     */
    public SortedSet<String> nodes() {
        return nodes;
    }

    /**
     * All edges in ranking order (see {@link GraphEdge#RANKING}).
     */
    public List<GraphEdge> edges() {
        return edges;
    }

    public boolean containsNode(String domain) {
        return adjacency.containsKey(domain);
    }

    public Optional<GraphEdge> edge(String domainA, String domainB) {
        if (domainA.equals(domainB)) {
            return Optional.empty();
        }
        return Optional.ofNullable(edgesByPair.get(DomainPair.of(domainA, domainB)));
    }

    /**
     * Edges touching a domain in ranking order; empty for unknown domains.
     */
    public List<GraphEdge> incidentEdges(String domain) {
        return adjacency.getOrDefault(domain, List.of());
    }

    public SortedSet<String> neighbors(String domain) {
        SortedSet<String> result = new TreeSet<>();
        for (GraphEdge edge : incidentEdges(domain)) {
            result.add(edge.pair().other(domain));
        }
        return Collections.unmodifiableSortedSet(result);
    }

    public int degree(String domain) {
        return incidentEdges(domain).size();
    }

    public int weightedDegree(String domain) {
        int sum = 0;
        for (GraphEdge edge : incidentEdges(domain)) {
            sum += edge.weight();
        }
        return sum;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean isEmpty() {
        return edges.isEmpty();
    }

    @Override
    public String toString() {
        return "DomainGraph{nodes=" + nodes.size() + ", edges=" + edges.size() + '}';
    }
}
