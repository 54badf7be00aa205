package com.domain.correlation.cluster;

import com.domain.correlation.core.model.ClusterConfidence;
import com.domain.correlation.graph.DomainGraph;
import com.domain.correlation.graph.GraphEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Partitions a {@link DomainGraph} into clusters: its connected components.
 *
 * <p>Output order is HIGH, MEDIUM, LOW confidence, then larger clusters first, then by
 * smallest member domain, so a given graph always yields the same sequence.</p>
 */
public class ClusterDetector {
    private static final Logger log = LoggerFactory.getLogger(ClusterDetector.class);

    public static final int DEFAULT_MIN_SIZE = 2;

    private static final Comparator<Component> OUTPUT_ORDER = Comparator
            .comparing(Component::confidence)
            .thenComparing(Comparator.comparingInt(Component::size).reversed())
            .thenComparing(Component::firstMember);

    private final DomainGraph graph;

    public ClusterDetector(DomainGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph is required");
    }

    public List<DomainCluster> detectClusters() {
        return detectClusters(DEFAULT_MIN_SIZE);
    }

    /**
     * Finds connected components with at least {@code minSize} domains.
     *
     * @throws IllegalArgumentException if minSize is less than 1
     */
    public List<DomainCluster> detectClusters(int minSize) {
        if (minSize < 1) {
            throw new IllegalArgumentException("minSize must be at least 1, got " + minSize);
        }
        if (graph.isEmpty()) {
            log.info("clusters.detected count=0 reason=empty-graph");
            return List.of();
        }

        UnionFind components = new UnionFind();
        for (GraphEdge edge : graph.edges()) {
            components.union(edge.source(), edge.target());
        }

        Map<String, Component> byRoot = new TreeMap<>();
        for (String domain : graph.nodes()) {
            byRoot.computeIfAbsent(components.find(domain), k -> new Component()).members.add(domain);
        }
        for (GraphEdge edge : graph.edges()) {
            Component component = byRoot.get(components.find(edge.source()));
            component.edges.add(edge);
            if (edge.isConfirmed()) {
                component.confirmed++;
            } else {
                component.likely++;
            }
        }

        List<Component> surviving = new ArrayList<>();
        for (Component component : byRoot.values()) {
            if (component.size() >= minSize) {
                surviving.add(component);
            }
        }
        surviving.sort(OUTPUT_ORDER);

        List<DomainCluster> clusters = new ArrayList<>(surviving.size());
        for (Component component : surviving) {
            clusters.add(DomainCluster.builder()
                    .clusterId(clusters.size() + 1)
                    .domains(component.members)
                    .edges(component.edges)
                    .hubDomain(hubOf(component))
                    .build());
        }

        log.info("clusters.detected count={} high={} medium={} minSize={}",
                clusters.size(),
                clusters.stream().filter(c -> c.getConfidence() == ClusterConfidence.HIGH).count(),
                clusters.stream().filter(c -> c.getConfidence() == ClusterConfidence.MEDIUM).count(),
                minSize);
        return List.copyOf(clusters);
    }

    /**
     * Member with the highest weighted degree inside the component; ties go to the smaller name.
     */
    private static String hubOf(Component component) {
        Map<String, Integer> weighted = new HashMap<>();
        for (GraphEdge edge : component.edges) {
            weighted.merge(edge.source(), edge.weight(), Integer::sum);
            weighted.merge(edge.target(), edge.weight(), Integer::sum);
        }
        String hub = component.firstMember();
        int best = weighted.getOrDefault(hub, 0);
        for (String domain : component.members) {
            int w = weighted.getOrDefault(domain, 0);
            if (w > best) {
                hub = domain;
                best = w;
            }
        }
        return hub;
    }

    private static final class Component {
        final SortedSet<String> members = new TreeSet<>();
        final List<GraphEdge> edges = new ArrayList<>();
        int confirmed;
        int likely;

        int size() {
            return members.size();
        }

        String firstMember() {
            return members.first();
        }

        ClusterConfidence confidence() {
            return ClusterConfidence.of(confirmed, likely);
        }
    }

    /**
     * Disjoint-set forest over domain names with path compression and union by size.
     */
    static final class UnionFind {
        private final Map<String, String> parent = new HashMap<>();
        private final Map<String, Integer> size = new HashMap<>();

        String find(String domain) {
            String root = domain;
            while (parent.containsKey(root)) {
                root = parent.get(root);
            }
            String current = domain;
            while (!current.equals(root)) {
                String up = parent.get(current);
                parent.put(current, root);
                current = up;
            }
            return root;
        }

        void union(String a, String b) {
            String rootA = find(a);
            String rootB = find(b);
            if (rootA.equals(rootB)) {
                return;
            }
            int sizeA = size.getOrDefault(rootA, 1);
            int sizeB = size.getOrDefault(rootB, 1);
            if (sizeA < sizeB) {
                String swap = rootA;
                rootA = rootB;
                rootB = swap;
            }
            parent.put(rootB, rootA);
            size.put(rootA, sizeA + sizeB);
        }
    }
}
