package com.domain.correlation.hub;

import com.domain.correlation.graph.DomainGraph;
import com.domain.correlation.graph.GraphEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Ranks domains by connectivity and flags probable hub/controller (C2) domains.
 *
 * <p>A domain is flagged only when its weighted degree strictly exceeds the configured
 * percentile of all weighted degrees <em>and</em> at least one of its edges is CONFIRMED.
 * High connectivity alone is common for shared-hosting noise.</p>
 */
public class HubIdentifier {
    private static final Logger log = LoggerFactory.getLogger(HubIdentifier.class);

    public static final int DEFAULT_TOP_N = 20;
    public static final double DEFAULT_PERCENTILE = 0.90;

    private static final Comparator<HubAnalysis> RANKING = Comparator
            .comparingInt(HubAnalysis::weightedDegree).reversed()
            .thenComparing(Comparator.comparingInt(HubAnalysis::degree).reversed())
            .thenComparing(HubAnalysis::domain);

    private final DomainGraph graph;
    private final double percentile;

    public HubIdentifier(DomainGraph graph) {
        this(graph, DEFAULT_PERCENTILE);
    }

    public HubIdentifier(DomainGraph graph, double percentile) {
        this.graph = Objects.requireNonNull(graph, "graph is required");
        if (percentile < 0.0 || percentile > 1.0) {
            throw new IllegalArgumentException("percentile must be between 0.0 and 1.0");
        }
        this.percentile = percentile;
    }

    public List<HubAnalysis> identifyHubs() {
        return identifyHubs(DEFAULT_TOP_N);
    }

    /**
     * Returns the {@code topN} best-connected domains, or every node if the graph is smaller.
     *
     * @throws IllegalArgumentException if topN is less than 1
     */
    public List<HubAnalysis> identifyHubs(int topN) {
        if (topN < 1) {
            throw new IllegalArgumentException("topN must be at least 1, got " + topN);
        }
        if (graph.isEmpty()) {
            log.info("hubs.identified nodes=0 reason=empty-graph");
            return List.of();
        }

        int[] weightedDegrees = graph.nodes().stream().mapToInt(graph::weightedDegree).toArray();
        double threshold = percentileOf(weightedDegrees, percentile);

        List<HubAnalysis> all = new ArrayList<>(graph.nodeCount());
        for (String domain : graph.nodes()) {
            all.add(analyze(domain, threshold));
        }
        all.sort(RANKING);

        List<HubAnalysis> selected = List.copyOf(all.subList(0, Math.min(topN, all.size())));
        log.info("hubs.identified nodes={} selected={} flagged={} threshold={}",
                all.size(), selected.size(),
                selected.stream().filter(HubAnalysis::potentialC2).count(), threshold);
        return selected;
    }

    /**
     * Weighted degree a domain must strictly exceed to be considered for the C2 flag.
     */
    public double weightedDegreeThreshold() {
        int[] weightedDegrees = graph.nodes().stream().mapToInt(graph::weightedDegree).toArray();
        return percentileOf(weightedDegrees, percentile);
    }

    private HubAnalysis analyze(String domain, double threshold) {
        int confirmed = 0;
        int likely = 0;
        int weighted = 0;
        List<GraphEdge> incident = graph.incidentEdges(domain);
        for (GraphEdge edge : incident) {
            weighted += edge.weight();
            if (edge.isConfirmed()) {
                confirmed++;
            } else {
                likely++;
            }
        }
        boolean potentialC2 = weighted > threshold && confirmed > 0;
        return new HubAnalysis(domain, incident.size(), weighted, confirmed, likely,
                new ArrayList<>(graph.neighbors(domain)), potentialC2);
    }

    /**
     * Percentile with linear interpolation between closest ranks.
     */
    static double percentileOf(int[] values, double p) {
        if (values.length == 0) {
            return 0.0;
        }
        int[] sorted = values.clone();
        Arrays.sort(sorted);
        double position = p * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        double fraction = position - lower;
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }
}
