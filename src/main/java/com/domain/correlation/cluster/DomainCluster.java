package com.domain.correlation.cluster;

import com.domain.correlation.core.model.ClusterConfidence;
import com.domain.correlation.core.model.Evidence;
import com.domain.correlation.core.model.SignalTier;
import com.domain.correlation.graph.GraphEdge;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A connected group of domains: a candidate sock-puppet network.
 */
public final class DomainCluster {

    private final int clusterId;
    private final SortedSet<String> domains;
    private final List<GraphEdge> edges;
    private final int confirmedEdgeCount;
    private final int likelyEdgeCount;
    private final ClusterConfidence confidence;
    private final String hubDomain;

    private DomainCluster(Builder builder) {
        this.clusterId = builder.clusterId;
        this.domains = Collections.unmodifiableSortedSet(new TreeSet<>(builder.domains));
        this.edges = List.copyOf(builder.edges);
        this.confirmedEdgeCount = (int) edges.stream().filter(GraphEdge::isConfirmed).count();
        this.likelyEdgeCount = edges.size() - confirmedEdgeCount;
        this.confidence = ClusterConfidence.of(confirmedEdgeCount, likelyEdgeCount);
        this.hubDomain = builder.hubDomain;
    }

    /**
     * 1-based position of this cluster in detection order.
     */
    public int getClusterId() {
        return clusterId;
    }

    public SortedSet<String> getDomains() {
        return domains;
    }

    public boolean contains(String domain) {
        return domains.contains(domain);
    }

    public int size() {
        return domains.size();
    }

    /**
     * Edges between members, in ranking order.
     */
    public List<GraphEdge> getEdges() {
        return edges;
    }

    public int getConfirmedEdgeCount() {
        return confirmedEdgeCount;
    }

    public int getLikelyEdgeCount() {
        return likelyEdgeCount;
    }

    public ClusterConfidence getConfidence() {
        return confidence;
    }

    /**
     * Member with the highest weighted degree inside the cluster.
     */
    public String getHubDomain() {
        return hubDomain;
    }

    /**
     * Distinct smoking-gun identifiers across the cluster's edges.
     */
    public int getSmokingGunCount() {
        Set<Evidence> distinct = new HashSet<>();
        for (GraphEdge edge : edges) {
            distinct.addAll(edge.connection().getEvidence(SignalTier.SMOKING_GUN));
        }
        return distinct.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DomainCluster that = (DomainCluster) o;
        return clusterId == that.clusterId && domains.equals(that.domains);
    }

    @Override
    public int hashCode() {
        return Objects.hash(clusterId, domains);
    }

    @Override
    public String toString() {
        return "DomainCluster{" +
                "id=" + clusterId +
                ", size=" + domains.size() +
                ", confidence=" + confidence +
                ", confirmedEdges=" + confirmedEdgeCount +
                ", likelyEdges=" + likelyEdgeCount +
                ", hub='" + hubDomain + '\'' +
                '}';
    }

    static Builder builder() {
        return new Builder();
    }

    static class Builder {
        private int clusterId;
        private Set<String> domains;
        private List<GraphEdge> edges = List.of();
        private String hubDomain;

        Builder clusterId(int clusterId) {
            this.clusterId = clusterId;
            return this;
        }

        Builder domains(Set<String> domains) {
            this.domains = domains;
            return this;
        }

        Builder edges(List<GraphEdge> edges) {
            this.edges = edges;
            return this;
        }

        Builder hubDomain(String hubDomain) {
            this.hubDomain = hubDomain;
            return this;
        }

        DomainCluster build() {
            Objects.requireNonNull(domains, "domains is required");
            Objects.requireNonNull(hubDomain, "hubDomain is required");
            if (domains.isEmpty()) {
                throw new IllegalArgumentException("A cluster needs at least one domain");
            }
            return new DomainCluster(this);
        }
    }
}
