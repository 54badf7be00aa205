package com.domain.correlation.api;

import com.domain.correlation.cluster.ClusterDetector;
import com.domain.correlation.hub.HubIdentifier;
import com.domain.correlation.rules.DefaultNoiseRules;
import com.domain.correlation.rules.NoiseFilter;
import com.domain.correlation.rules.PlatformDenylist;
import com.domain.correlation.signal.IdentifierTierTable;
import com.domain.correlation.signal.SignalExtractor;

import java.util.Objects;

/**
 * Options for a correlation run.
 * Configures the tier table, noise control, the group size cap and the
 * cluster and hub thresholds.
 */
public class CorrelationOptions {

    private final IdentifierTierTable tierTable;
    private final PlatformDenylist denylist;
    private final NoiseFilter noiseFilter;
    private final int groupSizeCap;
    private final int minClusterSize;
    private final int hubTopN;
    private final double hubPercentile;
    private final int maxLoggedWarnings;

    private CorrelationOptions(Builder builder) {
        this.tierTable = builder.tierTable;
        this.denylist = builder.denylist;
        this.noiseFilter = builder.noiseFilter;
        this.groupSizeCap = builder.groupSizeCap;
        this.minClusterSize = builder.minClusterSize;
        this.hubTopN = builder.hubTopN;
        this.hubPercentile = builder.hubPercentile;
        this.maxLoggedWarnings = builder.maxLoggedWarnings;
    }

    public IdentifierTierTable getTierTable() {
        return tierTable;
    }

    public PlatformDenylist getDenylist() {
        return denylist;
    }

    public NoiseFilter getNoiseFilter() {
        return noiseFilter;
    }

    public int getGroupSizeCap() {
        return groupSizeCap;
    }

    public int getMinClusterSize() {
        return minClusterSize;
    }

    public int getHubTopN() {
        return hubTopN;
    }

    public double getHubPercentile() {
        return hubPercentile;
    }

    public int getMaxLoggedWarnings() {
        return maxLoggedWarnings;
    }

    /**
     * Creates default options: default tier table and noise rules, empty denylist, cap 50.
     */
    public static CorrelationOptions defaults() {
        return builder().build();
    }

    /**
     * Creates strict options (smaller group cap, clusters of at least three domains).
     */
    public static CorrelationOptions strict() {
        return builder()
                .groupSizeCap(20)
                .minClusterSize(3)
                .build();
    }

    /**
     * Creates permissive options (no noise rules, large group cap).
     */
    public static CorrelationOptions permissive() {
        return builder()
                .noiseFilter(NoiseFilter.none())
                .groupSizeCap(200)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .tierTable(tierTable)
                .denylist(denylist)
                .noiseFilter(noiseFilter)
                .groupSizeCap(groupSizeCap)
                .minClusterSize(minClusterSize)
                .hubTopN(hubTopN)
                .hubPercentile(hubPercentile)
                .maxLoggedWarnings(maxLoggedWarnings);
    }

    public static class Builder {
        private IdentifierTierTable tierTable = IdentifierTierTable.defaultTable();
        private PlatformDenylist denylist = PlatformDenylist.empty();
        private NoiseFilter noiseFilter = DefaultNoiseRules.createDefaultFilter();
        private int groupSizeCap = SignalExtractor.DEFAULT_GROUP_SIZE_CAP;
        private int minClusterSize = ClusterDetector.DEFAULT_MIN_SIZE;
        private int hubTopN = HubIdentifier.DEFAULT_TOP_N;
        private double hubPercentile = HubIdentifier.DEFAULT_PERCENTILE;
        private int maxLoggedWarnings = SignalExtractor.DEFAULT_MAX_LOGGED_WARNINGS;

        public Builder tierTable(IdentifierTierTable tierTable) {
            this.tierTable = Objects.requireNonNull(tierTable, "tierTable is required");
            return this;
        }

        public Builder denylist(PlatformDenylist denylist) {
            this.denylist = Objects.requireNonNull(denylist, "denylist is required");
            return this;
        }

        public Builder noiseFilter(NoiseFilter noiseFilter) {
            this.noiseFilter = Objects.requireNonNull(noiseFilter, "noiseFilter is required");
            return this;
        }

        public Builder groupSizeCap(int groupSizeCap) {
            if (groupSizeCap < 2) {
                throw new IllegalArgumentException("groupSizeCap must be at least 2");
            }
            this.groupSizeCap = groupSizeCap;
            return this;
        }

        public Builder minClusterSize(int minClusterSize) {
            if (minClusterSize < 1) {
                throw new IllegalArgumentException("minClusterSize must be positive");
            }
            this.minClusterSize = minClusterSize;
            return this;
        }

        public Builder hubTopN(int hubTopN) {
            if (hubTopN < 1) {
                throw new IllegalArgumentException("hubTopN must be positive");
            }
            this.hubTopN = hubTopN;
            return this;
        }

        public Builder hubPercentile(double hubPercentile) {
            if (hubPercentile < 0.0 || hubPercentile > 1.0) {
                throw new IllegalArgumentException("hubPercentile must be between 0.0 and 1.0");
            }
            this.hubPercentile = hubPercentile;
            return this;
        }

        public Builder maxLoggedWarnings(int maxLoggedWarnings) {
            if (maxLoggedWarnings < 0) {
                throw new IllegalArgumentException("maxLoggedWarnings must not be negative");
            }
            this.maxLoggedWarnings = maxLoggedWarnings;
            return this;
        }

        public CorrelationOptions build() {
            return new CorrelationOptions(this);
        }
    }

    @Override
    public String toString() {
        return "CorrelationOptions{" +
                "tierTypes=" + tierTable.size() +
                ", denylistSize=" + denylist.size() +
                ", noiseRules=" + noiseFilter.getRules().size() +
                ", groupSizeCap=" + groupSizeCap +
                ", minClusterSize=" + minClusterSize +
                ", hubTopN=" + hubTopN +
                ", hubPercentile=" + hubPercentile +
                ", maxLoggedWarnings=" + maxLoggedWarnings +
                '}';
    }
}
