package com.domain.correlation.metrics;

import com.domain.correlation.core.model.ConnectionClassification;
import com.domain.correlation.core.model.SignalTier;
import com.domain.correlation.ingest.SkipReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code correlation.analysis.duration}: Timer</li>
 *   <li>{@code correlation.records.skipped}: Counter (tag: reason)</li>
 *   <li>{@code correlation.signals.emitted}: Counter (tag: tier)</li>
 *   <li>{@code correlation.groups.oversized}: Counter</li>
 *   <li>{@code correlation.connections}: Counter (tag: classification)</li>
 *   <li>{@code correlation.cluster.size}: DistributionSummary</li>
 *   <li>{@code correlation.hubs.flagged}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer analysisTimer;
    private final Counter oversizedGroupsCounter;
    private final DistributionSummary clusterSizeSummary;
    private final Counter hubsFlaggedCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.analysisTimer = Timer.builder("correlation.analysis.duration")
                .description("Duration of full correlation runs")
                .register(registry);
        this.oversizedGroupsCounter = Counter.builder("correlation.groups.oversized")
                .description("Identifier groups skipped for exceeding the group size cap")
                .register(registry);
        this.clusterSizeSummary = DistributionSummary.builder("correlation.cluster.size")
                .description("Distribution of detected cluster sizes")
                .register(registry);
        this.hubsFlaggedCounter = Counter.builder("correlation.hubs.flagged")
                .description("Hubs flagged as potential coordination points")
                .register(registry);
    }

    @Override
    public void recordAnalysisDuration(Duration duration) {
        analysisTimer.record(duration);
    }

    @Override
    public void incrementRecordsSkipped(SkipReason reason, long count) {
        Counter counter = counterCache.computeIfAbsent("skipped:" + reason.name(), k ->
                Counter.builder("correlation.records.skipped")
                        .description("Input records rejected during sanitization")
                        .tag("reason", reason.name())
                        .register(registry));
        counter.increment(count);
    }

    @Override
    public void incrementSignalsEmitted(SignalTier tier, long count) {
        Counter counter = counterCache.computeIfAbsent("signals:" + tier.name(), k ->
                Counter.builder("correlation.signals.emitted")
                        .description("Pairwise signals emitted by extraction")
                        .tag("tier", tier.name())
                        .register(registry));
        counter.increment(count);
    }

    @Override
    public void incrementOversizedGroups(long count) {
        oversizedGroupsCounter.increment(count);
    }

    @Override
    public void incrementConnections(ConnectionClassification classification, long count) {
        Counter counter = counterCache.computeIfAbsent("connections:" + classification.name(), k ->
                Counter.builder("correlation.connections")
                        .description("Aggregated domain connections")
                        .tag("classification", classification.name())
                        .register(registry));
        counter.increment(count);
    }

    @Override
    public void recordClusterSize(int size) {
        clusterSizeSummary.record(size);
    }

    @Override
    public void incrementHubsFlagged(long count) {
        hubsFlaggedCounter.increment(count);
    }
}
