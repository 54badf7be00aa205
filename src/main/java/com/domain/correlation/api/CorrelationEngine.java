package com.domain.correlation.api;

import com.domain.correlation.aggregate.ConnectionAggregator;
import com.domain.correlation.cluster.DomainCluster;
import com.domain.correlation.core.model.ConnectionClassification;
import com.domain.correlation.core.model.DomainConnection;
import com.domain.correlation.core.model.DomainPair;
import com.domain.correlation.core.model.ObservationRecord;
import com.domain.correlation.core.model.SignalTier;
import com.domain.correlation.graph.DomainGraph;
import com.domain.correlation.graph.GraphBuilder;
import com.domain.correlation.hub.HubAnalysis;
import com.domain.correlation.ingest.ObservationSource;
import com.domain.correlation.ingest.SkipReason;
import com.domain.correlation.logging.LogContext;
import com.domain.correlation.metrics.MetricsService;
import com.domain.correlation.metrics.NoOpMetricsService;
import com.domain.correlation.signal.ExtractionResult;
import com.domain.correlation.signal.ExtractionStats;
import com.domain.correlation.signal.SignalExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;

/**
 * Main entry point for domain correlation.
 * Runs records through signal extraction, connection aggregation and graph building,
 * then detects clusters and hubs.
 *
 * <p>Usage:</p>
 * <pre>
 * CorrelationEngine engine = CorrelationEngine.builder()
 *     .options(CorrelationOptions.defaults())
 *     .build();
 *
 * CorrelationResult result = engine.analyze(records);
 * result.getClusters().forEach(System.out::println);
 * </pre>
 *
 * <p>The engine holds only immutable configuration and may be shared between threads.</p>
 */
public class CorrelationEngine {
    private static final Logger log = LoggerFactory.getLogger(CorrelationEngine.class);

    private final CorrelationOptions options;
    private final MetricsService metricsService;
    private final SignalExtractor signalExtractor;
    private final ConnectionAggregator connectionAggregator;
    private final GraphBuilder graphBuilder;

    private CorrelationEngine(Builder builder) {
        this.options = builder.options;
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.signalExtractor = new SignalExtractor(
                options.getTierTable(),
                options.getDenylist(),
                options.getNoiseFilter(),
                options.getGroupSizeCap(),
                options.getMaxLoggedWarnings());
        this.connectionAggregator = new ConnectionAggregator();
        this.graphBuilder = new GraphBuilder();
    }

    /**
     * Runs the full pipeline over the records.
     *
     * @throws NullPointerException if the source or any record is null
     */
    public CorrelationResult analyze(Iterable<ObservationRecord> records) {
        Objects.requireNonNull(records, "records is required");
        return analyze(ObservationSource.of(records));
    }

    /**
     * Runs the full pipeline over the records of the source.
     *
     * @throws NullPointerException if the source or any record is null
     */
    public CorrelationResult analyze(ObservationSource source) {
        Objects.requireNonNull(source, "source is required");
        String runId = LogContext.generateRunId();

        try (LogContext ctx = LogContext.forAnalysis(runId)) {
            long start = System.nanoTime();

            ExtractionResult extraction = signalExtractor.extract(source);
            SortedMap<DomainPair, DomainConnection> connections =
                    connectionAggregator.aggregate(extraction.signals());
            DomainGraph graph = graphBuilder.build(connections);
            CorrelationResult result = new CorrelationResult(runId, extraction, connections, graph, options);

            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            recordMetrics(result, connections, elapsed);

            NetworkSummary summary = result.getNetworkSummary();
            log.info("analysis.complete runId={} domains={} edges={} confirmed={} likely={} clusters={} potentialC2={} durationMs={}",
                    runId, summary.totalDomains(), summary.totalEdges(), summary.confirmedConnections(),
                    summary.likelyConnections(), summary.clusters(), summary.potentialC2(), elapsed.toMillis());
            return result;
        }
    }

    public CorrelationOptions getOptions() {
        return options;
    }

    private void recordMetrics(CorrelationResult result,
                               SortedMap<DomainPair, DomainConnection> connections,
                               Duration elapsed) {
        metricsService.recordAnalysisDuration(elapsed);

        ExtractionStats stats = result.getExtractionStats();
        for (Map.Entry<SkipReason, Long> entry : stats.skippedByReason().entrySet()) {
            if (entry.getValue() > 0) {
                metricsService.incrementRecordsSkipped(entry.getKey(), entry.getValue());
            }
        }
        for (Map.Entry<SignalTier, Long> entry : stats.signalsByTier().entrySet()) {
            if (entry.getValue() > 0) {
                metricsService.incrementSignalsEmitted(entry.getKey(), entry.getValue());
            }
        }
        if (stats.oversizedGroups() > 0) {
            metricsService.incrementOversizedGroups(stats.oversizedGroups());
        }

        Map<ConnectionClassification, Long> byClassification =
                ConnectionAggregator.countByClassification(connections);
        for (Map.Entry<ConnectionClassification, Long> entry : byClassification.entrySet()) {
            if (entry.getValue() > 0) {
                metricsService.incrementConnections(entry.getKey(), entry.getValue());
            }
        }

        for (DomainCluster cluster : result.getClusters()) {
            metricsService.recordClusterSize(cluster.size());
        }
        long flagged = result.getHubs().stream().filter(HubAnalysis::potentialC2).count();
        if (flagged > 0) {
            metricsService.incrementHubsFlagged(flagged);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CorrelationOptions options = CorrelationOptions.defaults();
        private MetricsService metricsService;

        public Builder options(CorrelationOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Sets a custom metrics service.
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public CorrelationEngine build() {
            if (options == null) {
                throw new IllegalStateException("CorrelationOptions is required");
            }
            return new CorrelationEngine(this);
        }
    }
}
