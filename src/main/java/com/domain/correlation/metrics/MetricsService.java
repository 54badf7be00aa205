package com.domain.correlation.metrics;

import com.domain.correlation.core.model.ConnectionClassification;
import com.domain.correlation.core.model.SignalTier;
import com.domain.correlation.ingest.SkipReason;

import java.time.Duration;

/**
 * Interface for recording correlation metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine works
 * without any metrics backend on the classpath.
 */
public interface MetricsService {

    void recordAnalysisDuration(Duration duration);

    void incrementRecordsSkipped(SkipReason reason, long count);

    void incrementSignalsEmitted(SignalTier tier, long count);

    void incrementOversizedGroups(long count);

    void incrementConnections(ConnectionClassification classification, long count);

    void recordClusterSize(int size);

    void incrementHubsFlagged(long count);
}
