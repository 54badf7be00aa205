package com.domain.correlation.metrics;

import com.domain.correlation.core.model.ConnectionClassification;
import com.domain.correlation.core.model.SignalTier;
import com.domain.correlation.ingest.SkipReason;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}. Used when no metrics backend is configured.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordAnalysisDuration(Duration duration) {
    }

    @Override
    public void incrementRecordsSkipped(SkipReason reason, long count) {
    }

    @Override
    public void incrementSignalsEmitted(SignalTier tier, long count) {
    }

    @Override
    public void incrementOversizedGroups(long count) {
    }

    @Override
    public void incrementConnections(ConnectionClassification classification, long count) {
    }

    @Override
    public void recordClusterSize(int size) {
    }

    @Override
    public void incrementHubsFlagged(long count) {
    }
}
