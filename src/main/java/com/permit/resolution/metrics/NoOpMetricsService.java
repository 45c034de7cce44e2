package com.permit.resolution.metrics;

import com.permit.resolution.core.model.SourceTag;

import java.time.Duration;

/**
 * Discards all metrics.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordRunDuration(String mode, boolean cancelled, Duration duration) {
    }

    @Override
    public void recordRunAborted(String mode) {
    }

    @Override
    public void incrementMentionsProcessed(SourceTag source) {
    }

    @Override
    public void incrementMentionsSkipped(String reason) {
    }

    @Override
    public void incrementEntitiesCreated(SourceTag source) {
    }

    @Override
    public void incrementEntitiesUpdated(SourceTag source) {
    }

    @Override
    public void incrementAmbiguousMatches() {
    }

    @Override
    public void recordPartitionSize(int mentions) {
    }

    @Override
    public void recordEdgesWritten(long edges) {
    }

    @Override
    public void recordAnomaliesFlagged(long anomalies) {
    }

    @Override
    public void recordLookupCacheHit() {
    }

    @Override
    public void recordLookupCacheMiss() {
    }

    @Override
    public void incrementExportFailures() {
    }
}
