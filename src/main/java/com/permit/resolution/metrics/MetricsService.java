package com.permit.resolution.metrics;

import com.permit.resolution.core.model.SourceTag;

import java.time.Duration;

/**
 * Records pipeline metrics. The default {@link NoOpMetricsService} keeps the library
 * usable without a metrics backend.
 */
public interface MetricsService {

    void recordRunDuration(String mode, boolean cancelled, Duration duration);

    void recordRunAborted(String mode);

    void incrementMentionsProcessed(SourceTag source);

    void incrementMentionsSkipped(String reason);

    void incrementEntitiesCreated(SourceTag source);

    void incrementEntitiesUpdated(SourceTag source);

    void incrementAmbiguousMatches();

    void recordPartitionSize(int mentions);

    void recordEdgesWritten(long edges);

    void recordAnomaliesFlagged(long anomalies);

    void recordLookupCacheHit();

    void recordLookupCacheMiss();

    void incrementExportFailures();
}
