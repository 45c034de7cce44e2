package com.permit.resolution.metrics;

import com.permit.resolution.core.model.SourceTag;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-backed {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code permit.resolution.run.duration}: Timer (tags: mode, cancelled)</li>
 *   <li>{@code permit.resolution.run.aborted}: Counter (tag: mode)</li>
 *   <li>{@code permit.resolution.mentions.processed}: Counter (tag: source)</li>
 *   <li>{@code permit.resolution.mentions.skipped}: Counter (tag: reason)</li>
 *   <li>{@code permit.resolution.entities.created}: Counter (tag: source)</li>
 *   <li>{@code permit.resolution.entities.updated}: Counter (tag: source)</li>
 *   <li>{@code permit.resolution.matches.ambiguous}: Counter</li>
 *   <li>{@code permit.resolution.partition.size}: DistributionSummary</li>
 *   <li>{@code permit.resolution.edges.written}: Counter</li>
 *   <li>{@code permit.resolution.anomalies.flagged}: Counter</li>
 *   <li>{@code permit.resolution.lookup.cache}: Counter (tag: result)</li>
 *   <li>{@code permit.resolution.export.failures}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final DistributionSummary partitionSize;
    private final Counter edgesWritten;
    private final Counter anomaliesFlagged;
    private final Counter ambiguousMatches;
    private final Counter cacheHits;
    private final Counter cacheMisses;
    private final Counter exportFailures;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.partitionSize = DistributionSummary.builder("permit.resolution.partition.size")
                .description("Mentions per cascade partition")
                .register(registry);
        this.edgesWritten = Counter.builder("permit.resolution.edges.written")
                .description("Relationship rows written on commit")
                .register(registry);
        this.anomaliesFlagged = Counter.builder("permit.resolution.anomalies.flagged")
                .description("Advisory anomaly findings")
                .register(registry);
        this.ambiguousMatches = Counter.builder("permit.resolution.matches.ambiguous")
                .description("Mentions whose name key matched several entities")
                .register(registry);
        this.cacheHits = Counter.builder("permit.resolution.lookup.cache")
                .tag("result", "hit")
                .register(registry);
        this.cacheMisses = Counter.builder("permit.resolution.lookup.cache")
                .tag("result", "miss")
                .register(registry);
        this.exportFailures = Counter.builder("permit.resolution.export.failures")
                .description("Graph exports that failed after commit")
                .register(registry);
    }

    @Override
    public void recordRunDuration(String mode, boolean cancelled, Duration duration) {
        String key = mode + ":" + cancelled;
        timers.computeIfAbsent(key, k -> Timer.builder("permit.resolution.run.duration")
                        .description("Wall time of pipeline runs")
                        .tag("mode", mode)
                        .tag("cancelled", Boolean.toString(cancelled))
                        .register(registry))
                .record(duration);
    }

    @Override
    public void recordRunAborted(String mode) {
        counter("permit.resolution.run.aborted", "mode", mode).increment();
    }

    @Override
    public void incrementMentionsProcessed(SourceTag source) {
        counter("permit.resolution.mentions.processed", "source", source.getLabel()).increment();
    }

    @Override
    public void incrementMentionsSkipped(String reason) {
        counter("permit.resolution.mentions.skipped", "reason", reason).increment();
    }

    @Override
    public void incrementEntitiesCreated(SourceTag source) {
        counter("permit.resolution.entities.created", "source", source.getLabel()).increment();
    }

    @Override
    public void incrementEntitiesUpdated(SourceTag source) {
        counter("permit.resolution.entities.updated", "source", source.getLabel()).increment();
    }

    @Override
    public void incrementAmbiguousMatches() {
        ambiguousMatches.increment();
    }

    @Override
    public void recordPartitionSize(int mentions) {
        partitionSize.record(mentions);
    }

    @Override
    public void recordEdgesWritten(long edges) {
        edgesWritten.increment(edges);
    }

    @Override
    public void recordAnomaliesFlagged(long anomalies) {
        anomaliesFlagged.increment(anomalies);
    }

    @Override
    public void recordLookupCacheHit() {
        cacheHits.increment();
    }

    @Override
    public void recordLookupCacheMiss() {
        cacheMisses.increment();
    }

    @Override
    public void incrementExportFailures() {
        exportFailures.increment();
    }

    private Counter counter(String name, String tag, String value) {
        return counters.computeIfAbsent(name + ":" + value, k -> Counter.builder(name)
                .tag(tag, value)
                .register(registry));
    }
}
