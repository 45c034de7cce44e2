package com.permit.resolution.cascade;

import com.permit.resolution.core.model.Entity;
import com.permit.resolution.core.model.Mention;
import com.permit.resolution.core.model.SourceTag;
import com.permit.resolution.logging.LogContext;
import com.permit.resolution.metrics.MetricsService;
import com.permit.resolution.metrics.NoOpMetricsService;
import com.permit.resolution.rules.NameKey;
import com.permit.resolution.rules.NormalizationEngine;
import com.permit.resolution.store.ResolutionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Maps mentions to canonical entities.
 *
 * <p>Mentions are validated and normalized, then partitioned by block key and
 * shared identifier (see {@link PartitionPlanner}). Every mention that could match
 * another lands in the same partition, so partitions own disjoint entities and run
 * concurrently, each one single-threaded over its own {@link PartitionWorkingSet}.
 * Results are merged in partition order.</p>
 *
 * <p>Malformed mentions never fail the run; they are counted per {@link SkipReason}.</p>
 */
public class ResolutionCascade {
    private static final Logger log = LoggerFactory.getLogger(ResolutionCascade.class);

    private final NormalizationEngine normalizer;
    private final ExecutorService executor;
    private final int partitions;
    private final MetricsService metrics;

    public ResolutionCascade(NormalizationEngine normalizer, ExecutorService executor, int partitions) {
        this(normalizer, executor, partitions, new NoOpMetricsService());
    }

    public ResolutionCascade(NormalizationEngine normalizer, ExecutorService executor, int partitions,
                             MetricsService metrics) {
        if (partitions <= 0) {
            throw new IllegalArgumentException("partitions must be positive");
        }
        this.normalizer = normalizer;
        this.executor = executor;
        this.partitions = partitions;
        this.metrics = metrics;
    }

    /**
     * Validates a mention and derives its comparison key.
     *
     * @throws MalformedMentionException if the name is empty after normalization or the permit id is missing
     */
    public NormalizedMention normalize(Mention mention) {
        NameKey key = normalizer.key(mention.getRawName());
        if (key.isEmpty()) {
            throw new MalformedMentionException(mention.getMentionId(), SkipReason.EMPTY_NAME,
                    "name is empty after normalization: '" + mention.getRawName() + "'");
        }
        if (!mention.hasPermitId()) {
            throw new MalformedMentionException(mention.getMentionId(), SkipReason.MISSING_PERMIT_ID,
                    "mention has no permit id");
        }
        return new NormalizedMention(mention, key);
    }

    public CascadeResult resolve(String runId, Collection<Mention> mentions, ResolutionStore store) {
        Map<SourceTag, Integer> processedBySource = new EnumMap<>(SourceTag.class);
        Map<SkipReason, Integer> skipped = new EnumMap<>(SkipReason.class);
        Map<String, NormalizedMention> accepted = new LinkedHashMap<>();

        for (Mention mention : mentions) {
            processedBySource.merge(mention.getSource(), 1, Integer::sum);
            try {
                accepted.putIfAbsent(mention.getMentionId(), normalize(mention));
            } catch (MalformedMentionException e) {
                log.debug("cascade.mention.skipped mentionId={} reason={} detail={}",
                        e.getMentionId(), e.getReason(), e.getMessage());
                skipped.merge(e.getReason(), 1, Integer::sum);
            }
        }

        List<List<NormalizedMention>> buckets = new PartitionPlanner(partitions).plan(accepted.values(), store);

        List<Callable<PartitionResult>> tasks = new ArrayList<>();
        for (int i = 0; i < partitions; i++) {
            List<NormalizedMention> bucket = buckets.get(i);
            if (bucket.isEmpty()) {
                continue;
            }
            int partition = i;
            metrics.recordPartitionSize(bucket.size());
            tasks.add(() -> {
                try (LogContext ignored = LogContext.forPartition(runId, partition)) {
                    return new PartitionResolver(partition, new PartitionWorkingSet(store)).resolve(bucket);
                }
            });
        }

        CascadeResult result = merge(runPartitions(tasks), processedBySource, skipped);
        log.info("cascade.resolved runId={} processed={} skipped={} created={} updated={} ambiguous={} partitions={}",
                runId, result.getProcessedCount(), result.getSkippedCount(), result.getCreatedIds().size(),
                result.getUpdatedIds().size(), result.getAmbiguousMatches(), tasks.size());
        return result;
    }

    private List<PartitionResult> runPartitions(List<Callable<PartitionResult>> tasks) {
        List<PartitionResult> results = new ArrayList<>(tasks.size());
        try {
            for (Future<PartitionResult> future : executor.invokeAll(tasks)) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while resolving partitions", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Partition resolution failed", e.getCause());
        }
        return results;
    }

    private static CascadeResult merge(List<PartitionResult> results, Map<SourceTag, Integer> processedBySource,
                                       Map<SkipReason, Integer> skipped) {
        Map<String, Entity> entities = new TreeMap<>();
        Map<String, String> assignments = new TreeMap<>();
        Map<String, SourceTag> createdIds = new TreeMap<>();
        Set<String> updatedIds = new TreeSet<>();
        Map<ResolutionOutcome, Integer> outcomes = CascadeResult.emptyOutcomes();
        List<CascadeEvent> events = new ArrayList<>();
        Set<String> touchedPermits = new TreeSet<>();
        Set<String> touchedKeys = new TreeSet<>();
        int ambiguous = 0;

        for (PartitionResult result : results) {
            entities.putAll(result.entities());
            assignments.putAll(result.assignments());
            createdIds.putAll(result.createdIds());
            updatedIds.addAll(result.updatedIds());
            result.outcomes().forEach((outcome, count) -> outcomes.merge(outcome, count, Integer::sum));
            result.skipped().forEach((reason, count) -> skipped.merge(reason, count, Integer::sum));
            events.addAll(result.events());
            touchedPermits.addAll(result.touchedPermits());
            touchedKeys.addAll(result.touchedKeys());
            ambiguous += result.ambiguous();
        }
        int skippedTotal = skipped.values().stream().mapToInt(Integer::intValue).sum();
        if (skippedTotal > 0) {
            outcomes.put(ResolutionOutcome.SKIPPED, skippedTotal);
        }
        return new CascadeResult(entities, assignments, createdIds, updatedIds, outcomes, skipped,
                processedBySource, ambiguous, events, touchedPermits, touchedKeys);
    }
}
