package com.permit.resolution.graph;

import com.permit.resolution.core.model.Mention;
import com.permit.resolution.logging.LogContext;
import com.permit.resolution.store.MentionStore;
import com.permit.resolution.store.PermitContribution;
import com.permit.resolution.store.PermitStore;
import com.permit.resolution.store.ResolutionStore;
import com.permit.resolution.store.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

/**
 * Rebuilds the contributions of a set of permits in batches. Within a batch, permits
 * are computed in parallel from read-only inputs; the finished batch is then handed
 * to a single {@link EdgeAggregator}, so no edge row is ever written concurrently.
 * Cancellation is checked between batches, and a batch is staged whole or not at all.
 */
public class GraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    private final PermitContributionBuilder contributionBuilder;
    private final ExecutorService executor;
    private final int batchSize;
    private final int parallelism;

    public GraphBuilder(PermitContributionBuilder contributionBuilder, ExecutorService executor,
                        int batchSize, int parallelism) {
        if (batchSize <= 0 || parallelism <= 0) {
            throw new IllegalArgumentException("batchSize and parallelism must be positive");
        }
        this.contributionBuilder = contributionBuilder;
        this.executor = executor;
        this.batchSize = batchSize;
        this.parallelism = parallelism;
    }

    /**
     * @param runId      run id for log correlation
     * @param permitIds  permits to rebuild
     * @param mentions   mention source
     * @param permits    permit attributes
     * @param assignment mention id to entity id, including this run's staged assignments
     * @param store      committed state the rebuilt contributions replace
     * @param cancelled  polled between batches
     */
    public GraphBuildResult rebuild(String runId, Collection<String> permitIds, MentionStore mentions,
                                    PermitStore permits, Function<String, Optional<String>> assignment,
                                    ResolutionStore store, BooleanSupplier cancelled) {
        List<String> ordered = new ArrayList<>(new TreeSet<>(permitIds));
        EdgeAggregator aggregator = new EdgeAggregator(store);
        Set<String> rebuilt = new TreeSet<>();
        Set<String> deferred = new TreeSet<>();
        int failed = 0;
        boolean stopped = false;

        int batchCount = (ordered.size() + batchSize - 1) / batchSize;
        for (int batch = 0; batch < batchCount; batch++) {
            List<String> slice = ordered.subList(batch * batchSize, Math.min(ordered.size(), (batch + 1) * batchSize));
            if (cancelled.getAsBoolean()) {
                deferred.addAll(ordered.subList(batch * batchSize, ordered.size()));
                stopped = true;
                log.info("graph.cancelled runId={} completedBatches={} deferredPermits={}", runId, batch, deferred.size());
                break;
            }
            try (LogContext ignored = LogContext.forPermitBatch(runId, batch, slice.size())) {
                BatchOutcome outcome = computeBatch(slice, mentions, permits, assignment);
                aggregator.apply(outcome.contributions());
                outcome.contributions().forEach(c -> rebuilt.add(c.permitId()));
                deferred.addAll(outcome.failed());
                failed += outcome.failed().size();
                log.debug("graph.batch.staged runId={} batch={} permits={} failed={}",
                        runId, batch, outcome.contributions().size(), outcome.failed().size());
            }
        }

        EdgeDelta delta = aggregator.delta();
        log.info("graph.rebuilt runId={} permits={} edgeUpserts={} edgeRemovals={} deferred={}",
                runId, rebuilt.size(), delta.upserts().size(), delta.removals().size(), deferred.size());
        return new GraphBuildResult(aggregator.staged(), delta, rebuilt, deferred, failed, stopped);
    }

    private BatchOutcome computeBatch(List<String> slice, MentionStore mentions, PermitStore permits,
                                      Function<String, Optional<String>> assignment) {
        int chunkSize = Math.max(1, (slice.size() + parallelism - 1) / parallelism);
        List<Callable<BatchOutcome>> tasks = new ArrayList<>();
        for (int from = 0; from < slice.size(); from += chunkSize) {
            List<String> chunk = slice.subList(from, Math.min(slice.size(), from + chunkSize));
            tasks.add(() -> computeChunk(chunk, mentions, permits, assignment));
        }

        List<PermitContribution> contributions = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        try {
            for (Future<BatchOutcome> future : executor.invokeAll(tasks)) {
                BatchOutcome outcome = future.get();
                contributions.addAll(outcome.contributions());
                failed.addAll(outcome.failed());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while rebuilding permit edges", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Permit edge computation failed", e.getCause());
        }
        return new BatchOutcome(contributions, failed);
    }

    private BatchOutcome computeChunk(List<String> chunk, MentionStore mentions, PermitStore permits,
                                      Function<String, Optional<String>> assignment) {
        List<PermitContribution> contributions = new ArrayList<>(chunk.size());
        List<String> failed = new ArrayList<>();
        for (String permitId : chunk) {
            try {
                List<Mention> onPermit = mentions.findByPermitId(permitId);
                contributions.add(contributionBuilder.build(permitId, onPermit, permits.findById(permitId), assignment));
            } catch (StorageUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("graph.permit.failed permitId={} error={}", permitId, e.getMessage());
                failed.add(permitId);
            }
        }
        return new BatchOutcome(contributions, failed);
    }

    private record BatchOutcome(List<PermitContribution> contributions, List<String> failed) {}
}
