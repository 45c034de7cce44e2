package com.permit.resolution.api;

import com.permit.resolution.anomaly.AnomalyDetector;
import com.permit.resolution.anomaly.AnomalyReport;
import com.permit.resolution.audit.AuditAction;
import com.permit.resolution.audit.AuditService;
import com.permit.resolution.cache.CommitListener;
import com.permit.resolution.cascade.CascadeEvent;
import com.permit.resolution.cascade.CascadeResult;
import com.permit.resolution.cascade.ResolutionCascade;
import com.permit.resolution.core.model.EdgeKey;
import com.permit.resolution.core.model.Entity;
import com.permit.resolution.core.model.Mention;
import com.permit.resolution.graph.EdgeAggregator;
import com.permit.resolution.graph.EdgeDelta;
import com.permit.resolution.graph.GraphBuildResult;
import com.permit.resolution.graph.GraphBuilder;
import com.permit.resolution.graph.GraphExporter;
import com.permit.resolution.logging.LogContext;
import com.permit.resolution.metrics.MetricsService;
import com.permit.resolution.quality.QualityScorer;
import com.permit.resolution.store.MentionStore;
import com.permit.resolution.store.PermitStore;
import com.permit.resolution.store.ResolutionStore;
import com.permit.resolution.store.RunChangeSet;
import com.permit.resolution.store.StorageUnavailableException;
import com.permit.resolution.tracing.Span;
import com.permit.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs the stages in order: cascade, graph rebuild, scoring, commit, anomaly scan.
 *
 * <p>Every stage stages its output; nothing is visible to readers until the single
 * commit at the end. A {@link StorageUnavailableException} from any stage aborts the
 * run and leaves the previous snapshot in place. Only one run may be in progress.</p>
 */
public class ResolutionPipeline {
    private static final Logger log = LoggerFactory.getLogger(ResolutionPipeline.class);

    private final MentionStore mentions;
    private final PermitStore permits;
    private final ResolutionStore store;
    private final ResolutionCascade cascade;
    private final GraphBuilder graphBuilder;
    private final QualityScorer scorer;
    private final AnomalyDetector detector;
    private final AuditService auditService;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final GraphExporter exporter;
    private final Clock clock;
    private final List<CommitListener> commitListeners = new CopyOnWriteArrayList<>();
    private final ReentrantLock runLock = new ReentrantLock();

    private volatile AnomalyReport lastReport = AnomalyReport.empty();
    private volatile RunSummary lastSummary;
    private volatile boolean lastRunAborted;

    /**
     * @param exporter optional graph exporter, may be null
     * @param clock    reference clock for recency, may be null
     */
    public ResolutionPipeline(MentionStore mentions, PermitStore permits, ResolutionStore store,
                              ResolutionCascade cascade, GraphBuilder graphBuilder, QualityScorer scorer,
                              AnomalyDetector detector, AuditService auditService, MetricsService metrics,
                              TracingService tracing, GraphExporter exporter, Clock clock) {
        this.mentions = mentions;
        this.permits = permits;
        this.store = store;
        this.cascade = cascade;
        this.graphBuilder = graphBuilder;
        this.scorer = scorer;
        this.detector = detector;
        this.auditService = auditService;
        this.metrics = metrics;
        this.tracing = tracing;
        this.exporter = exporter;
        this.clock = clock;
    }

    public void addCommitListener(CommitListener listener) {
        commitListeners.add(listener);
    }

    public RunSummary run(RunMode mode) {
        return run(mode, CancellationToken.none());
    }

    /**
     * @throws IllegalStateException       if another run is in progress
     * @throws StorageUnavailableException if the store fails; nothing is committed
     */
    public RunSummary run(RunMode mode, CancellationToken token) {
        if (!runLock.tryLock()) {
            throw new IllegalStateException("A resolution run is already in progress");
        }
        try {
            String runId = LogContext.newRunId();
            try (LogContext ignored = LogContext.forRun(runId, mode.label());
                 Span span = tracing.startRun(runId, mode.label())) {
                try {
                    RunSummary summary = execute(runId, mode, token);
                    span.setAttribute("mentionsProcessed", summary.mentionsProcessed());
                    span.setAttribute("cancelled", summary.cancelled());
                    span.succeeded();
                    return summary;
                } catch (RuntimeException e) {
                    span.failed(e);
                    throw e;
                }
            }
        } finally {
            runLock.unlock();
        }
    }

    private RunSummary execute(String runId, RunMode mode, CancellationToken token) {
        long startNanos = System.nanoTime();
        log.info("run.started runId={} mode={}", runId, mode);
        try {
            Instant asOf = clock != null
                    ? clock.instant()
                    : mentions.latestObservedAt().orElseGet(Instant::now);
            List<Mention> batch = mode.isFull()
                    ? mentions.findAll()
                    : mentions.findObservedSince(mode.getSince().orElseThrow());

            CascadeResult resolved = stage("cascade", () -> cascade.resolve(runId, batch, store));

            Set<String> permitIds = new TreeSet<>(store.findDirtyPermits());
            permitIds.addAll(mode.isFull() ? mentions.findPermitIds() : resolved.getTouchedPermits());
            Function<String, Optional<String>> assignment = mentionId -> {
                String staged = resolved.getAssignments().get(mentionId);
                return staged != null ? Optional.of(staged) : store.findAssignment(mentionId);
            };
            GraphBuildResult graph = stage("graph", () -> graphBuilder.rebuild(
                    runId, permitIds, mentions, permits, assignment, store, token::isCancelled));

            List<Entity> scored = stage("score", () -> rescore(mode, resolved, graph.delta(), asOf));

            RunChangeSet changes = new RunChangeSet(runId, scored, resolved.getAssignments(), graph.contributions(),
                    graph.delta().upserts(), graph.delta().removals(), graph.deferredPermits(), graph.rebuiltPermits());
            stage("commit", () -> {
                store.commit(changes);
                return changes;
            });
            lastRunAborted = false;

            afterCommit(runId, resolved, scored, graph);
            AnomalyReport report = stage("anomaly", () -> detector.detect(
                    runId, asOf, store.findAllContributions(), store.findAllEntities()));
            lastReport = report;

            RunSummary summary = new RunSummary(runId, mode,
                    resolved.getProcessedCount(), resolved.getSkippedCount(), resolved.getSkipped(),
                    resolved.getCreatedIds().size(), resolved.getUpdatedIds().size(),
                    graph.delta().upserts().size(), report.size(), resolved.getAmbiguousMatches(),
                    graph.rebuiltPermits().size(), graph.deferredPermits().size(), graph.cancelled(),
                    Duration.ofNanos(System.nanoTime() - startNanos));
            lastSummary = summary;

            recordMetrics(resolved, summary);
            auditService.recordRun(summary.cancelled() ? AuditAction.RUN_CANCELLED : AuditAction.RUN_COMPLETED,
                    runId, summaryDetails(summary));
            log.info("run.completed runId={} summary={}", runId, summary);
            return summary;
        } catch (StorageUnavailableException e) {
            lastRunAborted = true;
            metrics.recordRunAborted(mode.label());
            auditService.recordRun(AuditAction.RUN_ABORTED, runId, Map.of("error", String.valueOf(e.getMessage())));
            log.error("run.aborted runId={} mode={} error={}", runId, mode.label(), e.getMessage());
            throw e;
        }
    }

    /**
     * Entities needing a new score: everything on a full run, otherwise the entities
     * the cascade touched plus those gaining or losing an edge. Returns only entities
     * whose record differs from the committed one.
     */
    private List<Entity> rescore(RunMode mode, CascadeResult resolved, EdgeDelta delta, Instant asOf) {
        Map<String, Entity> candidates = new TreeMap<>();
        if (mode.isFull()) {
            store.findAllEntities().forEach(e -> candidates.put(e.getEntityId(), e));
        } else {
            Set<String> edgeTouched = new TreeSet<>();
            for (EdgeKey key : delta.upserts().keySet()) {
                edgeTouched.add(key.entityIdA());
                edgeTouched.add(key.entityIdB());
            }
            for (EdgeKey key : delta.removals()) {
                edgeTouched.add(key.entityIdA());
                edgeTouched.add(key.entityIdB());
            }
            for (String entityId : edgeTouched) {
                store.findEntity(entityId).ifPresent(e -> candidates.put(entityId, e));
            }
        }
        candidates.putAll(resolved.getEntities());

        Map<String, Integer> relationshipCounts =
                new EdgeAggregator(store).relationshipCounts(candidates.keySet(), delta);
        List<Entity> changed = new ArrayList<>();
        for (Entity entity : candidates.values()) {
            Entity rescored = scorer.rescore(entity, asOf, relationshipCounts.getOrDefault(entity.getEntityId(), 0));
            Optional<Entity> committed = store.findEntity(entity.getEntityId());
            if (committed.isEmpty() || !committed.get().equals(rescored)) {
                changed.add(rescored);
            }
        }
        return changed;
    }

    private void afterCommit(String runId, CascadeResult resolved, List<Entity> scored, GraphBuildResult graph) {
        for (CascadeEvent event : resolved.getEvents()) {
            auditService.record(event.action(), runId, event.entityId(), event.details());
        }

        Set<String> entityIds = new TreeSet<>();
        Set<String> keys = new TreeSet<>(resolved.getTouchedKeys());
        for (Entity entity : scored) {
            entityIds.add(entity.getEntityId());
            keys.add(entity.getNormalizedKey());
        }
        for (CommitListener listener : commitListeners) {
            listener.onCommit(runId, entityIds, keys);
        }

        if (exporter != null) {
            try {
                int statements = exporter.export(scored, graph.delta().upserts().values(), graph.delta().removals());
                log.info("export.completed runId={} statements={}", runId, statements);
            } catch (RuntimeException e) {
                metrics.incrementExportFailures();
                log.warn("export.failed runId={} error={}", runId, e.getMessage());
            }
        }
    }

    private void recordMetrics(CascadeResult resolved, RunSummary summary) {
        resolved.getProcessedBySource().forEach((source, count) -> {
            for (int i = 0; i < count; i++) {
                metrics.incrementMentionsProcessed(source);
            }
        });
        resolved.getSkipped().forEach((reason, count) -> {
            for (int i = 0; i < count; i++) {
                metrics.incrementMentionsSkipped(reason.name());
            }
        });
        resolved.getCreatedIds().values().forEach(metrics::incrementEntitiesCreated);
        for (String entityId : resolved.getUpdatedIds()) {
            Entity entity = resolved.getEntities().get(entityId);
            if (entity != null) {
                metrics.incrementEntitiesUpdated(entity.getBestSource());
            }
        }
        for (int i = 0; i < summary.ambiguousMatches(); i++) {
            metrics.incrementAmbiguousMatches();
        }
        metrics.recordEdgesWritten(summary.edgesWritten());
        metrics.recordAnomaliesFlagged(summary.anomaliesFlagged());
        metrics.recordRunDuration(summary.mode().label(), summary.cancelled(), summary.elapsed());
    }

    private <T> T stage(String name, Supplier<T> work) {
        try (Span span = tracing.startStage(name)) {
            try {
                T result = work.get();
                span.succeeded();
                return result;
            } catch (RuntimeException e) {
                span.failed(e);
                throw e;
            }
        }
    }

    private static Map<String, Object> summaryDetails(RunSummary summary) {
        return Map.of(
                "mode", summary.mode().label(),
                "mentionsProcessed", summary.mentionsProcessed(),
                "mentionsSkipped", summary.mentionsSkipped(),
                "entitiesCreated", summary.entitiesCreated(),
                "entitiesUpdated", summary.entitiesUpdated(),
                "edgesWritten", summary.edgesWritten(),
                "permitsDeferred", summary.permitsDeferred());
    }

    public AnomalyReport getLastAnomalyReport() {
        return lastReport;
    }

    public Optional<RunSummary> getLastSummary() {
        return Optional.ofNullable(lastSummary);
    }

    public boolean isLastRunAborted() {
        return lastRunAborted;
    }

    public boolean isRunning() {
        return runLock.isLocked();
    }
}
