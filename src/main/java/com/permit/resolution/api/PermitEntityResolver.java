package com.permit.resolution.api;

import com.permit.resolution.anomaly.AnomalyDetector;
import com.permit.resolution.anomaly.AnomalyReport;
import com.permit.resolution.audit.AuditRepository;
import com.permit.resolution.audit.AuditService;
import com.permit.resolution.cache.CommitListener;
import com.permit.resolution.cache.EntityLookupCache;
import com.permit.resolution.cache.NoOpEntityLookupCache;
import com.permit.resolution.cascade.ResolutionCascade;
import com.permit.resolution.core.model.EdgeKey;
import com.permit.resolution.core.model.EdgeKind;
import com.permit.resolution.core.model.Entity;
import com.permit.resolution.core.model.RelationshipEdge;
import com.permit.resolution.graph.GraphBuilder;
import com.permit.resolution.graph.GraphConnection;
import com.permit.resolution.graph.GraphExporter;
import com.permit.resolution.graph.PermitContributionBuilder;
import com.permit.resolution.health.GraphConnectionHealthCheck;
import com.permit.resolution.health.HealthCheckRegistry;
import com.permit.resolution.health.HealthStatus;
import com.permit.resolution.health.MemoryHealthCheck;
import com.permit.resolution.metrics.MetricsService;
import com.permit.resolution.metrics.NoOpMetricsService;
import com.permit.resolution.quality.QualityScorer;
import com.permit.resolution.rules.DefaultNormalizationRules;
import com.permit.resolution.rules.NameKey;
import com.permit.resolution.rules.NormalizationEngine;
import com.permit.resolution.store.InMemoryResolutionStore;
import com.permit.resolution.store.MentionStore;
import com.permit.resolution.store.PermitStore;
import com.permit.resolution.store.ResolutionStore;
import com.permit.resolution.tracing.NoOpTracingService;
import com.permit.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point of the library: runs resolution over a mention store and answers
 * lookups against the last committed snapshot.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (PermitEntityResolver resolver = PermitEntityResolver.builder()
 *         .mentionStore(mentions)
 *         .permitStore(permits)
 *         .build()) {
 *
 *     RunSummary summary = resolver.run(RunMode.full());
 *
 *     List&lt;Entity&gt; matches = resolver.findByName("Jane Doe");
 *     List&lt;RelationshipEdge&gt; edges = resolver.getRelationships(matches.get(0).getEntityId());
 *     AnomalyReport report = resolver.anomalyReport();
 * }
 * </pre>
 */
public class PermitEntityResolver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PermitEntityResolver.class);

    /**
     * Relationship order: strongest first, then kind, then the other entity's id.
     */
    static Comparator<RelationshipEdge> relationshipOrder(String entityId) {
        return Comparator.comparingInt(RelationshipEdge::sharedPermitCount).reversed()
                .thenComparing(RelationshipEdge::kind)
                .thenComparing(e -> e.key().other(entityId));
    }

    private final ResolutionPipeline pipeline;
    private final ResolutionStore store;
    private final NormalizationEngine normalizer;
    private final EntityLookupCache cache;
    private final HealthCheckRegistry healthCheckRegistry;
    private final AuditService auditService;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final GraphConnection connection;

    private PermitEntityResolver(Builder builder) {
        PipelineOptions options = builder.options;
        this.store = builder.resolutionStore != null ? builder.resolutionStore : new InMemoryResolutionStore();
        this.normalizer = builder.normalizationEngine != null
                ? builder.normalizationEngine : DefaultNormalizationRules.createDefaultEngine();
        this.cache = builder.cache != null ? builder.cache : new NoOpEntityLookupCache();
        this.connection = builder.connection;

        MetricsService metrics = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        TracingService tracing = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();

        if (builder.auditService != null) {
            this.auditService = builder.auditService;
        } else if (builder.auditRepository != null) {
            this.auditService = new AuditService(builder.auditRepository);
        } else {
            this.auditService = new AuditService();
        }

        this.ownsExecutor = builder.executor == null;
        this.executor = builder.executor != null
                ? builder.executor : Executors.newFixedThreadPool(options.getParallelism());

        ResolutionCascade cascade = new ResolutionCascade(normalizer, executor, options.getPartitions(), metrics);
        GraphBuilder graphBuilder = new GraphBuilder(new PermitContributionBuilder(options.getCounterpartRoles()),
                executor, options.getPermitBatchSize(), options.getParallelism());
        GraphExporter exporter = options.isExportEnabled() && connection != null ? new GraphExporter(connection) : null;
        if (exporter != null && builder.createIndexes) {
            connection.createIndexes();
        }

        this.pipeline = new ResolutionPipeline(builder.mentionStore,
                builder.permitStore != null ? builder.permitStore : PermitStore.EMPTY,
                store, cascade, graphBuilder, new QualityScorer(),
                new AnomalyDetector(options.getAnomalyOptions()), auditService, metrics, tracing,
                exporter, options.getClock().orElse(null));
        if (cache instanceof CommitListener listener) {
            pipeline.addCommitListener(listener);
        }

        this.healthCheckRegistry = new HealthCheckRegistry();
        healthCheckRegistry.register(new MemoryHealthCheck());
        healthCheckRegistry.register(new RunHealthCheck(pipeline, store));
        if (connection != null) {
            healthCheckRegistry.register(new GraphConnectionHealthCheck(connection));
        }

        log.info("PermitEntityResolver initialized partitions={} parallelism={} permitBatchSize={} export={}",
                options.getPartitions(), options.getParallelism(), options.getPermitBatchSize(), exporter != null);
    }

    // ========== Runs ==========

    public RunSummary run(RunMode mode) {
        return pipeline.run(mode);
    }

    public RunSummary run(RunMode mode, CancellationToken token) {
        return pipeline.run(mode, token);
    }

    public Optional<RunSummary> lastRunSummary() {
        return pipeline.getLastSummary();
    }

    // ========== Lookups ==========

    public Optional<Entity> getEntity(String entityId) {
        return cache.getById(entityId, store::findEntity);
    }

    /**
     * Entities whose canonical name normalizes to the same key as {@code name}.
     */
    public List<Entity> findByName(String name) {
        NameKey key = normalizer.key(name);
        if (key.isEmpty()) {
            return List.of();
        }
        return cache.getByNormalizedKey(key.normalized(), store::findByNormalizedKey);
    }

    /**
     * All edges of both kinds touching the entity, strongest first.
     */
    public List<RelationshipEdge> getRelationships(String entityId) {
        List<RelationshipEdge> edges = new ArrayList<>(store.findEdgesFor(entityId));
        edges.sort(relationshipOrder(entityId));
        return edges;
    }

    public List<RelationshipEdge> getRelationships(String entityId, EdgeKind kind) {
        return getRelationships(entityId).stream()
                .filter(e -> e.kind() == kind)
                .toList();
    }

    /**
     * Entities one hop away, by id.
     */
    public Set<String> neighbors(String entityId) {
        Set<String> ids = new TreeSet<>();
        for (RelationshipEdge edge : store.findEdgesFor(entityId)) {
            ids.add(edge.key().other(entityId));
        }
        return ids;
    }

    /**
     * Breadth-first walk over edges of both kinds, up to {@code hops} away.
     */
    public EntityNetwork network(String entityId, int hops) {
        if (hops < 0) {
            throw new IllegalArgumentException("hops must not be negative");
        }
        Map<String, Integer> distances = new LinkedHashMap<>();
        Map<EdgeKey, RelationshipEdge> walked = new TreeMap<>();
        Deque<String> frontier = new ArrayDeque<>();
        distances.put(entityId, 0);
        frontier.add(entityId);

        while (!frontier.isEmpty()) {
            String current = frontier.poll();
            int distance = distances.get(current);
            if (distance == hops) {
                continue;
            }
            for (RelationshipEdge edge : store.findEdgesFor(current)) {
                walked.put(edge.key(), edge);
                String next = edge.key().other(current);
                if (!distances.containsKey(next)) {
                    distances.put(next, distance + 1);
                    frontier.add(next);
                }
            }
        }
        return new EntityNetwork(entityId, hops, distances, new ArrayList<>(walked.values()));
    }

    /**
     * Findings of the most recent run; empty before the first run.
     */
    public AnomalyReport anomalyReport() {
        return pipeline.getLastAnomalyReport();
    }

    // ========== Operations ==========

    public HealthStatus health() {
        return healthCheckRegistry.checkAll();
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public ResolutionStore getStore() {
        return store;
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        if (connection != null) {
            try {
                connection.close();
            } catch (Exception e) {
                log.warn("Error closing graph connection", e);
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MentionStore mentionStore;
        private PermitStore permitStore;
        private ResolutionStore resolutionStore;
        private NormalizationEngine normalizationEngine;
        private PipelineOptions options = PipelineOptions.defaults();
        private MetricsService metricsService;
        private TracingService tracingService;
        private AuditService auditService;
        private AuditRepository auditRepository;
        private EntityLookupCache cache;
        private GraphConnection connection;
        private boolean createIndexes = true;
        private ExecutorService executor;

        /**
         * Sets the mention source. Required.
         */
        public Builder mentionStore(MentionStore mentionStore) {
            this.mentionStore = mentionStore;
            return this;
        }

        /**
         * Sets the permit attribute source (neighborhood, outcome). Optional.
         */
        public Builder permitStore(PermitStore permitStore) {
            this.permitStore = permitStore;
            return this;
        }

        public Builder resolutionStore(ResolutionStore resolutionStore) {
            this.resolutionStore = resolutionStore;
            return this;
        }

        public Builder normalizationEngine(NormalizationEngine normalizationEngine) {
            this.normalizationEngine = normalizationEngine;
            return this;
        }

        public Builder options(PipelineOptions options) {
            this.options = options;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder auditRepository(AuditRepository auditRepository) {
            this.auditRepository = auditRepository;
            return this;
        }

        public Builder cache(EntityLookupCache cache) {
            this.cache = cache;
            return this;
        }

        /**
         * Sets the graph database that committed changes are exported to when
         * export is enabled in the options. The resolver closes it on {@link #close()}.
         */
        public Builder graphConnection(GraphConnection connection) {
            this.connection = connection;
            return this;
        }

        public Builder createIndexes(boolean createIndexes) {
            this.createIndexes = createIndexes;
            return this;
        }

        /**
         * Sets the pool used for partitions and permit batches. A supplied pool is not
         * shut down by the resolver.
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public PermitEntityResolver build() {
            if (mentionStore == null) {
                throw new IllegalStateException("MentionStore is required");
            }
            if (options == null) {
                throw new IllegalStateException("PipelineOptions are required");
            }
            return new PermitEntityResolver(this);
        }
    }
}
