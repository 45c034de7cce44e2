package com.permit.resolution.api;

import com.permit.resolution.anomaly.AnomalyOptions;
import com.permit.resolution.core.model.RoleTag;
import com.permit.resolution.graph.PermitContributionBuilder;

import java.time.Clock;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Options for resolution runs.
 * Configures partitioning, graph batching, interaction roles and anomaly thresholds.
 */
public class PipelineOptions {

    private static final int DEFAULT_PERMIT_BATCH_SIZE = 500;

    private final int partitions;
    private final int parallelism;
    private final int permitBatchSize;
    private final Set<RoleTag> counterpartRoles;
    private final Clock clock;
    private final AnomalyOptions anomalyOptions;
    private final boolean exportEnabled;

    private PipelineOptions(Builder builder) {
        this.partitions = builder.partitions;
        this.parallelism = builder.parallelism;
        this.permitBatchSize = builder.permitBatchSize;
        this.counterpartRoles = Collections.unmodifiableSet(EnumSet.copyOf(builder.counterpartRoles));
        this.clock = builder.clock;
        this.anomalyOptions = builder.anomalyOptions;
        this.exportEnabled = builder.exportEnabled;
    }

    public int getPartitions() {
        return partitions;
    }

    public int getParallelism() {
        return parallelism;
    }

    public int getPermitBatchSize() {
        return permitBatchSize;
    }

    public Set<RoleTag> getCounterpartRoles() {
        return counterpartRoles;
    }

    /**
     * Reference clock for recency scoring. When absent, runs score against the
     * latest observation in the mention store.
     */
    public Optional<Clock> getClock() {
        return Optional.ofNullable(clock);
    }

    public AnomalyOptions getAnomalyOptions() {
        return anomalyOptions;
    }

    public boolean isExportEnabled() {
        return exportEnabled;
    }

    public static PipelineOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int partitions = Runtime.getRuntime().availableProcessors();
        private int parallelism = Runtime.getRuntime().availableProcessors();
        private int permitBatchSize = DEFAULT_PERMIT_BATCH_SIZE;
        private Set<RoleTag> counterpartRoles = PermitContributionBuilder.DEFAULT_COUNTERPART_ROLES;
        private Clock clock;
        private AnomalyOptions anomalyOptions = AnomalyOptions.defaults();
        private boolean exportEnabled = false;

        public Builder partitions(int partitions) {
            if (partitions <= 0) {
                throw new IllegalArgumentException("partitions must be positive");
            }
            this.partitions = partitions;
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be positive");
            }
            this.parallelism = parallelism;
            return this;
        }

        public Builder permitBatchSize(int permitBatchSize) {
            if (permitBatchSize <= 0) {
                throw new IllegalArgumentException("permitBatchSize must be positive");
            }
            this.permitBatchSize = permitBatchSize;
            return this;
        }

        public Builder counterpartRoles(Set<RoleTag> counterpartRoles) {
            Objects.requireNonNull(counterpartRoles, "counterpartRoles is required");
            if (counterpartRoles.isEmpty()) {
                throw new IllegalArgumentException("counterpartRoles must not be empty");
            }
            if (counterpartRoles.contains(RoleTag.REVIEWER)) {
                throw new IllegalArgumentException("REVIEWER cannot be an interaction counterpart");
            }
            this.counterpartRoles = counterpartRoles;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder anomalyOptions(AnomalyOptions anomalyOptions) {
            this.anomalyOptions = Objects.requireNonNull(anomalyOptions, "anomalyOptions is required");
            return this;
        }

        public Builder exportEnabled(boolean exportEnabled) {
            this.exportEnabled = exportEnabled;
            return this;
        }

        public PipelineOptions build() {
            return new PipelineOptions(this);
        }
    }
}
