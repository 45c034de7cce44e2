package com.permit.resolution.api;

import com.permit.resolution.health.HealthCheck;
import com.permit.resolution.health.HealthStatus;
import com.permit.resolution.store.ResolutionStore;

import java.util.Set;

/**
 * Reports the state left by the last run. An aborted run is DOWN; permits still
 * waiting for a rebuild after a cancelled run are DEGRADED.
 */
public class RunHealthCheck implements HealthCheck {

    private final ResolutionPipeline pipeline;
    private final ResolutionStore store;

    public RunHealthCheck(ResolutionPipeline pipeline, ResolutionStore store) {
        this.pipeline = pipeline;
        this.store = store;
    }

    @Override
    public String getName() {
        return "resolution-run";
    }

    @Override
    public HealthStatus check() {
        if (pipeline.isLastRunAborted()) {
            return HealthStatus.down("Last run aborted; previous snapshot is being served");
        }
        Set<String> dirty = store.findDirtyPermits();
        HealthStatus status = dirty.isEmpty()
                ? HealthStatus.up()
                : HealthStatus.degraded(dirty.size() + " permits awaiting edge rebuild");
        status = status.withDetail("running", pipeline.isRunning())
                .withDetail("dirtyPermits", dirty.size());
        return withLastRun(status);
    }

    private HealthStatus withLastRun(HealthStatus status) {
        return pipeline.getLastSummary()
                .map(s -> status.withDetail("lastRunId", s.runId()).withDetail("lastRunCancelled", s.cancelled()))
                .orElse(status);
    }
}
