package com.permit.resolution.graph;

import com.permit.resolution.store.PermitContribution;

import java.util.Map;
import java.util.Set;

/**
 * Outcome of the graph stage.
 *
 * @param contributions  replacement contributions for rebuilt permits
 * @param delta          edge rows to write and delete
 * @param rebuiltPermits permits whose contributions were recomputed
 * @param deferredPermits permits left for a later run, after cancellation or a per-permit failure
 * @param failedPermits  permits whose recomputation failed
 * @param cancelled      whether the stage stopped early
 */
public record GraphBuildResult(Map<String, PermitContribution> contributions,
                               EdgeDelta delta,
                               Set<String> rebuiltPermits,
                               Set<String> deferredPermits,
                               int failedPermits,
                               boolean cancelled) {

    public GraphBuildResult {
        contributions = Map.copyOf(contributions);
        rebuiltPermits = Set.copyOf(rebuiltPermits);
        deferredPermits = Set.copyOf(deferredPermits);
    }
}
