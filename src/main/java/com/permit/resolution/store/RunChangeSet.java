package com.permit.resolution.store;

import com.permit.resolution.core.model.EdgeKey;
import com.permit.resolution.core.model.Entity;
import com.permit.resolution.core.model.RelationshipEdge;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Everything a run publishes, applied by {@link ResolutionStore#commit} as one unit.
 *
 * @param runId              the run that staged these changes
 * @param entities           created or updated entities, with their final scores
 * @param assignments        new mention id to entity id assignments
 * @param contributions      replacement contributions for rebuilt permits
 * @param edges              edge rows to upsert
 * @param removedEdges       edge rows no permit supports any more
 * @param dirtyPermitsAdded  permits left for a later run (cancellation)
 * @param dirtyPermitsCleared permits rebuilt by this run
 */
public record RunChangeSet(String runId,
                           List<Entity> entities,
                           Map<String, String> assignments,
                           Map<String, PermitContribution> contributions,
                           Map<EdgeKey, RelationshipEdge> edges,
                           Set<EdgeKey> removedEdges,
                           Set<String> dirtyPermitsAdded,
                           Set<String> dirtyPermitsCleared) {

    public RunChangeSet {
        Objects.requireNonNull(runId, "runId is required");
        entities = List.copyOf(entities);
        assignments = Map.copyOf(assignments);
        contributions = Map.copyOf(contributions);
        edges = Map.copyOf(edges);
        removedEdges = Set.copyOf(removedEdges);
        dirtyPermitsAdded = Set.copyOf(dirtyPermitsAdded);
        dirtyPermitsCleared = Set.copyOf(dirtyPermitsCleared);
    }

    public boolean isEmpty() {
        return entities.isEmpty() && assignments.isEmpty() && contributions.isEmpty()
                && edges.isEmpty() && removedEdges.isEmpty()
                && dirtyPermitsAdded.isEmpty() && dirtyPermitsCleared.isEmpty();
    }
}
