package com.permit.resolution.cascade;

import com.permit.resolution.core.model.Entity;
import com.permit.resolution.core.model.SourceTag;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * What one partition staged. Partitions own disjoint blocks, so results merge
 * without conflicts.
 *
 * @param createdIds   ids of new entities mapped to the source of their seed mention
 * @param updatedIds   ids of previously committed entities that gained mentions
 * @param touchedKeys  normalized keys whose lookups are stale after commit, old and new
 */
record PartitionResult(int partition,
                       Map<String, Entity> entities,
                       Map<String, String> assignments,
                       Map<String, SourceTag> createdIds,
                       Set<String> updatedIds,
                       Map<ResolutionOutcome, Integer> outcomes,
                       Map<SkipReason, Integer> skipped,
                       int ambiguous,
                       List<CascadeEvent> events,
                       Set<String> touchedPermits,
                       Set<String> touchedKeys) {
}
