package com.permit.resolution.cascade;

import com.permit.resolution.core.model.Entity;
import com.permit.resolution.core.model.SourceTag;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merged output of all partitions for one run. Nothing here is visible to readers
 * until the run commits it.
 */
public final class CascadeResult {

    private final Map<String, Entity> entities;
    private final Map<String, String> assignments;
    private final Map<String, SourceTag> createdIds;
    private final Set<String> updatedIds;
    private final Map<ResolutionOutcome, Integer> outcomes;
    private final Map<SkipReason, Integer> skipped;
    private final Map<SourceTag, Integer> processedBySource;
    private final int ambiguousMatches;
    private final List<CascadeEvent> events;
    private final Set<String> touchedPermits;
    private final Set<String> touchedKeys;

    CascadeResult(Map<String, Entity> entities, Map<String, String> assignments, Map<String, SourceTag> createdIds,
                  Set<String> updatedIds, Map<ResolutionOutcome, Integer> outcomes, Map<SkipReason, Integer> skipped,
                  Map<SourceTag, Integer> processedBySource, int ambiguousMatches, List<CascadeEvent> events,
                  Set<String> touchedPermits, Set<String> touchedKeys) {
        this.entities = Collections.unmodifiableMap(entities);
        this.assignments = Collections.unmodifiableMap(assignments);
        this.createdIds = Collections.unmodifiableMap(createdIds);
        this.updatedIds = Collections.unmodifiableSet(updatedIds);
        this.outcomes = Collections.unmodifiableMap(outcomes);
        this.skipped = Collections.unmodifiableMap(skipped);
        this.processedBySource = Collections.unmodifiableMap(processedBySource);
        this.ambiguousMatches = ambiguousMatches;
        this.events = List.copyOf(events);
        this.touchedPermits = Collections.unmodifiableSet(touchedPermits);
        this.touchedKeys = Collections.unmodifiableSet(touchedKeys);
    }

    /**
     * Created and updated entities by id, before scoring.
     */
    public Map<String, Entity> getEntities() {
        return entities;
    }

    /**
     * New mention id to entity id assignments.
     */
    public Map<String, String> getAssignments() {
        return assignments;
    }

    public Map<String, SourceTag> getCreatedIds() {
        return createdIds;
    }

    public Set<String> getUpdatedIds() {
        return updatedIds;
    }

    public int getOutcomeCount(ResolutionOutcome outcome) {
        return outcomes.getOrDefault(outcome, 0);
    }

    public Map<SkipReason, Integer> getSkipped() {
        return skipped;
    }

    public int getSkippedCount() {
        return skipped.values().stream().mapToInt(Integer::intValue).sum();
    }

    public Map<SourceTag, Integer> getProcessedBySource() {
        return processedBySource;
    }

    /**
     * Every mention read in this run, skipped ones included.
     */
    public int getProcessedCount() {
        return processedBySource.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int getAmbiguousMatches() {
        return ambiguousMatches;
    }

    public List<CascadeEvent> getEvents() {
        return events;
    }

    /**
     * Permits that gained newly assigned mentions.
     */
    public Set<String> getTouchedPermits() {
        return touchedPermits;
    }

    public Set<String> getTouchedKeys() {
        return touchedKeys;
    }

    static Map<ResolutionOutcome, Integer> emptyOutcomes() {
        return new EnumMap<>(ResolutionOutcome.class);
    }
}
