package com.permit.resolution.graph;

import com.permit.resolution.core.model.EdgeKey;
import com.permit.resolution.core.model.RelationshipEdge;
import com.permit.resolution.store.PermitContribution;
import com.permit.resolution.store.ResolutionStore;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Single writer that stages permit contributions over the committed store and
 * re-derives every edge row a staged permit can affect. A permit's previous
 * contribution is replaced as a whole, never merged field by field.
 */
public class EdgeAggregator {

    private final ResolutionStore store;
    private final Map<String, PermitContribution> staged = new TreeMap<>();

    public EdgeAggregator(ResolutionStore store) {
        this.store = store;
    }

    /**
     * Stages one batch. The batch is taken as a whole: callers pass only fully computed batches.
     */
    public void apply(Collection<PermitContribution> batch) {
        for (PermitContribution contribution : batch) {
            staged.put(contribution.permitId(), contribution);
        }
    }

    public Map<String, PermitContribution> staged() {
        return Map.copyOf(staged);
    }

    public EdgeDelta delta() {
        if (staged.isEmpty()) {
            return EdgeDelta.empty();
        }
        Set<EdgeKey> affected = new TreeSet<>();
        for (PermitContribution contribution : staged.values()) {
            affected.addAll(contribution.edgeKeys());
            store.findContribution(contribution.permitId()).ifPresent(previous -> affected.addAll(previous.edgeKeys()));
        }

        Map<EdgeKey, RelationshipEdge> upserts = new TreeMap<>();
        Set<EdgeKey> removals = new TreeSet<>();
        Map<String, Optional<String>> neighborhoods = new HashMap<>();
        for (EdgeKey key : affected) {
            Optional<RelationshipEdge> existing = store.findEdge(key);
            SortedSet<String> permits = new TreeSet<>(existing.map(RelationshipEdge::permitIds).orElse(new TreeSet<>()));
            permits.removeAll(staged.keySet());
            for (PermitContribution contribution : staged.values()) {
                if (contribution.edgeKeys().contains(key)) {
                    permits.add(contribution.permitId());
                }
            }
            if (permits.isEmpty()) {
                if (existing.isPresent()) {
                    removals.add(key);
                }
                continue;
            }
            SortedSet<String> hoods = new TreeSet<>();
            for (String permitId : permits) {
                neighborhoods.computeIfAbsent(permitId, this::neighborhoodOf).ifPresent(hoods::add);
            }
            upserts.put(key, RelationshipEdge.of(key, permits, hoods));
        }
        return new EdgeDelta(upserts, removals);
    }

    /**
     * Edge count per entity after the delta is applied, for the given entities.
     */
    public Map<String, Integer> relationshipCounts(Collection<String> entityIds, EdgeDelta delta) {
        Map<String, Set<EdgeKey>> changedByEntity = new HashMap<>();
        for (EdgeKey key : delta.upserts().keySet()) {
            changedByEntity.computeIfAbsent(key.entityIdA(), k -> new TreeSet<>()).add(key);
            changedByEntity.computeIfAbsent(key.entityIdB(), k -> new TreeSet<>()).add(key);
        }
        Map<String, Integer> counts = new HashMap<>();
        for (String entityId : entityIds) {
            Set<EdgeKey> keys = new TreeSet<>();
            List<RelationshipEdge> committed = store.findEdgesFor(entityId);
            committed.forEach(e -> keys.add(e.key()));
            keys.removeAll(delta.removals());
            keys.addAll(changedByEntity.getOrDefault(entityId, Set.of()));
            counts.put(entityId, keys.size());
        }
        return counts;
    }

    private Optional<String> neighborhoodOf(String permitId) {
        PermitContribution contribution = staged.get(permitId);
        if (contribution != null) {
            return contribution.neighborhoodOption();
        }
        return store.findContribution(permitId).flatMap(PermitContribution::neighborhoodOption);
    }
}
