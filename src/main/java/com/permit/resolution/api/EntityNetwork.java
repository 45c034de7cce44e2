package com.permit.resolution.api;

import com.permit.resolution.core.model.RelationshipEdge;

import java.util.List;
import java.util.Map;

/**
 * Entities reachable from a root within a number of hops.
 *
 * @param rootEntityId the entity the walk started from
 * @param hops         maximum distance explored
 * @param distances    reachable entity ids mapped to their hop distance, root at 0
 * @param edges        every edge walked, both kinds
 */
public record EntityNetwork(String rootEntityId, int hops, Map<String, Integer> distances,
                            List<RelationshipEdge> edges) {

    public EntityNetwork {
        distances = Map.copyOf(distances);
        edges = List.copyOf(edges);
    }

    public int size() {
        return distances.size();
    }
}
