package com.permit.resolution.graph;

import com.permit.resolution.core.model.EdgeKey;
import com.permit.resolution.core.model.RelationshipEdge;

import java.util.Map;
import java.util.Set;

/**
 * Edge rows to write and delete after re-aggregating the rebuilt permits.
 */
public record EdgeDelta(Map<EdgeKey, RelationshipEdge> upserts, Set<EdgeKey> removals) {

    public EdgeDelta {
        upserts = Map.copyOf(upserts);
        removals = Set.copyOf(removals);
    }

    public static EdgeDelta empty() {
        return new EdgeDelta(Map.of(), Set.of());
    }
}
