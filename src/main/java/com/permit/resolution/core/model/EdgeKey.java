package com.permit.resolution.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Composite key of a relationship edge. The pair is unordered, so the two ids
 * are stored with {@code entityIdA < entityIdB} by {@link String#compareTo}.
 */
public record EdgeKey(String entityIdA, String entityIdB, EdgeKind kind) implements Comparable<EdgeKey> {

    private static final Comparator<EdgeKey> ORDER = Comparator.comparing(EdgeKey::entityIdA)
            .thenComparing(EdgeKey::entityIdB)
            .thenComparing(EdgeKey::kind);

    public EdgeKey {
        Objects.requireNonNull(entityIdA, "entityIdA is required");
        Objects.requireNonNull(entityIdB, "entityIdB is required");
        Objects.requireNonNull(kind, "kind is required");
        if (entityIdA.compareTo(entityIdB) >= 0) {
            throw new IllegalArgumentException(
                    "Edge ids must be strictly ordered: " + entityIdA + " / " + entityIdB);
        }
    }

    /**
     * Builds the key for two entity ids in either order.
     *
     * @throws IllegalArgumentException if both ids are the same entity
     */
    public static EdgeKey of(String first, String second, EdgeKind kind) {
        if (first.equals(second)) {
            throw new IllegalArgumentException("Self edges are not allowed: " + first);
        }
        return first.compareTo(second) < 0
                ? new EdgeKey(first, second, kind)
                : new EdgeKey(second, first, kind);
    }

    public boolean touches(String entityId) {
        return entityIdA.equals(entityId) || entityIdB.equals(entityId);
    }

    /**
     * Returns the id on the other end of the edge.
     */
    public String other(String entityId) {
        if (entityIdA.equals(entityId)) {
            return entityIdB;
        }
        if (entityIdB.equals(entityId)) {
            return entityIdA;
        }
        throw new IllegalArgumentException(entityId + " is not an endpoint of " + this);
    }

    @Override
    public int compareTo(EdgeKey o) {
        return ORDER.compare(this, o);
    }
}
