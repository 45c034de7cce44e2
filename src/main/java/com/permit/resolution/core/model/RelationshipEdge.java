package com.permit.resolution.core.model;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Derived relationship row. Rebuilt from permit contributions, never patched field by field.
 */
public record RelationshipEdge(EdgeKey key, int sharedPermitCount,
                               SortedSet<String> permitIds, SortedSet<String> neighborhoods) {

    public RelationshipEdge {
        Objects.requireNonNull(key, "key is required");
        permitIds = Collections.unmodifiableSortedSet(new TreeSet<>(permitIds));
        neighborhoods = neighborhoods != null
                ? Collections.unmodifiableSortedSet(new TreeSet<>(neighborhoods))
                : Collections.emptySortedSet();
        if (sharedPermitCount != permitIds.size()) {
            throw new IllegalArgumentException("sharedPermitCount must equal the number of permit ids");
        }
    }

    public static RelationshipEdge of(EdgeKey key, SortedSet<String> permitIds, SortedSet<String> neighborhoods) {
        return new RelationshipEdge(key, permitIds.size(), permitIds, neighborhoods);
    }

    public String entityIdA() {
        return key.entityIdA();
    }

    public String entityIdB() {
        return key.entityIdB();
    }

    public EdgeKind kind() {
        return key.kind();
    }
}
