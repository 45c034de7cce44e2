package com.permit.resolution.store;

import com.permit.resolution.core.model.Mention;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view over the mention records produced by upstream ingestion.
 */
public interface MentionStore {

    List<Mention> findAll();

    /**
     * Mentions observed at or after the given instant.
     */
    List<Mention> findObservedSince(Instant since);

    List<Mention> findByPermitId(String permitId);

    default List<Mention> findByPermitIds(Collection<String> permitIds) {
        return permitIds.stream()
                .flatMap(id -> findByPermitId(id).stream())
                .toList();
    }

    /**
     * All distinct, non-blank permit ids referenced by mentions.
     */
    Set<String> findPermitIds();

    Optional<Instant> latestObservedAt();

    long count();
}
