package com.permit.resolution.store;

import com.permit.resolution.core.model.ContactIdentifier;
import com.permit.resolution.core.model.EdgeKey;
import com.permit.resolution.core.model.Entity;
import com.permit.resolution.core.model.RelationshipEdge;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Derived state owned by this library: the entity table, the mention assignment
 * table, permit contributions and the relationship table.
 *
 * <p>Readers see one committed snapshot at a time. Any method may throw
 * {@link StorageUnavailableException}.</p>
 */
public interface ResolutionStore {

    Optional<Entity> findEntity(String entityId);

    boolean containsEntity(String entityId);

    /**
     * Entities whose canonical name has the given normalized key, ordered by id.
     */
    List<Entity> findByNormalizedKey(String normalizedKey);

    /**
     * Entities in the given block, ordered by id.
     */
    List<Entity> findByBlockKey(String blockKey);

    /**
     * Entities carrying the given upstream identifier, ordered by id.
     */
    List<Entity> findByIdentifier(ContactIdentifier identifier);

    /**
     * All entities ordered by id.
     */
    List<Entity> findAllEntities();

    Optional<String> findAssignment(String mentionId);

    Optional<RelationshipEdge> findEdge(EdgeKey key);

    /**
     * Edges of both kinds touching the entity, ordered by key.
     */
    List<RelationshipEdge> findEdgesFor(String entityId);

    /**
     * All edges ordered by key.
     */
    List<RelationshipEdge> findAllEdges();

    Optional<PermitContribution> findContribution(String permitId);

    List<PermitContribution> findAllContributions();

    /**
     * Permits whose edges a cancelled run did not rebuild.
     */
    Set<String> findDirtyPermits();

    /**
     * Publishes a run's changes atomically: either all of them become visible
     * or, on failure, the previous snapshot is left unchanged.
     */
    void commit(RunChangeSet changes);
}
