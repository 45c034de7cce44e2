package com.permit.resolution.cascade;

import com.permit.resolution.core.model.ContactIdentifier;
import com.permit.resolution.core.model.Entity;
import com.permit.resolution.store.ResolutionStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Copy-on-write view of the entity table for one partition. Blocks are loaded from
 * the committed store on first use; every change stays local until the run merges
 * the partition results and commits.
 *
 * <p>Not thread-safe: each partition owns exactly one working set.</p>
 */
public final class PartitionWorkingSet {

    private final ResolutionStore store;
    private final Map<String, Map<String, Entity>> blocks = new HashMap<>();
    private final Map<String, Entity> current = new HashMap<>();
    private final Map<ContactIdentifier, SortedSet<String>> byIdentifier = new HashMap<>();
    private final Set<ContactIdentifier> loadedIdentifiers = new HashSet<>();
    private final Map<String, Entity> changed = new TreeMap<>();
    private final Map<String, Entity> original = new HashMap<>();
    private final Map<String, String> assignments = new TreeMap<>();

    public PartitionWorkingSet(ResolutionStore store) {
        this.store = store;
    }

    /**
     * Entities of a block, ordered by id, including this partition's changes.
     */
    public Collection<Entity> block(String blockKey) {
        return blocks.computeIfAbsent(blockKey, this::load).values();
    }

    /**
     * Entities carrying the identifier, ordered by id, including this partition's changes.
     */
    public List<Entity> byIdentifier(ContactIdentifier identifier) {
        if (loadedIdentifiers.add(identifier)) {
            for (Entity entity : store.findByIdentifier(identifier)) {
                block(entity.getBlockKey());
            }
        }
        SortedSet<String> ids = byIdentifier.get(identifier);
        if (ids == null) {
            return List.of();
        }
        List<Entity> owners = new ArrayList<>(ids.size());
        for (String id : ids) {
            owners.add(current.get(id));
        }
        return owners;
    }

    public void put(Entity entity) {
        String entityId = entity.getEntityId();
        Entity previous = current.get(entityId);
        if (previous != null && !previous.getBlockKey().equals(entity.getBlockKey())) {
            blocks.get(previous.getBlockKey()).remove(entityId);
        }
        blocks.computeIfAbsent(entity.getBlockKey(), this::load).put(entityId, entity);
        if (previous != null && !changed.containsKey(entityId)) {
            original.put(entityId, previous);
        }
        current.put(entityId, entity);
        index(entity);
        changed.put(entityId, entity);
    }

    public boolean isAssigned(String mentionId) {
        return assignments.containsKey(mentionId) || store.findAssignment(mentionId).isPresent();
    }

    public void assign(String mentionId, String entityId) {
        assignments.put(mentionId, entityId);
    }

    public boolean isIdTaken(String entityId) {
        return changed.containsKey(entityId) || store.containsEntity(entityId);
    }

    /**
     * The committed version of a changed entity, empty for entities created here.
     */
    public Optional<Entity> originalOf(String entityId) {
        return Optional.ofNullable(original.get(entityId));
    }

    public Map<String, Entity> changedEntities() {
        return changed;
    }

    public Map<String, String> assignments() {
        return assignments;
    }

    private Map<String, Entity> load(String blockKey) {
        Map<String, Entity> block = new TreeMap<>();
        for (Entity entity : store.findByBlockKey(blockKey)) {
            // an entity already moved to another block in this partition stays there
            if (!current.containsKey(entity.getEntityId())) {
                block.put(entity.getEntityId(), entity);
                current.put(entity.getEntityId(), entity);
                index(entity);
            }
        }
        return block;
    }

    private void index(Entity entity) {
        for (ContactIdentifier identifier : entity.getIdentifiers()) {
            byIdentifier.computeIfAbsent(identifier, k -> new TreeSet<>()).add(entity.getEntityId());
        }
    }
}
