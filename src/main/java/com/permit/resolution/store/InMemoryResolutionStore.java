package com.permit.resolution.store;

import com.permit.resolution.core.model.ContactIdentifier;
import com.permit.resolution.core.model.EdgeKey;
import com.permit.resolution.core.model.Entity;
import com.permit.resolution.core.model.RelationshipEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

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
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory {@link ResolutionStore}. Commits hold the write lock for their whole
 * duration, so readers observe either the previous or the new snapshot.
 *
 * <p>The {@code write*} methods are the persistence seam for each table;
 * subclasses backed by external storage override them.</p>
 */
public class InMemoryResolutionStore implements ResolutionStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryResolutionStore.class);

    private final Map<String, Entity> entities = new HashMap<>();
    private final Map<String, SortedSet<String>> byNormalizedKey = new HashMap<>();
    private final Map<String, SortedSet<String>> byBlockKey = new HashMap<>();
    private final Map<ContactIdentifier, SortedSet<String>> byIdentifier = new HashMap<>();
    private final Map<String, String> assignments = new HashMap<>();
    private final Map<String, PermitContribution> contributions = new TreeMap<>();
    private final Map<EdgeKey, RelationshipEdge> edges = new TreeMap<>();
    private final Map<String, SortedSet<EdgeKey>> edgesByEntity = new HashMap<>();
    private final SortedSet<String> dirtyPermits = new TreeSet<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public Optional<Entity> findEntity(String entityId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entities.get(entityId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean containsEntity(String entityId) {
        lock.readLock().lock();
        try {
            return entities.containsKey(entityId);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Entity> findByNormalizedKey(String normalizedKey) {
        lock.readLock().lock();
        try {
            return resolve(byNormalizedKey.get(normalizedKey));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Entity> findByBlockKey(String blockKey) {
        lock.readLock().lock();
        try {
            return resolve(byBlockKey.get(blockKey));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Entity> findByIdentifier(ContactIdentifier identifier) {
        lock.readLock().lock();
        try {
            return resolve(byIdentifier.get(identifier));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Entity> findAllEntities() {
        lock.readLock().lock();
        try {
            return resolve(new TreeSet<>(entities.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<String> findAssignment(String mentionId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(assignments.get(mentionId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<RelationshipEdge> findEdge(EdgeKey key) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(edges.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<RelationshipEdge> findEdgesFor(String entityId) {
        lock.readLock().lock();
        try {
            SortedSet<EdgeKey> keys = edgesByEntity.get(entityId);
            if (keys == null) {
                return List.of();
            }
            return keys.stream().map(edges::get).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<RelationshipEdge> findAllEdges() {
        lock.readLock().lock();
        try {
            return List.copyOf(edges.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<PermitContribution> findContribution(String permitId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(contributions.get(permitId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<PermitContribution> findAllContributions() {
        lock.readLock().lock();
        try {
            return List.copyOf(contributions.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Set<String> findDirtyPermits() {
        lock.readLock().lock();
        try {
            return new TreeSet<>(dirtyPermits);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int entityCount() {
        lock.readLock().lock();
        try {
            return entities.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int edgeCount() {
        lock.readLock().lock();
        try {
            return edges.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void commit(RunChangeSet changes) {
        if (changes.isEmpty()) {
            return;
        }
        lock.writeLock().lock();
        try (RunTransaction tx = new RunTransaction(changes.runId())) {
            Map<String, Entity> priorEntities = snapshot(entities, changes.entities().stream().map(Entity::getEntityId).toList());
            tx.apply("entities",
                    () -> writeEntities(changes.entities()),
                    () -> restoreEntities(priorEntities));

            Map<String, String> priorAssignments = snapshot(assignments, changes.assignments().keySet());
            tx.apply("assignments",
                    () -> writeAssignments(changes.assignments()),
                    () -> restore(assignments, priorAssignments));

            Map<String, PermitContribution> priorContributions = snapshot(contributions, changes.contributions().keySet());
            tx.apply("contributions",
                    () -> writeContributions(changes.contributions()),
                    () -> restore(contributions, priorContributions));

            Set<EdgeKey> touchedEdges = new HashSet<>(changes.edges().keySet());
            touchedEdges.addAll(changes.removedEdges());
            Map<EdgeKey, RelationshipEdge> priorEdges = snapshot(edges, touchedEdges);
            tx.apply("edges",
                    () -> writeEdges(changes.edges(), changes.removedEdges()),
                    () -> restoreEdges(priorEdges));

            Set<String> priorDirty = new TreeSet<>(dirtyPermits);
            tx.apply("dirty-permits",
                    () -> writeDirtyPermits(changes.dirtyPermitsAdded(), changes.dirtyPermitsCleared()),
                    () -> {
                        dirtyPermits.clear();
                        dirtyPermits.addAll(priorDirty);
                    });

            tx.commit();
            log.debug("store.committed runId={} entities={} edges={} removedEdges={}",
                    changes.runId(), changes.entities().size(), changes.edges().size(), changes.removedEdges().size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    protected void writeEntities(Collection<Entity> updated) {
        updated.forEach(this::putEntity);
    }

    protected void writeAssignments(Map<String, String> added) {
        for (Map.Entry<String, String> entry : added.entrySet()) {
            String existing = assignments.putIfAbsent(entry.getKey(), entry.getValue());
            if (existing != null && !existing.equals(entry.getValue())) {
                throw new IllegalStateException("Mention " + entry.getKey() + " is already assigned to " + existing);
            }
        }
    }

    protected void writeContributions(Map<String, PermitContribution> replaced) {
        contributions.putAll(replaced);
    }

    protected void writeEdges(Map<EdgeKey, RelationshipEdge> upserts, Set<EdgeKey> removed) {
        removed.forEach(this::removeEdge);
        upserts.values().forEach(this::putEdge);
    }

    protected void writeDirtyPermits(Set<String> added, Set<String> cleared) {
        dirtyPermits.removeAll(cleared);
        dirtyPermits.addAll(added);
    }

    private void putEntity(Entity entity) {
        Entity previous = entities.put(entity.getEntityId(), entity);
        if (previous != null) {
            unindexEntity(previous);
        }
        byNormalizedKey.computeIfAbsent(entity.getNormalizedKey(), k -> new TreeSet<>()).add(entity.getEntityId());
        byBlockKey.computeIfAbsent(entity.getBlockKey(), k -> new TreeSet<>()).add(entity.getEntityId());
        for (ContactIdentifier identifier : entity.getIdentifiers()) {
            byIdentifier.computeIfAbsent(identifier, k -> new TreeSet<>()).add(entity.getEntityId());
        }
    }

    private void removeEntity(String entityId) {
        Entity previous = entities.remove(entityId);
        if (previous != null) {
            unindexEntity(previous);
        }
    }

    private void unindexEntity(Entity entity) {
        unindex(byNormalizedKey, entity.getNormalizedKey(), entity.getEntityId());
        unindex(byBlockKey, entity.getBlockKey(), entity.getEntityId());
        for (ContactIdentifier identifier : entity.getIdentifiers()) {
            unindex(byIdentifier, identifier, entity.getEntityId());
        }
    }

    private void putEdge(RelationshipEdge edge) {
        edges.put(edge.key(), edge);
        edgesByEntity.computeIfAbsent(edge.entityIdA(), k -> new TreeSet<>()).add(edge.key());
        edgesByEntity.computeIfAbsent(edge.entityIdB(), k -> new TreeSet<>()).add(edge.key());
    }

    private void removeEdge(EdgeKey key) {
        if (edges.remove(key) != null) {
            unindex(edgesByEntity, key.entityIdA(), key);
            unindex(edgesByEntity, key.entityIdB(), key);
        }
    }

    private void restoreEntities(Map<String, Entity> prior) {
        prior.forEach((id, entity) -> {
            if (entity == null) {
                removeEntity(id);
            } else {
                putEntity(entity);
            }
        });
    }

    private void restoreEdges(Map<EdgeKey, RelationshipEdge> prior) {
        prior.forEach((key, edge) -> {
            removeEdge(key);
            if (edge != null) {
                putEdge(edge);
            }
        });
    }

    private List<Entity> resolve(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        List<Entity> result = new ArrayList<>(ids.size());
        for (String id : ids) {
            result.add(entities.get(id));
        }
        return List.copyOf(result);
    }

    private static <K, V> Map<K, V> snapshot(Map<K, V> table, Collection<K> keys) {
        // null values mark keys that did not exist before the step
        Map<K, V> prior = new HashMap<>();
        for (K key : keys) {
            prior.put(key, table.get(key));
        }
        return prior;
    }

    private static <K, V> void restore(Map<K, V> table, Map<K, V> prior) {
        prior.forEach((key, value) -> {
            if (value == null) {
                table.remove(key);
            } else {
                table.put(key, value);
            }
        });
    }

    private static <K, V> void unindex(Map<K, SortedSet<V>> index, K key, V value) {
        SortedSet<V> values = index.get(key);
        if (values != null) {
            values.remove(value);
            if (values.isEmpty()) {
                index.remove(key);
            }
        }
    }
}
