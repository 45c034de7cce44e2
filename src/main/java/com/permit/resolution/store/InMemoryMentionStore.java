package com.permit.resolution.store;

import com.permit.resolution.core.model.Mention;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Append-only, in-memory mention table indexed by permit id.
 * A mention whose id is already present is ignored.
 */
public class InMemoryMentionStore implements MentionStore {

    private final Map<String, Mention> mentions = new LinkedHashMap<>();
    private final Map<String, List<Mention>> byPermit = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private Instant latest;

    /**
     * Appends a mention.
     *
     * @return false if a mention with the same id was already stored
     */
    public boolean append(Mention mention) {
        lock.writeLock().lock();
        try {
            if (mentions.putIfAbsent(mention.getMentionId(), mention) != null) {
                return false;
            }
            if (mention.hasPermitId()) {
                byPermit.computeIfAbsent(mention.getPermitId(), k -> new ArrayList<>()).add(mention);
            }
            if (latest == null || mention.getObservedAt().isAfter(latest)) {
                latest = mention.getObservedAt();
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int appendAll(Collection<Mention> batch) {
        int added = 0;
        for (Mention mention : batch) {
            if (append(mention)) {
                added++;
            }
        }
        return added;
    }

    @Override
    public List<Mention> findAll() {
        lock.readLock().lock();
        try {
            return List.copyOf(mentions.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Mention> findObservedSince(Instant since) {
        lock.readLock().lock();
        try {
            return mentions.values().stream()
                    .filter(m -> !m.getObservedAt().isBefore(since))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Mention> findByPermitId(String permitId) {
        lock.readLock().lock();
        try {
            return List.copyOf(byPermit.getOrDefault(permitId, List.of()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Set<String> findPermitIds() {
        lock.readLock().lock();
        try {
            return new TreeSet<>(byPermit.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Instant> latestObservedAt() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(latest);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long count() {
        lock.readLock().lock();
        try {
            return mentions.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
