package com.permit.resolution.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.permit.resolution.core.model.Entity;
import com.permit.resolution.metrics.MetricsService;
import com.permit.resolution.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Caffeine-backed lookup cache. Name lookups are indexed by the entity ids they
 * returned so that a commit only evicts the lookups it can have changed.
 */
public class CaffeineEntityLookupCache implements EntityLookupCache, CommitListener {
    private static final Logger log = LoggerFactory.getLogger(CaffeineEntityLookupCache.class);

    private final Cache<LookupKey, List<Entity>> cache;
    // entityId -> name lookups that returned it
    private final ConcurrentMap<String, Set<LookupKey>> entityIndex = new ConcurrentHashMap<>();
    private final AtomicLong commitInvalidations = new AtomicLong();
    private final MetricsService metrics;

    public CaffeineEntityLookupCache(CacheConfig config) {
        this(config, new NoOpMetricsService());
    }

    public CaffeineEntityLookupCache(CacheConfig config, MetricsService metrics) {
        this.metrics = metrics;
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .removalListener((LookupKey key, List<Entity> value, com.github.benmanes.caffeine.cache.RemovalCause cause) -> {
                    if (key != null && value != null) {
                        value.forEach(e -> unindex(e.getEntityId(), key));
                    }
                })
                .build();
        log.info("lookup.cache.initialized maxSize={} ttlSeconds={}", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<Entity> getById(String entityId, Function<String, Optional<Entity>> loader) {
        List<Entity> result = lookup(new LookupKey(LookupKind.ID, entityId),
                id -> loader.apply(id).map(List::of).orElse(List.of()));
        return result.stream().findFirst();
    }

    @Override
    public List<Entity> getByNormalizedKey(String normalizedKey, Function<String, List<Entity>> loader) {
        return lookup(new LookupKey(LookupKind.NAME, normalizedKey), loader);
    }

    private List<Entity> lookup(LookupKey key, Function<String, List<Entity>> loader) {
        List<Entity> cached = cache.getIfPresent(key);
        if (cached != null) {
            metrics.recordLookupCacheHit();
            return cached;
        }
        metrics.recordLookupCacheMiss();
        List<Entity> loaded = List.copyOf(loader.apply(key.value()));
        cache.put(key, loaded);
        loaded.forEach(e -> entityIndex.computeIfAbsent(e.getEntityId(), k -> ConcurrentHashMap.newKeySet()).add(key));
        return loaded;
    }

    @Override
    public void onCommit(String runId, Set<String> entityIds, Set<String> normalizedKeys) {
        int dropped = 0;
        for (String entityId : entityIds) {
            dropped += drop(new LookupKey(LookupKind.ID, entityId));
            Set<LookupKey> keys = entityIndex.remove(entityId);
            if (keys != null) {
                for (LookupKey key : keys) {
                    dropped += drop(key);
                }
            }
        }
        for (String normalizedKey : normalizedKeys) {
            dropped += drop(new LookupKey(LookupKind.NAME, normalizedKey));
        }
        commitInvalidations.addAndGet(dropped);
        log.debug("lookup.cache.invalidated runId={} entities={} keys={} dropped={}",
                runId, entityIds.size(), normalizedKeys.size(), dropped);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        entityIndex.clear();
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(),
                commitInvalidations.get(), cache.estimatedSize());
    }

    private int drop(LookupKey key) {
        return cache.asMap().remove(key) != null ? 1 : 0;
    }

    private void unindex(String entityId, LookupKey key) {
        Set<LookupKey> keys = entityIndex.get(entityId);
        if (keys != null) {
            keys.remove(key);
        }
    }

    enum LookupKind { ID, NAME }

    record LookupKey(LookupKind kind, String value) {}
}
