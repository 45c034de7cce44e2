package com.permit.resolution.cache;

import com.permit.resolution.core.model.Entity;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Always loads from the store. Used when caching is disabled.
 */
public class NoOpEntityLookupCache implements EntityLookupCache {

    @Override
    public Optional<Entity> getById(String entityId, Function<String, Optional<Entity>> loader) {
        return loader.apply(entityId);
    }

    @Override
    public List<Entity> getByNormalizedKey(String normalizedKey, Function<String, List<Entity>> loader) {
        return loader.apply(normalizedKey);
    }

    @Override
    public void invalidateAll() {
        // nothing cached
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
