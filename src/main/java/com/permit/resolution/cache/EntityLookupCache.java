package com.permit.resolution.cache;

import com.permit.resolution.core.model.Entity;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Caches entity lookups by id and by normalized name.
 */
public interface EntityLookupCache {

    Optional<Entity> getById(String entityId, Function<String, Optional<Entity>> loader);

    List<Entity> getByNormalizedKey(String normalizedKey, Function<String, List<Entity>> loader);

    void invalidateAll();

    CacheStats getStats();
}
