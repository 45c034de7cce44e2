package com.permit.resolution.cache;

/**
 * Lookup cache counters.
 *
 * @param hitCount            lookups served from the cache
 * @param missCount           lookups that went to the store
 * @param evictionCount       entries dropped for size or age
 * @param commitInvalidations entries dropped because a commit touched their entities or keys
 * @param size                entries currently held
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long commitInvalidations, long size) {

    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0, 0);
    }
}
