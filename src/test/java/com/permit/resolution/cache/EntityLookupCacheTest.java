package com.permit.resolution.cache;

import com.permit.resolution.core.model.Entity;
import com.permit.resolution.core.model.SourceTag;
import com.permit.resolution.metrics.MicrometerMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EntityLookupCache Tests")
class EntityLookupCacheTest {

    private static Entity entity(String id, String key) {
        return Entity.builder()
                .entityId(id)
                .canonicalName(key)
                .normalizedKey(key)
                .blockKey(key.charAt(0) + "|" + key.substring(key.lastIndexOf(' ') + 1))
                .addSourceTag(SourceTag.BUILDING)
                .addSpelling(key)
                .lastActivityAt(Instant.EPOCH)
                .canonicalSource(SourceTag.BUILDING)
                .canonicalObservedAt(Instant.EPOCH)
                .build();
    }

    @Nested
    @DisplayName("CaffeineEntityLookupCache")
    class CaffeineTests {

        private CaffeineEntityLookupCache cache;
        private AtomicInteger loads;
        private Function<String, Optional<Entity>> byId;
        private Function<String, List<Entity>> byKey;

        @BeforeEach
        void setUp() {
            cache = new CaffeineEntityLookupCache(CacheConfig.defaults());
            loads = new AtomicInteger();
            byId = id -> {
                loads.incrementAndGet();
                return Optional.of(entity(id, "jane doe"));
            };
            byKey = key -> {
                loads.incrementAndGet();
                return List.of(entity("ent-1", key));
            };
        }

        @Test
        @DisplayName("Second lookup is served from the cache")
        void cachesLookups() {
            cache.getById("ent-1", byId);
            cache.getById("ent-1", byId);
            cache.getByNormalizedKey("jane doe", byKey);
            cache.getByNormalizedKey("jane doe", byKey);

            assertEquals(2, loads.get());
            assertEquals(2, cache.getStats().hitCount());
        }

        @Test
        @DisplayName("Missing entities are cached as empty")
        void cachesMisses() {
            Function<String, Optional<Entity>> none = id -> {
                loads.incrementAndGet();
                return Optional.empty();
            };
            assertTrue(cache.getById("ent-x", none).isEmpty());
            assertTrue(cache.getById("ent-x", none).isEmpty());
            assertEquals(1, loads.get());
        }

        @Test
        @DisplayName("Commit evicts the id and every name lookup that returned the entity")
        void commitEvictsByEntity() {
            cache.getById("ent-1", byId);
            cache.getByNormalizedKey("jane doe", byKey);

            cache.onCommit("run-2", Set.of("ent-1"), Set.of());
            cache.getById("ent-1", byId);
            cache.getByNormalizedKey("jane doe", byKey);

            assertEquals(4, loads.get());
        }

        @Test
        @DisplayName("Commit evicts name lookups for touched keys")
        void commitEvictsByKey() {
            Function<String, List<Entity>> empty = key -> {
                loads.incrementAndGet();
                return List.of();
            };
            cache.getByNormalizedKey("acme builders", empty);

            cache.onCommit("run-2", Set.of("ent-9"), Set.of("acme builders"));
            cache.getByNormalizedKey("acme builders", empty);

            assertEquals(2, loads.get());
        }

        @Test
        @DisplayName("Stats count commit invalidations apart from size evictions")
        void statsCountCommitInvalidations() {
            cache.getById("ent-1", byId);
            cache.getByNormalizedKey("jane doe", byKey);
            cache.getById("ent-1", byId);

            cache.onCommit("run-2", Set.of("ent-1"), Set.of("jane doe"));

            CacheStats stats = cache.getStats();
            assertEquals(2, stats.commitInvalidations());
            assertEquals(0, stats.evictionCount());
            assertEquals(1.0 / 3, stats.hitRate(), 1e-9);
        }

        @Test
        @DisplayName("Unrelated commits keep entries")
        void unrelatedCommitKeeps() {
            cache.getById("ent-1", byId);
            cache.onCommit("run-2", Set.of("ent-2"), Set.of("john roe"));
            cache.getById("ent-1", byId);
            assertEquals(1, loads.get());
        }

        @Test
        @DisplayName("Hits and misses are reported to metrics")
        void metrics() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            CaffeineEntityLookupCache metered = new CaffeineEntityLookupCache(CacheConfig.defaults(),
                    new MicrometerMetricsService(registry));
            metered.getById("ent-1", byId);
            metered.getById("ent-1", byId);

            assertEquals(1.0, registry.find("permit.resolution.lookup.cache").tag("result", "hit").counter().count());
            assertEquals(1.0, registry.find("permit.resolution.lookup.cache").tag("result", "miss").counter().count());
        }
    }

    @Nested
    @DisplayName("NoOpEntityLookupCache")
    class NoOpTests {

        @Test
        @DisplayName("Always delegates to the loader")
        void alwaysLoads() {
            NoOpEntityLookupCache cache = new NoOpEntityLookupCache();
            AtomicInteger loads = new AtomicInteger();
            cache.getByNormalizedKey("jane doe", key -> {
                loads.incrementAndGet();
                return List.of();
            });
            cache.getByNormalizedKey("jane doe", key -> {
                loads.incrementAndGet();
                return List.of();
            });
            assertEquals(2, loads.get());
            assertEquals(CacheStats.empty(), cache.getStats());
        }
    }

    @Test
    @DisplayName("Config rejects non-positive sizes")
    void configValidation() {
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 60, true));
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, 0, true));
    }
}
