package com.permit.resolution.cascade;

import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Mints entity ids from the id of the seeding mention, so the same mention set
 * always yields the same ids regardless of how partitions are scheduled.
 */
public final class EntityIdGenerator {

    private static final String PREFIX = "ent-";

    private EntityIdGenerator() {
    }

    /**
     * @param seedMentionId id of the mention that creates the entity
     * @param taken         tells whether an id is already in use
     */
    public static String mint(String seedMentionId, Predicate<String> taken) {
        String base = PREFIX + UUID.nameUUIDFromBytes(seedMentionId.getBytes(StandardCharsets.UTF_8));
        String candidate = base;
        int suffix = 2;
        while (taken.test(candidate)) {
            candidate = base + "-" + suffix++;
        }
        return candidate;
    }
}
