package com.permit.resolution.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EdgeKey Tests")
class EdgeKeyTest {

    @Test
    @DisplayName("of() orders the pair regardless of argument order")
    void ordersPair() {
        EdgeKey forward = EdgeKey.of("ent-a", "ent-b", EdgeKind.CO_OCCURRENCE);
        EdgeKey backward = EdgeKey.of("ent-b", "ent-a", EdgeKind.CO_OCCURRENCE);

        assertEquals(forward, backward);
        assertEquals("ent-a", forward.entityIdA());
        assertEquals("ent-b", forward.entityIdB());
    }

    @Test
    @DisplayName("Self pairs are rejected")
    void rejectsSelfEdge() {
        assertThrows(IllegalArgumentException.class, () -> EdgeKey.of("ent-a", "ent-a", EdgeKind.INTERACTION));
    }

    @Test
    @DisplayName("Constructor rejects unordered ids")
    void constructorRequiresOrder() {
        assertThrows(IllegalArgumentException.class, () -> new EdgeKey("ent-b", "ent-a", EdgeKind.CO_OCCURRENCE));
    }

    @Test
    @DisplayName("Kinds of the same pair are distinct keys")
    void kindsAreDistinct() {
        EdgeKey co = EdgeKey.of("ent-a", "ent-b", EdgeKind.CO_OCCURRENCE);
        EdgeKey interaction = EdgeKey.of("ent-a", "ent-b", EdgeKind.INTERACTION);

        assertNotEquals(co, interaction);
        assertEquals(2, new TreeSet<>(List.of(co, interaction)).size());
    }

    @Test
    @DisplayName("other() returns the opposite endpoint")
    void otherEndpoint() {
        EdgeKey key = EdgeKey.of("ent-a", "ent-b", EdgeKind.CO_OCCURRENCE);

        assertEquals("ent-b", key.other("ent-a"));
        assertEquals("ent-a", key.other("ent-b"));
        assertTrue(key.touches("ent-a"));
        assertFalse(key.touches("ent-c"));
        assertThrows(IllegalArgumentException.class, () -> key.other("ent-c"));
    }

    @Test
    @DisplayName("Edge count must match its permit set")
    void edgeCountMatchesPermits() {
        EdgeKey key = EdgeKey.of("ent-a", "ent-b", EdgeKind.CO_OCCURRENCE);
        TreeSet<String> permits = new TreeSet<>(List.of("P1", "P2"));

        assertEquals(2, RelationshipEdge.of(key, permits, new TreeSet<>()).sharedPermitCount());
        assertThrows(IllegalArgumentException.class, () -> new RelationshipEdge(key, 3, permits, new TreeSet<>()));
    }
}
