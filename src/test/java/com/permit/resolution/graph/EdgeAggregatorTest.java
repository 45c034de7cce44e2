package com.permit.resolution.graph;

import com.permit.resolution.core.model.EdgeKey;
import com.permit.resolution.core.model.EdgeKind;
import com.permit.resolution.core.model.PermitOutcome;
import com.permit.resolution.core.model.RelationshipEdge;
import com.permit.resolution.store.InMemoryResolutionStore;
import com.permit.resolution.store.PermitContribution;
import com.permit.resolution.store.RunChangeSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EdgeAggregator Tests")
class EdgeAggregatorTest {

    private static final EdgeKey AB = EdgeKey.of("ent-a", "ent-b", EdgeKind.CO_OCCURRENCE);
    private static final EdgeKey AC = EdgeKey.of("ent-a", "ent-c", EdgeKind.CO_OCCURRENCE);

    private InMemoryResolutionStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryResolutionStore();
    }

    private static PermitContribution contribution(String permitId, String hood, EdgeKey... keys) {
        return new PermitContribution(permitId, hood, PermitOutcome.APPROVED,
                new TreeSet<>(List.of(keys)), new TreeSet<>(), List.of());
    }

    private void commit(EdgeAggregator aggregator) {
        EdgeDelta delta = aggregator.delta();
        store.commit(new RunChangeSet("run", List.of(), Map.of(), aggregator.staged(),
                delta.upserts(), delta.removals(), Set.of(), Set.of()));
    }

    @Test
    @DisplayName("Shared permits accumulate on one edge with their neighborhoods")
    void accumulates() {
        EdgeAggregator aggregator = new EdgeAggregator(store);
        aggregator.apply(List.of(contribution("P1", "Mission", AB), contribution("P2", "Sunset", AB)));

        RelationshipEdge edge = aggregator.delta().upserts().get(AB);

        assertEquals(2, edge.sharedPermitCount());
        assertEquals(Set.of("P1", "P2"), edge.permitIds());
        assertEquals(Set.of("Mission", "Sunset"), edge.neighborhoods());
    }

    @Test
    @DisplayName("Rebuilding a permit replaces its old contribution")
    void replacesPreviousContribution() {
        EdgeAggregator first = new EdgeAggregator(store);
        first.apply(List.of(contribution("P1", "Mission", AB), contribution("P2", "Mission", AB)));
        commit(first);

        EdgeAggregator second = new EdgeAggregator(store);
        second.apply(List.of(contribution("P1", "Mission", AC)));
        EdgeDelta delta = second.delta();

        assertEquals(Set.of("P2"), delta.upserts().get(AB).permitIds());
        assertEquals(Set.of("P1"), delta.upserts().get(AC).permitIds());
        assertTrue(delta.removals().isEmpty());
    }

    @Test
    @DisplayName("An edge no permit supports is removed")
    void removesUnsupportedEdge() {
        EdgeAggregator first = new EdgeAggregator(store);
        first.apply(List.of(contribution("P1", "Mission", AB)));
        commit(first);

        EdgeAggregator second = new EdgeAggregator(store);
        second.apply(List.of(contribution("P1", "Mission")));
        EdgeDelta delta = second.delta();

        assertEquals(Set.of(AB), delta.removals());
        assertTrue(delta.upserts().isEmpty());
    }

    @Test
    @DisplayName("Relationship counts reflect the pending delta")
    void relationshipCounts() {
        EdgeAggregator first = new EdgeAggregator(store);
        first.apply(List.of(contribution("P1", "Mission", AB)));
        commit(first);

        EdgeAggregator second = new EdgeAggregator(store);
        second.apply(List.of(contribution("P2", "Mission", AC)));
        Map<String, Integer> counts = second.relationshipCounts(List.of("ent-a", "ent-b", "ent-c"), second.delta());

        assertEquals(2, counts.get("ent-a"));
        assertEquals(1, counts.get("ent-b"));
        assertEquals(1, counts.get("ent-c"));
    }

    @Test
    @DisplayName("Nothing staged means an empty delta")
    void emptyDelta() {
        assertEquals(EdgeDelta.empty(), new EdgeAggregator(store).delta());
    }
}
