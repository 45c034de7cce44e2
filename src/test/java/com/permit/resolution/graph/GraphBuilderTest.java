package com.permit.resolution.graph;

import com.permit.resolution.core.model.EdgeKey;
import com.permit.resolution.core.model.EdgeKind;
import com.permit.resolution.core.model.Mention;
import com.permit.resolution.core.model.RoleTag;
import com.permit.resolution.core.model.SourceTag;
import com.permit.resolution.store.InMemoryMentionStore;
import com.permit.resolution.store.InMemoryResolutionStore;
import com.permit.resolution.store.PermitStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static com.permit.resolution.MentionFixtures.mention;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GraphBuilder Tests")
class GraphBuilderTest {

    private ExecutorService executor;
    private InMemoryMentionStore mentions;
    private final Map<String, String> assignments = new HashMap<>();

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        mentions = new InMemoryMentionStore();
        for (int i = 1; i <= 5; i++) {
            add("ent-a", "Jane Doe", RoleTag.APPLICANT, "P" + i);
            add("ent-b", "Acme Builders", RoleTag.CONTRACTOR, "P" + i);
        }
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private void add(String entityId, String name, RoleTag role, String permitId) {
        Mention m = mention(SourceTag.BUILDING, name, role, permitId);
        mentions.append(m);
        assignments.put(m.getMentionId(), entityId);
    }

    private Function<String, Optional<String>> lookup() {
        return id -> Optional.ofNullable(assignments.get(id));
    }

    @Test
    @DisplayName("Rebuilds every permit into one aggregated edge")
    void rebuildsAll() {
        GraphBuilder builder = new GraphBuilder(new PermitContributionBuilder(), executor, 2, 2);

        GraphBuildResult result = builder.rebuild("run-1", mentions.findPermitIds(), mentions, PermitStore.EMPTY,
                lookup(), new InMemoryResolutionStore(), () -> false);

        assertFalse(result.cancelled());
        assertEquals(5, result.rebuiltPermits().size());
        assertTrue(result.deferredPermits().isEmpty());
        assertEquals(5, result.delta().upserts().get(EdgeKey.of("ent-a", "ent-b", EdgeKind.CO_OCCURRENCE))
                .sharedPermitCount());
    }

    @Test
    @DisplayName("Cancellation between batches defers the remaining permits")
    void cancellationDefers() {
        GraphBuilder builder = new GraphBuilder(new PermitContributionBuilder(), executor, 2, 2);
        AtomicInteger polls = new AtomicInteger();

        GraphBuildResult result = builder.rebuild("run-1", mentions.findPermitIds(), mentions, PermitStore.EMPTY,
                lookup(), new InMemoryResolutionStore(), () -> polls.incrementAndGet() > 1);

        assertTrue(result.cancelled());
        assertEquals(Set.of("P1", "P2"), result.rebuiltPermits());
        assertEquals(Set.of("P3", "P4", "P5"), result.deferredPermits());
        assertEquals(Set.of("P1", "P2"),
                result.delta().upserts().get(EdgeKey.of("ent-a", "ent-b", EdgeKind.CO_OCCURRENCE)).permitIds());
    }

    @Test
    @DisplayName("A failing permit is deferred without failing the batch")
    void permitFailureDeferred() {
        PermitStore flaky = permitId -> {
            if (permitId.equals("P3")) {
                throw new IllegalStateException("corrupt permit row");
            }
            return Optional.empty();
        };
        GraphBuilder builder = new GraphBuilder(new PermitContributionBuilder(), executor, 10, 2);

        GraphBuildResult result = builder.rebuild("run-1", mentions.findPermitIds(), mentions, flaky,
                lookup(), new InMemoryResolutionStore(), () -> false);

        assertEquals(1, result.failedPermits());
        assertEquals(Set.of("P3"), result.deferredPermits());
        assertEquals(4, result.rebuiltPermits().size());
    }

    @Test
    @DisplayName("Batch size and parallelism must be positive")
    void rejectsBadSizes() {
        assertThrows(IllegalArgumentException.class,
                () -> new GraphBuilder(new PermitContributionBuilder(), executor, 0, 1));
    }
}
