package com.permit.resolution.health;

import com.permit.resolution.graph.GraphConnection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.lang.management.MemoryUsage;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("Health Check Tests")
class HealthCheckTest {

    private static final long MB = 1024 * 1024;

    @Nested
    @DisplayName("HealthStatus")
    class HealthStatusTests {

        @Test
        @DisplayName("withDetail() keeps earlier details")
        void withDetail() {
            HealthStatus status = HealthStatus.up().withDetail("a", 1).withDetail("b", "two");
            assertEquals(Map.of("a", 1, "b", "two"), status.details());
            assertTrue(status.isUp());
        }

        @Test
        @DisplayName("details should be immutable")
        void detailsImmutable() {
            HealthStatus status = HealthStatus.up().withDetail("key", "value");
            assertThrows(UnsupportedOperationException.class, () -> status.details().put("other", "value"));
        }

        @Test
        @DisplayName("worst() picks the more severe status")
        void worst() {
            assertEquals(HealthStatus.Status.DOWN, HealthStatus.Status.DEGRADED.worst(HealthStatus.Status.DOWN));
            assertEquals(HealthStatus.Status.DEGRADED, HealthStatus.Status.DEGRADED.worst(HealthStatus.Status.UP));
        }
    }

    @Nested
    @DisplayName("HealthCheckRegistry")
    class RegistryTests {

        @Test
        @DisplayName("Empty registry is UP")
        void emptyIsUp() {
            assertTrue(new HealthCheckRegistry().checkAll().isUp());
        }

        @Test
        @DisplayName("Overall status is the worst check and names it")
        void worstWins() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(HealthCheck.of("memory", HealthStatus::up));
            registry.register(HealthCheck.of("graph-export", () -> HealthStatus.degraded("Graph database unreachable")));

            HealthStatus status = registry.checkAll();

            assertEquals(HealthStatus.Status.DEGRADED, status.status());
            assertEquals("graph-export: Graph database unreachable", status.message());
            assertTrue(status.details().containsKey("memory"));
            assertEquals(2, registry.size());
        }

        @Test
        @DisplayName("A throwing check reports DOWN")
        void throwingCheckIsDown() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(HealthCheck.of("broken", () -> {
                throw new IllegalStateException("boom");
            }));

            HealthStatus status = registry.checkAll();
            assertTrue(status.isDown());
            assertTrue(status.message().contains("boom"));
        }

        @Test
        @DisplayName("Supplier-backed checks are evaluated on every run")
        void supplierEvaluatedEachRun() {
            AtomicInteger calls = new AtomicInteger();
            HealthCheck counting = HealthCheck.of("counting", () -> HealthStatus.up("call " + calls.incrementAndGet()));

            assertEquals("counting", counting.getName());
            assertEquals("call 1", counting.check().message());
            assertEquals("call 2", counting.check().message());
        }
    }

    @Nested
    @DisplayName("MemoryHealthCheck")
    class MemoryHealthCheckTests {

        @Test
        @DisplayName("Should return UP or DEGRADED in normal test conditions")
        void realHeap() {
            MemoryHealthCheck check = new MemoryHealthCheck();
            HealthStatus status = check.check();

            assertFalse(status.isDown(), "Expected UP or DEGRADED, got: " + status.status());
            assertEquals("memory", check.getName());
            assertTrue(status.details().containsKey("heapUsagePercent"));
        }

        @Test
        @DisplayName("High usage is DEGRADED, critical usage is DOWN")
        void thresholds() {
            HealthStatus high = new MemoryHealthCheck(() -> new MemoryUsage(0, 85 * MB, 100 * MB, 100 * MB)).check();
            HealthStatus critical = new MemoryHealthCheck(() -> new MemoryUsage(0, 97 * MB, 100 * MB, 100 * MB)).check();

            assertEquals(HealthStatus.Status.DEGRADED, high.status());
            assertTrue(critical.isDown());
            assertEquals(97L, critical.details().get("heapUsedMB"));
        }
    }

    @Nested
    @DisplayName("GraphConnectionHealthCheck")
    class GraphConnectionHealthCheckTests {

        @Test
        @DisplayName("Should return UP when the graph answers")
        void upOnSuccess() {
            GraphConnection connection = mock(GraphConnection.class);
            when(connection.query("RETURN 1")).thenReturn(List.of(Map.of("1", 1)));
            when(connection.getGraphName()).thenReturn("permits");

            HealthStatus status = new GraphConnectionHealthCheck(connection).check();

            assertTrue(status.isUp());
            assertEquals("permits", status.details().get("graphName"));
            assertTrue(status.details().containsKey("latencyMs"));
        }

        @Test
        @DisplayName("Should return DEGRADED when the graph is unreachable")
        void degradedOnFailure() {
            GraphConnection connection = mock(GraphConnection.class);
            when(connection.query(anyString())).thenThrow(new IllegalStateException("Connection refused"));

            GraphConnectionHealthCheck check = new GraphConnectionHealthCheck(connection);
            HealthStatus status = check.check();

            assertEquals(HealthStatus.Status.DEGRADED, status.status());
            assertTrue(status.message().contains("Connection refused"));
            assertEquals("graph-export", check.getName());
        }
    }
}
