package com.permit.resolution.metrics;

import com.permit.resolution.core.model.SourceTag;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All operations should complete without errors")
        void noErrors() {
            NoOpMetricsService noOp = new NoOpMetricsService();
            assertDoesNotThrow(() -> {
                noOp.recordRunDuration("full", false, Duration.ofSeconds(1));
                noOp.recordRunAborted("full");
                noOp.incrementMentionsProcessed(SourceTag.BUILDING);
                noOp.incrementMentionsSkipped("EMPTY_NAME");
                noOp.incrementEntitiesCreated(SourceTag.PLANNING);
                noOp.incrementEntitiesUpdated(SourceTag.PLANNING);
                noOp.incrementAmbiguousMatches();
                noOp.recordPartitionSize(10);
                noOp.recordEdgesWritten(3);
                noOp.recordAnomaliesFlagged(1);
                noOp.recordLookupCacheHit();
                noOp.recordLookupCacheMiss();
                noOp.incrementExportFailures();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private SimpleMeterRegistry registry;
        private MicrometerMetricsService metrics;

        @BeforeEach
        void setUp() {
            registry = new SimpleMeterRegistry();
            metrics = new MicrometerMetricsService(registry);
        }

        @Test
        @DisplayName("Mention counters are tagged by source")
        void mentionsBySource() {
            metrics.incrementMentionsProcessed(SourceTag.BUILDING);
            metrics.incrementMentionsProcessed(SourceTag.BUILDING);
            metrics.incrementMentionsProcessed(SourceTag.STREET_USE);

            assertEquals(2.0, registry.find("permit.resolution.mentions.processed")
                    .tag("source", "Building").counter().count());
            assertEquals(1.0, registry.find("permit.resolution.mentions.processed")
                    .tag("source", "StreetUse").counter().count());
        }

        @Test
        @DisplayName("Skips are tagged by reason")
        void skipsByReason() {
            metrics.incrementMentionsSkipped("MISSING_PERMIT_ID");

            assertEquals(1.0, registry.find("permit.resolution.mentions.skipped")
                    .tag("reason", "MISSING_PERMIT_ID").counter().count());
        }

        @Test
        @DisplayName("Run timer is tagged by mode and cancellation")
        void runTimer() {
            metrics.recordRunDuration("incremental", true, Duration.ofMillis(250));

            var timer = registry.find("permit.resolution.run.duration")
                    .tag("mode", "incremental").tag("cancelled", "true").timer();
            assertNotNull(timer);
            assertEquals(1, timer.count());
        }

        @Test
        @DisplayName("Edges, anomalies and cache lookups are counted")
        void counters() {
            metrics.recordEdgesWritten(7);
            metrics.recordAnomaliesFlagged(2);
            metrics.recordLookupCacheHit();
            metrics.recordLookupCacheMiss();
            metrics.recordLookupCacheMiss();

            assertEquals(7.0, registry.find("permit.resolution.edges.written").counter().count());
            assertEquals(2.0, registry.find("permit.resolution.anomalies.flagged").counter().count());
            assertEquals(1.0, registry.find("permit.resolution.lookup.cache").tag("result", "hit").counter().count());
            assertEquals(2.0, registry.find("permit.resolution.lookup.cache").tag("result", "miss").counter().count());
        }

        @Test
        @DisplayName("Partition sizes feed a distribution summary")
        void partitionSizes() {
            metrics.recordPartitionSize(4);
            metrics.recordPartitionSize(6);

            var summary = registry.find("permit.resolution.partition.size").summary();
            assertEquals(2, summary.count());
            assertEquals(10.0, summary.totalAmount());
        }
    }
}
