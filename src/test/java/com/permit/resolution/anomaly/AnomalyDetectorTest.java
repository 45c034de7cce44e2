package com.permit.resolution.anomaly;

import com.permit.resolution.core.model.EdgeKey;
import com.permit.resolution.core.model.EdgeKind;
import com.permit.resolution.core.model.Entity;
import com.permit.resolution.core.model.InteractionObservation;
import com.permit.resolution.core.model.PermitOutcome;
import com.permit.resolution.core.model.SourceTag;
import com.permit.resolution.store.PermitContribution;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.StringWriter;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AnomalyDetector Tests")
class AnomalyDetectorTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    private final AnomalyDetector detector = new AnomalyDetector();

    private static PermitContribution reviewed(String permitId, String reviewer, String counterpart,
                                               PermitOutcome outcome) {
        return new PermitContribution(permitId, "Mission", outcome,
                new TreeSet<>(List.of(EdgeKey.of(reviewer, counterpart, EdgeKind.INTERACTION))),
                new TreeSet<>(List.of(reviewer)),
                List.of(new InteractionObservation(permitId, reviewer, counterpart, outcome)));
    }

    private static List<PermitContribution> reviewerHistory() {
        List<PermitContribution> permits = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            permits.add(reviewed("PA" + i, "ent-r", "ent-a", PermitOutcome.APPROVED));
        }
        for (int i = 0; i < 14; i++) {
            permits.add(reviewed("PB" + i, "ent-r", "ent-b", i < 4 ? PermitOutcome.APPROVED : PermitOutcome.DENIED));
        }
        return permits;
    }

    private static Entity withPermits(String id, int permits) {
        Entity.Builder builder = Entity.builder()
                .entityId(id)
                .canonicalName(id)
                .normalizedKey(id)
                .blockKey("e|" + id)
                .addSourceTag(SourceTag.BUILDING)
                .addSpelling(id)
                .lastActivityAt(NOW)
                .canonicalSource(SourceTag.BUILDING)
                .canonicalObservedAt(NOW);
        for (int i = 0; i < permits; i++) {
            builder.addPermitId(id + "-P" + i);
        }
        return builder.build();
    }

    @Nested
    @DisplayName("Approval rate")
    class ApprovalRate {

        @Test
        @DisplayName("Pair approving far above the reviewer's baseline is flagged")
        void flagsOutlierPair() {
            List<ApprovalRateAnomaly> findings = detector.approvalRateAnomalies(reviewerHistory());

            assertEquals(1, findings.size());
            ApprovalRateAnomaly anomaly = findings.get(0);
            assertEquals("ent-r", anomaly.reviewerEntityId());
            assertEquals("ent-a", anomaly.counterpartEntityId());
            assertEquals(1.0, anomaly.pairRate(), 1e-9);
            assertEquals(0.5, anomaly.baselineRate(), 1e-9);
            assertEquals(6, anomaly.pairSampleSize());
            assertEquals(20, anomaly.reviewerSampleSize());
            assertEquals(Math.sqrt(6), anomaly.zScore(), 1e-9);
        }

        @Test
        @DisplayName("Pairs below the minimum sample size are not flagged")
        void respectsMinimumSample() {
            AnomalyDetector strict = new AnomalyDetector(AnomalyOptions.builder().minSampleSize(7).build());
            assertTrue(strict.approvalRateAnomalies(reviewerHistory()).isEmpty());
        }

        @Test
        @DisplayName("Pending permits are ignored")
        void pendingIgnored() {
            List<PermitContribution> permits = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                permits.add(reviewed("P" + i, "ent-r", "ent-a", PermitOutcome.PENDING));
            }
            assertTrue(detector.approvalRateAnomalies(permits).isEmpty());
        }

        @Test
        @DisplayName("Reviewer who approves everything is never flagged")
        void fullBaselineNeverFlagged() {
            List<PermitContribution> permits = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                permits.add(reviewed("P" + i, "ent-r", "ent-a", PermitOutcome.APPROVED));
            }
            assertTrue(detector.approvalRateAnomalies(permits).isEmpty());
        }
    }

    @Nested
    @DisplayName("High volume")
    class HighVolume {

        @Test
        @DisplayName("Entity far above the median permit count is flagged")
        void flagsHighVolume() {
            List<Entity> entities = List.of(withPermits("a", 1), withPermits("b", 1), withPermits("c", 2),
                    withPermits("d", 2), withPermits("e", 12));

            List<HighVolumeAnomaly> findings = detector.highVolumeAnomalies(entities);

            assertEquals(1, findings.size());
            assertEquals("e", findings.get(0).entityId());
            assertEquals(2.0, findings.get(0).medianPermitCount(), 1e-9);
        }

        @Test
        @DisplayName("Small absolute counts are not flagged")
        void minimumCount() {
            List<Entity> entities = List.of(withPermits("a", 1), withPermits("b", 1), withPermits("c", 9));
            assertTrue(detector.highVolumeAnomalies(entities).isEmpty());
        }
    }

    @ParameterizedTest(name = "median of {0} is {1}")
    @CsvSource({
            "'1', 1.0",
            "'1 3', 2.0",
            "'1 2 9', 2.0",
            "'1 2 4 10', 3.0"
    })
    @DisplayName("Median of sorted counts")
    void median(String values, double expected) {
        int[] sorted = Arrays.stream(values.split(" ")).mapToInt(Integer::parseInt).toArray();
        assertEquals(expected, AnomalyDetector.median(sorted), 1e-9);
    }

    @Test
    @DisplayName("Report collects both kinds and serializes to JSON")
    void reportToJson() {
        AnomalyReport report = detector.detect("run-1", NOW, reviewerHistory(), List.of(withPermits("a", 1)));

        assertEquals(1, report.size());

        StringWriter out = new StringWriter();
        new AnomalyReportWriter().write(report, out);
        String json = out.toString();
        assertTrue(json.contains("\"runId\" : \"run-1\""));
        assertTrue(json.contains("\"generatedAt\" : \"2024-06-01T00:00:00Z\""));
        assertTrue(json.contains("\"reviewerEntityId\" : \"ent-r\""));
        assertEquals(json, new AnomalyReportWriter().toJson(report));
    }
}
