package com.permit.resolution.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forRun should set runId, runMode and stage in MDC")
    void forRunSetsMDC() {
        try (LogContext ctx = LogContext.forRun("run-1", "full")) {
            assertEquals("run-1", MDC.get("runId"));
            assertEquals("full", MDC.get("runMode"));
            assertEquals("run", MDC.get("stage"));
        }
        assertNull(MDC.get("runId"));
    }

    @Test
    @DisplayName("forPartition should set the partition number")
    void forPartitionSetsMDC() {
        try (LogContext ctx = LogContext.forPartition("run-1", 3)) {
            assertEquals("cascade", MDC.get("stage"));
            assertEquals("3", MDC.get("partition"));
        }
    }

    @Test
    @DisplayName("forPermitBatch should set batch index and size")
    void forPermitBatchSetsMDC() {
        try (LogContext ctx = LogContext.forPermitBatch("run-1", 2, 500)) {
            assertEquals("graph", MDC.get("stage"));
            assertEquals("2", MDC.get("permitBatch"));
            assertEquals("500", MDC.get("permitBatchSize"));
        }
    }

    @Test
    @DisplayName("Nested contexts restore the outer values on close")
    void nestedRestoresOuter() {
        try (LogContext run = LogContext.forRun("run-1", "incremental")) {
            try (LogContext stage = LogContext.forPartition("run-1", 0)) {
                assertEquals("cascade", MDC.get("stage"));
            }
            assertEquals("run", MDC.get("stage"));
            assertNull(MDC.get("partition"));
            assertEquals("incremental", MDC.get("runMode"));
        }
        assertNull(MDC.get("stage"));
    }

    @Test
    @DisplayName("newRunId should produce distinct prefixed ids")
    void newRunId() {
        String a = LogContext.newRunId();
        assertTrue(a.startsWith("run-"));
        assertNotEquals(a, LogContext.newRunId());
    }
}
