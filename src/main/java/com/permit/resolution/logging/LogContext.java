package com.permit.resolution.logging;

import org.slf4j.MDC;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.UUID;

/**
 * Scoped SLF4J MDC entries for a run and its stages. Closing the context removes
 * exactly the keys it added, and restores any value a key had before.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRun(runId, "full")) {
 *     log.info("run.started runId={}", runId);
 * }
 * </pre>
 */
public final class LogContext implements AutoCloseable {

    private final Deque<PriorValue> added = new ArrayDeque<>();

    private LogContext() {
    }

    public static LogContext forRun(String runId, String mode) {
        return new LogContext()
                .with("runId", runId)
                .with("runMode", mode)
                .with("stage", "run");
    }

    /**
     * Context for one cascade partition. Partition workers run on pool threads,
     * so the run id is copied onto them here.
     */
    public static LogContext forPartition(String runId, int partition) {
        return new LogContext()
                .with("runId", runId)
                .with("stage", "cascade")
                .with("partition", Integer.toString(partition));
    }

    public static LogContext forPermitBatch(String runId, int batchIndex, int batchSize) {
        return new LogContext()
                .with("runId", runId)
                .with("stage", "graph")
                .with("permitBatch", Integer.toString(batchIndex))
                .with("permitBatchSize", Integer.toString(batchSize));
    }

    public static String newRunId() {
        return "run-" + UUID.randomUUID();
    }

    public LogContext with(String key, String value) {
        added.push(new PriorValue(key, MDC.get(key)));
        MDC.put(key, value);
        return this;
    }

    @Override
    public void close() {
        while (!added.isEmpty()) {
            PriorValue prior = added.pop();
            if (prior.value == null) {
                MDC.remove(prior.key);
            } else {
                MDC.put(prior.key, prior.value);
            }
        }
    }

    private record PriorValue(String key, String value) {}
}
