package com.permit.resolution.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Commit unit for a run's changes. Each applied step registers an undo action;
 * if a step fails, or the transaction closes without {@link #commit()}, the undo
 * actions run newest first and the store returns to its previous snapshot.
 *
 * <pre>
 * try (RunTransaction tx = new RunTransaction(runId)) {
 *     tx.apply("entities", () -> writeEntities(...), () -> restoreEntities(...));
 *     tx.apply("edges", () -> writeEdges(...), () -> restoreEdges(...));
 *     tx.commit();
 * }
 * </pre>
 */
public class RunTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RunTransaction.class);

    private final String runId;
    private final Deque<Step> applied = new ArrayDeque<>();
    private boolean committed;
    private boolean closed;

    public RunTransaction(String runId) {
        this.runId = runId;
    }

    /**
     * Applies one step. On failure every earlier step is undone and the failure rethrown.
     */
    public void apply(String step, Runnable action, Runnable undo) {
        if (closed || committed) {
            throw new IllegalStateException("Transaction for run " + runId + " is no longer open");
        }
        try {
            log.debug("commit.step runId={} step={}", runId, step);
            action.run();
        } catch (RuntimeException e) {
            log.warn("commit.step.failed runId={} step={} error={}", runId, step, e.getMessage());
            // the failed step may have written part of its data
            applied.push(new Step(step, undo));
            rollback();
            throw e;
        }
        applied.push(new Step(step, undo));
    }

    public void commit() {
        committed = true;
        applied.clear();
    }

    public boolean isCommitted() {
        return committed;
    }

    @Override
    public void close() {
        if (!closed && !committed) {
            log.warn("commit.abandoned runId={} steps={}", runId, applied.size());
            rollback();
        }
        closed = true;
    }

    private void rollback() {
        while (!applied.isEmpty()) {
            Step step = applied.pop();
            try {
                step.undo.run();
                log.debug("commit.undo runId={} step={}", runId, step.name);
            } catch (RuntimeException e) {
                log.error("commit.undo.failed runId={} step={} error={}", runId, step.name, e.getMessage(), e);
            }
        }
        closed = true;
    }

    private record Step(String name, Runnable undo) {}
}
