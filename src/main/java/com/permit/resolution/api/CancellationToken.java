package com.permit.resolution.api;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for a run. Checked between permit batches.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
