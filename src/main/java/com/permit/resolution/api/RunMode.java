package com.permit.resolution.api;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Scope of a run: every mention, or only mentions observed at or after a timestamp.
 */
public final class RunMode {

    private final boolean full;
    private final Instant since;

    private RunMode(boolean full, Instant since) {
        this.full = full;
        this.since = since;
    }

    /**
     * Re-resolves all mentions, rebuilds every permit's edges and rescores every entity.
     */
    public static RunMode full() {
        return new RunMode(true, null);
    }

    /**
     * Resolves mentions observed at or after {@code since} and rebuilds the permits they
     * touch, plus any permit a cancelled run left behind.
     */
    public static RunMode incremental(Instant since) {
        return new RunMode(false, Objects.requireNonNull(since, "since is required"));
    }

    public boolean isFull() {
        return full;
    }

    public Optional<Instant> getSince() {
        return Optional.ofNullable(since);
    }

    public String label() {
        return full ? "full" : "incremental";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RunMode that = (RunMode) o;
        return full == that.full && Objects.equals(since, that.since);
    }

    @Override
    public int hashCode() {
        return Objects.hash(full, since);
    }

    @Override
    public String toString() {
        return full ? "full" : "incremental(since=" + since + ")";
    }
}
