package com.permit.resolution.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only permit attributes consumed by the graph builder and the anomaly detector.
 */
public record Permit(String permitId, String neighborhood, PermitOutcome outcome, Instant filedAt, Instant decidedAt) {

    public Permit {
        Objects.requireNonNull(permitId, "permitId is required");
        outcome = outcome != null ? outcome : PermitOutcome.PENDING;
    }

    public Permit(String permitId, String neighborhood, PermitOutcome outcome) {
        this(permitId, neighborhood, outcome, null, null);
    }

    public Optional<String> neighborhoodOption() {
        return neighborhood == null || neighborhood.isBlank() ? Optional.empty() : Optional.of(neighborhood);
    }
}
