package com.permit.resolution.store;

import com.permit.resolution.core.model.EdgeKey;
import com.permit.resolution.core.model.InteractionObservation;
import com.permit.resolution.core.model.PermitOutcome;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Everything one permit contributes to the relationship graph. Replacing a permit's
 * contribution and re-aggregating the affected edges is how edges are rebuilt.
 *
 * @param permitId     the permit
 * @param neighborhood the permit's neighborhood, or null when unknown
 * @param outcome      the permit's outcome
 * @param edgeKeys     edges of both kinds this permit supports
 * @param reviewers    entities that reviewed this permit
 * @param interactions directed reviewer to counterpart pairings on this permit
 */
public record PermitContribution(String permitId, String neighborhood, PermitOutcome outcome,
                                 SortedSet<EdgeKey> edgeKeys, SortedSet<String> reviewers,
                                 List<InteractionObservation> interactions) {

    public PermitContribution {
        Objects.requireNonNull(permitId, "permitId is required");
        outcome = outcome != null ? outcome : PermitOutcome.PENDING;
        edgeKeys = Collections.unmodifiableSortedSet(new TreeSet<>(edgeKeys));
        reviewers = Collections.unmodifiableSortedSet(new TreeSet<>(reviewers));
        interactions = List.copyOf(interactions);
    }

    public Optional<String> neighborhoodOption() {
        return Optional.ofNullable(neighborhood).filter(n -> !n.isBlank());
    }
}
