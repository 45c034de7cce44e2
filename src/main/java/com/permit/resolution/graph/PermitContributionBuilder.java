package com.permit.resolution.graph;

import com.permit.resolution.core.model.EdgeKey;
import com.permit.resolution.core.model.EdgeKind;
import com.permit.resolution.core.model.InteractionObservation;
import com.permit.resolution.core.model.Mention;
import com.permit.resolution.core.model.Permit;
import com.permit.resolution.core.model.PermitOutcome;
import com.permit.resolution.core.model.RoleTag;
import com.permit.resolution.store.PermitContribution;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Computes what a single permit contributes to the graph from that permit's
 * mentions alone. Work is bounded by the permit's own contacts.
 *
 * <ul>
 *   <li>Co-occurrence: every unordered pair of distinct entities holding a
 *   non-reviewer role on the permit.</li>
 *   <li>Interaction: every reviewer paired with every entity holding one of the
 *   counterpart roles.</li>
 * </ul>
 */
public class PermitContributionBuilder {

    public static final Set<RoleTag> DEFAULT_COUNTERPART_ROLES = EnumSet.of(RoleTag.APPLICANT, RoleTag.CONSULTANT);

    private final Set<RoleTag> counterpartRoles;

    public PermitContributionBuilder() {
        this(DEFAULT_COUNTERPART_ROLES);
    }

    public PermitContributionBuilder(Set<RoleTag> counterpartRoles) {
        if (counterpartRoles.contains(RoleTag.REVIEWER)) {
            throw new IllegalArgumentException("REVIEWER cannot be its own counterpart role");
        }
        this.counterpartRoles = EnumSet.copyOf(counterpartRoles);
    }

    /**
     * @param permitId   the permit
     * @param mentions   every mention on the permit
     * @param permit     permit attributes, if known
     * @param assignment mention id to entity id; unassigned mentions are ignored
     */
    public PermitContribution build(String permitId, List<Mention> mentions, Optional<Permit> permit,
                                    Function<String, Optional<String>> assignment) {
        SortedSet<String> participants = new TreeSet<>();
        SortedSet<String> reviewers = new TreeSet<>();
        SortedSet<String> counterparts = new TreeSet<>();

        for (Mention mention : mentions) {
            Optional<String> entityId = assignment.apply(mention.getMentionId());
            if (entityId.isEmpty()) {
                continue;
            }
            RoleTag role = mention.getRole();
            if (role == RoleTag.REVIEWER) {
                reviewers.add(entityId.get());
            } else {
                participants.add(entityId.get());
                if (counterpartRoles.contains(role)) {
                    counterparts.add(entityId.get());
                }
            }
        }

        PermitOutcome outcome = permit.map(Permit::outcome).orElse(PermitOutcome.PENDING);
        SortedSet<EdgeKey> keys = new TreeSet<>();
        List<String> ordered = new ArrayList<>(participants);
        for (int i = 0; i < ordered.size(); i++) {
            for (int j = i + 1; j < ordered.size(); j++) {
                keys.add(new EdgeKey(ordered.get(i), ordered.get(j), EdgeKind.CO_OCCURRENCE));
            }
        }

        List<InteractionObservation> interactions = new ArrayList<>();
        for (String reviewer : reviewers) {
            for (String counterpart : counterparts) {
                if (!reviewer.equals(counterpart)) {
                    keys.add(EdgeKey.of(reviewer, counterpart, EdgeKind.INTERACTION));
                    interactions.add(new InteractionObservation(permitId, reviewer, counterpart, outcome));
                }
            }
        }

        String neighborhood = permit.flatMap(Permit::neighborhoodOption).orElse(null);
        return new PermitContribution(permitId, neighborhood, outcome, keys, reviewers, interactions);
    }
}
