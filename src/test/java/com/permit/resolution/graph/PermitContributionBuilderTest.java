package com.permit.resolution.graph;

import com.permit.resolution.core.model.EdgeKey;
import com.permit.resolution.core.model.EdgeKind;
import com.permit.resolution.core.model.InteractionObservation;
import com.permit.resolution.core.model.Mention;
import com.permit.resolution.core.model.Permit;
import com.permit.resolution.core.model.PermitOutcome;
import com.permit.resolution.core.model.RoleTag;
import com.permit.resolution.core.model.SourceTag;
import com.permit.resolution.store.PermitContribution;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import static com.permit.resolution.MentionFixtures.mention;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PermitContributionBuilder Tests")
class PermitContributionBuilderTest {

    private final PermitContributionBuilder builder = new PermitContributionBuilder();
    private final Map<String, String> assignments = new HashMap<>();

    private Mention assigned(String entityId, String name, RoleTag role, String permitId) {
        Mention m = mention(SourceTag.BUILDING, name, role, permitId);
        assignments.put(m.getMentionId(), entityId);
        return m;
    }

    private Function<String, Optional<String>> lookup() {
        return id -> Optional.ofNullable(assignments.get(id));
    }

    @Test
    @DisplayName("Reviewer and applicant produce one interaction and no co-occurrence")
    void reviewerApplicant() {
        List<Mention> mentions = List.of(
                assigned("ent-r", "Ann Lee", RoleTag.REVIEWER, "P2"),
                assigned("ent-a", "Jane Doe", RoleTag.APPLICANT, "P2"));
        Permit permit = new Permit("P2", "Mission", PermitOutcome.APPROVED);

        PermitContribution contribution = builder.build("P2", mentions, Optional.of(permit), lookup());

        assertEquals(Set.of(EdgeKey.of("ent-r", "ent-a", EdgeKind.INTERACTION)), contribution.edgeKeys());
        assertEquals(Set.of("ent-r"), contribution.reviewers());
        assertEquals(List.of(new InteractionObservation("P2", "ent-r", "ent-a", PermitOutcome.APPROVED)),
                contribution.interactions());
        assertEquals("Mission", contribution.neighborhood());
    }

    @Test
    @DisplayName("Every pair of non-reviewer participants co-occurs")
    void coOccurrencePairs() {
        List<Mention> mentions = List.of(
                assigned("ent-a", "Jane Doe", RoleTag.APPLICANT, "P1"),
                assigned("ent-b", "Acme Builders", RoleTag.CONTRACTOR, "P1"),
                assigned("ent-c", "Bay Engineering", RoleTag.ENGINEER, "P1"));

        PermitContribution contribution = builder.build("P1", mentions, Optional.empty(), lookup());

        assertEquals(3, contribution.edgeKeys().size());
        assertTrue(contribution.edgeKeys().stream().allMatch(k -> k.kind() == EdgeKind.CO_OCCURRENCE));
        assertEquals(PermitOutcome.PENDING, contribution.outcome());
    }

    @Test
    @DisplayName("Two mentions of the same entity produce no self edge")
    void noSelfEdges() {
        List<Mention> mentions = List.of(
                assigned("ent-a", "Jane Doe", RoleTag.APPLICANT, "P1"),
                assigned("ent-a", "J. Doe", RoleTag.REVIEWER, "P1"),
                assigned("ent-a", "JANE DOE", RoleTag.CONSULTANT, "P1"));

        PermitContribution contribution = builder.build("P1", mentions, Optional.empty(), lookup());

        assertTrue(contribution.edgeKeys().isEmpty());
        assertTrue(contribution.interactions().isEmpty());
    }

    @Test
    @DisplayName("Unassigned mentions are ignored")
    void unassignedIgnored() {
        List<Mention> mentions = List.of(
                assigned("ent-a", "Jane Doe", RoleTag.APPLICANT, "P1"),
                mention(SourceTag.BUILDING, "Stray Contact", RoleTag.CONTRACTOR, "P1"));

        assertTrue(builder.build("P1", mentions, Optional.empty(), lookup()).edgeKeys().isEmpty());
    }

    @Test
    @DisplayName("Counterpart roles are configurable")
    void customCounterparts() {
        PermitContributionBuilder contractors = new PermitContributionBuilder(EnumSet.of(RoleTag.CONTRACTOR));
        List<Mention> mentions = List.of(
                assigned("ent-r", "Ann Lee", RoleTag.REVIEWER, "P1"),
                assigned("ent-a", "Jane Doe", RoleTag.APPLICANT, "P1"),
                assigned("ent-b", "Acme Builders", RoleTag.CONTRACTOR, "P1"));

        PermitContribution contribution = contractors.build("P1", mentions, Optional.empty(), lookup());

        assertTrue(contribution.edgeKeys().contains(EdgeKey.of("ent-r", "ent-b", EdgeKind.INTERACTION)));
        assertFalse(contribution.edgeKeys().contains(EdgeKey.of("ent-r", "ent-a", EdgeKind.INTERACTION)));
    }

    @Test
    @DisplayName("Reviewer cannot be a counterpart role")
    void reviewerCounterpartRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new PermitContributionBuilder(EnumSet.of(RoleTag.REVIEWER)));
    }
}
