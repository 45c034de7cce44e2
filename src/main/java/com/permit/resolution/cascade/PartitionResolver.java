package com.permit.resolution.cascade;

import com.permit.resolution.audit.AuditAction;
import com.permit.resolution.core.model.ContactIdentifier;
import com.permit.resolution.core.model.Entity;
import com.permit.resolution.core.model.Mention;
import com.permit.resolution.core.model.SourceTag;
import com.permit.resolution.rules.NameKey;
import com.permit.resolution.rules.NameMatcher;
import com.permit.resolution.store.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Resolves the mentions of one partition, one at a time, against its working set.
 *
 * <p>Candidate search order for a mention with source {@code s}:</p>
 * <ol>
 *   <li>entities sharing one of the mention's identifiers, tried in identifier priority order</li>
 *   <li>entities with the same normalized key whose best source ranks at least {@code s}</li>
 *   <li>entities with the same normalized key, any source</li>
 *   <li>a single initial-compatible entity in the same block</li>
 *   <li>otherwise a new entity seeded from the mention</li>
 * </ol>
 * Several candidates are broken by best source, then latest activity, then id.
 * An entity whose identifier of some kind differs from the mention's identifier of
 * that kind is never a candidate.
 */
class PartitionResolver {
    private static final Logger log = LoggerFactory.getLogger(PartitionResolver.class);

    static final Comparator<Entity> CANDIDATE_ORDER =
            Comparator.comparing(Entity::getBestSource, SourceTag.BY_PRIORITY)
                    .thenComparing(Entity::getLastActivityAt, Comparator.reverseOrder())
                    .thenComparing(Entity::getEntityId);

    private final int partition;
    private final PartitionWorkingSet workingSet;

    private final Map<String, SourceTag> createdIds = new LinkedHashMap<>();
    private final Map<ResolutionOutcome, Integer> outcomes = new EnumMap<>(ResolutionOutcome.class);
    private final Map<SkipReason, Integer> skipped = new EnumMap<>(SkipReason.class);
    private final List<CascadeEvent> events = new ArrayList<>();
    private final Set<String> touchedPermits = new TreeSet<>();
    private final Set<String> touchedKeys = new TreeSet<>();
    private int ambiguous;

    PartitionResolver(int partition, PartitionWorkingSet workingSet) {
        this.partition = partition;
        this.workingSet = workingSet;
    }

    PartitionResult resolve(List<NormalizedMention> mentions) {
        List<NormalizedMention> ordered = new ArrayList<>(mentions);
        ordered.sort(NormalizedMention.PROCESSING_ORDER);

        for (NormalizedMention mention : ordered) {
            try {
                ResolutionOutcome outcome = resolveOne(mention);
                outcomes.merge(outcome, 1, Integer::sum);
            } catch (StorageUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("cascade.mention.failed mentionId={} error={}", mention.mention().getMentionId(), e.getMessage());
                skipped.merge(SkipReason.INVALID_RECORD, 1, Integer::sum);
                outcomes.merge(ResolutionOutcome.SKIPPED, 1, Integer::sum);
            }
        }

        Set<String> updatedIds = new TreeSet<>();
        for (String entityId : workingSet.changedEntities().keySet()) {
            if (!createdIds.containsKey(entityId)) {
                updatedIds.add(entityId);
            }
        }
        log.debug("cascade.partition.resolved partition={} mentions={} created={} updated={} ambiguous={}",
                partition, ordered.size(), createdIds.size(), updatedIds.size(), ambiguous);
        return new PartitionResult(partition, workingSet.changedEntities(), workingSet.assignments(), createdIds,
                updatedIds, outcomes, skipped, ambiguous, events, touchedPermits, touchedKeys);
    }

    ResolutionOutcome resolveOne(NormalizedMention incoming) {
        Mention mention = incoming.mention();
        if (workingSet.isAssigned(mention.getMentionId())) {
            return ResolutionOutcome.ALREADY_ASSIGNED;
        }

        Collection<Entity> block = workingSet.block(incoming.key().blockKey());
        Entity target = findCandidate(incoming, block);
        ResolutionOutcome outcome;
        Entity resolved;
        if (target == null) {
            resolved = create(incoming);
            outcome = ResolutionOutcome.CREATED;
        } else {
            AttachResult attached = attach(target, incoming);
            resolved = attached.entity();
            outcome = attached.outcome();
            touchedKeys.add(target.getNormalizedKey());
        }

        workingSet.put(resolved);
        workingSet.assign(mention.getMentionId(), resolved.getEntityId());
        touchedPermits.add(mention.getPermitId());
        touchedKeys.add(resolved.getNormalizedKey());
        log.trace("cascade.mention.resolved mentionId={} entityId={} outcome={}",
                mention.getMentionId(), resolved.getEntityId(), outcome);
        return outcome;
    }

    private Entity findCandidate(NormalizedMention incoming, Collection<Entity> block) {
        Set<ContactIdentifier> identifiers = incoming.mention().getIdentifiers();
        for (ContactIdentifier identifier : identifiers) {
            List<Entity> owners = workingSet.byIdentifier(identifier).stream()
                    .filter(e -> !e.conflictsWith(identifiers))
                    .collect(Collectors.toList());
            if (owners.size() > 1) {
                ambiguous++;
                log.debug("cascade.match.ambiguous mentionId={} identifier={} candidates={}",
                        incoming.mention().getMentionId(), identifier, owners.size());
            }
            if (!owners.isEmpty()) {
                return owners.stream().min(CANDIDATE_ORDER).orElseThrow();
            }
        }

        SourceTag source = incoming.mention().getSource();
        List<Entity> exact = block.stream()
                .filter(e -> !e.conflictsWith(identifiers))
                .filter(e -> e.getNormalizedKey().equals(incoming.key().normalized()))
                .collect(Collectors.toList());

        if (!exact.isEmpty()) {
            List<Entity> pool = exact.stream()
                    .filter(e -> e.getBestSource().atLeast(source))
                    .collect(Collectors.toList());
            if (pool.isEmpty()) {
                pool = exact;
            }
            if (pool.size() > 1) {
                ambiguous++;
                log.debug("cascade.match.ambiguous mentionId={} key='{}' candidates={}",
                        incoming.mention().getMentionId(), incoming.key().normalized(), pool.size());
            }
            return pool.stream().min(CANDIDATE_ORDER).orElseThrow();
        }

        List<Entity> compatible = block.stream()
                .filter(e -> !e.conflictsWith(identifiers))
                .filter(e -> NameMatcher.initialsCompatible(incoming.key(), keyOf(e)))
                .collect(Collectors.toList());
        if (compatible.size() == 1) {
            return compatible.get(0);
        }
        if (compatible.size() > 1) {
            ambiguous++;
            log.debug("cascade.match.ambiguous mentionId={} key='{}' initialCandidates={}",
                    incoming.mention().getMentionId(), incoming.key().normalized(), compatible.size());
        }
        return null;
    }

    private Entity create(NormalizedMention incoming) {
        Mention mention = incoming.mention();
        String entityId = EntityIdGenerator.mint(mention.getMentionId(), workingSet::isIdTaken);
        Entity entity = Entity.builder()
                .entityId(entityId)
                .canonicalName(incoming.spelling())
                .canonicalFirm(mention.getFirmName().orElse(null))
                .normalizedKey(incoming.key().normalized())
                .blockKey(incoming.key().blockKey())
                .addSourceTag(mention.getSource())
                .addPermitId(mention.getPermitId())
                .addSpelling(incoming.spelling())
                .identifiers(mention.getIdentifiers())
                .lastActivityAt(mention.getObservedAt())
                .canonicalSource(mention.getSource())
                .canonicalObservedAt(mention.getObservedAt())
                .build();
        createdIds.put(entityId, mention.getSource());
        events.add(new CascadeEvent(AuditAction.ENTITY_CREATED, entityId, Map.of(
                "canonicalName", entity.getCanonicalName(),
                "source", mention.getSource().getLabel(),
                "mentionId", mention.getMentionId())));
        return entity;
    }

    private AttachResult attach(Entity current, NormalizedMention incoming) {
        Mention mention = incoming.mention();
        SourceTag source = mention.getSource();
        String spelling = incoming.spelling();
        Instant lastActivity = mention.getObservedAt().isAfter(current.getLastActivityAt())
                ? mention.getObservedAt()
                : current.getLastActivityAt();

        Entity.Builder builder = current.toBuilder()
                .addSourceTag(source)
                .addPermitId(mention.getPermitId())
                .addSpelling(spelling)
                .addIdentifiers(mention.getIdentifiers())
                .lastActivityAt(lastActivity);

        boolean refresh = source.outranks(current.getBestSource())
                || (source.getRank() == current.getBestSource().getRank() && supersedesSpelling(current, incoming));
        if (refresh) {
            builder.canonicalName(spelling)
                    .normalizedKey(incoming.key().normalized())
                    .blockKey(incoming.key().blockKey())
                    .canonicalSource(source)
                    .canonicalObservedAt(mention.getObservedAt());
            mention.getFirmName().ifPresent(builder::canonicalFirm);
            events.add(new CascadeEvent(AuditAction.CANONICAL_REFRESHED, current.getEntityId(), Map.of(
                    "previousName", current.getCanonicalName(),
                    "canonicalName", spelling,
                    "source", source.getLabel())));
        }

        Entity updated = builder.build();
        if (!current.getSpellings().containsKey(spelling) && !spelling.equals(updated.getCanonicalName())) {
            events.add(new CascadeEvent(AuditAction.ALIAS_RECORDED, current.getEntityId(), Map.of(
                    "alias", spelling,
                    "source", source.getLabel())));
        }
        return new AttachResult(updated, refresh ? ResolutionOutcome.REFRESHED : ResolutionOutcome.ATTACHED);
    }

    /**
     * Most recent spelling wins between equally ranked sources.
     */
    private static boolean supersedesSpelling(Entity current, NormalizedMention incoming) {
        return !incoming.spelling().equals(current.getCanonicalName())
                && incoming.mention().getObservedAt().isAfter(current.getCanonicalObservedAt());
    }

    private static NameKey keyOf(Entity entity) {
        return new NameKey(entity.getNormalizedKey(), entity.getBlockKey());
    }

    private record AttachResult(Entity entity, ResolutionOutcome outcome) {}
}
