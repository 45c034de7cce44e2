package com.permit.resolution.quality;

import com.permit.resolution.core.model.Entity;
import com.permit.resolution.core.model.QualityEvidence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Computes an entity's 0-100 confidence score from its current evidence.
 *
 * <p>Formula:</p>
 * <pre>
 * score = round(100 * (0.30 * min(1, sources / 3)
 *                    + 0.30 * canonicalSpellingMentions / mentions
 *                    + 0.20 * recency
 *                    + 0.20 * min(1, edges / 10)))
 * </pre>
 *
 * <p>Recency is 1 up to one year before the reference instant and decays linearly
 * to 0 at five years. The score is a pure function of the evidence; prior scores
 * never feed back into it.</p>
 */
public class QualityScorer {
    private static final Logger log = LoggerFactory.getLogger(QualityScorer.class);

    static final int FULL_SOURCE_COUNT = 3;
    static final int FULL_RELATIONSHIP_COUNT = 10;
    static final long FRESH_DAYS = 365;
    static final long STALE_DAYS = 5 * 365;

    private final QualityWeights weights;

    public QualityScorer() {
        this(QualityWeights.STANDARD);
    }

    QualityScorer(QualityWeights weights) {
        this.weights = weights;
    }

    /**
     * Collects the raw score inputs of an entity.
     *
     * @param asOf              reference instant for recency
     * @param relationshipCount edges of either kind touching the entity
     */
    public QualityEvidence evidence(Entity entity, Instant asOf, int relationshipCount) {
        int mentions = entity.getMentionCount();
        int canonical = entity.getSpellings().getOrDefault(entity.getCanonicalName(), 0);
        double consistency = mentions == 0 ? 0.0 : (double) canonical / mentions;
        long days = Math.max(0, Duration.between(entity.getLastActivityAt(), asOf).toDays());
        return new QualityEvidence(entity.getSourceTags().size(), consistency, days, relationshipCount);
    }

    public int score(QualityEvidence evidence) {
        double sources = Math.min(1.0, (double) evidence.sourceCount() / FULL_SOURCE_COUNT);
        double relationships = Math.min(1.0, (double) evidence.relationshipCount() / FULL_RELATIONSHIP_COUNT);
        double recency = recency(evidence.recencyDays());

        double weighted = weights.sourceWeight() * sources
                + weights.consistencyWeight() * evidence.nameConsistency()
                + weights.recencyWeight() * recency
                + weights.relationshipWeight() * relationships;
        int score = (int) Math.round(100.0 * weighted);

        log.trace("quality.scored sources={} consistency={} recency={} relationships={} score={}",
                sources, evidence.nameConsistency(), recency, relationships, score);
        return Math.max(0, Math.min(100, score));
    }

    /**
     * Returns a copy of the entity carrying its recomputed score and evidence.
     */
    public Entity rescore(Entity entity, Instant asOf, int relationshipCount) {
        QualityEvidence evidence = evidence(entity, asOf, relationshipCount);
        return entity.toBuilder()
                .qualityScore(score(evidence))
                .qualityEvidence(evidence)
                .build();
    }

    static double recency(long days) {
        if (days <= FRESH_DAYS) {
            return 1.0;
        }
        if (days >= STALE_DAYS) {
            return 0.0;
        }
        return (double) (STALE_DAYS - days) / (STALE_DAYS - FRESH_DAYS);
    }
}
