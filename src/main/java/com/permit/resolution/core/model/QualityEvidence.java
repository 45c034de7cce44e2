package com.permit.resolution.core.model;

/**
 * Raw inputs of an entity's quality score, kept for explainability.
 *
 * @param sourceCount       distinct sources on the entity
 * @param nameConsistency   fraction of mentions spelled exactly like the canonical name
 * @param recencyDays       days between the last activity and the scoring reference instant
 * @param relationshipCount edges of either kind touching the entity
 */
public record QualityEvidence(int sourceCount, double nameConsistency, long recencyDays, int relationshipCount) {

    public QualityEvidence {
        if (nameConsistency < 0.0 || nameConsistency > 1.0) {
            throw new IllegalArgumentException("nameConsistency must be between 0.0 and 1.0");
        }
        if (sourceCount < 0 || relationshipCount < 0) {
            throw new IllegalArgumentException("counts must not be negative");
        }
    }
}
