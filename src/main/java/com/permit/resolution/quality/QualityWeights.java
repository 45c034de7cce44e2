package com.permit.resolution.quality;

/**
 * Weights of the quality sub-scores. Fixed so that scores are reproducible across runs.
 */
public record QualityWeights(
        double sourceWeight,
        double consistencyWeight,
        double recencyWeight,
        double relationshipWeight
) {
    public static final QualityWeights STANDARD = new QualityWeights(0.30, 0.30, 0.20, 0.20);

    public QualityWeights {
        if (sourceWeight < 0 || consistencyWeight < 0 || recencyWeight < 0 || relationshipWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = sourceWeight + consistencyWeight + recencyWeight + relationshipWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }
}
