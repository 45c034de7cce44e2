package com.permit.resolution.core.model;

/**
 * Directed reviewer to counterpart pairing observed on one permit.
 * Edge keys are unordered, so the direction is kept here for the anomaly detector.
 */
public record InteractionObservation(String permitId, String reviewerEntityId,
                                     String counterpartEntityId, PermitOutcome outcome) {
}
