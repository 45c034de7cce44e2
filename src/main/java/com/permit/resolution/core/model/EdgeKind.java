package com.permit.resolution.core.model;

/**
 * Kinds of relationship edges. The same pair of entities may carry one edge of each kind.
 */
public enum EdgeKind {
    /** Both entities appear on a shared permit. */
    CO_OCCURRENCE,
    /** A reviewer and an applicant or consultant meet on a shared permit. */
    INTERACTION
}
