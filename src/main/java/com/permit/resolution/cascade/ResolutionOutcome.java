package com.permit.resolution.cascade;

/**
 * What the cascade did with one mention.
 */
public enum ResolutionOutcome {
    /** A new entity was seeded from the mention. */
    CREATED,
    /** The mention was attached without touching the canonical identity. */
    ATTACHED,
    /** The mention was attached and replaced the canonical name. */
    REFRESHED,
    /** An earlier run already resolved this mention. */
    ALREADY_ASSIGNED,
    /** The mention was malformed. */
    SKIPPED
}
