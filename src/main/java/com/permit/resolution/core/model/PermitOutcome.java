package com.permit.resolution.core.model;

/**
 * Final disposition of a permit application.
 */
public enum PermitOutcome {
    APPROVED,
    DENIED,
    WITHDRAWN,
    PENDING;

    /**
     * Returns true for outcomes that count toward an approval rate.
     */
    public boolean isDecided() {
        return this == APPROVED || this == DENIED;
    }
}
