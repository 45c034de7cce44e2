package com.permit.resolution.core.model;

/**
 * Upstream identifiers a contact may carry, in matching priority order.
 */
public enum IdentifierKind {
    /** Permit tracking system agent id; building contacts only. */
    AGENT_ID,
    /** State contractor or professional license number. */
    LICENSE_NUMBER,
    /** City business registration number. */
    BUSINESS_LICENSE
}
