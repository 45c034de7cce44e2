package com.permit.resolution.audit;

/**
 * Auditable pipeline events.
 */
public enum AuditAction {
    ENTITY_CREATED,
    CANONICAL_REFRESHED,
    ALIAS_RECORDED,
    RUN_COMPLETED,
    RUN_CANCELLED,
    RUN_ABORTED
}
