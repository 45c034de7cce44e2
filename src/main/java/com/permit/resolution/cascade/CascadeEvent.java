package com.permit.resolution.cascade;

import com.permit.resolution.audit.AuditAction;

import java.util.Map;

/**
 * Entity-level change made by the cascade, audited once the run commits.
 */
public record CascadeEvent(AuditAction action, String entityId, Map<String, Object> details) {

    public CascadeEvent {
        details = Map.copyOf(details);
    }
}
