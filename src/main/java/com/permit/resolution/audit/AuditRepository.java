package com.permit.resolution.audit;

import java.util.List;

/**
 * Append-only audit storage.
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    List<AuditEntry> findAll();

    List<AuditEntry> findByEntityId(String entityId);

    List<AuditEntry> findByRunId(String runId);

    List<AuditEntry> findByAction(AuditAction action);

    int count();
}
