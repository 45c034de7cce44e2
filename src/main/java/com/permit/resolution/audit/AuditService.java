package com.permit.resolution.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Records entity and run events for later inspection.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditRepository repository;
    private final Clock clock;

    public AuditService() {
        this(new InMemoryAuditRepository());
    }

    public AuditService(AuditRepository repository) {
        this(repository, Clock.systemUTC());
    }

    public AuditService(AuditRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public AuditEntry record(AuditAction action, String runId, String entityId, Map<String, Object> details) {
        AuditEntry entry = AuditEntry.builder()
                .action(action)
                .runId(runId)
                .entityId(entityId)
                .details(details)
                .timestamp(clock.instant())
                .build();
        repository.save(entry);
        log.debug("audit.recorded action={} runId={} entityId={}", action, runId, entityId);
        return entry;
    }

    public AuditEntry recordRun(AuditAction action, String runId, Map<String, Object> details) {
        return record(action, runId, null, details);
    }

    public List<AuditEntry> getEntriesForEntity(String entityId) {
        return repository.findByEntityId(entityId);
    }

    public List<AuditEntry> getEntriesForRun(String runId) {
        return repository.findByRunId(runId);
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    public int size() {
        return repository.count();
    }
}
