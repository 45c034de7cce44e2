package com.permit.resolution.audit;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * Default audit repository, thread-safe via {@link CopyOnWriteArrayList}.
 */
public class InMemoryAuditRepository implements AuditRepository {

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public AuditEntry save(AuditEntry entry) {
        entries.add(entry);
        return entry;
    }

    @Override
    public List<AuditEntry> findAll() {
        return List.copyOf(entries);
    }

    @Override
    public List<AuditEntry> findByEntityId(String entityId) {
        return filter(e -> entityId.equals(e.entityId()));
    }

    @Override
    public List<AuditEntry> findByRunId(String runId) {
        return filter(e -> runId.equals(e.runId()));
    }

    @Override
    public List<AuditEntry> findByAction(AuditAction action) {
        return filter(e -> e.action() == action);
    }

    @Override
    public int count() {
        return entries.size();
    }

    private List<AuditEntry> filter(Predicate<AuditEntry> predicate) {
        return entries.stream().filter(predicate).toList();
    }
}
