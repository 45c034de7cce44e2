package com.permit.resolution.store;

import com.permit.resolution.core.model.Permit;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory permit table.
 */
public class InMemoryPermitStore implements PermitStore {

    private final Map<String, Permit> permits = new ConcurrentHashMap<>();

    public void put(Permit permit) {
        permits.put(permit.permitId(), permit);
    }

    public void putAll(Collection<Permit> batch) {
        batch.forEach(this::put);
    }

    @Override
    public Optional<Permit> findById(String permitId) {
        return Optional.ofNullable(permits.get(permitId));
    }

    public int size() {
        return permits.size();
    }
}
