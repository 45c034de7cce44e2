package com.permit.resolution.store;

import com.permit.resolution.core.model.Permit;

import java.util.Optional;

/**
 * Read-only permit attributes supplied by the ingestion collaborator.
 */
public interface PermitStore {

    Optional<Permit> findById(String permitId);

    /**
     * A store that knows no permits: every permit has no neighborhood and is pending.
     */
    PermitStore EMPTY = permitId -> Optional.empty();
}
