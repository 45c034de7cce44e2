package com.permit.resolution.cache;

import java.util.Set;

/**
 * Notified after a run's changes are published.
 */
public interface CommitListener {

    /**
     * @param runId          the committed run
     * @param entityIds      entities created or updated by the run
     * @param normalizedKeys name keys whose lookup result may have changed
     */
    void onCommit(String runId, Set<String> entityIds, Set<String> normalizedKeys);
}
