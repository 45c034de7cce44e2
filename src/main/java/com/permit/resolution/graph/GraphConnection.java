package com.permit.resolution.graph;

import java.util.List;
import java.util.Map;

/**
 * Connection to the graph database that downstream graph views read from.
 */
public interface GraphConnection extends AutoCloseable {

    void execute(String query, Map<String, Object> params);

    default void execute(String query) {
        execute(query, Map.of());
    }

    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    boolean isConnected();

    String getGraphName();

    /**
     * Creates the indexes the exporter's MERGE statements rely on. Idempotent.
     */
    void createIndexes();

    @Override
    void close();
}
