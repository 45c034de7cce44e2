package com.permit.resolution.health;

import com.permit.resolution.graph.GraphConnection;

/**
 * Round-trip check against the export graph database. An unreachable graph
 * reports DEGRADED rather than DOWN.
 */
public class GraphConnectionHealthCheck implements HealthCheck {

    private final GraphConnection connection;

    public GraphConnectionHealthCheck(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public String getName() {
        return "graph-export";
    }

    @Override
    public HealthStatus check() {
        long start = System.nanoTime();
        try {
            connection.query("RETURN 1");
        } catch (RuntimeException e) {
            return HealthStatus.degraded("Graph database unreachable: " + e.getMessage())
                    .withDetail("graphName", connection.getGraphName())
                    .withDetail("error", e.getClass().getSimpleName());
        }
        long latencyMs = (System.nanoTime() - start) / 1_000_000;
        return HealthStatus.up()
                .withDetail("graphName", connection.getGraphName())
                .withDetail("latencyMs", latencyMs);
    }
}
