package com.permit.resolution.health;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Aggregates registered checks; the overall status is the worst individual status.
 */
public class HealthCheckRegistry {

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        HealthStatus.Status overall = HealthStatus.Status.UP;
        String message = "OK";
        HealthStatus aggregate = HealthStatus.up();
        for (HealthCheck check : checks) {
            HealthStatus result = runSafely(check);
            if (result.status().ordinal() > overall.ordinal()) {
                message = check.getName() + ": " + result.message();
            }
            overall = overall.worst(result.status());
            aggregate = aggregate.withDetail(check.getName(), Map.of(
                    "status", result.status().name(),
                    "message", result.message(),
                    "details", result.details()));
        }
        return new HealthStatus(overall, message, aggregate.details());
    }

    public int size() {
        return checks.size();
    }

    private static HealthStatus runSafely(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            return HealthStatus.down("Check threw " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
