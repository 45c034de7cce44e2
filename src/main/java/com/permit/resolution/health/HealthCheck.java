package com.permit.resolution.health;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A single component check, registered with a {@link HealthCheckRegistry} under its name.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();

    /**
     * Check backed by a supplier, for components without their own check class.
     */
    static HealthCheck of(String name, Supplier<HealthStatus> status) {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(status, "status is required");
        return new HealthCheck() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public HealthStatus check() {
                return status.get();
            }
        };
    }
}
