package com.permit.resolution.health;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.util.function.Supplier;

/**
 * Heap utilization check. Full runs hold the working sets of every partition in memory.
 */
public class MemoryHealthCheck implements HealthCheck {

    private static final double DOWN_THRESHOLD = 0.95;
    private static final double DEGRADED_THRESHOLD = 0.80;

    private final Supplier<MemoryUsage> heapUsage;

    public MemoryHealthCheck() {
        this(() -> ManagementFactory.getMemoryMXBean().getHeapMemoryUsage());
    }

    MemoryHealthCheck(Supplier<MemoryUsage> heapUsage) {
        this.heapUsage = heapUsage;
    }

    @Override
    public String getName() {
        return "memory";
    }

    @Override
    public HealthStatus check() {
        MemoryUsage usage = heapUsage.get();
        long usedMB = usage.getUsed() / (1024 * 1024);
        long maxMB = usage.getMax() > 0 ? usage.getMax() / (1024 * 1024) : -1;
        double ratio = maxMB > 0 ? (double) usedMB / maxMB : 0.0;
        String percent = String.format("%.1f%%", ratio * 100);

        HealthStatus base;
        if (ratio >= DOWN_THRESHOLD) {
            base = HealthStatus.down("Heap usage critical: " + percent);
        } else if (ratio >= DEGRADED_THRESHOLD) {
            base = HealthStatus.degraded("Heap usage high: " + percent);
        } else {
            base = HealthStatus.up();
        }
        return base.withDetail("heapUsedMB", usedMB)
                .withDetail("heapMaxMB", maxMB)
                .withDetail("heapUsagePercent", Math.round(ratio * 1000.0) / 10.0);
    }
}
