package com.permit.resolution.anomaly;

/**
 * An entity with far more permits than is typical.
 */
public record HighVolumeAnomaly(String entityId, String canonicalName, int permitCount, double medianPermitCount) {
}
