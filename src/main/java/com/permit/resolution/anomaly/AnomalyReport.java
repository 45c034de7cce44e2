package com.permit.resolution.anomaly;

import java.time.Instant;
import java.util.List;

/**
 * Advisory findings of one scan. Never drives any change to entities or edges.
 */
public record AnomalyReport(String runId,
                            Instant generatedAt,
                            List<ApprovalRateAnomaly> approvalRateAnomalies,
                            List<HighVolumeAnomaly> highVolumeAnomalies) {

    public AnomalyReport {
        approvalRateAnomalies = List.copyOf(approvalRateAnomalies);
        highVolumeAnomalies = List.copyOf(highVolumeAnomalies);
    }

    public static AnomalyReport empty() {
        return new AnomalyReport(null, null, List.of(), List.of());
    }

    public int size() {
        return approvalRateAnomalies.size() + highVolumeAnomalies.size();
    }
}
