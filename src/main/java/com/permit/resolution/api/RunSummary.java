package com.permit.resolution.api;

import com.permit.resolution.cascade.SkipReason;

import java.time.Duration;
import java.util.Map;

/**
 * Outcome of one run. Per-record problems show up only as counts here.
 *
 * @param mentionsProcessed mentions read by the run, skipped ones included
 * @param mentionsSkipped   malformed mentions, broken down in {@code skipReasons}
 * @param entitiesCreated   entities created by this run
 * @param entitiesUpdated   previously committed entities that gained mentions
 * @param edgesWritten      edge rows inserted or replaced
 * @param anomaliesFlagged  findings in the run's anomaly report
 * @param ambiguousMatches  mentions with more than one equally good candidate
 * @param permitsRebuilt    permits whose edge contribution was recomputed
 * @param permitsDeferred   permits left for the next run
 * @param cancelled         whether the run stopped early
 */
public record RunSummary(String runId,
                         RunMode mode,
                         long mentionsProcessed,
                         long mentionsSkipped,
                         Map<SkipReason, Integer> skipReasons,
                         long entitiesCreated,
                         long entitiesUpdated,
                         long edgesWritten,
                         long anomaliesFlagged,
                         long ambiguousMatches,
                         long permitsRebuilt,
                         long permitsDeferred,
                         boolean cancelled,
                         Duration elapsed) {

    public RunSummary {
        skipReasons = Map.copyOf(skipReasons);
    }

    @Override
    public String toString() {
        return "RunSummary{runId=" + runId +
                ", mode=" + mode +
                ", processed=" + mentionsProcessed +
                ", skipped=" + mentionsSkipped +
                ", created=" + entitiesCreated +
                ", updated=" + entitiesUpdated +
                ", edgesWritten=" + edgesWritten +
                ", anomalies=" + anomaliesFlagged +
                ", cancelled=" + cancelled +
                ", elapsed=" + elapsed.toMillis() + "ms}";
    }
}
