package com.permit.resolution.anomaly;

import com.permit.resolution.core.model.Entity;
import com.permit.resolution.core.model.InteractionObservation;
import com.permit.resolution.core.model.PermitOutcome;
import com.permit.resolution.store.PermitContribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Scans committed permit contributions for suspicious reviewer patterns.
 *
 * <p>Only decided permits (approved or denied) count. For each reviewer the baseline
 * approval rate {@code p} is taken over every permit they reviewed; a
 * (reviewer, counterpart) pair with {@code n} shared decided permits is flagged when
 * its approval rate exceeds {@code p + k * sqrt(p * (1 - p) / n)}.</p>
 */
public class AnomalyDetector {
    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    private static final Comparator<ApprovalRateAnomaly> BY_SEVERITY =
            Comparator.comparingDouble(ApprovalRateAnomaly::zScore).reversed()
                    .thenComparing(ApprovalRateAnomaly::reviewerEntityId)
                    .thenComparing(ApprovalRateAnomaly::counterpartEntityId);

    private final AnomalyOptions options;

    public AnomalyDetector() {
        this(AnomalyOptions.defaults());
    }

    public AnomalyDetector(AnomalyOptions options) {
        this.options = options;
    }

    public AnomalyReport detect(String runId, Instant generatedAt,
                                Collection<PermitContribution> contributions, Collection<Entity> entities) {
        List<ApprovalRateAnomaly> approval = approvalRateAnomalies(contributions);
        List<HighVolumeAnomaly> volume = highVolumeAnomalies(entities);
        log.info("anomaly.scanned runId={} permits={} approvalOutliers={} highVolume={}",
                runId, contributions.size(), approval.size(), volume.size());
        return new AnomalyReport(runId, generatedAt, approval, volume);
    }

    List<ApprovalRateAnomaly> approvalRateAnomalies(Collection<PermitContribution> contributions) {
        Map<String, Tally> baselines = new TreeMap<>();
        Map<String, Map<String, Set<String>>> pairPermits = new TreeMap<>();
        Map<String, PermitOutcome> outcomes = new HashMap<>();

        for (PermitContribution contribution : contributions) {
            if (!contribution.outcome().isDecided()) {
                continue;
            }
            outcomes.put(contribution.permitId(), contribution.outcome());
            for (String reviewer : contribution.reviewers()) {
                baselines.computeIfAbsent(reviewer, r -> new Tally()).add(contribution.outcome());
            }
            for (InteractionObservation observation : contribution.interactions()) {
                pairPermits.computeIfAbsent(observation.reviewerEntityId(), r -> new TreeMap<>())
                        .computeIfAbsent(observation.counterpartEntityId(), c -> new TreeSet<>())
                        .add(observation.permitId());
            }
        }

        List<ApprovalRateAnomaly> findings = new ArrayList<>();
        pairPermits.forEach((reviewer, counterparts) -> {
            Tally baseline = baselines.get(reviewer);
            if (baseline == null || baseline.decided == 0) {
                return;
            }
            double p = baseline.rate();
            counterparts.forEach((counterpart, permitIds) -> {
                Tally pair = new Tally();
                permitIds.forEach(id -> pair.add(outcomes.get(id)));
                if (pair.decided < options.getMinSampleSize()) {
                    return;
                }
                double rate = pair.rate();
                double deviation = Math.sqrt(p * (1.0 - p) / pair.decided);
                boolean flagged;
                double z;
                if (deviation == 0.0) {
                    // Nothing can beat a baseline of 1; any approval beats a baseline of 0.
                    flagged = p == 0.0 && rate > 0.0;
                    z = Double.POSITIVE_INFINITY;
                } else {
                    z = (rate - p) / deviation;
                    flagged = rate > p + options.getSigmaThreshold() * deviation;
                }
                if (flagged) {
                    findings.add(new ApprovalRateAnomaly(reviewer, counterpart, rate, p, deviation, z,
                            pair.decided, baseline.decided));
                    log.debug("anomaly.approval reviewer={} counterpart={} rate={} baseline={} n={}",
                            reviewer, counterpart, rate, p, pair.decided);
                }
            });
        });
        findings.sort(BY_SEVERITY);
        return findings;
    }

    List<HighVolumeAnomaly> highVolumeAnomalies(Collection<Entity> entities) {
        if (entities.isEmpty()) {
            return List.of();
        }
        double median = median(entities.stream().mapToInt(Entity::getPermitCount).sorted().toArray());
        List<HighVolumeAnomaly> findings = new ArrayList<>();
        for (Entity entity : entities) {
            int count = entity.getPermitCount();
            if (count >= options.getHighVolumeMinPermits() && count > options.getHighVolumeMultiplier() * median) {
                findings.add(new HighVolumeAnomaly(entity.getEntityId(), entity.getCanonicalName(), count, median));
            }
        }
        findings.sort(Comparator.comparingInt(HighVolumeAnomaly::permitCount).reversed()
                .thenComparing(HighVolumeAnomaly::entityId));
        return findings;
    }

    static double median(int[] sorted) {
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[mid];
        }
        return (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    private static final class Tally {
        private int decided;
        private int approved;

        void add(PermitOutcome outcome) {
            if (outcome == null || !outcome.isDecided()) {
                return;
            }
            decided++;
            if (outcome == PermitOutcome.APPROVED) {
                approved++;
            }
        }

        double rate() {
            return decided == 0 ? 0.0 : (double) approved / decided;
        }
    }
}
