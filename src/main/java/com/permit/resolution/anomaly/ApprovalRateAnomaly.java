package com.permit.resolution.anomaly;

/**
 * A reviewer whose approval rate on permits shared with one counterpart is an
 * outlier against the reviewer's own baseline.
 *
 * @param reviewerEntityId    the reviewer
 * @param counterpartEntityId the applicant or consultant
 * @param pairRate            approvals / decided permits shared by the pair
 * @param baselineRate        approvals / decided permits over everything the reviewer reviewed
 * @param standardDeviation   standard error of the baseline at the pair's sample size
 * @param zScore              distance from the baseline in standard deviations, infinite when the deviation is 0
 * @param pairSampleSize      decided permits shared by the pair
 * @param reviewerSampleSize  decided permits reviewed overall
 */
public record ApprovalRateAnomaly(String reviewerEntityId,
                                  String counterpartEntityId,
                                  double pairRate,
                                  double baselineRate,
                                  double standardDeviation,
                                  double zScore,
                                  int pairSampleSize,
                                  int reviewerSampleSize) {
}
