package com.permit.resolution.anomaly;

/**
 * Thresholds of the anomaly scan.
 */
public class AnomalyOptions {

    private static final double DEFAULT_SIGMA_THRESHOLD = 2.0;
    private static final int DEFAULT_MIN_SAMPLE_SIZE = 5;
    private static final int DEFAULT_HIGH_VOLUME_MIN_PERMITS = 10;
    private static final double DEFAULT_HIGH_VOLUME_MULTIPLIER = 3.0;

    private final double sigmaThreshold;
    private final int minSampleSize;
    private final int highVolumeMinPermits;
    private final double highVolumeMultiplier;

    private AnomalyOptions(Builder builder) {
        this.sigmaThreshold = builder.sigmaThreshold;
        this.minSampleSize = builder.minSampleSize;
        this.highVolumeMinPermits = builder.highVolumeMinPermits;
        this.highVolumeMultiplier = builder.highVolumeMultiplier;
    }

    /**
     * Standard deviations above the reviewer baseline a pair must exceed.
     */
    public double getSigmaThreshold() {
        return sigmaThreshold;
    }

    /**
     * Decided shared permits a pair needs before it is tested.
     */
    public int getMinSampleSize() {
        return minSampleSize;
    }

    public int getHighVolumeMinPermits() {
        return highVolumeMinPermits;
    }

    public double getHighVolumeMultiplier() {
        return highVolumeMultiplier;
    }

    public static AnomalyOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double sigmaThreshold = DEFAULT_SIGMA_THRESHOLD;
        private int minSampleSize = DEFAULT_MIN_SAMPLE_SIZE;
        private int highVolumeMinPermits = DEFAULT_HIGH_VOLUME_MIN_PERMITS;
        private double highVolumeMultiplier = DEFAULT_HIGH_VOLUME_MULTIPLIER;

        public Builder sigmaThreshold(double sigmaThreshold) {
            if (sigmaThreshold < 0.0) {
                throw new IllegalArgumentException("sigmaThreshold must be non-negative");
            }
            this.sigmaThreshold = sigmaThreshold;
            return this;
        }

        public Builder minSampleSize(int minSampleSize) {
            if (minSampleSize <= 0) {
                throw new IllegalArgumentException("minSampleSize must be positive");
            }
            this.minSampleSize = minSampleSize;
            return this;
        }

        public Builder highVolumeMinPermits(int highVolumeMinPermits) {
            if (highVolumeMinPermits <= 0) {
                throw new IllegalArgumentException("highVolumeMinPermits must be positive");
            }
            this.highVolumeMinPermits = highVolumeMinPermits;
            return this;
        }

        public Builder highVolumeMultiplier(double highVolumeMultiplier) {
            if (highVolumeMultiplier < 1.0) {
                throw new IllegalArgumentException("highVolumeMultiplier must be at least 1.0");
            }
            this.highVolumeMultiplier = highVolumeMultiplier;
            return this;
        }

        public AnomalyOptions build() {
            return new AnomalyOptions(this);
        }
    }
}
