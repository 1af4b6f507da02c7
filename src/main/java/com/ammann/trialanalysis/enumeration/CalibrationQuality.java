package com.ammann.trialanalysis.enumeration;

/**
 * Quality tier of a calibration run based on a composite score in the range [0, 100].
 *
 * <p>A score is classified into the highest tier whose threshold it meets or exceeds.
 */
public enum CalibrationQuality
{
    /** Score of 95 or above. */
    EXCELLENT(95),
    /** Score of 85 or above. */
    GOOD(85),
    /** Score of 70 or above. */
    ACCEPTABLE(70),
    /** Score of 50 or above. */
    POOR(50),
    /** Score below 50. */
    FAILED(0);

    private final double threshold;

    CalibrationQuality(double threshold) {
        this.threshold = threshold;
    }

    public static CalibrationQuality fromScore(double score) {
        if (score >= EXCELLENT.threshold) return EXCELLENT;
        if (score >= GOOD.threshold) return GOOD;
        if (score >= ACCEPTABLE.threshold) return ACCEPTABLE;
        if (score >= POOR.threshold) return POOR;
        return FAILED;
    }

    public boolean needsRecalibration() {
        return this == POOR || this == FAILED;
    }

    public double getThreshold() { return threshold; }
}
