package com.ammann.trialanalysis.enumeration;

/**
 * Classification of a single quality metric against its threshold.
 *
 * <p>Each status carries the score penalty applied by the quality controller.
 */
public enum MetricStatus
{
    /** Within the threshold. */
    EXCELLENT(0),
    /** Within twice the threshold (or 90% of it for higher-is-better metrics). */
    GOOD(2),
    /** Within four times the threshold (or 70% of it for higher-is-better metrics). */
    WARNING(10),
    /** Beyond the warning band. */
    CRITICAL(20);

    private final int penalty;

    MetricStatus(int penalty) {
        this.penalty = penalty;
    }

    /**
     * Classifies a metric where smaller values are better, such as bias.
     *
     * @param value observed metric value
     * @param threshold configured threshold
     * @return status band
     */
    public static MetricStatus lowerIsBetter(double value, double threshold) {
        if (value <= threshold) return EXCELLENT;
        if (value <= threshold * 2) return GOOD;
        if (value <= threshold * 4) return WARNING;
        return CRITICAL;
    }

    /**
     * Classifies a metric where larger values are better, such as the entropy ratio.
     *
     * @param value observed metric value
     * @param threshold configured threshold
     * @return status band
     */
    public static MetricStatus higherIsBetter(double value, double threshold) {
        if (value >= threshold) return EXCELLENT;
        if (value >= threshold * 0.9) return GOOD;
        if (value >= threshold * 0.7) return WARNING;
        return CRITICAL;
    }

    public int getPenalty() { return penalty; }
}
