/* (C)2026 */
package com.ammann.trialanalysis.config;

/**
 * Immutable configuration shared by every analysis component.
 *
 * <p>Built once (see {@link AnalysisConfigProducer}) and validated in the compact
 * constructor, so an out-of-domain value fails application startup rather than an
 * analysis call.
 *
 * @param bitsPerTrial number of binary draws summed into one trial (N)
 * @param significanceAlpha α for z-score, trend and baseline significance
 * @param randomnessAlpha α for the randomness battery
 * @param blockSize block length of the block-frequency test
 * @param randomnessAutocorrelationThreshold pass threshold for bit-level autocorrelation
 * @param excursionThreshold |Z| above which a cumulative excursion starts
 * @param excursionMinDuration minimum excursion length, in trials, to be recorded
 * @param trendWindowSize window length of the trend detector
 * @param trendAlpha α for the slope t-test
 * @param changePointThreshold baseline change-point threshold on mean differences
 * @param periodicConfidenceFloor minimum confidence for a periodic pattern to be reported
 * @param quality quality-controller thresholds
 * @param calibration calibration sampling settings
 */
public record AnalysisConfig(
        int bitsPerTrial,
        double significanceAlpha,
        double randomnessAlpha,
        int blockSize,
        double randomnessAutocorrelationThreshold,
        double excursionThreshold,
        int excursionMinDuration,
        int trendWindowSize,
        double trendAlpha,
        double changePointThreshold,
        double periodicConfidenceFloor,
        QualityThresholds quality,
        CalibrationSettings calibration) {

    public static final int DEFAULT_BITS_PER_TRIAL = 200;

    public AnalysisConfig {
        ConfigChecks.positive("analysis.trial.bits-per-trial", bitsPerTrial);
        ConfigChecks.probability("analysis.significance.alpha", significanceAlpha);
        ConfigChecks.probability("analysis.randomness.alpha", randomnessAlpha);
        ConfigChecks.positive("analysis.randomness.block-size", blockSize);
        ConfigChecks.probability(
                "analysis.randomness.autocorrelation-threshold", randomnessAutocorrelationThreshold);
        ConfigChecks.positive("analysis.excursion.threshold", excursionThreshold);
        ConfigChecks.positive("analysis.excursion.min-duration", excursionMinDuration);
        ConfigChecks.atLeast("analysis.trend.window-size", trendWindowSize, 4);
        ConfigChecks.probability("analysis.trend.alpha", trendAlpha);
        ConfigChecks.positive("analysis.baseline.change-point-threshold", changePointThreshold);
        ConfigChecks.inRange("analysis.baseline.periodic-confidence-floor", periodicConfidenceFloor, 0, 100);
        if (quality == null) {
            quality = QualityThresholds.defaults();
        }
        if (calibration == null) {
            calibration = CalibrationSettings.defaults();
        }
    }

    /** Configuration with every documented default. */
    public static AnalysisConfig defaults() {
        return withBitsPerTrial(DEFAULT_BITS_PER_TRIAL);
    }

    public static AnalysisConfig withBitsPerTrial(int bitsPerTrial) {
        return new AnalysisConfig(
                bitsPerTrial, 0.05, 0.01, 128, 0.05, 2.0, 100, 100, 0.05, 0.01, 50.0,
                QualityThresholds.defaults(), CalibrationSettings.defaults());
    }

    public AnalysisConfig withQuality(QualityThresholds thresholds) {
        return new AnalysisConfig(
                bitsPerTrial, significanceAlpha, randomnessAlpha, blockSize,
                randomnessAutocorrelationThreshold, excursionThreshold, excursionMinDuration,
                trendWindowSize, trendAlpha, changePointThreshold, periodicConfidenceFloor,
                thresholds, calibration);
    }

    public AnalysisConfig withCalibration(CalibrationSettings settings) {
        return new AnalysisConfig(
                bitsPerTrial, significanceAlpha, randomnessAlpha, blockSize,
                randomnessAutocorrelationThreshold, excursionThreshold, excursionMinDuration,
                trendWindowSize, trendAlpha, changePointThreshold, periodicConfidenceFloor,
                quality, settings);
    }

    public AnalysisConfig withExcursion(double threshold, int minDuration) {
        return new AnalysisConfig(
                bitsPerTrial, significanceAlpha, randomnessAlpha, blockSize,
                randomnessAutocorrelationThreshold, threshold, minDuration,
                trendWindowSize, trendAlpha, changePointThreshold, periodicConfidenceFloor,
                quality, calibration);
    }

    public AnalysisConfig withTrendWindowSize(int windowSize) {
        return new AnalysisConfig(
                bitsPerTrial, significanceAlpha, randomnessAlpha, blockSize,
                randomnessAutocorrelationThreshold, excursionThreshold, excursionMinDuration,
                windowSize, trendAlpha, changePointThreshold, periodicConfidenceFloor,
                quality, calibration);
    }

    /** N/2. */
    public double expectedMean() {
        return bitsPerTrial / 2.0;
    }

    /** N/4. */
    public double expectedVariance() {
        return bitsPerTrial / 4.0;
    }

    public double expectedStd() {
        return Math.sqrt(expectedVariance());
    }
}
