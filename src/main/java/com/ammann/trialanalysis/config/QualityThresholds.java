/* (C)2026 */
package com.ammann.trialanalysis.config;

/**
 * Thresholds used by the quality controller. Validated once on construction.
 *
 * @param bias maximum deviation of the per-draw proportion from 0.5
 * @param variance maximum relative deviation of the observed variance from N/4
 * @param autocorrelation maximum absolute autocorrelation at any scanned lag
 * @param entropy minimum binary entropy ratio of the per-draw proportion
 * @param outlier z-score above which an inter-trial interval is an outlier
 * @param timingDeviation maximum coefficient of variation of inter-trial intervals
 * @param biasWindow sliding window size for the bias scan (stepped at half the window)
 * @param patternRunCutoff run length above which a run is reported
 * @param patternRunSevereCutoff run length above which a run is reported with high severity
 * @param expectedIntervalMs expected spacing between consecutive trials
 * @param missingGapMultiplier multiple of the expected interval that counts as missing data
 */
public record QualityThresholds(
        double bias,
        double variance,
        double autocorrelation,
        double entropy,
        double outlier,
        double timingDeviation,
        int biasWindow,
        int patternRunCutoff,
        int patternRunSevereCutoff,
        double expectedIntervalMs,
        double missingGapMultiplier) {

    public QualityThresholds {
        ConfigChecks.inRange("analysis.quality.bias-threshold", bias, Double.MIN_VALUE, 0.5);
        ConfigChecks.positive("analysis.quality.variance-threshold", variance);
        ConfigChecks.probability("analysis.quality.autocorrelation-threshold", autocorrelation);
        ConfigChecks.inRange("analysis.quality.entropy-threshold", entropy, Double.MIN_VALUE, 1.0);
        ConfigChecks.positive("analysis.quality.outlier-threshold", outlier);
        ConfigChecks.positive("analysis.quality.timing-deviation-threshold", timingDeviation);
        ConfigChecks.atLeast("analysis.quality.bias-window", biasWindow, 2);
        ConfigChecks.positive("analysis.quality.pattern-run-cutoff", patternRunCutoff);
        ConfigChecks.atLeast(
                "analysis.quality.pattern-run-severe-cutoff", patternRunSevereCutoff, patternRunCutoff + 1L);
        ConfigChecks.positive("analysis.quality.expected-interval-ms", expectedIntervalMs);
        ConfigChecks.inRange(
                "analysis.quality.missing-gap-multiplier", missingGapMultiplier, 1.0, Double.MAX_VALUE);
    }

    public static QualityThresholds defaults() {
        return new QualityThresholds(0.05, 0.1, 0.1, 0.95, 3.0, 0.1, 1000, 20, 50, 5.0, 10.0);
    }

    public QualityThresholds withBiasWindow(int window) {
        return new QualityThresholds(
                bias, variance, autocorrelation, entropy, outlier, timingDeviation, window,
                patternRunCutoff, patternRunSevereCutoff, expectedIntervalMs, missingGapMultiplier);
    }
}
