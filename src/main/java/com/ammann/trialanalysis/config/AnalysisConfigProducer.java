/* (C)2026 */
package com.ammann.trialanalysis.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import java.time.Duration;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * CDI producer assembling the immutable {@link AnalysisConfig} from application.properties.
 *
 * <p>All properties live under the {@code analysis.} prefix. Validation runs while the
 * bean is produced, so an invalid value stops startup with an
 * {@link com.ammann.trialanalysis.exception.InvalidConfigurationException}.
 */
@ApplicationScoped
public class AnalysisConfigProducer {

    private static final Logger LOG = Logger.getLogger(AnalysisConfigProducer.class);

    @ConfigProperty(name = "analysis.trial.bits-per-trial", defaultValue = "200")
    int bitsPerTrial;

    @ConfigProperty(name = "analysis.significance.alpha", defaultValue = "0.05")
    double significanceAlpha;

    @ConfigProperty(name = "analysis.randomness.alpha", defaultValue = "0.01")
    double randomnessAlpha;

    @ConfigProperty(name = "analysis.randomness.block-size", defaultValue = "128")
    int blockSize;

    @ConfigProperty(name = "analysis.randomness.autocorrelation-threshold", defaultValue = "0.05")
    double randomnessAutocorrelationThreshold;

    @ConfigProperty(name = "analysis.excursion.threshold", defaultValue = "2.0")
    double excursionThreshold;

    @ConfigProperty(name = "analysis.excursion.min-duration", defaultValue = "100")
    int excursionMinDuration;

    @ConfigProperty(name = "analysis.trend.window-size", defaultValue = "100")
    int trendWindowSize;

    @ConfigProperty(name = "analysis.trend.alpha", defaultValue = "0.05")
    double trendAlpha;

    @ConfigProperty(name = "analysis.baseline.change-point-threshold", defaultValue = "0.01")
    double changePointThreshold;

    @ConfigProperty(name = "analysis.baseline.periodic-confidence-floor", defaultValue = "50")
    double periodicConfidenceFloor;

    @ConfigProperty(name = "analysis.quality.bias-threshold", defaultValue = "0.05")
    double biasThreshold;

    @ConfigProperty(name = "analysis.quality.variance-threshold", defaultValue = "0.1")
    double varianceThreshold;

    @ConfigProperty(name = "analysis.quality.autocorrelation-threshold", defaultValue = "0.1")
    double autocorrelationThreshold;

    @ConfigProperty(name = "analysis.quality.entropy-threshold", defaultValue = "0.95")
    double entropyThreshold;

    @ConfigProperty(name = "analysis.quality.outlier-threshold", defaultValue = "3.0")
    double outlierThreshold;

    @ConfigProperty(name = "analysis.quality.timing-deviation-threshold", defaultValue = "0.1")
    double timingDeviationThreshold;

    @ConfigProperty(name = "analysis.quality.bias-window", defaultValue = "1000")
    int biasWindow;

    @ConfigProperty(name = "analysis.quality.pattern-run-cutoff", defaultValue = "20")
    int patternRunCutoff;

    @ConfigProperty(name = "analysis.quality.pattern-run-severe-cutoff", defaultValue = "50")
    int patternRunSevereCutoff;

    @ConfigProperty(name = "analysis.quality.expected-interval-ms", defaultValue = "5.0")
    double expectedIntervalMs;

    @ConfigProperty(name = "analysis.quality.missing-gap-multiplier", defaultValue = "10.0")
    double missingGapMultiplier;

    @ConfigProperty(name = "analysis.calibration.trials", defaultValue = "100000")
    int calibrationBits;

    @ConfigProperty(name = "analysis.calibration.extended-bits-per-interval", defaultValue = "1000")
    int extendedBitsPerInterval;

    @ConfigProperty(name = "analysis.calibration.max-sample-interval-ms", defaultValue = "60000")
    long maxSampleIntervalMs;

    @ConfigProperty(name = "analysis.calibration.health-check-bits", defaultValue = "10000")
    int healthCheckBits;

    @ConfigProperty(name = "analysis.calibration.next-due-days", defaultValue = "30")
    int nextDueDays;

    @Produces
    @ApplicationScoped
    public AnalysisConfig analysisConfig() {
        QualityThresholds thresholds = new QualityThresholds(
                biasThreshold,
                varianceThreshold,
                autocorrelationThreshold,
                entropyThreshold,
                outlierThreshold,
                timingDeviationThreshold,
                biasWindow,
                patternRunCutoff,
                patternRunSevereCutoff,
                expectedIntervalMs,
                missingGapMultiplier);

        CalibrationSettings calibration = new CalibrationSettings(
                calibrationBits,
                extendedBitsPerInterval,
                Duration.ofMillis(maxSampleIntervalMs),
                healthCheckBits,
                Duration.ofDays(nextDueDays));

        AnalysisConfig config = new AnalysisConfig(
                bitsPerTrial,
                significanceAlpha,
                randomnessAlpha,
                blockSize,
                randomnessAutocorrelationThreshold,
                excursionThreshold,
                excursionMinDuration,
                trendWindowSize,
                trendAlpha,
                changePointThreshold,
                periodicConfidenceFloor,
                thresholds,
                calibration);

        LOG.infof("Analysis configuration loaded: N=%d alpha=%.3f randomnessAlpha=%.3f excursion=%.1f/%d trendWindow=%d",
                config.bitsPerTrial(), config.significanceAlpha(), config.randomnessAlpha(),
                config.excursionThreshold(), config.excursionMinDuration(), config.trendWindowSize());
        return config;
    }
}
