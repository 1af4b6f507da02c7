/* (C)2026 */
package com.ammann.trialanalysis.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.trialanalysis.exception.InvalidConfigurationException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class AnalysisConfigTest {

    @Test
    void defaultsDescribeTwoHundredBitTrials() {
        AnalysisConfig config = AnalysisConfig.defaults();

        assertThat(config.bitsPerTrial()).isEqualTo(200);
        assertThat(config.expectedMean()).isEqualTo(100.0);
        assertThat(config.expectedVariance()).isEqualTo(50.0);
        assertThat(config.expectedStd()).isEqualTo(Math.sqrt(50.0));
        assertThat(config.excursionThreshold()).isEqualTo(2.0);
        assertThat(config.excursionMinDuration()).isEqualTo(100);
        assertThat(config.trendWindowSize()).isEqualTo(100);
        assertThat(config.quality()).isEqualTo(QualityThresholds.defaults());
        assertThat(config.calibration()).isEqualTo(CalibrationSettings.defaults());
    }

    @Test
    void copiesReplaceOnlyTheirSection() {
        AnalysisConfig config = AnalysisConfig.withBitsPerTrial(20)
                .withExcursion(3.0, 10)
                .withTrendWindowSize(8);

        assertThat(config.bitsPerTrial()).isEqualTo(20);
        assertThat(config.excursionThreshold()).isEqualTo(3.0);
        assertThat(config.excursionMinDuration()).isEqualTo(10);
        assertThat(config.trendWindowSize()).isEqualTo(8);
        assertThat(config.significanceAlpha()).isEqualTo(0.05);
    }

    @Test
    void missingSectionsFallBackToDefaults() {
        AnalysisConfig config = new AnalysisConfig(
                200, 0.05, 0.01, 128, 0.05, 2.0, 100, 100, 0.05, 0.01, 50.0, null, null);

        assertThat(config.quality()).isEqualTo(QualityThresholds.defaults());
        assertThat(config.calibration()).isEqualTo(CalibrationSettings.defaults());
    }

    @Test
    void rejectsNonPositiveBitsPerTrial() {
        assertThatThrownBy(() -> AnalysisConfig.withBitsPerTrial(0))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("analysis.trial.bits-per-trial");
    }

    @Test
    void rejectsAlphaOutsideUnitInterval() {
        assertThatThrownBy(() -> new AnalysisConfig(
                        200, 1.0, 0.01, 128, 0.05, 2.0, 100, 100, 0.05, 0.01, 50.0, null, null))
                .isInstanceOfSatisfying(InvalidConfigurationException.class,
                        e -> assertThat(e.getProperty()).isEqualTo("analysis.significance.alpha"));
    }

    @Test
    void rejectsTinyTrendWindow() {
        assertThatThrownBy(() -> AnalysisConfig.defaults().withTrendWindowSize(3))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("analysis.trend.window-size");
    }

    @Test
    void rejectsPeriodicFloorAboveHundred() {
        assertThatThrownBy(() -> new AnalysisConfig(
                        200, 0.05, 0.01, 128, 0.05, 2.0, 100, 100, 0.05, 0.01, 101.0, null, null))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("analysis.baseline.periodic-confidence-floor");
    }

    @Test
    void qualityThresholdsNeedSevereCutoffAboveCutoff() {
        assertThatThrownBy(() -> new QualityThresholds(0.05, 0.1, 0.1, 0.95, 3.0, 0.1, 1000, 20, 20, 5.0, 10.0))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("analysis.quality.pattern-run-severe-cutoff");
    }

    @Test
    void qualityThresholdsRejectBiasAboveHalf() {
        assertThatThrownBy(() -> new QualityThresholds(0.6, 0.1, 0.1, 0.95, 3.0, 0.1, 1000, 20, 50, 5.0, 10.0))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("analysis.quality.bias-threshold");
    }

    @Test
    void calibrationSettingsRejectMissingInterval() {
        assertThatThrownBy(() -> new CalibrationSettings(100, 10, null, 10, Duration.ofDays(1)))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("analysis.calibration.max-sample-interval-ms");
    }
}
