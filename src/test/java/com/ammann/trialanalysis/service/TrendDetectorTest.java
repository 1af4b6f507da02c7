/* (C)2026 */
package com.ammann.trialanalysis.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.trialanalysis.config.AnalysisConfig;
import com.ammann.trialanalysis.dto.ChangePointDTO;
import com.ammann.trialanalysis.dto.TrendResultDTO;
import com.ammann.trialanalysis.enumeration.TrendDirection;
import com.ammann.trialanalysis.support.TrialFixtures;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class TrendDetectorTest {

    private final TrendDetector detector = new TrendDetector(AnalysisConfig.defaults().withTrendWindowSize(20));

    @Test
    void tooFewWindowsYieldStableTrend() {
        TrendDetector wide = new TrendDetector(AnalysisConfig.defaults());

        TrendResultDTO result = wide.analyze(TrialFixtures.constant(120, 130));

        assertThat(result.windowCount()).isEqualTo(1);
        assertThat(result.trendDirection()).isEqualTo(TrendDirection.STABLE);
        assertThat(result.slope()).isZero();
        assertThat(result.slopeSignificance()).isEqualTo(1.0);
        assertThat(result.changePoints()).isEmpty();
    }

    @Test
    void rampingValuesGiveSignificantIncrease() {
        int[] values = new int[400];
        for (int i = 0; i < values.length; i++) {
            values[i] = 100 + i / 10;
        }

        TrendResultDTO result = detector.analyze(TrialFixtures.fromValues(values));

        // windows of 20 stepped by 5
        assertThat(result.windowCount()).isEqualTo(77);
        assertThat(result.slope()).isPositive();
        assertThat(result.slopeSignificance()).isLessThan(0.05);
        assertThat(result.correlation()).isGreaterThan(0.99);
        assertThat(result.trendDirection()).isEqualTo(TrendDirection.INCREASING);
    }

    @Test
    void fallingValuesGiveSignificantDecrease() {
        int[] values = new int[400];
        for (int i = 0; i < values.length; i++) {
            values[i] = 140 - i / 10;
        }

        TrendResultDTO result = detector.analyze(TrialFixtures.fromValues(values));

        assertThat(result.trendDirection()).isEqualTo(TrendDirection.DECREASING);
    }

    @Test
    void constantValuesAreStable() {
        TrendResultDTO result = detector.analyze(TrialFixtures.constant(400, 100));

        assertThat(result.trendDirection()).isEqualTo(TrendDirection.STABLE);
        assertThat(result.slope()).isZero();
        assertThat(result.changePoints()).isEmpty();
    }

    @Test
    void cusumFiresAtRunningExtremaAndResets() {
        double[] values = new double[20];
        for (int i = 10; i < 20; i++) {
            values[i] = 1.0;
        }

        List<ChangePointDTO> changePoints = detector.detectChangePoints(values, timestamps(values.length));

        assertThat(changePoints).extracting(ChangePointDTO::index).containsExactly(2, 5, 8, 13, 16, 19);
        assertThat(changePoints).allSatisfy(cp -> {
            assertThat(cp.confidence()).isBetween(0.0, 0.99);
            assertThat(cp.magnitudeChange()).isGreaterThan(2.0);
        });
    }

    @Test
    void shortOrConstantSeriesHaveNoChangePoints() {
        assertThat(detector.detectChangePoints(new double[] {0, 0, 0, 1, 1, 1}, timestamps(6))).isEmpty();
        assertThat(detector.detectChangePoints(new double[12], timestamps(12))).isEmpty();
    }

    private static Instant[] timestamps(int n) {
        Instant[] timestamps = new Instant[n];
        for (int i = 0; i < n; i++) {
            timestamps[i] = TrialFixtures.START.plusSeconds(i);
        }
        return timestamps;
    }
}
