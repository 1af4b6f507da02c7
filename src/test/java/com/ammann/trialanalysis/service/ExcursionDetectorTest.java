/* (C)2026 */
package com.ammann.trialanalysis.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.ammann.trialanalysis.config.AnalysisConfig;
import com.ammann.trialanalysis.dto.CumulativePointDTO;
import com.ammann.trialanalysis.dto.CumulativeResultDTO;
import com.ammann.trialanalysis.dto.ExcursionPeriodDTO;
import com.ammann.trialanalysis.math.StatisticalMath;
import com.ammann.trialanalysis.support.TrialFixtures;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class ExcursionDetectorTest {

    private final ExcursionDetector detector = new ExcursionDetector(AnalysisConfig.defaults());

    @Test
    void singleSustainedExcursionIsReportedWithItsBounds() {
        double[] z = series(new double[] {0.5, 2.5, 0.5}, new int[] {50, 110, 50});

        List<ExcursionPeriodDTO> excursions = detector.detectExcursions(z, timestamps(z.length));

        assertThat(excursions).hasSize(1);
        ExcursionPeriodDTO excursion = excursions.get(0);
        assertThat(excursion.startIndex()).isEqualTo(50);
        assertThat(excursion.endIndex()).isEqualTo(159);
        assertThat(excursion.durationTrials()).isEqualTo(110);
        assertThat(excursion.maxDeviation()).isEqualTo(2.5);
        assertThat(excursion.isPositive()).isTrue();
        assertThat(excursion.durationMillis()).isEqualTo(109 * 5L);
        assertThat(excursion.significance()).isCloseTo(StatisticalMath.oneTailedNormalP(2.5), within(1e-12));
    }

    @Test
    void excursionsShorterThanMinimumDurationAreDropped() {
        double[] z = series(new double[] {0.0, 3.0, 0.0}, new int[] {10, 99, 10});

        assertThat(detector.detectExcursions(z, timestamps(z.length))).isEmpty();
    }

    @Test
    void signFlipEndsOneExcursionAndStartsTheNext() {
        double[] z = series(new double[] {2.5, -3.0}, new int[] {120, 130});

        List<ExcursionPeriodDTO> excursions = detector.detectExcursions(z, timestamps(z.length));

        assertThat(excursions).hasSize(2);
        assertThat(excursions.get(0).startIndex()).isZero();
        assertThat(excursions.get(0).endIndex()).isEqualTo(119);
        assertThat(excursions.get(1).startIndex()).isEqualTo(120);
        assertThat(excursions.get(1).endIndex()).isEqualTo(249);
        assertThat(excursions.get(1).maxDeviation()).isEqualTo(-3.0);
        assertThat(excursions.get(1).isPositive()).isFalse();
    }

    @Test
    void excursionOpenAtEndOfSeriesIsKept() {
        double[] z = series(new double[] {1.0, 4.0}, new int[] {5, 100});

        List<ExcursionPeriodDTO> excursions = detector.detectExcursions(z, timestamps(z.length));

        assertThat(excursions).singleElement()
                .satisfies(e -> {
                    assertThat(e.startIndex()).isEqualTo(5);
                    assertThat(e.endIndex()).isEqualTo(104);
                });
    }

    @Test
    void valueExactlyAtThresholdDoesNotStartAnExcursion() {
        double[] z = series(new double[] {2.0}, new int[] {200});

        assertThat(detector.detectExcursions(z, timestamps(z.length))).isEmpty();
    }

    @Test
    void cumulativeSeriesCountsZeroCrossings() {
        // cumulative deviation: 1, 0, -1, 0, 1
        CumulativeResultDTO result = detector.analyze(TrialFixtures.fromValues(101, 99, 99, 101, 101));

        assertThat(result.points()).hasSize(5);
        assertThat(result.finalDeviation()).isEqualTo(1.0);
        assertThat(result.maxDeviation()).isEqualTo(1.0);
        assertThat(result.minDeviation()).isEqualTo(-1.0);
        assertThat(result.crossings()).isEqualTo(2);

        CumulativePointDTO first = result.points().get(0);
        assertThat(first.trialIndex()).isZero();
        assertThat(first.runningMean()).isEqualTo(101.0);
        assertThat(first.zScore()).isCloseTo(1 / Math.sqrt(50), within(1e-12));
    }

    @Test
    void persistentDeviationProducesExcursionFromThirdTrial() {
        // z_i = 10(i+1) / sqrt(50(i+1)) first exceeds 2 at i = 2
        CumulativeResultDTO result = detector.analyze(TrialFixtures.constant(150, 110));

        assertThat(result.crossings()).isZero();
        assertThat(result.excursions()).singleElement()
                .satisfies(e -> {
                    assertThat(e.startIndex()).isEqualTo(2);
                    assertThat(e.endIndex()).isEqualTo(149);
                    assertThat(e.durationTrials()).isEqualTo(148);
                });
    }

    @Test
    void emptyWindowYieldsEmptyResult() {
        CumulativeResultDTO result = detector.analyze(List.of());

        assertThat(result.points()).isEmpty();
        assertThat(result.excursions()).isEmpty();
        assertThat(result.finalDeviation()).isZero();
        assertThat(result.crossings()).isZero();
    }

    private static double[] series(double[] levels, int[] lengths) {
        int total = Arrays.stream(lengths).sum();
        double[] values = new double[total];
        int index = 0;
        for (int s = 0; s < levels.length; s++) {
            for (int k = 0; k < lengths[s]; k++) {
                values[index++] = levels[s];
            }
        }
        return values;
    }

    private static Instant[] timestamps(int n) {
        Instant[] timestamps = new Instant[n];
        for (int i = 0; i < n; i++) {
            timestamps[i] = TrialFixtures.START.plusMillis(i * 5L);
        }
        return timestamps;
    }
}
