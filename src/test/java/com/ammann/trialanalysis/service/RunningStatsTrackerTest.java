/* (C)2026 */
package com.ammann.trialanalysis.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ammann.trialanalysis.config.AnalysisConfig;
import com.ammann.trialanalysis.dto.RealtimeSignificanceDTO;
import com.ammann.trialanalysis.enumeration.SignificanceLevel;
import com.ammann.trialanalysis.exception.ValidationException;
import com.ammann.trialanalysis.model.RunningStats;
import com.ammann.trialanalysis.model.Trial;
import com.ammann.trialanalysis.support.TrialFixtures;
import java.util.List;
import org.junit.jupiter.api.Test;

class RunningStatsTrackerTest {

    private final RunningStatsTracker tracker = new RunningStatsTracker(AnalysisConfig.defaults());

    @Test
    void welfordMatchesTwoPassStatisticsAtEveryPrefix() {
        List<Trial> trials = TrialFixtures.binomial(500, 200, 7L);
        RunningStats stats = tracker.newStats();

        double cumulative = 0.0;
        for (int n = 1; n <= trials.size(); n++) {
            tracker.update(stats, trials.get(n - 1));
            cumulative += trials.get(n - 1).value() - 100.0;

            double sum = 0.0;
            for (int i = 0; i < n; i++) {
                sum += trials.get(i).value();
            }
            double mean = sum / n;
            double squares = 0.0;
            for (int i = 0; i < n; i++) {
                double d = trials.get(i).value() - mean;
                squares += d * d;
            }
            double variance = n < 2 ? 0.0 : squares / (n - 1);

            assertThat(stats.getCount()).isEqualTo(n);
            assertThat(stats.getMean()).isCloseTo(mean, within(1e-9));
            assertThat(stats.getVariance()).isCloseTo(variance, within(1e-9));
            assertThat(stats.getCumulativeDeviation()).isCloseTo(cumulative, within(1e-9));
        }
    }

    @Test
    void tracksExtremesAndLastTimestamp() {
        RunningStats stats = tracker.updateAll(tracker.newStats(), TrialFixtures.fromValues(100, 90, 120, 101));

        assertThat(stats.getMinValue()).isEqualTo(90);
        assertThat(stats.getMaxValue()).isEqualTo(120);
        assertThat(stats.getSum()).isEqualTo(411.0);
        assertThat(stats.getLastUpdated()).isEqualTo(TrialFixtures.trial(3, 101).timestamp());
    }

    @Test
    void firstTrialHasZeroVariance() {
        RunningStats stats = tracker.update(tracker.newStats(), TrialFixtures.trial(0, 140));

        assertThat(stats.getVariance()).isZero();
        assertThat(stats.getMean()).isEqualTo(140.0);
        assertThat(stats.getCumulativeDeviation()).isEqualTo(40.0);
    }

    @Test
    void rejectsValuesOutsideTheTrialRange() {
        RunningStats stats = tracker.newStats();

        assertThatThrownBy(() -> tracker.update(stats, TrialFixtures.trial(0, 201)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("trial.value");
        assertThatThrownBy(() -> tracker.update(stats, TrialFixtures.trial(0, -1)))
                .isInstanceOf(ValidationException.class);
        assertThat(stats.isEmpty()).isTrue();
    }

    @Test
    void rejectsTrialsOlderThanTheLastUpdate() {
        RunningStats stats = tracker.update(tracker.newStats(), TrialFixtures.trial(5, 100));

        assertThatThrownBy(() -> tracker.update(stats, TrialFixtures.trial(4, 100)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("trial.timestamp");
    }

    @Test
    void snapshotIsIndependentOfLaterUpdates() {
        RunningStats stats = tracker.updateAll(tracker.newStats(), TrialFixtures.fromValues(100, 102));
        RunningStats snapshot = stats.snapshot();

        tracker.update(stats, TrialFixtures.trial(2, 150));

        assertThat(snapshot.getCount()).isEqualTo(2);
        assertThat(snapshot.getMean()).isEqualTo(101.0);
        assertThat(stats.getCount()).isEqualTo(3);
    }

    @Test
    void emptyStatsAreNotSignificant() {
        RealtimeSignificanceDTO significance = tracker.currentSignificance(tracker.newStats());

        assertThat(significance.cumulativeZ()).isZero();
        assertThat(significance.pValue()).isEqualTo(1.0);
        assertThat(significance.significance()).isEqualTo(SignificanceLevel.NONE);
    }

    @Test
    void persistentDeviationBecomesHighlySignificant() {
        RunningStats stats = tracker.updateAll(tracker.newStats(), TrialFixtures.constant(100, 110));

        RealtimeSignificanceDTO significance = tracker.currentSignificance(stats);

        // cumulative deviation 1000 over sqrt(50 * 100)
        assertThat(significance.cumulativeZ()).isCloseTo(1000 / Math.sqrt(5000), within(1e-9));
        assertThat(significance.significance()).isEqualTo(SignificanceLevel.HIGHLY_SIGNIFICANT);
        assertThat(significance.effectSize()).isCloseTo(10 / Math.sqrt(50), within(1e-9));
        assertThat(significance.power()).isGreaterThan(0.99);
    }
}
