package com.ammann.trialanalysis.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ammann.trialanalysis.config.AnalysisConfig;
import com.ammann.trialanalysis.config.QualityThresholds;
import com.ammann.trialanalysis.dto.AnomalyReportDTO;
import com.ammann.trialanalysis.dto.DataIntegrityDTO;
import com.ammann.trialanalysis.dto.QualityMetricDTO;
import com.ammann.trialanalysis.dto.QualityReportDTO;
import com.ammann.trialanalysis.enumeration.AnomalySeverity;
import com.ammann.trialanalysis.enumeration.AnomalyType;
import com.ammann.trialanalysis.enumeration.QualityVerdict;
import com.ammann.trialanalysis.model.Trial;
import com.ammann.trialanalysis.port.ReportRepository;
import com.ammann.trialanalysis.port.TrialRepository;
import com.ammann.trialanalysis.support.TrialFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link QualityController}.
 *
 * <p>The main fixture is a balanced stream of 4000 trials with N = 20 whose 200-trial
 * windows are free of bias, long runs and correlation. Anomalies are injected one at a
 * time and each must lower the score.
 */
class QualityControllerTest
{

    private static final int TRIALS = 4000;

    private final AnalysisConfig config = AnalysisConfig.withBitsPerTrial(20)
            .withQuality(QualityThresholds.defaults().withBiasWindow(200));

    private final QualityController controller = new QualityController(config);

    @Test
    void cleanStreamScoresFullMarks()
    {
        QualityReportDTO report = controller.assess(trials(cleanValues(), regularTimestamps()));

        assertThat(report.score()).isEqualTo(100.0);
        assertThat(report.verdict()).isEqualTo(QualityVerdict.PASS);
        assertThat(report.anomalies()).isEmpty();
        assertThat(report.alert()).isFalse();
        assertThat(report.metrics()).extracting(QualityMetricDTO::name)
                .containsExactly("bias", "variance", "autocorrelation", "entropy", "timing");
        assertThat(report.recommendations()).containsExactly(QualityController.ACCEPTABLE_RECOMMENDATION);
        assertThat(report.sampleSize()).isEqualTo(TRIALS);
        assertThat(report.windowStart()).isEqualTo(TrialFixtures.START);
    }

    @Test
    void eachInjectedAnomalyLowersTheScore()
    {
        int[] values = cleanValues();
        long[] timestamps = regularTimestamps();
        double clean = controller.assess(trials(values, timestamps)).score();

        for (int i = 1000; i < 1200; i++) {
            values[i] += 2;
        }
        QualityReportDTO biased = controller.assess(trials(values, timestamps));

        for (int i = 2000; i < 2080; i++) {
            values[i] = i % 2 == 0 ? 11 : 13;
        }
        QualityReportDTO patterned = controller.assess(trials(values, timestamps));

        for (int i = 3000; i < TRIALS; i++) {
            timestamps[i] += 35;
        }
        QualityReportDTO delayed = controller.assess(trials(values, timestamps));

        assertThat(biased.score()).isLessThan(clean);
        assertThat(patterned.score()).isLessThan(biased.score());
        assertThat(delayed.score()).isLessThan(patterned.score());

        assertThat(biased.anomalies()).extracting(AnomalyReportDTO::type).containsOnly(AnomalyType.BIAS);
        assertThat(biased.verdict()).isEqualTo(QualityVerdict.PASS);

        assertThat(patterned.anomalies())
                .filteredOn(a -> a.type() == AnomalyType.PATTERN)
                .singleElement()
                .satisfies(a -> {
                    assertThat(a.startIndex()).isEqualTo(2000);
                    assertThat(a.severity()).isEqualTo(AnomalySeverity.HIGH);
                });
        assertThat(patterned.verdict()).isEqualTo(QualityVerdict.WARNING);

        assertThat(delayed.anomalies())
                .filteredOn(a -> a.type() == AnomalyType.OUTLIER)
                .singleElement()
                .satisfies(a -> {
                    assertThat(a.startIndex()).isEqualTo(2999);
                    assertThat(a.endIndex()).isEqualTo(3000);
                });
        assertThat(delayed.anomalies()).extracting(AnomalyReportDTO::type).contains(AnomalyType.TIMING);
        assertThat(delayed.anomalies()).extracting(AnomalyReportDTO::type).doesNotContain(AnomalyType.MISSING_DATA);
    }

    @Test
    void biasWindowSeverityGrowsWithDeviation()
    {
        int[] values = cleanValues();
        for (int i = 0; i < 200; i++) {
            values[i] = 16;
        }

        QualityReportDTO report = controller.assess(trials(values, regularTimestamps()));

        // window 0..199 has proportion 0.8, six times the threshold
        assertThat(report.anomalies())
                .filteredOn(a -> a.type() == AnomalyType.BIAS && a.startIndex() == 0)
                .singleElement()
                .satisfies(a -> assertThat(a.severity()).isEqualTo(AnomalySeverity.CRITICAL));
        assertThat(report.alert()).isTrue();
        assertThat(report.verdict()).isEqualTo(QualityVerdict.FAIL);
        assertThat(report.recommendations()).contains(QualityController.CRITICAL_RECOMMENDATION);
    }

    @Test
    void runsMustExceedTheCutoffToBeReported()
    {
        List<Trial> exactlyAtCutoff = TrialFixtures.fromValues(concat(repeat(12, 20), repeat(10, 1), repeat(8, 5)));
        List<Trial> aboveCutoff = TrialFixtures.fromValues(concat(repeat(12, 21), repeat(10, 1), repeat(8, 5)));
        QualityThresholds thresholds = config.quality();

        assertThat(controller.detectPatterns(exactlyAtCutoff, values(exactlyAtCutoff), thresholds)).isEmpty();
        assertThat(controller.detectPatterns(aboveCutoff, values(aboveCutoff), thresholds))
                .singleElement()
                .satisfies(a -> {
                    assertThat(a.severity()).isEqualTo(AnomalySeverity.MEDIUM);
                    assertThat(a.affectedTrials()).isEqualTo(21);
                    assertThat(a.endIndex()).isEqualTo(20);
                    assertThat(a.description()).contains("above");
                });
    }

    @Test
    void longGapIsReportedAsMissingData()
    {
        long[] timestamps = regularTimestamps();
        for (int i = 2000; i < TRIALS; i++) {
            timestamps[i] += 10_000;
        }

        QualityReportDTO report = controller.assess(trials(cleanValues(), timestamps));

        // 10 005 ms / 5 ms - 1 = 2000 missed trials
        assertThat(report.anomalies())
                .filteredOn(a -> a.type() == AnomalyType.MISSING_DATA)
                .singleElement()
                .satisfies(a -> {
                    assertThat(a.affectedTrials()).isEqualTo(2000);
                    assertThat(a.severity()).isEqualTo(AnomalySeverity.CRITICAL);
                    assertThat(a.confidence()).isEqualTo(90.0);
                });
        assertThat(report.alert()).isTrue();
        assertThat(report.verdict()).isEqualTo(QualityVerdict.FAIL);
        assertThat(report.integrity().temporalConsistency()).isLessThan(1.0);
    }

    @Test
    void integrityCountsSequenceGapsAndDuplicates()
    {
        List<Trial> trials = List.of(
                Trial.baseline(TrialFixtures.START, 10, "s", 0),
                Trial.baseline(TrialFixtures.START.plusMillis(5), 10, "s", 1),
                Trial.baseline(TrialFixtures.START.plusMillis(10), 10, "s", 1),
                Trial.baseline(TrialFixtures.START.plusMillis(15), 10, "s", 2),
                Trial.baseline(TrialFixtures.START.plusMillis(20), 25, "s", 5));

        DataIntegrityDTO integrity = controller.assess(trials).integrity();

        assertThat(integrity.missingTrials()).isEqualTo(2);
        assertThat(integrity.duplicateSequences()).isEqualTo(1);
        assertThat(integrity.completeness()).isEqualTo(5.0 / 7.0);
        assertThat(integrity.sequenceIntegrity()).isEqualTo(1.0);
        assertThat(integrity.valueConsistency()).isEqualTo(0.8);
        assertThat(integrity.temporalConsistency()).isEqualTo(1.0);
    }

    @Test
    void emptyBatchYieldsCanonicalEmptyReport()
    {
        QualityReportDTO report = controller.assess(List.of());

        assertThat(report.isEmpty()).isTrue();
        assertThat(report.score()).isZero();
        assertThat(report.verdict()).isEqualTo(QualityVerdict.FAIL);
        assertThat(report.recommendations()).containsExactly(QualityReportDTO.NO_DATA_RECOMMENDATION);
        assertThat(controller.getLastReport()).contains(report);
    }

    @Test
    void singleTrialHasNoIntervalBasedFindings()
    {
        QualityReportDTO report = controller.assess(TrialFixtures.fromValues(10));

        assertThat(report.metrics()).extracting(QualityMetricDTO::name).containsExactly("bias", "entropy");
        assertThat(report.anomalies()).isEmpty();
        assertThat(report.score()).isEqualTo(100.0);
    }

    @Test
    void recommendationsGroupAnomaliesByType()
    {
        AnomalyReportDTO bias = anomaly(AnomalyType.BIAS, AnomalySeverity.MEDIUM);
        AnomalyReportDTO gap = anomaly(AnomalyType.MISSING_DATA, AnomalySeverity.HIGH);

        List<String> recommendations = QualityController.recommendations(List.of(bias, bias, gap), false);

        assertThat(recommendations).containsExactly(
                "Address bias issues: 2 anomalies detected",
                "Address missing data issues: 1 anomalies detected");
    }

    @Test
    void scoreIsClampedAtZero()
    {
        List<AnomalyReportDTO> anomalies = Collections.nCopies(10, anomaly(AnomalyType.OUTLIER, AnomalySeverity.CRITICAL));

        assertThat(QualityController.calculateScore(List.of(), anomalies)).isZero();
    }

    @Test
    void recentAssessmentIsStoredAndAlertsAreCounted()
    {
        TrialRepository trialRepository = mock(TrialRepository.class);
        ReportRepository reportRepository = mock(ReportRepository.class);
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        QualityController stored = new QualityController(config, trialRepository, reportRepository, registry);

        int[] values = cleanValues();
        for (int i = 0; i < 200; i++) {
            values[i] = 16;
        }
        when(trialRepository.findInTimeWindow(any(Instant.class), any(Instant.class)))
                .thenReturn(trials(values, regularTimestamps()));

        QualityReportDTO report = stored.assessRecent(Duration.ofHours(1));

        verify(reportRepository).save(report);
        assertThat(report.alert()).isTrue();
        assertThat(registry.get("quality_alerts_total").counter().count()).isEqualTo(1.0);
        assertThat(stored.getLastReport()).contains(report);
    }

    @Test
    void alertCounterIsRegisteredBeforeAnyAlert()
    {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        new QualityController(config, mock(TrialRepository.class), mock(ReportRepository.class), registry);

        assertThat(registry.get("quality_alerts_total").counter().count()).isZero();
    }

    private static int[] cleanValues()
    {
        return TrialFixtures.balancedBlocks(TRIALS, 10, 5L);
    }

    private static long[] regularTimestamps()
    {
        long[] timestamps = new long[TRIALS];
        for (int i = 0; i < TRIALS; i++) {
            timestamps[i] = i * 5L;
        }
        return timestamps;
    }

    private static List<Trial> trials(int[] values, long[] offsetsMs)
    {
        List<Trial> trials = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            trials.add(Trial.baseline(TrialFixtures.START.plusMillis(offsetsMs[i]), values[i], "quality", i));
        }
        return trials;
    }

    private static double[] values(List<Trial> trials)
    {
        return trials.stream().mapToDouble(Trial::value).toArray();
    }

    private static int[] repeat(int value, int count)
    {
        int[] values = new int[count];
        Arrays.fill(values, value);
        return values;
    }

    private static int[] concat(int[]... parts)
    {
        return Arrays.stream(parts).flatMapToInt(Arrays::stream).toArray();
    }

    private static AnomalyReportDTO anomaly(AnomalyType type, AnomalySeverity severity)
    {
        return new AnomalyReportDTO(type, severity, "test", 50.0, 1.0, 0, 1, TrialFixtures.START,
                TrialFixtures.START, 1);
    }
}
