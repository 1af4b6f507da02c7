package com.ammann.trialanalysis.service;

import com.ammann.trialanalysis.config.AnalysisConfig;
import com.ammann.trialanalysis.config.QualityThresholds;
import com.ammann.trialanalysis.dto.AnomalyReportDTO;
import com.ammann.trialanalysis.dto.DataIntegrityDTO;
import com.ammann.trialanalysis.dto.QualityMetricDTO;
import com.ammann.trialanalysis.dto.QualityReportDTO;
import com.ammann.trialanalysis.enumeration.AnomalySeverity;
import com.ammann.trialanalysis.enumeration.AnomalyType;
import com.ammann.trialanalysis.enumeration.QualityVerdict;
import com.ammann.trialanalysis.math.SeriesStatistics;
import com.ammann.trialanalysis.math.StatisticalMath;
import com.ammann.trialanalysis.model.Trial;
import com.ammann.trialanalysis.port.ReportRepository;
import com.ammann.trialanalysis.port.TrialRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.jboss.logging.Logger;

/**
 * Quality assessment of recent trial batches.
 *
 * <p>Six sub-detectors (bias, pattern, correlation, outlier, missing data, timing) produce
 * anomalies; five metrics (bias, variance, autocorrelation, entropy, timing) are banded
 * against their thresholds. The score starts at 100 and loses a fixed penalty per metric
 * status and per anomaly severity.
 *
 * <p>Assessment never mutates its input and may run while a calibration is active.
 */
@ApplicationScoped
public class QualityController
{
    private static final Logger LOG = Logger.getLogger(QualityController.class);

    static final double MAX_SCORE = 100.0;
    static final int MAX_CORRELATION_LAG = 100;
    static final double HIGH_CORRELATION = 0.2;
    static final double HIGH_OUTLIER_Z = 5.0;
    static final double HIGH_TIMING_CV = 0.2;
    static final long HIGH_MISSING_TRIALS = 100;
    static final long CRITICAL_MISSING_TRIALS = 1000;
    static final String CRITICAL_RECOMMENDATION =
            "Critical anomalies detected - immediate investigation required";
    static final String ACCEPTABLE_RECOMMENDATION = "Data quality is acceptable - continue monitoring";

    private final AnalysisConfig config;
    private final TrialRepository trialRepository;
    private final ReportRepository reportRepository;
    private final MeterRegistry meterRegistry;

    private final AtomicReference<QualityReportDTO> lastReport = new AtomicReference<>();
    private volatile Counter alertCounter;

    @Inject
    public QualityController(AnalysisConfig config,
                             TrialRepository trialRepository,
                             ReportRepository reportRepository,
                             MeterRegistry meterRegistry)
    {
        this.config = config;
        this.trialRepository = trialRepository;
        this.reportRepository = reportRepository;
        this.meterRegistry = meterRegistry;
        initMetrics();
    }

    /** Constructor for pure assessment without storage or metrics. */
    public QualityController(AnalysisConfig config)
    {
        this(config, null, null, null);
    }

    @PostConstruct
    void initMetrics()
    {
        if (meterRegistry != null && alertCounter == null) {
            alertCounter = Counter.builder("quality_alerts_total")
                    .description("Count of quality reports that raised an alert")
                    .register(meterRegistry);
        }
    }

    /**
     * Loads the trials of the last {@code window}, assesses them and stores the report.
     *
     * @param window how far back to look
     * @return the stored report
     */
    public QualityReportDTO assessRecent(Duration window)
    {
        Instant end = Instant.now();
        List<Trial> trials = trialRepository.findInTimeWindow(end.minus(window), end);
        QualityReportDTO report = assess(trials);

        reportRepository.save(report);
        if (report.alert()) {
            if (alertCounter != null) {
                alertCounter.increment();
            }
            LOG.warnf("Quality alert: verdict=%s score=%.1f critical=%d high=%d over %d trials",
                    report.verdict(), report.score(),
                    report.countBySeverity(AnomalySeverity.CRITICAL),
                    report.countBySeverity(AnomalySeverity.HIGH),
                    report.sampleSize());
        }
        return report;
    }

    /**
     * Assesses one batch. An empty batch yields {@link QualityReportDTO#empty(Instant)}.
     *
     * @param trials batch in timestamp order
     * @return quality report
     */
    public QualityReportDTO assess(List<Trial> trials)
    {
        if (trials == null || trials.isEmpty()) {
            LOG.warn("Cannot assess quality of an empty trial batch");
            QualityReportDTO empty = QualityReportDTO.empty(Instant.now());
            lastReport.set(empty);
            return empty;
        }

        QualityThresholds thresholds = config.quality();
        double[] values = values(trials);
        double[] intervals = intervalsMs(trials);

        List<QualityMetricDTO> metrics = calculateMetrics(values, intervals, thresholds);

        List<AnomalyReportDTO> anomalies = new ArrayList<>();
        anomalies.addAll(detectBias(trials, values, thresholds));
        anomalies.addAll(detectPatterns(trials, values, thresholds));
        anomalies.addAll(detectCorrelation(trials, values, thresholds));
        anomalies.addAll(detectOutliers(trials, intervals, thresholds));
        anomalies.addAll(detectMissingData(trials, intervals, thresholds));
        anomalies.addAll(detectTimingVariability(trials, intervals, thresholds));

        double score = calculateScore(metrics, anomalies);
        boolean anyCritical = anomalies.stream().anyMatch(a -> a.severity() == AnomalySeverity.CRITICAL);
        boolean anyHigh = anomalies.stream().anyMatch(a -> a.severity() == AnomalySeverity.HIGH);
        QualityVerdict verdict = QualityVerdict.evaluate(score, anyCritical, anyHigh);

        QualityReportDTO report = new QualityReportDTO(
                score,
                verdict,
                trials.size(),
                trials.get(0).timestamp(),
                trials.get(trials.size() - 1).timestamp(),
                metrics,
                anomalies,
                checkIntegrity(trials, intervals, thresholds),
                recommendations(anomalies, anyCritical),
                verdict == QualityVerdict.FAIL || anyCritical,
                Instant.now());

        LOG.infof("Quality assessment: %d trials, %d anomalies, score=%.1f, verdict=%s",
                trials.size(), anomalies.size(), score, verdict);
        lastReport.set(report);
        return report;
    }

    /** Most recent report produced by this controller, if any. */
    public Optional<QualityReportDTO> getLastReport()
    {
        return Optional.ofNullable(lastReport.get());
    }

    List<QualityMetricDTO> calculateMetrics(double[] values, double[] intervals, QualityThresholds thresholds)
    {
        int n = values.length;
        int bitsPerTrial = config.bitsPerTrial();
        double mean = SeriesStatistics.mean(values);
        List<QualityMetricDTO> metrics = new ArrayList<>();

        double bias = Math.abs(mean / bitsPerTrial - 0.5);
        metrics.add(QualityMetricDTO.lowerIsBetter(
                "bias", bias, thresholds.bias(),
                String.format(Locale.ROOT, "Mean proportion deviates %.4f from 0.5", bias)));

        if (n >= 2) {
            double varianceDeviation =
                    Math.abs(SeriesStatistics.sampleVariance(values) / config.expectedVariance() - 1.0);
            metrics.add(QualityMetricDTO.lowerIsBetter(
                    "variance", varianceDeviation, thresholds.variance(),
                    String.format(Locale.ROOT, "Variance deviates %.1f%% from N/4", varianceDeviation * 100)));

            double lag1 = Math.abs(SeriesStatistics.autocorrelation(values, 1));
            metrics.add(QualityMetricDTO.lowerIsBetter(
                    "autocorrelation", lag1, thresholds.autocorrelation(),
                    String.format(Locale.ROOT, "Lag-1 autocorrelation %.4f", lag1)));
        }

        double entropy = StatisticalMath.binaryEntropy(mean / bitsPerTrial);
        metrics.add(QualityMetricDTO.higherIsBetter(
                "entropy", entropy, thresholds.entropy(),
                String.format(Locale.ROOT, "Draw entropy %.4f bits", entropy)));

        if (intervals.length >= 2) {
            double cv = coefficientOfVariation(intervals);
            metrics.add(QualityMetricDTO.lowerIsBetter(
                    "timing", cv, thresholds.timingDeviation(),
                    String.format(Locale.ROOT, "Interval coefficient of variation %.4f", cv)));
        }
        return metrics;
    }

    /** Sliding windows stepped at half their size; each window beyond the threshold is one anomaly. */
    List<AnomalyReportDTO> detectBias(List<Trial> trials, double[] values, QualityThresholds thresholds)
    {
        List<AnomalyReportDTO> anomalies = new ArrayList<>();
        int window = Math.min(thresholds.biasWindow(), values.length);
        int step = Math.max(1, window / 2);
        double bitsPerTrial = config.bitsPerTrial();

        for (int start = 0; start + window <= values.length; start += step) {
            double sum = 0.0;
            for (int i = start; i < start + window; i++) {
                sum += values[i];
            }
            double bias = Math.abs(sum / window / bitsPerTrial - 0.5);
            if (bias <= thresholds.bias()) {
                continue;
            }
            AnomalySeverity severity;
            if (bias > thresholds.bias() * 4) {
                severity = AnomalySeverity.CRITICAL;
            } else if (bias > thresholds.bias() * 2) {
                severity = AnomalySeverity.HIGH;
            } else {
                severity = AnomalySeverity.MEDIUM;
            }
            int end = start + window - 1;
            anomalies.add(new AnomalyReportDTO(
                    AnomalyType.BIAS,
                    severity,
                    String.format(Locale.ROOT, "Window bias %.4f exceeds %.4f", bias, thresholds.bias()),
                    Math.min(95.0, bias * 1000),
                    bias,
                    start,
                    end,
                    trials.get(start).timestamp(),
                    trials.get(end).timestamp(),
                    window));
        }
        return anomalies;
    }

    /** Runs of consecutive trials on the same side of N/2. A trial at exactly N/2 ends a run. */
    List<AnomalyReportDTO> detectPatterns(List<Trial> trials, double[] values, QualityThresholds thresholds)
    {
        List<AnomalyReportDTO> anomalies = new ArrayList<>();
        double expectedMean = config.expectedMean();
        int runStart = 0;
        int runSide = 0;

        for (int i = 0; i <= values.length; i++) {
            int side = i < values.length ? (int) Math.signum(values[i] - expectedMean) : 0;
            if (i < values.length && side == runSide && side != 0) {
                continue;
            }
            int runLength = i - runStart;
            if (runSide != 0 && runLength > thresholds.patternRunCutoff()) {
                AnomalySeverity severity = runLength > thresholds.patternRunSevereCutoff()
                        ? AnomalySeverity.HIGH
                        : AnomalySeverity.MEDIUM;
                anomalies.add(new AnomalyReportDTO(
                        AnomalyType.PATTERN,
                        severity,
                        String.format("Run of %d trials %s the expected mean",
                                runLength, runSide > 0 ? "above" : "below"),
                        Math.min(95.0, runLength * 2.0),
                        runLength,
                        runStart,
                        i - 1,
                        trials.get(runStart).timestamp(),
                        trials.get(i - 1).timestamp(),
                        runLength));
            }
            runStart = i;
            runSide = side;
        }
        return anomalies;
    }

    List<AnomalyReportDTO> detectCorrelation(List<Trial> trials, double[] values, QualityThresholds thresholds)
    {
        List<AnomalyReportDTO> anomalies = new ArrayList<>();
        int maxLag = Math.min(MAX_CORRELATION_LAG, values.length / 10);
        int last = values.length - 1;

        for (int lag = 1; lag <= maxLag; lag++) {
            double r = SeriesStatistics.autocorrelation(values, lag);
            if (Math.abs(r) <= thresholds.autocorrelation()) {
                continue;
            }
            anomalies.add(new AnomalyReportDTO(
                    AnomalyType.CORRELATION,
                    Math.abs(r) > HIGH_CORRELATION ? AnomalySeverity.HIGH : AnomalySeverity.MEDIUM,
                    String.format(Locale.ROOT, "Autocorrelation %.4f at lag %d", r, lag),
                    Math.min(95.0, Math.abs(r) * 500),
                    r,
                    0,
                    last,
                    trials.get(0).timestamp(),
                    trials.get(last).timestamp(),
                    values.length));
        }
        return anomalies;
    }

    /** Z-scores of inter-trial intervals. Interval i lies between trials i and i + 1. */
    List<AnomalyReportDTO> detectOutliers(List<Trial> trials, double[] intervals, QualityThresholds thresholds)
    {
        List<AnomalyReportDTO> anomalies = new ArrayList<>();
        if (intervals.length < 2) {
            return anomalies;
        }
        double mean = SeriesStatistics.mean(intervals);
        double std = Math.sqrt(SeriesStatistics.sampleVariance(intervals));
        if (std == 0.0) {
            return anomalies;
        }

        for (int i = 0; i < intervals.length; i++) {
            double z = Math.abs(intervals[i] - mean) / std;
            if (z <= thresholds.outlier()) {
                continue;
            }
            anomalies.add(new AnomalyReportDTO(
                    AnomalyType.OUTLIER,
                    z > HIGH_OUTLIER_Z ? AnomalySeverity.HIGH : AnomalySeverity.MEDIUM,
                    String.format(Locale.ROOT, "Interval of %.1f ms is %.1f sigma from the mean", intervals[i], z),
                    Math.min(95.0, z * 15),
                    z,
                    i,
                    i + 1,
                    trials.get(i).timestamp(),
                    trials.get(i + 1).timestamp(),
                    1));
        }
        return anomalies;
    }

    List<AnomalyReportDTO> detectMissingData(List<Trial> trials, double[] intervals, QualityThresholds thresholds)
    {
        List<AnomalyReportDTO> anomalies = new ArrayList<>();
        double expected = thresholds.expectedIntervalMs();
        double maxGap = expected * thresholds.missingGapMultiplier();

        for (int i = 0; i < intervals.length; i++) {
            if (intervals[i] <= maxGap) {
                continue;
            }
            long missed = (long) Math.floor(intervals[i] / expected) - 1;
            AnomalySeverity severity;
            if (missed > CRITICAL_MISSING_TRIALS) {
                severity = AnomalySeverity.CRITICAL;
            } else if (missed > HIGH_MISSING_TRIALS) {
                severity = AnomalySeverity.HIGH;
            } else {
                severity = AnomalySeverity.MEDIUM;
            }
            anomalies.add(new AnomalyReportDTO(
                    AnomalyType.MISSING_DATA,
                    severity,
                    String.format(Locale.ROOT, "Gap of %.1f ms, about %d trials missing", intervals[i], missed),
                    90.0,
                    intervals[i],
                    i,
                    i + 1,
                    trials.get(i).timestamp(),
                    trials.get(i + 1).timestamp(),
                    missed));
        }
        return anomalies;
    }

    List<AnomalyReportDTO> detectTimingVariability(
            List<Trial> trials, double[] intervals, QualityThresholds thresholds)
    {
        if (intervals.length < 2) {
            return List.of();
        }
        double cv = coefficientOfVariation(intervals);
        if (cv <= thresholds.timingDeviation()) {
            return List.of();
        }
        int last = trials.size() - 1;
        return List.of(new AnomalyReportDTO(
                AnomalyType.TIMING,
                cv > HIGH_TIMING_CV ? AnomalySeverity.HIGH : AnomalySeverity.MEDIUM,
                String.format(Locale.ROOT, "Interval coefficient of variation %.4f exceeds %.4f",
                        cv, thresholds.timingDeviation()),
                Math.min(95.0, cv * 300),
                cv,
                0,
                last,
                trials.get(0).timestamp(),
                trials.get(last).timestamp(),
                trials.size()));
    }

    DataIntegrityDTO checkIntegrity(List<Trial> trials, double[] intervals, QualityThresholds thresholds)
    {
        int n = trials.size();
        int bitsPerTrial = config.bitsPerTrial();

        long validValues = trials.stream().filter(t -> t.value() >= 0 && t.value() <= bitsPerTrial).count();

        long missing = 0;
        long duplicates = 0;
        long ordered = 0;
        for (int i = 1; i < n; i++) {
            long step = trials.get(i).sequenceNumber() - trials.get(i - 1).sequenceNumber();
            if (step == 0) {
                duplicates++;
            }
            if (step > 1) {
                missing += step - 1;
            }
            if (step >= 0) {
                ordered++;
            }
        }

        double maxGap = thresholds.expectedIntervalMs() * thresholds.missingGapMultiplier();
        long consistentIntervals = 0;
        for (double interval : intervals) {
            if (interval >= 0 && interval <= maxGap) {
                consistentIntervals++;
            }
        }

        return DataIntegrityDTO.create(
                (double) n / (n + missing),
                intervals.length == 0 ? 1.0 : (double) consistentIntervals / intervals.length,
                (double) validValues / n,
                n < 2 ? 1.0 : (double) ordered / (n - 1),
                missing,
                duplicates);
    }

    static double calculateScore(List<QualityMetricDTO> metrics, List<AnomalyReportDTO> anomalies)
    {
        double score = MAX_SCORE;
        for (QualityMetricDTO metric : metrics) {
            score -= metric.status().getPenalty();
        }
        for (AnomalyReportDTO anomaly : anomalies) {
            score -= anomaly.severity().getPenalty();
        }
        return Math.max(0.0, Math.min(MAX_SCORE, score));
    }

    static List<String> recommendations(List<AnomalyReportDTO> anomalies, boolean anyCritical)
    {
        Map<AnomalyType, Integer> counts = new EnumMap<>(AnomalyType.class);
        for (AnomalyReportDTO anomaly : anomalies) {
            counts.merge(anomaly.type(), 1, Integer::sum);
        }

        List<String> recommendations = new ArrayList<>();
        counts.forEach((type, count) -> recommendations.add(String.format(
                "Address %s issues: %d anomalies detected",
                type.name().toLowerCase(Locale.ROOT).replace('_', ' '), count)));
        if (anyCritical) {
            recommendations.add(CRITICAL_RECOMMENDATION);
        }
        if (recommendations.isEmpty()) {
            recommendations.add(ACCEPTABLE_RECOMMENDATION);
        }
        return recommendations;
    }

    private static double coefficientOfVariation(double[] intervals)
    {
        double mean = SeriesStatistics.mean(intervals);
        return StatisticalMath.safeDivide(Math.sqrt(SeriesStatistics.sampleVariance(intervals)), mean);
    }

    private static double[] values(List<Trial> trials)
    {
        double[] values = new double[trials.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = trials.get(i).value();
        }
        return values;
    }

    private static double[] intervalsMs(List<Trial> trials)
    {
        if (trials.size() < 2) {
            return new double[0];
        }
        double[] intervals = new double[trials.size() - 1];
        for (int i = 1; i < trials.size(); i++) {
            intervals[i - 1] = (trials.get(i).timestamp().toEpochMilli()
                    - trials.get(i - 1).timestamp().toEpochMilli());
        }
        return intervals;
    }
}
