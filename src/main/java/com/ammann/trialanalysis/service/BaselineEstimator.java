package com.ammann.trialanalysis.service;

import com.ammann.trialanalysis.config.AnalysisConfig;
import com.ammann.trialanalysis.dto.BaselineComparisonDTO;
import com.ammann.trialanalysis.dto.BaselineResultDTO;
import com.ammann.trialanalysis.dto.DriftAnalysisDTO;
import com.ammann.trialanalysis.dto.PeriodicPatternDTO;
import com.ammann.trialanalysis.enumeration.ChangeType;
import com.ammann.trialanalysis.enumeration.PeriodType;
import com.ammann.trialanalysis.enumeration.TrendDirection;
import com.ammann.trialanalysis.exception.ValidationException;
import com.ammann.trialanalysis.math.SeriesStatistics;
import com.ammann.trialanalysis.math.StatisticalMath;
import com.ammann.trialanalysis.model.IntervalSample;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import org.jboss.logging.Logger;

/**
 * Baseline estimation and long-horizon drift analysis.
 *
 * <p>A baseline is the fitted distribution of a reference window. Drift, periodicity and
 * comparisons work on sequences of baselines or interval means. Hour-of-day and day-of-week
 * grouping uses UTC.
 */
@ApplicationScoped
public class BaselineEstimator
{
    private static final Logger LOG = Logger.getLogger(BaselineEstimator.class);

    static final double CONFIDENCE_Z = 1.96;
    static final double STABLE_SLOPE = 0.001;
    static final double VARIANCE_CHANGE_RATIO = 0.1;
    static final double PERIODIC_CORRELATION = 0.3;
    static final int MIN_DRIFT_SAMPLES = 10;
    static final int MIN_PERIODIC_SAMPLES = 20;
    static final int MAX_PERIODIC_LAG = 50;
    static final int MIN_DRIFT_BASELINES = 5;
    static final int MIN_HOURLY_SAMPLES = 24;
    static final int MIN_DAILY_SAMPLES = 168;
    static final double MAX_F_STATISTIC = 1.0e6;
    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    static final String NO_CHANGE = "No significant changes detected";
    static final String BOTH_CHANGED = "Significant changes in both mean and variance detected";

    private final AnalysisConfig config;

    @Inject
    public BaselineEstimator(AnalysisConfig config)
    {
        this.config = config;
    }

    /**
     * Fits mean, sample variance, skewness, excess kurtosis and a 1.96·SE interval for the mean.
     *
     * @param values baseline window
     * @return baseline
     * @throws ValidationException if the window is empty
     */
    public BaselineResultDTO calculateBaseline(double[] values)
    {
        if (values == null || values.length == 0) {
            throw ValidationException.insufficientData("values for baseline", 1, 0);
        }
        int n = values.length;
        double mean = SeriesStatistics.mean(values);
        double variance = SeriesStatistics.sampleVariance(values);
        double std = Math.sqrt(variance);
        double margin = CONFIDENCE_Z * std / Math.sqrt(n);

        return new BaselineResultDTO(
                mean,
                variance,
                std,
                SeriesStatistics.skewness(values),
                SeriesStatistics.excessKurtosis(values),
                mean - margin,
                mean + margin,
                n,
                Instant.now());
    }

    public BaselineResultDTO calculateBaseline(int[] values)
    {
        double[] converted = new double[values == null ? 0 : values.length];
        for (int i = 0; i < converted.length; i++) {
            converted[i] = values[i];
        }
        return calculateBaseline(converted);
    }

    /**
     * Drift of interval means per hour: the per-interval regression slope scaled by intervals
     * per hour. Needs at least ten intervals, otherwise 0.
     */
    public double calculateLongTermDrift(List<IntervalSample> samples)
    {
        if (samples == null || samples.size() < MIN_DRIFT_SAMPLES) {
            return 0.0;
        }
        List<IntervalSample> sorted = sortedByTime(samples);
        int n = sorted.size();
        double[] index = new double[n];
        double[] means = new double[n];
        for (int i = 0; i < n; i++) {
            index[i] = i;
            means[i] = sorted.get(i).mean();
        }
        double slope = SeriesStatistics.linearFit(index, means).slope();
        double spanHours = hoursBetween(sorted.get(0).timestamp(), sorted.get(n - 1).timestamp());
        return StatisticalMath.safeDivide(slope * n, spanHours);
    }

    /**
     * Autocorrelation of interval means at lags 2..min(n/4, 50). Lags with |r| at most 0.3
     * contribute 0. Needs at least twenty intervals, otherwise an empty list.
     */
    public List<Double> detectPeriodicPatterns(List<IntervalSample> samples)
    {
        List<Double> patterns = new ArrayList<>();
        if (samples == null || samples.size() < MIN_PERIODIC_SAMPLES) {
            return patterns;
        }
        double[] means = sortedByTime(samples).stream().mapToDouble(IntervalSample::mean).toArray();
        int maxLag = Math.min(means.length / 4, MAX_PERIODIC_LAG);
        for (int lag = 2; lag <= maxLag; lag++) {
            double r = SeriesStatistics.autocorrelation(means, lag);
            patterns.add(Math.abs(r) > PERIODIC_CORRELATION ? r : 0.0);
        }
        return patterns;
    }

    /**
     * Regresses baseline means on elapsed hours. Needs at least five baselines, otherwise
     * the drift is stable with zero confidence.
     */
    public DriftAnalysisDTO analyzeDrift(List<BaselineResultDTO> baselines)
    {
        if (baselines == null || baselines.size() < MIN_DRIFT_BASELINES) {
            return DriftAnalysisDTO.stable();
        }
        List<BaselineResultDTO> sorted = new ArrayList<>(baselines);
        sorted.sort(Comparator.comparing(BaselineResultDTO::timestamp));

        int n = sorted.size();
        Instant origin = sorted.get(0).timestamp();
        double[] hours = new double[n];
        double[] means = new double[n];
        for (int i = 0; i < n; i++) {
            hours[i] = hoursBetween(origin, sorted.get(i).timestamp());
            means[i] = sorted.get(i).mean();
        }

        SeriesStatistics.LinearFit fit = SeriesStatistics.linearFit(hours, means);
        double slope = fit.slope();
        TrendDirection direction = TrendDirection.STABLE;
        if (Math.abs(slope) > STABLE_SLOPE) {
            direction = slope > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;
        }

        List<Integer> changePoints = new ArrayList<>();
        for (int i = 1; i < n - 1; i++) {
            double before = mean(means, 0, i);
            double after = mean(means, i, n);
            if (Math.abs(after - before) > config.changePointThreshold()) {
                changePoints.add(i);
            }
        }

        LOG.debugf("Baseline drift over %d baselines: slope=%.6f/h direction=%s changePoints=%d",
                n, slope, direction, changePoints.size());
        return new DriftAnalysisDTO(
                slope * (hours[n - 1] - hours[0]),
                slope,
                direction,
                fit.slopePValue(),
                changePoints,
                Math.abs(fit.correlation()) * 100);
    }

    /**
     * Hour-of-day patterns from 24 intervals on, day-of-week patterns from 168 on. Only
     * patterns whose confidence reaches the configured floor are returned.
     */
    public List<PeriodicPatternDTO> detectSeasonalPatterns(List<IntervalSample> samples)
    {
        List<PeriodicPatternDTO> patterns = new ArrayList<>();
        if (samples == null || samples.size() < MIN_HOURLY_SAMPLES) {
            return patterns;
        }
        List<IntervalSample> sorted = sortedByTime(samples);
        PeriodicPatternDTO hourly = periodicPattern(sorted, PeriodType.HOURLY);
        if (hourly != null) {
            patterns.add(hourly);
        }
        if (sorted.size() >= MIN_DAILY_SAMPLES) {
            PeriodicPatternDTO daily = periodicPattern(sorted, PeriodType.DAILY);
            if (daily != null) {
                patterns.add(daily);
            }
        }
        return patterns;
    }

    /**
     * Pooled-variance z-test of the means plus a relative variance check (more than 10%).
     */
    public BaselineComparisonDTO compareBaselines(BaselineResultDTO current, BaselineResultDTO reference)
    {
        int n1 = current.sampleSize();
        int n2 = reference.sampleSize();
        double pooledVariance = StatisticalMath.safeDivide(
                (n1 - 1) * current.variance() + (n2 - 1) * reference.variance(), n1 + n2 - 2);
        double standardError = Math.sqrt(pooledVariance * (1.0 / n1 + 1.0 / n2));
        double z = StatisticalMath.safeDivide(current.mean() - reference.mean(), standardError);
        double pValue = StatisticalMath.twoTailedNormalP(z);

        boolean meanChanged = pValue < config.significanceAlpha();
        boolean varianceChanged = Math.abs(StatisticalMath.safeDivide(
                current.variance() - reference.variance(), reference.variance())) > VARIANCE_CHANGE_RATIO;
        ChangeType changeType = ChangeType.of(meanChanged, varianceChanged);

        return new BaselineComparisonDTO(
                current,
                reference,
                changeType != ChangeType.NONE,
                changeType,
                z,
                pValue,
                comparisonRecommendation(changeType, current, reference));
    }

    static String comparisonRecommendation(
            ChangeType changeType, BaselineResultDTO current, BaselineResultDTO reference)
    {
        switch (changeType) {
            case MEAN:
                return String.format(Locale.ROOT, "Significant mean change detected (%.4f vs %.4f)",
                        current.mean(), reference.mean());
            case VARIANCE:
                return String.format(Locale.ROOT, "Significant variance change detected (%.4f vs %.4f)",
                        current.variance(), reference.variance());
            case BOTH:
                return BOTH_CHANGED;
            default:
                return NO_CHANGE;
        }
    }

    /** Between-group over within-group variance of interval means grouped by hour or weekday. */
    PeriodicPatternDTO periodicPattern(List<IntervalSample> samples, PeriodType period)
    {
        int groups = period.getGroups();
        List<List<Double>> grouped = new ArrayList<>(groups);
        for (int g = 0; g < groups; g++) {
            grouped.add(new ArrayList<>());
        }
        double[] means = new double[samples.size()];
        for (int i = 0; i < samples.size(); i++) {
            IntervalSample sample = samples.get(i);
            means[i] = sample.mean();
            ZonedDateTime time = sample.timestamp().atZone(ZoneOffset.UTC);
            int key = period == PeriodType.HOURLY ? time.getHour() : time.getDayOfWeek().getValue() % 7;
            grouped.get(key).add(sample.mean());
        }

        double seriesMean = SeriesStatistics.mean(means);
        double[] groupMeans = new double[groups];
        for (int g = 0; g < groups; g++) {
            List<Double> group = grouped.get(g);
            groupMeans[g] = group.isEmpty() ? seriesMean : group.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        }
        double overallMean = SeriesStatistics.mean(groupMeans);

        double sumSquares = 0.0;
        int peakGroup = 0;
        for (int g = 0; g < groups; g++) {
            double deviation = groupMeans[g] - overallMean;
            sumSquares += deviation * deviation;
            if (Math.abs(deviation) > Math.abs(groupMeans[peakGroup] - overallMean)) {
                peakGroup = g;
            }
        }
        double amplitude = Math.sqrt(sumSquares / groups);
        double phase = peakGroup * 2 * Math.PI / groups;

        double between = 0.0;
        double within = 0.0;
        for (int g = 0; g < groups; g++) {
            List<Double> group = grouped.get(g);
            if (group.isEmpty()) {
                continue;
            }
            double groupMean = groupMeans[g];
            between += (groupMean - overallMean) * (groupMean - overallMean);
            for (double value : group) {
                within += (value - groupMean) * (value - groupMean);
            }
        }

        int dfWithin = samples.size() - groups;
        double f;
        if (dfWithin <= 0) {
            // one sample per group leaves no within-group variance to test against
            f = 0.0;
        } else if (within == 0.0) {
            f = between > 0.0 ? MAX_F_STATISTIC : 0.0;
        } else {
            f = Math.min(MAX_F_STATISTIC, between / (within / dfWithin));
        }
        double confidence = f > 2 ? Math.min(95.0, f * 10) : 0.0;
        if (confidence < config.periodicConfidenceFloor() || confidence == 0.0) {
            return null;
        }
        return new PeriodicPatternDTO(period, 1.0 / groups, amplitude, phase, f, confidence);
    }

    private static List<IntervalSample> sortedByTime(List<IntervalSample> samples)
    {
        List<IntervalSample> sorted = new ArrayList<>(samples);
        sorted.sort(Comparator.comparing(IntervalSample::timestamp));
        return sorted;
    }

    private static double hoursBetween(Instant start, Instant end)
    {
        return (end.toEpochMilli() - start.toEpochMilli()) / MILLIS_PER_HOUR;
    }

    private static double mean(double[] values, int from, int to)
    {
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }
}
