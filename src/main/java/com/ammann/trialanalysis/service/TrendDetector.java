/* (C)2026 */
package com.ammann.trialanalysis.service;

import com.ammann.trialanalysis.config.AnalysisConfig;
import com.ammann.trialanalysis.dto.ChangePointDTO;
import com.ammann.trialanalysis.dto.TrendResultDTO;
import com.ammann.trialanalysis.enumeration.TrendDirection;
import com.ammann.trialanalysis.math.SeriesStatistics;
import com.ammann.trialanalysis.model.Trial;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Linear trend and change points of windowed mean deviations.
 *
 * <p>Windows have the configured size and are stepped at a quarter of it. Each window
 * contributes its mean deviation from N/2 at its mean timestamp.
 */
@ApplicationScoped
public class TrendDetector {

    private static final Logger LOG = Logger.getLogger(TrendDetector.class);

    static final int MIN_WINDOWS = 3;
    static final int MIN_CHANGE_POINT_VALUES = 10;
    static final double CUSUM_THRESHOLD_SIGMAS = 2.0;
    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    private final AnalysisConfig config;

    @Inject
    public TrendDetector(AnalysisConfig config) {
        this.config = config;
    }

    /**
     * Fits mean deviation against elapsed hours and tests the slope with a two-sided t-test
     * (df = windows − 2). Fewer than three windows yield a stable trend with slope 0.
     *
     * @param trials window in trial order
     * @return trend report
     */
    public TrendResultDTO analyze(List<Trial> trials) {
        int windowSize = config.trendWindowSize();
        int step = Math.max(1, windowSize / 4);
        List<double[]> windows = windowMeans(trials, windowSize, step);

        if (windows.size() < MIN_WINDOWS) {
            LOG.debugf("Trend needs %d windows, got %d", MIN_WINDOWS, windows.size());
            return TrendResultDTO.stable(windows.size(), Instant.now());
        }

        int count = windows.size();
        double origin = windows.get(0)[0];
        double[] hours = new double[count];
        double[] means = new double[count];
        Instant[] timestamps = new Instant[count];
        for (int i = 0; i < count; i++) {
            double[] window = windows.get(i);
            hours[i] = (window[0] - origin) / MILLIS_PER_HOUR;
            means[i] = window[1];
            timestamps[i] = Instant.ofEpochMilli((long) window[0]);
        }

        SeriesStatistics.LinearFit fit = SeriesStatistics.linearFit(hours, means);
        double pValue = fit.slopePValue();
        TrendDirection direction = TrendDirection.STABLE;
        if (pValue < config.trendAlpha() && fit.slope() != 0.0) {
            direction = fit.slope() > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;
        }

        List<ChangePointDTO> changePoints = detectChangePoints(means, timestamps);
        LOG.debugf("Trend over %d windows: slope=%.5f/h p=%.4f direction=%s changePoints=%d",
                count, fit.slope(), pValue, direction, changePoints.size());
        return new TrendResultDTO(
                fit.slope(), pValue, fit.correlation(), direction, count, changePoints, Instant.now());
    }

    /**
     * CUSUM scan: accumulates value − overall mean, tracks the running extrema and emits a
     * change point at the most recent extremum whenever |sum| exceeds 2σ, then resets.
     *
     * @param values series, at least ten values for any change point to be reported
     * @param timestamps timestamp per value
     * @return change points in order
     */
    public List<ChangePointDTO> detectChangePoints(double[] values, Instant[] timestamps) {
        List<ChangePointDTO> changePoints = new ArrayList<>();
        if (values.length < MIN_CHANGE_POINT_VALUES) {
            return changePoints;
        }

        double mean = SeriesStatistics.mean(values);
        double std = Math.sqrt(SeriesStatistics.sampleVariance(values));
        if (std == 0.0) {
            return changePoints;
        }
        double threshold = CUSUM_THRESHOLD_SIGMAS * std;

        double sum = 0.0;
        double maxSum = 0.0;
        double minSum = 0.0;
        int maxIndex = 0;
        int minIndex = 0;

        for (int i = 0; i < values.length; i++) {
            sum += values[i] - mean;
            if (sum > maxSum) {
                maxSum = sum;
                maxIndex = i;
            }
            if (sum < minSum) {
                minSum = sum;
                minIndex = i;
            }

            if (Math.abs(sum) > threshold) {
                int index = sum > 0 ? maxIndex : minIndex;
                double magnitude = Math.abs(sum) / std;
                changePoints.add(new ChangePointDTO(index, timestamps[index], Math.min(0.99, magnitude / 5.0), magnitude));
                sum = 0.0;
                maxSum = 0.0;
                minSum = 0.0;
                maxIndex = i;
                minIndex = i;
            }
        }
        return changePoints;
    }

    /** Each element is {mean epoch millis, mean deviation}. */
    private List<double[]> windowMeans(List<Trial> trials, int windowSize, int step) {
        List<double[]> windows = new ArrayList<>();
        if (trials == null) {
            return windows;
        }
        double expectedMean = config.expectedMean();
        for (int start = 0; start + windowSize <= trials.size(); start += step) {
            double valueSum = 0.0;
            double timeSum = 0.0;
            for (int i = start; i < start + windowSize; i++) {
                Trial trial = trials.get(i);
                valueSum += trial.value();
                timeSum += trial.timestamp().toEpochMilli();
            }
            windows.add(new double[] {timeSum / windowSize, valueSum / windowSize - expectedMean});
        }
        return windows;
    }
}
