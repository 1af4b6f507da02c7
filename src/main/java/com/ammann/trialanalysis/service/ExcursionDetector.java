/* (C)2026 */
package com.ammann.trialanalysis.service;

import com.ammann.trialanalysis.config.AnalysisConfig;
import com.ammann.trialanalysis.dto.CumulativePointDTO;
import com.ammann.trialanalysis.dto.CumulativeResultDTO;
import com.ammann.trialanalysis.dto.ExcursionPeriodDTO;
import com.ammann.trialanalysis.math.StatisticalMath;
import com.ammann.trialanalysis.model.Trial;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Cumulative deviation series and the excursions of its Z-score.
 *
 * <p>Runs continuously over possibly-empty recent windows, so an empty window yields an
 * empty result instead of an error.
 */
@ApplicationScoped
public class ExcursionDetector {

    private static final Logger LOG = Logger.getLogger(ExcursionDetector.class);

    private final AnalysisConfig config;

    @Inject
    public ExcursionDetector(AnalysisConfig config) {
        this.config = config;
    }

    /**
     * Builds the cumulative series with Z = cumulativeDeviation / sqrt(N/4 · n) and detects
     * excursions at the configured threshold and minimum duration.
     *
     * @param trials window in trial order, may be empty
     * @return cumulative result
     */
    public CumulativeResultDTO analyze(List<Trial> trials) {
        if (trials == null || trials.isEmpty()) {
            return CumulativeResultDTO.empty(Instant.now());
        }

        int n = trials.size();
        double expectedMean = config.expectedMean();
        double expectedVariance = config.expectedVariance();

        List<CumulativePointDTO> points = new ArrayList<>(n);
        double[] zScores = new double[n];
        Instant[] timestamps = new Instant[n];

        double cumulative = 0.0;
        double sum = 0.0;
        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        int crossings = 0;
        int lastSign = 0;

        for (int i = 0; i < n; i++) {
            Trial trial = trials.get(i);
            cumulative += trial.value() - expectedMean;
            sum += trial.value();
            double z = StatisticalMath.safeDivide(cumulative, Math.sqrt(expectedVariance * (i + 1)));

            zScores[i] = z;
            timestamps[i] = trial.timestamp();
            points.add(new CumulativePointDTO(i, trial.timestamp(), cumulative, sum / (i + 1), z));

            max = Math.max(max, cumulative);
            min = Math.min(min, cumulative);
            int sign = (int) Math.signum(cumulative);
            if (sign != 0) {
                if (lastSign != 0 && sign != lastSign) {
                    crossings++;
                }
                lastSign = sign;
            }
        }

        List<ExcursionPeriodDTO> excursions = detectExcursions(zScores, timestamps);
        LOG.debugf("Cumulative deviation over %d trials: final=%.2f crossings=%d excursions=%d",
                n, cumulative, crossings, excursions.size());
        return new CumulativeResultDTO(points, cumulative, max, min, crossings, excursions, Instant.now());
    }

    /**
     * Scans a Z-score series for excursions.
     *
     * <p>An excursion starts when |Z| exceeds the threshold and ends at the first point where
     * the sign flips or |Z| falls below the threshold; that point may start the next
     * excursion. Excursions shorter than the minimum duration are dropped. An excursion still
     * open at the end of the series is kept when it already meets the minimum.
     *
     * @param zScores Z-score per trial
     * @param timestamps timestamp per trial, same length
     * @return recorded excursions in order
     */
    public List<ExcursionPeriodDTO> detectExcursions(double[] zScores, Instant[] timestamps) {
        double threshold = config.excursionThreshold();
        int minDuration = config.excursionMinDuration();
        List<ExcursionPeriodDTO> excursions = new ArrayList<>();

        boolean active = false;
        int start = 0;
        int sign = 0;
        double peak = 0.0;

        for (int i = 0; i < zScores.length; i++) {
            double z = zScores[i];
            double magnitude = Math.abs(z);

            if (active && ((int) Math.signum(z) != sign || magnitude < threshold)) {
                record(excursions, start, i - 1, sign, peak, timestamps, minDuration);
                active = false;
            }

            if (active) {
                peak = Math.max(peak, magnitude);
            } else if (magnitude > threshold) {
                active = true;
                start = i;
                sign = (int) Math.signum(z);
                peak = magnitude;
            }
        }

        if (active) {
            record(excursions, start, zScores.length - 1, sign, peak, timestamps, minDuration);
        }
        return excursions;
    }

    private static void record(
            List<ExcursionPeriodDTO> excursions,
            int start,
            int end,
            int sign,
            double peak,
            Instant[] timestamps,
            int minDuration) {
        int duration = end - start + 1;
        if (duration < minDuration) {
            return;
        }
        excursions.add(ExcursionPeriodDTO.create(
                start,
                end,
                timestamps[start],
                timestamps[end],
                peak * sign,
                duration,
                StatisticalMath.oneTailedNormalP(peak)));
    }
}
