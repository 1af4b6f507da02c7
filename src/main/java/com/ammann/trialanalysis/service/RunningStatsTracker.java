/* (C)2026 */
package com.ammann.trialanalysis.service;

import com.ammann.trialanalysis.config.AnalysisConfig;
import com.ammann.trialanalysis.dto.RealtimeSignificanceDTO;
import com.ammann.trialanalysis.enumeration.SignificanceLevel;
import com.ammann.trialanalysis.exception.ValidationException;
import com.ammann.trialanalysis.math.StatisticalMath;
import com.ammann.trialanalysis.model.RunningStats;
import com.ammann.trialanalysis.model.Trial;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Incremental O(1) statistics over a trial stream.
 *
 * <p>Each stream or session owns its own {@link RunningStats}; this bean holds no
 * per-stream state. Updates must be applied by a single writer in trial order.
 */
@ApplicationScoped
public class RunningStatsTracker {

    private static final Logger LOG = Logger.getLogger(RunningStatsTracker.class);

    private final AnalysisConfig config;

    @Inject
    public RunningStatsTracker(AnalysisConfig config) {
        this.config = config;
    }

    /** Creates an empty aggregate for a new stream. */
    public RunningStats newStats() {
        return new RunningStats(config.bitsPerTrial());
    }

    /**
     * Folds one trial into the aggregate.
     *
     * @param stats aggregate owned by the caller's stream
     * @param trial next trial, not older than the last one applied
     * @return the same aggregate instance, updated
     * @throws ValidationException if the value is outside [0, N] or the trial is out of order
     */
    public RunningStats update(RunningStats stats, Trial trial) {
        int value = trial.value();
        if (value < 0 || value > stats.getBitsPerTrial()) {
            throw ValidationException.invalidParameter(
                    "trial.value", value, "a value in [0, " + stats.getBitsPerTrial() + "]");
        }
        if (stats.getLastUpdated() != null && trial.timestamp().isBefore(stats.getLastUpdated())) {
            throw ValidationException.invalidParameter(
                    "trial.timestamp", trial.timestamp(), "not before " + stats.getLastUpdated());
        }
        stats.accept(value, trial.timestamp(), stats.getBitsPerTrial() / 2.0);
        return stats;
    }

    /** Applies a batch of trials in order. */
    public RunningStats updateAll(RunningStats stats, List<Trial> trials) {
        for (Trial trial : trials) {
            update(stats, trial);
        }
        LOG.debugf("Running stats after batch of %d: %s", trials.size(), stats);
        return stats;
    }

    /**
     * Significance of the cumulative deviation accumulated so far.
     *
     * <p>An empty aggregate yields z = 0, p = 1.
     */
    public RealtimeSignificanceDTO currentSignificance(RunningStats stats) {
        long n = stats.getCount();
        if (n == 0) {
            return new RealtimeSignificanceDTO(0, 0.0, 1.0, SignificanceLevel.NONE, 0.0, 0.0);
        }
        double expectedVariance = stats.getBitsPerTrial() / 4.0;
        double z = StatisticalMath.safeDivide(stats.getCumulativeDeviation(), Math.sqrt(expectedVariance * n));
        double p = StatisticalMath.twoTailedNormalP(z);
        double d = (stats.getMean() - stats.getBitsPerTrial() / 2.0) / Math.sqrt(expectedVariance);
        double power = EffectSizeCalculator.observedPower(d, n, config.significanceAlpha());
        return new RealtimeSignificanceDTO(n, z, p, SignificanceLevel.fromPValue(p), d, power);
    }
}
