/* (C)2026 */
package com.ammann.trialanalysis.service;

import com.ammann.trialanalysis.config.AnalysisConfig;
import com.ammann.trialanalysis.dto.NetworkVarianceResultDTO;
import com.ammann.trialanalysis.dto.ZScoreResultDTO;
import com.ammann.trialanalysis.enumeration.SignificanceLevel;
import com.ammann.trialanalysis.exception.ValidationException;
import com.ammann.trialanalysis.math.StatisticalMath;
import com.ammann.trialanalysis.model.Trial;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Aggregate significance of a trial window against the unbiased null.
 *
 * <p>Network variance sums the squared per-trial Z-scores; under the null it is chi-square
 * distributed with one degree of freedom per trial. The z-test compares the window mean
 * with N/2.
 */
@ApplicationScoped
public class NetworkVarianceAnalyzer {

    private static final Logger LOG = Logger.getLogger(NetworkVarianceAnalyzer.class);

    static final double CONFIDENCE_LEVEL = 0.95;

    private final AnalysisConfig config;

    @Inject
    public NetworkVarianceAnalyzer(AnalysisConfig config) {
        this.config = config;
    }

    /**
     * Computes netvar = Σ ((value − N/2) / sqrt(N/4))² with df = n.
     *
     * @param trials non-empty window
     * @return network variance report
     * @throws ValidationException if the window is empty
     */
    public NetworkVarianceResultDTO analyze(List<Trial> trials) {
        requireTrials(trials, "network variance");

        double expectedMean = config.expectedMean();
        double expectedVariance = config.expectedVariance();
        double netvar = 0.0;
        for (Trial trial : trials) {
            double deviation = trial.value() - expectedMean;
            netvar += deviation * deviation / expectedVariance;
        }

        int df = trials.size();
        double pValue = StatisticalMath.chiSquarePValue(netvar, df);
        double tail = (1.0 - CONFIDENCE_LEVEL) / 2.0;
        double lower = StatisticalMath.chiSquareInverse(tail, df);
        double upper = StatisticalMath.chiSquareInverse(1.0 - tail, df);

        NetworkVarianceResultDTO result =
                NetworkVarianceResultDTO.create(netvar, df, pValue, lower, upper, Instant.now());
        LOG.debugf("Network variance: netvar=%.3f df=%d p=%.5f (%s)", netvar, df, pValue, result.significance());
        return result;
    }

    /**
     * Z-test of the window mean: z = (mean − N/2) / (sqrt(N/4) / sqrt(n)).
     *
     * @param trials non-empty window
     * @return z-score report with a 95% interval for the mean
     * @throws ValidationException if the window is empty
     */
    public ZScoreResultDTO zScore(List<Trial> trials) {
        requireTrials(trials, "z-score");

        int n = trials.size();
        double sum = 0.0;
        for (Trial trial : trials) {
            sum += trial.value();
        }
        double mean = sum / n;
        double standardError = config.expectedStd() / Math.sqrt(n);
        double z = (mean - config.expectedMean()) / standardError;
        double pTwo = StatisticalMath.twoTailedNormalP(z);
        double pOne = StatisticalMath.oneTailedNormalP(z);
        double critical = StatisticalMath.normalInverse(1.0 - (1.0 - CONFIDENCE_LEVEL) / 2.0);
        double effectSize = (mean - config.expectedMean()) / config.expectedStd();

        return new ZScoreResultDTO(
                z,
                pTwo,
                pOne,
                mean - critical * standardError,
                mean + critical * standardError,
                standardError,
                effectSize,
                n,
                SignificanceLevel.fromPValue(pTwo),
                Instant.now());
    }

    private static void requireTrials(List<Trial> trials, String analysis) {
        if (trials == null || trials.isEmpty()) {
            LOG.warnf("Cannot compute %s of an empty trial window", analysis);
            throw ValidationException.insufficientData("trials for " + analysis, 1, 0);
        }
    }
}
