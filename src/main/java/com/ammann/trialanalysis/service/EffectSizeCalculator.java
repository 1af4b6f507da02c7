/* (C)2026 */
package com.ammann.trialanalysis.service;

import com.ammann.trialanalysis.config.AnalysisConfig;
import com.ammann.trialanalysis.dto.EffectSizeResultDTO;
import com.ammann.trialanalysis.dto.PowerAnalysisDTO;
import com.ammann.trialanalysis.exception.ValidationException;
import com.ammann.trialanalysis.math.StatisticalMath;
import com.ammann.trialanalysis.model.Trial;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Standardized effect size of a window's deviation from N/2, with power analysis.
 */
@ApplicationScoped
public class EffectSizeCalculator {

    private static final Logger LOG = Logger.getLogger(EffectSizeCalculator.class);

    static final double TARGET_POWER = 0.8;

    private final AnalysisConfig config;

    @Inject
    public EffectSizeCalculator(AnalysisConfig config) {
        this.config = config;
    }

    /**
     * Computes Cohen's d, Hedges' g, the point-biserial correlation and an interval around d.
     *
     * @param trials non-empty window
     * @return effect size report
     * @throws ValidationException if the window is empty
     */
    public EffectSizeResultDTO calculate(List<Trial> trials) {
        if (trials == null || trials.isEmpty()) {
            LOG.warn("Cannot compute effect size of an empty trial window");
            throw ValidationException.insufficientData("trials for effect size", 1, 0);
        }

        int n = trials.size();
        double expectedMean = config.expectedMean();
        double[] deviations = new double[n];
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            deviations[i] = trials.get(i).value() - expectedMean;
            sum += deviations[i];
        }
        double d = (sum / n) / config.expectedStd();
        double g = hedgesG(d, n);
        double rpb = pointBiserial(deviations);

        double se = standardError(d, n);
        double critical = StatisticalMath.normalInverse(1.0 - config.significanceAlpha() / 2.0);
        PowerAnalysisDTO power = powerAnalysis(d, n);

        LOG.debugf("Effect size: d=%.4f g=%.4f rpb=%.4f n=%d power=%.3f", d, g, rpb, n, power.power());
        return EffectSizeResultDTO.create(d, g, rpb, d - critical * se, d + critical * se, power, n, Instant.now());
    }

    /**
     * Hedges' small-sample correction {@code J = 1 − 3/(4·df − 1)} with df = n − 1.
     * Returns d unchanged below two observations.
     */
    static double hedgesG(double d, int n) {
        if (n < 2) {
            return d;
        }
        int df = n - 1;
        return d * (1.0 - 3.0 / (4.0 * df - 1.0));
    }

    /**
     * Point-biserial correlation between each deviation and the indicator "deviation > 0".
     * Returns 0 when either group is empty or all deviations are equal.
     */
    static double pointBiserial(double[] deviations) {
        int n = deviations.length;
        double sumPositive = 0.0;
        double sumOther = 0.0;
        int positive = 0;
        double total = 0.0;
        for (double deviation : deviations) {
            total += deviation;
            if (deviation > 0) {
                sumPositive += deviation;
                positive++;
            } else {
                sumOther += deviation;
            }
        }
        int other = n - positive;
        if (positive == 0 || other == 0) {
            return 0.0;
        }
        double mean = total / n;
        double squares = 0.0;
        for (double deviation : deviations) {
            squares += (deviation - mean) * (deviation - mean);
        }
        double std = Math.sqrt(squares / n);
        double meanDifference = sumPositive / positive - sumOther / other;
        return StatisticalMath.safeDivide(meanDifference, std) * Math.sqrt((double) positive * other / ((double) n * n));
    }

    /** {@code sqrt((n + d²/2) / (n·(n − 3)))}, 0 for n ≤ 3. */
    static double standardError(double d, int n) {
        if (n <= 3) {
            return 0.0;
        }
        return Math.sqrt((n + d * d / 2.0) / ((double) n * (n - 3)));
    }

    /**
     * Power analysis of a two-sided z-test at the configured α.
     *
     * @param d effect size
     * @param n sample size
     * @return observed power, sample size for 80% power and minimum detectable effect at n
     */
    public PowerAnalysisDTO powerAnalysis(double d, int n) {
        double alpha = config.significanceAlpha();
        return new PowerAnalysisDTO(
                d,
                n,
                alpha,
                observedPower(d, n, alpha),
                requiredSampleSize(d, alpha, TARGET_POWER),
                minimumDetectableEffect(n, alpha, TARGET_POWER));
    }

    /** Power of a two-sided z-test: Φ(|d|√n − z) + Φ(−|d|√n − z) with z = z(1 − α/2). */
    static double observedPower(double d, long n, double alpha) {
        if (n <= 0) {
            return 0.0;
        }
        double zAlpha = StatisticalMath.normalInverse(1.0 - alpha / 2.0);
        double shift = Math.abs(d) * Math.sqrt(n);
        return StatisticalMath.normalCdf(shift - zAlpha) + StatisticalMath.normalCdf(-shift - zAlpha);
    }

    /** {@code ceil(((z(1 − α/2) + z(power)) / d)²)}, 0 when d is 0. */
    static long requiredSampleSize(double d, double alpha, double power) {
        if (d == 0.0) {
            return 0L;
        }
        double zAlpha = StatisticalMath.normalInverse(1.0 - alpha / 2.0);
        double zBeta = StatisticalMath.normalInverse(power);
        double ratio = (zAlpha + zBeta) / Math.abs(d);
        return (long) Math.ceil(ratio * ratio);
    }

    /** {@code (z(1 − α/2) + z(power)) / √n}, 0 for n ≤ 0. */
    static double minimumDetectableEffect(int n, double alpha, double power) {
        if (n <= 0) {
            return 0.0;
        }
        double zAlpha = StatisticalMath.normalInverse(1.0 - alpha / 2.0);
        double zBeta = StatisticalMath.normalInverse(power);
        return (zAlpha + zBeta) / Math.sqrt(n);
    }
}
