/* (C)2026 */
package com.ammann.trialanalysis.math;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.special.Erf;
import org.apache.commons.math3.special.Gamma;

/**
 * Distribution functions used by every analysis component.
 *
 * <p>Pure static functions over commons-math3. Results are finite: degenerate inputs
 * (zero degrees of freedom, non-positive statistics) map to the conservative value
 * instead of NaN.
 */
public final class StatisticalMath {

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0.0, 1.0);
    private static final double SQRT2 = Math.sqrt(2.0);

    private StatisticalMath() {}

    /** Standard normal cumulative distribution Φ(z). */
    public static double normalCdf(double z) {
        return 0.5 * Erf.erfc(-z / SQRT2);
    }

    /** Two-tailed p-value of a standard normal statistic: 2·(1 − Φ(|z|)). */
    public static double twoTailedNormalP(double z) {
        if (Double.isNaN(z)) {
            return 1.0;
        }
        return Math.min(1.0, Erf.erfc(Math.abs(z) / SQRT2));
    }

    /** Upper one-tailed p-value of a standard normal statistic: 1 − Φ(z). */
    public static double oneTailedNormalP(double z) {
        if (Double.isNaN(z)) {
            return 1.0;
        }
        return 0.5 * Erf.erfc(z / SQRT2);
    }

    /**
     * Inverse of the standard normal CDF.
     *
     * @param p probability, clamped into the open interval (0, 1)
     * @return z such that Φ(z) = p
     */
    public static double normalInverse(double p) {
        double clamped = Math.max(1e-15, Math.min(1 - 1e-15, p));
        return STANDARD_NORMAL.inverseCumulativeProbability(clamped);
    }

    /**
     * Upper-tail chi-square probability P(X ≥ x) via the regularized incomplete gamma function.
     *
     * @param x statistic value
     * @param df degrees of freedom
     * @return p-value in [0, 1]
     */
    public static double chiSquarePValue(double x, double df) {
        if (df <= 0 || Double.isNaN(x)) {
            return 1.0;
        }
        if (x <= 0) {
            return 1.0;
        }
        return igamc(df / 2.0, x / 2.0);
    }

    /**
     * Chi-square quantile by the Wilson–Hilferty cube transform.
     *
     * @param p lower-tail probability
     * @param df degrees of freedom
     * @return approximate x with P(X ≤ x) = p, never negative
     */
    public static double chiSquareInverse(double p, double df) {
        if (df <= 0) {
            return 0.0;
        }
        double h = 2.0 / (9.0 * df);
        double z = normalInverse(p);
        double cube = 1.0 - h + z * Math.sqrt(h);
        return Math.max(0.0, df * cube * cube * cube);
    }

    /**
     * Two-tailed p-value of Student's t statistic.
     *
     * @param t statistic value
     * @param df degrees of freedom, must be at least 1 for a meaningful result
     * @return p-value, 1 when df is below 1 or t is not finite
     */
    public static double tTwoTailedP(double t, double df) {
        if (df < 1 || Double.isNaN(t)) {
            return 1.0;
        }
        if (Double.isInfinite(t)) {
            return 0.0;
        }
        TDistribution distribution = new TDistribution(null, df);
        return Math.min(1.0, 2.0 * distribution.cumulativeProbability(-Math.abs(t)));
    }

    /** Complementary regularized incomplete gamma function Q(a, x), NIST's igamc. */
    public static double igamc(double a, double x) {
        if (x <= 0) {
            return 1.0;
        }
        return Gamma.regularizedGammaQ(a, x);
    }

    public static double erf(double x) {
        return Erf.erf(x);
    }

    public static double erfc(double x) {
        return Erf.erfc(x);
    }

    /** Divides, returning 0 when the result would be NaN or infinite. */
    public static double safeDivide(double numerator, double denominator) {
        if (denominator == 0 || Double.isNaN(denominator)) {
            return 0.0;
        }
        double result = numerator / denominator;
        return Double.isFinite(result) ? result : 0.0;
    }

    /** Binary Shannon entropy H(p) in bits. */
    public static double binaryEntropy(double p) {
        if (p <= 0 || p >= 1) {
            return 0.0;
        }
        return -(p * log2(p) + (1 - p) * log2(1 - p));
    }

    public static double log2(double x) {
        return Math.log(x) / Math.log(2.0);
    }
}
