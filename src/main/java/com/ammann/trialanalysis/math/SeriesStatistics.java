/* (C)2026 */
package com.ammann.trialanalysis.math;

import java.util.Arrays;
import org.apache.commons.math3.stat.descriptive.moment.Kurtosis;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.Skewness;
import org.apache.commons.math3.stat.descriptive.moment.Variance;
import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * Batch statistics over numeric series: moments, autocorrelation, correlation and
 * least-squares fits.
 */
public final class SeriesStatistics {

    private SeriesStatistics() {}

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        return new Mean().evaluate(values);
    }

    /** Sample variance with the n − 1 denominator, 0 for fewer than two values. */
    public static double sampleVariance(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        return new Variance(true).evaluate(values);
    }

    /** Population variance with the n denominator. */
    public static double populationVariance(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        return new Variance(false).evaluate(values);
    }

    /** Bias-corrected sample skewness, 0 for fewer than three values or a constant series. */
    public static double skewness(double[] values) {
        if (values.length < 3) {
            return 0.0;
        }
        double result = new Skewness().evaluate(values);
        return Double.isFinite(result) ? result : 0.0;
    }

    /** Bias-corrected excess kurtosis, 0 for fewer than four values or a constant series. */
    public static double excessKurtosis(double[] values) {
        if (values.length < 4) {
            return 0.0;
        }
        double result = new Kurtosis().evaluate(values);
        return Double.isFinite(result) ? result : 0.0;
    }

    /**
     * Jarque–Bera normality statistic {@code n/6 · (S² + K²/4)}.
     *
     * @param values sample
     * @return two-element array of statistic and chi-square (df = 2) p-value
     */
    public static double[] jarqueBera(double[] values) {
        int n = values.length;
        if (n < 4) {
            return new double[] {0.0, 1.0};
        }
        double s = skewness(values);
        double k = excessKurtosis(values);
        double statistic = n / 6.0 * (s * s + k * k / 4.0);
        return new double[] {statistic, StatisticalMath.chiSquarePValue(statistic, 2)};
    }

    public static double median(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int middle = sorted.length / 2;
        return sorted.length % 2 == 0 ? (sorted[middle - 1] + sorted[middle]) / 2.0 : sorted[middle];
    }

    /**
     * Lag-k autocorrelation normalized by the total sum of squares.
     *
     * @param values series
     * @param lag lag, at least 1
     * @return autocorrelation, 0 when the lag does not fit or the series is constant
     */
    public static double autocorrelation(double[] values, int lag) {
        int n = values.length;
        if (lag <= 0 || lag >= n) {
            return 0.0;
        }
        double mean = mean(values);
        double numerator = 0.0;
        for (int i = 0; i < n - lag; i++) {
            numerator += (values[i] - mean) * (values[i + lag] - mean);
        }
        double denominator = 0.0;
        for (double value : values) {
            double d = value - mean;
            denominator += d * d;
        }
        return StatisticalMath.safeDivide(numerator, denominator);
    }

    /** Pearson correlation of two equally long series, 0 when either is constant. */
    public static double pearson(double[] x, double[] y) {
        int n = Math.min(x.length, y.length);
        if (n < 2) {
            return 0.0;
        }
        double meanX = 0.0;
        double meanY = 0.0;
        for (int i = 0; i < n; i++) {
            meanX += x[i];
            meanY += y[i];
        }
        meanX /= n;
        meanY /= n;
        double sxy = 0.0;
        double sxx = 0.0;
        double syy = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - meanX;
            double dy = y[i] - meanY;
            sxy += dx * dy;
            sxx += dx * dx;
            syy += dy * dy;
        }
        return StatisticalMath.safeDivide(sxy, Math.sqrt(sxx * syy));
    }

    /**
     * Ordinary least-squares fit of y against x.
     *
     * @return fitted line, with zeroed error terms when fewer than three points are given
     */
    public static LinearFit linearFit(double[] x, double[] y) {
        int n = Math.min(x.length, y.length);
        SimpleRegression regression = new SimpleRegression(true);
        for (int i = 0; i < n; i++) {
            regression.addData(x[i], y[i]);
        }
        if (n < 2) {
            return new LinearFit(0.0, n == 1 ? y[0] : 0.0, 0.0, 0.0, n);
        }
        double slope = finiteOrZero(regression.getSlope());
        double intercept = finiteOrZero(regression.getIntercept());
        double r = finiteOrZero(regression.getR());
        double slopeStdErr = n > 2 ? finiteOrZero(regression.getSlopeStdErr()) : 0.0;
        return new LinearFit(slope, intercept, r, slopeStdErr, n);
    }

    private static double finiteOrZero(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }

    /**
     * Result of a least-squares fit.
     *
     * @param slope fitted slope
     * @param intercept fitted intercept
     * @param correlation Pearson r between x and y
     * @param slopeStdError standard error of the slope, {@code sqrt(RSS/((n-2)·Sxx))}
     * @param n number of points
     */
    public record LinearFit(double slope, double intercept, double correlation, double slopeStdError, int n) {

        /** t statistic of the slope, 0 when the standard error vanishes. */
        public double tStatistic() {
            return StatisticalMath.safeDivide(slope, slopeStdError);
        }

        /** Two-sided p-value of the slope with n − 2 degrees of freedom. */
        public double slopePValue() {
            if (n < 3) {
                return 1.0;
            }
            if (slopeStdError == 0.0) {
                return slope == 0.0 ? 1.0 : 0.0;
            }
            return StatisticalMath.tTwoTailedP(tStatistic(), n - 2);
        }

        public double predict(double x) {
            return slope * x + intercept;
        }

        public double rSquared() {
            return correlation * correlation;
        }
    }
}
