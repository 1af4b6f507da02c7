/* (C)2026 */
package com.ammann.trialanalysis.math;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Adjusted p-values for families of simultaneous tests. Each method returns the adjusted
 * values in the order of its input.
 */
public final class MultipleTesting {

    private MultipleTesting() {}

    public static double[] bonferroni(double[] pValues) {
        int m = pValues.length;
        double[] adjusted = new double[m];
        for (int i = 0; i < m; i++) {
            adjusted[i] = Math.min(1.0, pValues[i] * m);
        }
        return adjusted;
    }

    /** Holm step-down adjustment. */
    public static double[] holm(double[] pValues) {
        int m = pValues.length;
        Integer[] order = ascendingOrder(pValues);
        double[] adjusted = new double[m];
        double runningMax = 0.0;
        for (int rank = 0; rank < m; rank++) {
            int index = order[rank];
            double value = Math.min(1.0, (m - rank) * pValues[index]);
            runningMax = Math.max(runningMax, value);
            adjusted[index] = runningMax;
        }
        return adjusted;
    }

    /** Benjamini–Hochberg step-up adjustment controlling the false discovery rate. */
    public static double[] benjaminiHochberg(double[] pValues) {
        int m = pValues.length;
        Integer[] order = ascendingOrder(pValues);
        double[] adjusted = new double[m];
        double runningMin = 1.0;
        for (int rank = m - 1; rank >= 0; rank--) {
            int index = order[rank];
            double value = Math.min(1.0, pValues[index] * m / (rank + 1));
            runningMin = Math.min(runningMin, value);
            adjusted[index] = runningMin;
        }
        return adjusted;
    }

    private static Integer[] ascendingOrder(double[] values) {
        Integer[] order = IntStream.range(0, values.length).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble(i -> values[i]));
        return order;
    }
}
