/* (C)2026 */
package com.ammann.trialanalysis.model;

import java.time.Instant;

/**
 * Summary of one sampling interval of an extended calibration or a baseline time series.
 *
 * @param timestamp interval start
 * @param mean mean of the values drawn in the interval
 * @param sampleCount number of values drawn
 */
public record IntervalSample(Instant timestamp, double mean, int sampleCount) {

    public static IntervalSample of(Instant timestamp, int[] values) {
        long sum = 0;
        for (int value : values) {
            sum += value;
        }
        double mean = values.length == 0 ? 0.0 : (double) sum / values.length;
        return new IntervalSample(timestamp, mean, values.length);
    }
}
