package com.ammann.trialanalysis.model;

import java.time.Instant;

/**
 * Mutable running aggregate for one stream or session.
 *
 * <p>Owned by exactly one stream context and updated through
 * {@link com.ammann.trialanalysis.service.RunningStatsTracker} one trial at a time, in
 * trial order. Instances are not thread-safe; callers hand out {@link #snapshot()} copies
 * to readers.
 */
public class RunningStats
{
    private final int bitsPerTrial;

    private long count;
    private double sum;
    private double sumOfSquares;
    private double mean;
    private double variance;
    private double cumulativeDeviation;
    private int minValue;
    private int maxValue;
    private Instant lastUpdated;

    public RunningStats(int bitsPerTrial)
    {
        this.bitsPerTrial = bitsPerTrial;
    }

    /**
     * Folds one trial value into the aggregate with Welford's update.
     *
     * <p>{@code delta = value - mean_old}, {@code mean_new = mean_old + delta/n},
     * {@code variance_new = ((n-1)·variance_old + delta·(value - mean_new)) / (n-1)}
     * with the variance fixed at 0 for the first value.
     *
     * @param value trial value
     * @param timestamp trial timestamp
     * @param expectedMean mean of the unbiased process, N/2
     */
    public void accept(int value, Instant timestamp, double expectedMean)
    {
        long previousCount = count;
        count = previousCount + 1;
        sum += value;
        sumOfSquares += (double) value * value;

        double delta = value - mean;
        mean += delta / count;
        if (count == 1) {
            variance = 0.0;
        } else {
            double m2 = variance * (previousCount - 1) + delta * (value - mean);
            variance = m2 / (count - 1);
        }

        cumulativeDeviation += value - expectedMean;
        if (previousCount == 0) {
            minValue = value;
            maxValue = value;
        } else {
            minValue = Math.min(minValue, value);
            maxValue = Math.max(maxValue, value);
        }
        lastUpdated = timestamp;
    }

    /**
     * Returns an independent copy of this aggregate.
     */
    public RunningStats snapshot()
    {
        RunningStats copy = new RunningStats(bitsPerTrial);
        copy.count = count;
        copy.sum = sum;
        copy.sumOfSquares = sumOfSquares;
        copy.mean = mean;
        copy.variance = variance;
        copy.cumulativeDeviation = cumulativeDeviation;
        copy.minValue = minValue;
        copy.maxValue = maxValue;
        copy.lastUpdated = lastUpdated;
        return copy;
    }

    public int getBitsPerTrial() { return bitsPerTrial; }

    public long getCount() { return count; }

    public double getSum() { return sum; }

    public double getSumOfSquares() { return sumOfSquares; }

    public double getMean() { return mean; }

    /** Sample variance (n − 1 denominator), 0 until two trials have been seen. */
    public double getVariance() { return variance; }

    public double getStandardDeviation() { return Math.sqrt(variance); }

    public double getCumulativeDeviation() { return cumulativeDeviation; }

    public int getMinValue() { return minValue; }

    public int getMaxValue() { return maxValue; }

    public Instant getLastUpdated() { return lastUpdated; }

    public boolean isEmpty() { return count == 0; }

    @Override
    public String toString()
    {
        return String.format("RunningStats[n=%d, mean=%.4f, variance=%.4f, cumDev=%.2f]",
                count, mean, variance, cumulativeDeviation);
    }
}
