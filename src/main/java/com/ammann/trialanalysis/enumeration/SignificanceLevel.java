package com.ammann.trialanalysis.enumeration;

/**
 * Significance band of a p-value. Every report type uses the same four bands.
 */
public enum SignificanceLevel
{
    /** p below 0.001. */
    HIGHLY_SIGNIFICANT(0.001),
    /** p below 0.05. */
    SIGNIFICANT(0.05),
    /** p below 0.1. */
    MARGINAL(0.1),
    /** p of 0.1 or above. */
    NONE(1.0);

    private final double upperBound;

    SignificanceLevel(double upperBound) {
        this.upperBound = upperBound;
    }

    /**
     * Returns the band the given p-value falls into.
     *
     * @param pValue probability in [0, 1]
     * @return the first band whose exclusive upper bound exceeds the p-value
     */
    public static SignificanceLevel fromPValue(double pValue) {
        if (pValue < HIGHLY_SIGNIFICANT.upperBound) return HIGHLY_SIGNIFICANT;
        if (pValue < SIGNIFICANT.upperBound) return SIGNIFICANT;
        if (pValue < MARGINAL.upperBound) return MARGINAL;
        return NONE;
    }

    public boolean isSignificant() {
        return this == HIGHLY_SIGNIFICANT || this == SIGNIFICANT;
    }

    public double getUpperBound() { return upperBound; }
}
