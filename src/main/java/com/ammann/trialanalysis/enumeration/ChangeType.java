/* (C)2026 */
package com.ammann.trialanalysis.enumeration;

/** What changed between two baselines. */
public enum ChangeType {
    NONE,
    MEAN,
    VARIANCE,
    BOTH;

    public static ChangeType of(boolean meanChanged, boolean varianceChanged) {
        if (meanChanged && varianceChanged) return BOTH;
        if (meanChanged) return MEAN;
        if (varianceChanged) return VARIANCE;
        return NONE;
    }
}
