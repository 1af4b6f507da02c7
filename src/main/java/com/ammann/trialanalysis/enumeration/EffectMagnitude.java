/* (C)2026 */
package com.ammann.trialanalysis.enumeration;

/** Conventional interpretation bands for Cohen's d. */
public enum EffectMagnitude {
    NEGLIGIBLE,
    SMALL,
    MEDIUM,
    LARGE;

    public static EffectMagnitude fromCohensD(double d) {
        double magnitude = Math.abs(d);
        if (magnitude < 0.2) return NEGLIGIBLE;
        if (magnitude < 0.5) return SMALL;
        if (magnitude < 0.8) return MEDIUM;
        return LARGE;
    }
}
