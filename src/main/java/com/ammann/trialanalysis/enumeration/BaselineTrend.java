/* (C)2026 */
package com.ammann.trialanalysis.enumeration;

/** Direction in which recent baselines move relative to the unbiased centre. */
public enum BaselineTrend {
    IMPROVING,
    DEGRADING,
    STABLE
}
