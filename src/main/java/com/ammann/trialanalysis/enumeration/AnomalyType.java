/* (C)2026 */
package com.ammann.trialanalysis.enumeration;

/** Kinds of anomaly the quality controller reports. */
public enum AnomalyType {
    BIAS,
    PATTERN,
    CORRELATION,
    OUTLIER,
    MISSING_DATA,
    TIMING
}
