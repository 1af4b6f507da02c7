/* (C)2026 */
package com.ammann.trialanalysis.enumeration;

/** Direction of a fitted trend or drift. */
public enum TrendDirection {
    INCREASING,
    DECREASING,
    STABLE
}
