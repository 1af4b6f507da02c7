/* (C)2026 */
package com.ammann.trialanalysis.enumeration;

/** Checkpoint phases reported through the calibration progress object. */
public enum CalibrationPhase {
    PENDING,
    GENERATING_DATA,
    RUNNING_TESTS,
    CALCULATING_BASELINE,
    EXTENDED_COLLECTION,
    EXTENDED_ANALYSIS,
    HEALTH_CHECK,
    FINISHED
}
