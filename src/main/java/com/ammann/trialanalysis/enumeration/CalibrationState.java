/* (C)2026 */
package com.ammann.trialanalysis.enumeration;

/**
 * Calibration lifecycle state.
 * <p>
 * Expected transition sequence is IDLE to RUNNING and then to COMPLETED, CANCELLED or FAILED.
 * Only one calibration may be RUNNING per process.
 */
public enum CalibrationState {
    /** No calibration has run yet */
    IDLE,
    /** Calibration is sampling or analysing */
    RUNNING,
    /** Calibration produced a result */
    COMPLETED,
    /** Extended calibration was cancelled and produced a partial result */
    CANCELLED,
    /** Calibration aborted with an error */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }
}
