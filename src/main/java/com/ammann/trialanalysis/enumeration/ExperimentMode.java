/* (C)2026 */
package com.ammann.trialanalysis.enumeration;

/** Operating mode of the trial source when a trial was produced. */
public enum ExperimentMode {
    SESSION,
    CONTINUOUS,
    CALIBRATION
}
