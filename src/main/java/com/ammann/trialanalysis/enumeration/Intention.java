/* (C)2026 */
package com.ammann.trialanalysis.enumeration;

/** Intended outcome direction recorded with each trial. */
public enum Intention {
    HIGH,
    LOW,
    BASELINE
}
