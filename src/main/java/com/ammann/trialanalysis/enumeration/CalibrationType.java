/* (C)2026 */
package com.ammann.trialanalysis.enumeration;

public enum CalibrationType {
    STANDARD,
    EXTENDED
}
