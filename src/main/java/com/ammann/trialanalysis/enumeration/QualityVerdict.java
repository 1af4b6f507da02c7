/* (C)2026 */
package com.ammann.trialanalysis.enumeration;

/**
 * Overall verdict of a quality report.
 *
 * <p>FAIL when the score is below 50 or any anomaly is critical, WARNING when the score
 * is below 80 or any anomaly is high, PASS otherwise.
 */
public enum QualityVerdict {
    PASS,
    WARNING,
    FAIL;

    public static QualityVerdict evaluate(double score, boolean anyCritical, boolean anyHigh) {
        if (score < 50 || anyCritical) return FAIL;
        if (score < 80 || anyHigh) return WARNING;
        return PASS;
    }
}
