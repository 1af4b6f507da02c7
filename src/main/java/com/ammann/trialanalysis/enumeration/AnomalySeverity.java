/* (C)2026 */
package com.ammann.trialanalysis.enumeration;

/** Severity of a detected anomaly together with its quality-score penalty. */
public enum AnomalySeverity {
    LOW(2),
    MEDIUM(5),
    HIGH(10),
    CRITICAL(15);

    private final int penalty;

    AnomalySeverity(int penalty) {
        this.penalty = penalty;
    }

    public int getPenalty() {
        return penalty;
    }
}
