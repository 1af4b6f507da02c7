/* (C)2026 */
package com.ammann.trialanalysis.enumeration;

/** Grouping used for periodicity detection: hour of day or day of week. */
public enum PeriodType {
    HOURLY(24),
    DAILY(7);

    private final int groups;

    PeriodType(int groups) {
        this.groups = groups;
    }

    public int getGroups() {
        return groups;
    }
}
