package com.ammann.trialanalysis.enumeration;

import com.ammann.trialanalysis.exception.ValidationException;
import java.time.Duration;

/**
 * Recurring calibration schedule intervals.
 */
public enum CalibrationInterval
{
    DAILY(Duration.ofDays(1)),
    WEEKLY(Duration.ofDays(7)),
    MONTHLY(Duration.ofDays(30)),
    QUARTERLY(Duration.ofDays(90));

    private final Duration period;

    CalibrationInterval(Duration period) {
        this.period = period;
    }

    public Duration getPeriod() { return period; }

    /**
     * Parses an interval name case-insensitively.
     *
     * @param value interval name such as {@code weekly}
     * @return the matching interval
     * @throws ValidationException if the name is unknown
     */
    public static CalibrationInterval fromString(String value) {
        if (value != null) {
            for (CalibrationInterval interval : values()) {
                if (interval.name().equalsIgnoreCase(value.trim())) {
                    return interval;
                }
            }
        }
        throw ValidationException.invalidParameter("interval", value, "one of daily, weekly, monthly, quarterly");
    }
}
