/* (C)2026 */
package com.ammann.trialanalysis.config;

import java.time.Duration;

/**
 * Sampling sizes and timing for calibration runs.
 *
 * @param standardBits number of bits drawn by a standard calibration
 * @param extendedBitsPerInterval bits drawn in each extended-calibration interval
 * @param maxSampleInterval upper bound on the pause between extended intervals
 * @param healthCheckBits bits drawn by a hardware health check
 * @param nextDue delay until the next calibration after an extended run
 */
public record CalibrationSettings(
        int standardBits,
        int extendedBitsPerInterval,
        Duration maxSampleInterval,
        int healthCheckBits,
        Duration nextDue) {

    public CalibrationSettings {
        ConfigChecks.positive("analysis.calibration.trials", standardBits);
        ConfigChecks.positive("analysis.calibration.extended-bits-per-interval", extendedBitsPerInterval);
        ConfigChecks.positive("analysis.calibration.max-sample-interval-ms",
                maxSampleInterval == null ? 0 : maxSampleInterval.toMillis());
        ConfigChecks.positive("analysis.calibration.health-check-bits", healthCheckBits);
        ConfigChecks.positive("analysis.calibration.next-due-days", nextDue == null ? 0 : nextDue.toMillis());
    }

    public static CalibrationSettings defaults() {
        return new CalibrationSettings(100_000, 1000, Duration.ofMinutes(1), 10_000, Duration.ofDays(30));
    }
}
