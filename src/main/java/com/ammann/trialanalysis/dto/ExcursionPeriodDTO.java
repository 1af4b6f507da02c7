/* (C)2026 */
package com.ammann.trialanalysis.dto;

import java.time.Duration;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Sustained run of the cumulative Z-score beyond the excursion threshold in one direction.
 *
 * @param startIndex index of the first point beyond the threshold
 * @param endIndex index of the last point of the excursion
 * @param startTime timestamp at startIndex
 * @param endTime timestamp at endIndex
 * @param maxDeviation signed peak |Z| (negative for downward excursions)
 * @param durationTrials number of points in the excursion
 * @param durationMillis wall-clock span between start and end
 * @param significance one-tailed p-value of the peak magnitude
 */
@Schema(description = "Excursion of the cumulative Z-score")
public record ExcursionPeriodDTO(
        int startIndex,
        int endIndex,
        Instant startTime,
        Instant endTime,
        double maxDeviation,
        int durationTrials,
        long durationMillis,
        double significance) {

    public static ExcursionPeriodDTO create(
            int startIndex, int endIndex, Instant startTime, Instant endTime, double signedPeak, int durationTrials,
            double significance) {
        return new ExcursionPeriodDTO(
                startIndex,
                endIndex,
                startTime,
                endTime,
                signedPeak,
                durationTrials,
                Duration.between(startTime, endTime).toMillis(),
                significance);
    }

    public boolean isPositive() {
        return maxDeviation > 0;
    }
}
