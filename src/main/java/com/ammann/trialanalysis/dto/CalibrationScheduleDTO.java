/* (C)2026 */
package com.ammann.trialanalysis.dto;

import com.ammann.trialanalysis.enumeration.CalibrationInterval;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Recurring calibration entry.
 *
 * @param interval recurrence
 * @param nextDue next due time
 * @param lastRun last time a calibration was started for this entry, null if never
 */
@Schema(description = "Calibration schedule entry")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CalibrationScheduleDTO(CalibrationInterval interval, Instant nextDue, Instant lastRun) {

    public boolean isDue(Instant now) {
        return !now.isBefore(nextDue);
    }

    public CalibrationScheduleDTO rescheduled(Instant startedAt) {
        return new CalibrationScheduleDTO(interval, startedAt.plus(interval.getPeriod()), startedAt);
    }
}
