/* (C)2026 */
package com.ammann.trialanalysis.dto;

import com.ammann.trialanalysis.enumeration.CalibrationPhase;
import com.ammann.trialanalysis.enumeration.CalibrationState;
import com.ammann.trialanalysis.enumeration.CalibrationType;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Snapshot of the calibration state machine, polled by callers instead of receiving events.
 *
 * @param calibrationId id of the current or last calibration, null when idle
 * @param type calibration type
 * @param state lifecycle state
 * @param phase current checkpoint
 * @param progress percentage of the current phase in [0, 100]
 * @param startedAt calibration start
 * @param updatedAt time of this checkpoint
 * @param message failure message, when failed
 */
@Schema(description = "Calibration progress")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CalibrationProgressDTO(
        String calibrationId,
        CalibrationType type,
        CalibrationState state,
        CalibrationPhase phase,
        double progress,
        Instant startedAt,
        Instant updatedAt,
        String message) {

    public static CalibrationProgressDTO idle() {
        return new CalibrationProgressDTO(
                null, null, CalibrationState.IDLE, CalibrationPhase.PENDING, 0.0, null, Instant.now(), null);
    }

    public CalibrationProgressDTO at(CalibrationPhase newPhase, double newProgress) {
        return new CalibrationProgressDTO(
                calibrationId, type, state, newPhase, Math.max(0.0, Math.min(100.0, newProgress)), startedAt,
                Instant.now(), message);
    }

    public CalibrationProgressDTO finish(CalibrationState finalState, String finalMessage) {
        return new CalibrationProgressDTO(
                calibrationId, type, finalState, CalibrationPhase.FINISHED, 100.0, startedAt, Instant.now(),
                finalMessage);
    }
}
