/* (C)2026 */
package com.ammann.trialanalysis.model;

import com.ammann.trialanalysis.enumeration.ExperimentMode;
import com.ammann.trialanalysis.enumeration.Intention;
import java.time.Instant;
import java.util.Objects;

/**
 * One bounded-sum trial: the number of ones among N binary draws.
 *
 * <p>Immutable once produced by the trial source. Within a session trials are ordered by
 * timestamp with non-decreasing sequence numbers; gaps in the sequence are expected and
 * detected by the quality controller.
 *
 * @param timestamp time the trial was produced
 * @param value number of ones, in [0, N]
 * @param sessionId owning session
 * @param mode operating mode of the source
 * @param intention intended outcome direction, {@link Intention#BASELINE} for calibration
 * @param sequenceNumber per-session sequence number
 */
public record Trial(
        Instant timestamp,
        int value,
        String sessionId,
        ExperimentMode mode,
        Intention intention,
        long sequenceNumber) {

    public Trial {
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static Trial baseline(Instant timestamp, int value, String sessionId, long sequenceNumber) {
        return new Trial(timestamp, value, sessionId, ExperimentMode.CALIBRATION, Intention.BASELINE, sequenceNumber);
    }
}
