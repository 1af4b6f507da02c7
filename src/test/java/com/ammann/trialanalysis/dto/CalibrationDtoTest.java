/* (C)2026 */
package com.ammann.trialanalysis.dto;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.trialanalysis.enumeration.CalibrationInterval;
import com.ammann.trialanalysis.enumeration.CalibrationPhase;
import com.ammann.trialanalysis.enumeration.CalibrationState;
import com.ammann.trialanalysis.enumeration.TrendDirection;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class CalibrationDtoTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void scheduleIsDueFromNextDueOn() {
        CalibrationScheduleDTO entry = new CalibrationScheduleDTO(CalibrationInterval.DAILY, T0, null);

        assertThat(entry.isDue(T0.minusMillis(1))).isFalse();
        assertThat(entry.isDue(T0)).isTrue();
    }

    @Test
    void rescheduleAdvancesByThePeriod() {
        CalibrationScheduleDTO entry = new CalibrationScheduleDTO(CalibrationInterval.QUARTERLY, T0, null);
        Instant started = T0.plusSeconds(30);

        CalibrationScheduleDTO next = entry.rescheduled(started);

        assertThat(next.lastRun()).isEqualTo(started);
        assertThat(next.nextDue()).isEqualTo(started.plus(Duration.ofDays(90)));
    }

    @Test
    void progressIsClampedAndFinishKeepsIdentity() {
        CalibrationProgressDTO progress = new CalibrationProgressDTO(
                "cal-1", null, CalibrationState.RUNNING, CalibrationPhase.PENDING, 0.0, T0, T0, null);

        assertThat(progress.at(CalibrationPhase.GENERATING_DATA, 140.0).progress()).isEqualTo(100.0);
        assertThat(progress.at(CalibrationPhase.GENERATING_DATA, -3.0).progress()).isZero();

        CalibrationProgressDTO finished = progress.finish(CalibrationState.CANCELLED, "stopped");
        assertThat(finished.calibrationId()).isEqualTo("cal-1");
        assertThat(finished.phase()).isEqualTo(CalibrationPhase.FINISHED);
        assertThat(finished.startedAt()).isEqualTo(T0);
        assertThat(finished.message()).isEqualTo("stopped");
    }

    @Test
    void idleProgressHasNoCalibration() {
        CalibrationProgressDTO idle = CalibrationProgressDTO.idle();

        assertThat(idle.calibrationId()).isNull();
        assertThat(idle.state()).isEqualTo(CalibrationState.IDLE);
    }

    @Test
    void stableDriftHasNoChangePoints() {
        DriftAnalysisDTO stable = DriftAnalysisDTO.stable();

        assertThat(stable.direction()).isEqualTo(TrendDirection.STABLE);
        assertThat(stable.changePoints()).isEmpty();
        assertThat(stable.confidence()).isZero();
    }
}
