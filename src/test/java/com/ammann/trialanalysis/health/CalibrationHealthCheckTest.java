/* (C)2026 */
package com.ammann.trialanalysis.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.ammann.trialanalysis.dto.CalibrationProgressDTO;
import com.ammann.trialanalysis.dto.QualityReportDTO;
import com.ammann.trialanalysis.enumeration.CalibrationPhase;
import com.ammann.trialanalysis.enumeration.CalibrationState;
import com.ammann.trialanalysis.enumeration.CalibrationType;
import com.ammann.trialanalysis.service.CalibrationOrchestrator;
import com.ammann.trialanalysis.service.QualityController;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("CalibrationHealthCheck")
class CalibrationHealthCheckTest {

    @Mock CalibrationOrchestrator orchestrator;
    @Mock QualityController qualityController;

    private CalibrationHealthCheck check;

    @BeforeEach
    void setUp() {
        check = new CalibrationHealthCheck(orchestrator, qualityController);
        when(orchestrator.getLastResult()).thenReturn(Optional.empty());
    }

    @Test
    @DisplayName("should be UP while idle")
    void upWhenIdle() {
        when(orchestrator.getProgress()).thenReturn(CalibrationProgressDTO.idle());
        when(qualityController.getLastReport()).thenReturn(Optional.empty());

        HealthCheckResponse response = check.call();

        assertThat(response.getName()).isEqualTo("calibration-health");
        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        Map<String, Object> data = response.getData().orElseThrow();
        assertThat(data).containsEntry("calibration-state", "IDLE").doesNotContainKey("last-quality-verdict");
    }

    @Test
    @DisplayName("should stay UP with a failing quality verdict")
    void failingQualityIsDataOnly() {
        when(orchestrator.getProgress()).thenReturn(CalibrationProgressDTO.idle());
        when(qualityController.getLastReport()).thenReturn(Optional.of(QualityReportDTO.empty(Instant.now())));

        HealthCheckResponse response = check.call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getData().orElseThrow())
                .containsEntry("last-quality-verdict", "FAIL")
                .containsEntry("last-quality-score", 0L);
    }

    @Test
    @DisplayName("should be DOWN after a failed calibration")
    void downAfterFailedCalibration() {
        Instant now = Instant.now();
        CalibrationProgressDTO failed = new CalibrationProgressDTO(
                "cal-9", CalibrationType.STANDARD, CalibrationState.FAILED, CalibrationPhase.FINISHED,
                100.0, now, now, "Trial source failed: gone");
        when(orchestrator.getProgress()).thenReturn(failed);
        when(qualityController.getLastReport()).thenReturn(Optional.empty());

        HealthCheckResponse response = check.call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.DOWN);
        assertThat(response.getData().orElseThrow())
                .containsEntry("calibration-state", "FAILED")
                .containsEntry("message", "Trial source failed: gone");
    }
}
