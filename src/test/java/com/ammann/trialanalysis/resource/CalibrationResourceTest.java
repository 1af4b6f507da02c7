/* (C)2026 */
package com.ammann.trialanalysis.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ammann.trialanalysis.dto.CalibrationProgressDTO;
import com.ammann.trialanalysis.dto.CalibrationScheduleDTO;
import com.ammann.trialanalysis.enumeration.CalibrationInterval;
import com.ammann.trialanalysis.enumeration.CalibrationPhase;
import com.ammann.trialanalysis.enumeration.CalibrationState;
import com.ammann.trialanalysis.enumeration.CalibrationType;
import com.ammann.trialanalysis.exception.ConcurrentCalibrationException;
import com.ammann.trialanalysis.exception.ValidationException;
import com.ammann.trialanalysis.properties.ApiProperties;
import com.ammann.trialanalysis.service.CalibrationOrchestrator;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.core.Response;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CalibrationResourceTest {

    private CalibrationResource resource;
    private CalibrationOrchestrator orchestrator;
    private CalibrationProgressDTO running;

    @BeforeEach
    void setUp() {
        orchestrator = mock(CalibrationOrchestrator.class);
        resource = new CalibrationResource();
        resource.orchestrator = orchestrator;
        Instant now = Instant.now();
        running = new CalibrationProgressDTO(
                "cal-1", CalibrationType.STANDARD, CalibrationState.RUNNING, CalibrationPhase.PENDING,
                0.0, now, now, null);
    }

    @Test
    void resource_classHasCorrectPath() {
        Path path = CalibrationResource.class.getAnnotation(Path.class);
        assertThat(path).isNotNull();
        assertThat(path.value()).isEqualTo(ApiProperties.BASE_URL_V1 + ApiProperties.Calibration.BASE);
    }

    @Test
    void startStandard_withoutTrialsUsesDefault() {
        when(orchestrator.getProgress()).thenReturn(running);

        Response response = resource.startStandard(null);

        assertThat(response.getStatus()).isEqualTo(202);
        assertThat(response.getEntity()).isEqualTo(running);
        verify(orchestrator).startStandardCalibration();
    }

    @Test
    void startStandard_passesTrialCount() {
        when(orchestrator.getProgress()).thenReturn(running);

        resource.startStandard(5000);

        verify(orchestrator).startStandardCalibration(5000);
    }

    @Test
    void startStandard_conflictPropagates() {
        when(orchestrator.startStandardCalibration()).thenThrow(new ConcurrentCalibrationException("cal-0"));

        assertThatThrownBy(() -> resource.startStandard(null)).isInstanceOf(ConcurrentCalibrationException.class);
    }

    @Test
    void startExtended_validatesHours() {
        assertThatThrownBy(() -> resource.startExtended(0)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> resource.startExtended(169)).isInstanceOf(ValidationException.class);
        verify(orchestrator, never()).startExtendedCalibration(any());
    }

    @Test
    void startExtended_acceptsRun() {
        when(orchestrator.getProgress()).thenReturn(running);

        Response response = resource.startExtended(24);

        assertThat(response.getStatus()).isEqualTo(202);
        verify(orchestrator).startExtendedCalibration(Duration.ofHours(24));
    }

    @Test
    void cancel_withoutRunReturns404() {
        when(orchestrator.cancel()).thenReturn(false);

        Response response = resource.cancel();

        assertThat(response.getStatus()).isEqualTo(404);
        assertThat(response.getEntity()).isEqualTo(Map.of("error", "No calibration running"));
    }

    @Test
    void cancel_returnsProgress() {
        when(orchestrator.cancel()).thenReturn(true);
        when(orchestrator.getProgress()).thenReturn(running);

        Response response = resource.cancel();

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getEntity()).isEqualTo(running);
    }

    @Test
    void schedule_parsesInterval() {
        CalibrationScheduleDTO entry = new CalibrationScheduleDTO(CalibrationInterval.WEEKLY, Instant.now(), null);
        when(orchestrator.schedule(CalibrationInterval.WEEKLY)).thenReturn(entry);

        Response response = resource.schedule("weekly");

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getEntity()).isEqualTo(entry);
    }

    @Test
    void schedule_rejectsUnknownInterval() {
        assertThatThrownBy(() -> resource.schedule("hourly")).isInstanceOf(ValidationException.class);
    }

    @Test
    void unschedule_returns204Or404() {
        when(orchestrator.unschedule(CalibrationInterval.DAILY)).thenReturn(true);
        when(orchestrator.unschedule(CalibrationInterval.MONTHLY)).thenReturn(false);

        assertThat(resource.unschedule("daily").getStatus()).isEqualTo(204);
        assertThat(resource.unschedule("monthly").getStatus()).isEqualTo(404);
    }

    @Test
    void schedules_listsEntries() {
        when(orchestrator.getSchedules()).thenReturn(List.of());

        assertThat(resource.schedules().getEntity()).isEqualTo(List.of());
    }
}
