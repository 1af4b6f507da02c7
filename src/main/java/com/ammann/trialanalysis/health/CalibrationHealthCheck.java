/* (C)2026 */
package com.ammann.trialanalysis.health;

import com.ammann.trialanalysis.dto.CalibrationProgressDTO;
import com.ammann.trialanalysis.dto.CalibrationResultDTO;
import com.ammann.trialanalysis.dto.QualityReportDTO;
import com.ammann.trialanalysis.enumeration.CalibrationState;
import com.ammann.trialanalysis.service.CalibrationOrchestrator;
import com.ammann.trialanalysis.service.QualityController;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Optional;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness check exposing calibration state and the last quality verdict.
 *
 * <p>Reports DOWN only when the most recent calibration failed; a failing quality verdict
 * is data and is exposed without affecting readiness.
 */
@Readiness
@ApplicationScoped
public class CalibrationHealthCheck implements HealthCheck {

    private final CalibrationOrchestrator orchestrator;
    private final QualityController qualityController;

    @Inject
    public CalibrationHealthCheck(CalibrationOrchestrator orchestrator, QualityController qualityController) {
        this.orchestrator = orchestrator;
        this.qualityController = qualityController;
    }

    @Override
    public HealthCheckResponse call() {
        CalibrationProgressDTO progress = orchestrator.getProgress();
        boolean up = progress.state() != CalibrationState.FAILED;

        HealthCheckResponseBuilder builder = HealthCheckResponse.named("calibration-health")
                .status(up)
                .withData("calibration-state", progress.state().name())
                .withData("calibration-phase", progress.phase().name());

        Optional<CalibrationResultDTO> last = orchestrator.getLastResult();
        last.ifPresent(result -> builder
                .withData("last-calibration", result.timestamp().toString())
                .withData("last-calibration-quality", result.quality().name()));

        Optional<QualityReportDTO> report = qualityController.getLastReport();
        report.ifPresent(r -> builder
                .withData("last-quality-verdict", r.verdict().name())
                .withData("last-quality-score", (long) Math.round(r.score())));

        if (progress.message() != null) {
            builder.withData("message", progress.message());
        }
        return builder.build();
    }
}
