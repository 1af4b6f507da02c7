/* (C)2026 */
package com.ammann.trialanalysis.scheduled;

import com.ammann.trialanalysis.service.CalibrationOrchestrator;
import com.ammann.trialanalysis.service.QualityController;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import org.jboss.logging.Logger;

/**
 * Recurring jobs of the analysis engine.
 * <p>
 * <ol>
 *   <li><b>Quality scan:</b> assesses the most recent hour of trials and stores the report</li>
 *   <li><b>Calibration schedule:</b> starts a standard calibration for due schedule entries</li>
 * </ol>
 */
@ApplicationScoped
public class AnalysisScheduler {

    private static final Logger LOG = Logger.getLogger(AnalysisScheduler.class);

    static final Duration QUALITY_WINDOW = Duration.ofHours(1);

    private final QualityController qualityController;
    private final CalibrationOrchestrator orchestrator;

    @Inject
    public AnalysisScheduler(QualityController qualityController, CalibrationOrchestrator orchestrator) {
        this.qualityController = qualityController;
        this.orchestrator = orchestrator;
    }

    @Scheduled(
            cron = "{analysis.quality.scan-cron}",
            identity = "hourly-quality-scan",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public void scanRecentQuality() {
        try {
            qualityController.assessRecent(QUALITY_WINDOW);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Scheduled quality scan failed");
        }
    }

    @Scheduled(
            every = "{analysis.calibration.schedule-check-every}",
            identity = "calibration-schedule-check",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public void startDueCalibrations() {
        orchestrator.runDueCalibrations()
                .ifPresent(future -> future.whenComplete((result, error) -> {
                    if (error != null) {
                        LOG.errorf(error, "Scheduled calibration failed");
                    } else {
                        LOG.infof("Scheduled calibration %s finished with quality %s", result.id(), result.quality());
                    }
                }));
    }
}
