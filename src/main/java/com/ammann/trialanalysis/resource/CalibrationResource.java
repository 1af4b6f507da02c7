/* (C)2026 */
package com.ammann.trialanalysis.resource;

import com.ammann.trialanalysis.dto.CalibrationProgressDTO;
import com.ammann.trialanalysis.dto.CalibrationScheduleDTO;
import com.ammann.trialanalysis.dto.HardwareHealthReportDTO;
import com.ammann.trialanalysis.enumeration.CalibrationInterval;
import com.ammann.trialanalysis.exception.ValidationException;
import com.ammann.trialanalysis.properties.ApiProperties;
import com.ammann.trialanalysis.service.CalibrationOrchestrator;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource controlling calibration runs and their schedule.
 *
 * <p>Start endpoints return {@code 202 Accepted} with the current progress; callers poll
 * {@code /status} until the run reaches a final state. A second start while one is active
 * answers {@code 409 Conflict}.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Calibration.BASE)
@Tag(name = "Calibration API", description = "Trial source calibration and health checks")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class CalibrationResource {

    private static final Logger LOG = Logger.getLogger(CalibrationResource.class);

    static final int MAX_EXTENDED_HOURS = 24 * 7;

    @Inject CalibrationOrchestrator orchestrator;

    @POST
    @Path(ApiProperties.Calibration.STANDARD)
    @Operation(
            summary = "Start a standard calibration",
            description = "Draws the given number of bits and runs the randomness battery")
    @APIResponses({
        @APIResponse(
                responseCode = "202",
                description = "Calibration started",
                content = @Content(schema = @Schema(implementation = CalibrationProgressDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid trial count"),
        @APIResponse(responseCode = "409", description = "Calibration already running")
    })
    public Response startStandard(@QueryParam("trials") Integer trials) {
        if (trials == null) {
            orchestrator.startStandardCalibration();
        } else {
            orchestrator.startStandardCalibration(trials);
        }
        CalibrationProgressDTO progress = orchestrator.getProgress();
        LOG.infof("Standard calibration %s accepted", progress.calibrationId());
        return Response.accepted(progress).build();
    }

    @POST
    @Path(ApiProperties.Calibration.EXTENDED)
    @Operation(
            summary = "Start an extended calibration",
            description = "Samples in intervals over the given hours and analyses drift and periodicity")
    @APIResponses({
        @APIResponse(
                responseCode = "202",
                description = "Calibration started",
                content = @Content(schema = @Schema(implementation = CalibrationProgressDTO.class))),
        @APIResponse(responseCode = "400", description = "Hours out of range"),
        @APIResponse(responseCode = "409", description = "Calibration already running")
    })
    public Response startExtended(@QueryParam("hours") @DefaultValue("24") int hours) {
        if (hours < 1 || hours > MAX_EXTENDED_HOURS) {
            throw ValidationException.invalidParameter("hours", hours, "1.." + MAX_EXTENDED_HOURS);
        }
        orchestrator.startExtendedCalibration(Duration.ofHours(hours));
        CalibrationProgressDTO progress = orchestrator.getProgress();
        LOG.infof("Extended calibration %s accepted for %d h", progress.calibrationId(), hours);
        return Response.accepted(progress).build();
    }

    @POST
    @Path(ApiProperties.Calibration.CANCEL)
    @Operation(summary = "Request cancellation of the running calibration")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Cancellation requested"),
        @APIResponse(responseCode = "404", description = "No calibration running")
    })
    public Response cancel() {
        if (!orchestrator.cancel()) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(Map.of("error", "No calibration running"))
                    .build();
        }
        return Response.ok(orchestrator.getProgress()).build();
    }

    @GET
    @Path(ApiProperties.Calibration.STATUS)
    @Operation(summary = "Current calibration progress")
    @APIResponse(
            responseCode = "200",
            description = "Progress snapshot",
            content = @Content(schema = @Schema(implementation = CalibrationProgressDTO.class)))
    public Response status() {
        return Response.ok(orchestrator.getProgress()).build();
    }

    @POST
    @Path(ApiProperties.Calibration.HEALTH_CHECK)
    @Operation(
            summary = "Run a hardware health check",
            description = "Quick randomness tests, timing accuracy and system resources")
    @APIResponse(
            responseCode = "200",
            description = "Health report",
            content = @Content(schema = @Schema(implementation = HardwareHealthReportDTO.class)))
    public Response healthCheck() {
        HardwareHealthReportDTO report = orchestrator.runHealthCheck();
        LOG.infof("Health check finished: overall=%.1f", report.overallHealth());
        return Response.ok(report).build();
    }

    @GET
    @Path(ApiProperties.Calibration.SCHEDULES)
    @Operation(summary = "List recurring calibration schedules")
    @APIResponse(
            responseCode = "200",
            description = "Schedule entries",
            content = @Content(schema = @Schema(implementation = CalibrationScheduleDTO[].class)))
    public Response schedules() {
        List<CalibrationScheduleDTO> schedules = orchestrator.getSchedules();
        return Response.ok(schedules).build();
    }

    @POST
    @Path(ApiProperties.Calibration.SCHEDULES + "/{interval}")
    @Operation(summary = "Schedule a recurring standard calibration")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Schedule entry",
                content = @Content(schema = @Schema(implementation = CalibrationScheduleDTO.class))),
        @APIResponse(responseCode = "400", description = "Unknown interval")
    })
    public Response schedule(@PathParam("interval") String interval) {
        CalibrationScheduleDTO entry = orchestrator.schedule(CalibrationInterval.fromString(interval));
        return Response.ok(entry).build();
    }

    @DELETE
    @Path(ApiProperties.Calibration.SCHEDULES + "/{interval}")
    @Operation(summary = "Remove a recurring calibration")
    @APIResponses({
        @APIResponse(responseCode = "204", description = "Schedule removed"),
        @APIResponse(responseCode = "400", description = "Unknown interval"),
        @APIResponse(responseCode = "404", description = "Interval not scheduled")
    })
    public Response unschedule(@PathParam("interval") String interval) {
        if (!orchestrator.unschedule(CalibrationInterval.fromString(interval))) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(Map.of("error", "Interval not scheduled"))
                    .build();
        }
        return Response.noContent().build();
    }
}
