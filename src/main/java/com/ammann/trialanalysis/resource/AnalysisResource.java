/* (C)2026 */
package com.ammann.trialanalysis.resource;

import com.ammann.trialanalysis.dto.CumulativeResultDTO;
import com.ammann.trialanalysis.dto.EffectSizeResultDTO;
import com.ammann.trialanalysis.dto.NetworkVarianceResultDTO;
import com.ammann.trialanalysis.dto.QualityReportDTO;
import com.ammann.trialanalysis.dto.TrendResultDTO;
import com.ammann.trialanalysis.dto.ZScoreResultDTO;
import com.ammann.trialanalysis.exception.ValidationException;
import com.ammann.trialanalysis.properties.ApiProperties;
import com.ammann.trialanalysis.service.QualityController;
import com.ammann.trialanalysis.service.SessionAnalysisService;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.time.Duration;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource running statistical analyses over stored trials.
 *
 * <p>Session endpoints analyse every trial of one session and store the resulting report.
 * The quality endpoint assesses the most recent trials across sessions.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Analysis.BASE)
@Tag(name = "Analysis API", description = "Session statistics and data quality")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AnalysisResource {

    private static final Logger LOG = Logger.getLogger(AnalysisResource.class);

    static final int MAX_QUALITY_HOURS = 24 * 7;

    @Inject SessionAnalysisService sessionAnalysis;

    @Inject QualityController qualityController;

    @GET
    @Path(ApiProperties.Analysis.NETWORK_VARIANCE)
    @Operation(
            summary = "Network variance of a session",
            description = "Chi-square test of summed squared trial z-scores against the trial count")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Analysis completed",
                content = @Content(schema = @Schema(implementation = NetworkVarianceResultDTO.class))),
        @APIResponse(responseCode = "400", description = "Missing session id")
    })
    public Response networkVariance(@QueryParam("sessionId") String sessionId) {
        LOG.debugf("Network variance request: sessionId=%s", sessionId);
        return Response.ok(sessionAnalysis.networkVariance(sessionId)).build();
    }

    @GET
    @Path(ApiProperties.Analysis.Z_SCORE)
    @Operation(summary = "Stouffer z-score of a session")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Analysis completed",
                content = @Content(schema = @Schema(implementation = ZScoreResultDTO.class))),
        @APIResponse(responseCode = "400", description = "Missing session id")
    })
    public Response zScore(@QueryParam("sessionId") String sessionId) {
        LOG.debugf("Z-score request: sessionId=%s", sessionId);
        return Response.ok(sessionAnalysis.zScore(sessionId)).build();
    }

    @GET
    @Path(ApiProperties.Analysis.EFFECT_SIZE)
    @Operation(
            summary = "Effect size of a session",
            description = "Cohen's d with confidence interval and post-hoc power")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Analysis completed",
                content = @Content(schema = @Schema(implementation = EffectSizeResultDTO.class))),
        @APIResponse(responseCode = "400", description = "Missing session id")
    })
    public Response effectSize(@QueryParam("sessionId") String sessionId) {
        LOG.debugf("Effect size request: sessionId=%s", sessionId);
        return Response.ok(sessionAnalysis.effectSize(sessionId)).build();
    }

    @GET
    @Path(ApiProperties.Analysis.CUMULATIVE)
    @Operation(
            summary = "Cumulative deviation of a session",
            description = "Cumulative deviation series with zero crossings and significant excursions")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Analysis completed",
                content = @Content(schema = @Schema(implementation = CumulativeResultDTO.class))),
        @APIResponse(responseCode = "400", description = "Missing session id")
    })
    public Response cumulative(@QueryParam("sessionId") String sessionId) {
        LOG.debugf("Cumulative deviation request: sessionId=%s", sessionId);
        return Response.ok(sessionAnalysis.cumulative(sessionId)).build();
    }

    @GET
    @Path(ApiProperties.Analysis.TREND)
    @Operation(
            summary = "Trend of a session",
            description = "Linear trend over sliding window means and CUSUM change points")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Analysis completed",
                content = @Content(schema = @Schema(implementation = TrendResultDTO.class))),
        @APIResponse(responseCode = "400", description = "Missing session id")
    })
    public Response trend(@QueryParam("sessionId") String sessionId) {
        LOG.debugf("Trend request: sessionId=%s", sessionId);
        return Response.ok(sessionAnalysis.trend(sessionId)).build();
    }

    @GET
    @Path(ApiProperties.Analysis.QUALITY)
    @Operation(
            summary = "Quality report of recent trials",
            description = "Assesses the trials of the last hours and stores the report")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Assessment completed",
                content = @Content(schema = @Schema(implementation = QualityReportDTO.class))),
        @APIResponse(responseCode = "400", description = "Hours out of range")
    })
    public Response quality(@QueryParam("hours") @DefaultValue("1") int hours) {
        if (hours < 1 || hours > MAX_QUALITY_HOURS) {
            throw ValidationException.invalidParameter("hours", hours, "1.." + MAX_QUALITY_HOURS);
        }
        QualityReportDTO report = qualityController.assessRecent(Duration.ofHours(hours));
        LOG.infof("Quality assessment over %d h: score=%.1f, verdict=%s", hours, report.score(), report.verdict());
        return Response.ok(report).build();
    }
}
