/* (C)2026 */
package com.ammann.trialanalysis.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/** Extended calibration: a standard result plus long-horizon analyses. */
@Schema(description = "Extended calibration result")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExtendedCalibrationResultDTO(
        @Schema(description = "Core calibration result") CalibrationResultDTO calibration,
        @Schema(description = "Drift of interval means per hour") double longTermDrift,
        @Schema(description = "Significant lag autocorrelations of interval means, 0 where insignificant")
        List<Double> periodicPatterns,
        @Schema(description = "Hour-of-day and day-of-week patterns") List<PeriodicPatternDTO> seasonalPatterns,
        @Schema(description = "Correlation of interval means with external signals")
        Map<String, Double> environmentalCorrelations,
        @Schema(description = "Degradation indicators") List<String> degradationIndicators,
        @Schema(description = "Number of sampled intervals") int intervalCount,
        @Schema(description = "True when the run was cancelled and the result is partial") boolean cancelled,
        @Schema(description = "When the next calibration is due") Instant nextCalibrationDue,
        @Schema(description = "Report timestamp") Instant timestamp)
        implements AnalysisReport {

    public ExtendedCalibrationResultDTO {
        periodicPatterns = List.copyOf(periodicPatterns);
        seasonalPatterns = List.copyOf(seasonalPatterns);
        environmentalCorrelations = Map.copyOf(environmentalCorrelations);
        degradationIndicators = List.copyOf(degradationIndicators);
    }
}
