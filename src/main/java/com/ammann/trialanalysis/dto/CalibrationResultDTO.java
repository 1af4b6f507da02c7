/* (C)2026 */
package com.ammann.trialanalysis.dto;

import com.ammann.trialanalysis.enumeration.CalibrationQuality;
import com.ammann.trialanalysis.enumeration.CalibrationType;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/** Outcome of a calibration run. */
@Schema(description = "Calibration result")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CalibrationResultDTO(
        @Schema(description = "Calibration identifier") String id,
        @Schema(description = "Standard or extended") CalibrationType type,
        @Schema(description = "Number of bits analysed") int trials,
        @Schema(description = "Wall-clock duration in milliseconds") long durationMillis,
        @Schema(description = "Health score in [0, 100]") double rngHealth,
        @Schema(description = "Percentage of passing randomness tests") double passRate,
        @Schema(description = "Randomness battery results") RandomnessSuiteResultDTO testResults,
        @Schema(description = "Baseline of the calibration bits") BaselineResultDTO baseline,
        @Schema(description = "Quality tier") CalibrationQuality quality,
        @Schema(description = "Recommendations") List<String> recommendations,
        @Schema(description = "Report timestamp") Instant timestamp)
        implements AnalysisReport {

    public CalibrationResultDTO {
        recommendations = List.copyOf(recommendations);
    }
}
