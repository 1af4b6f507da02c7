/* (C)2026 */
package com.ammann.trialanalysis.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/** Cumulative deviation series of a window and the excursions found in it. */
@Schema(description = "Cumulative deviation analysis with excursion periods")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CumulativeResultDTO(
        @Schema(description = "Series points") List<CumulativePointDTO> points,
        @Schema(description = "Cumulative deviation after the last trial") double finalDeviation,
        @Schema(description = "Largest cumulative deviation") double maxDeviation,
        @Schema(description = "Smallest cumulative deviation") double minDeviation,
        @Schema(description = "Number of zero crossings of the cumulative deviation") int crossings,
        @Schema(description = "Recorded excursions") List<ExcursionPeriodDTO> excursions,
        @Schema(description = "Report timestamp") Instant timestamp)
        implements AnalysisReport {

    public CumulativeResultDTO {
        points = List.copyOf(points);
        excursions = List.copyOf(excursions);
    }

    public static CumulativeResultDTO empty(Instant timestamp) {
        return new CumulativeResultDTO(List.of(), 0.0, 0.0, 0.0, 0, List.of(), timestamp);
    }
}
