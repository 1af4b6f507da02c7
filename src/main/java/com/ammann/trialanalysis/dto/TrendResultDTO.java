/* (C)2026 */
package com.ammann.trialanalysis.dto;

import com.ammann.trialanalysis.enumeration.TrendDirection;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/** Linear trend of windowed mean deviations plus CUSUM change points. */
@Schema(description = "Trend of window-mean deviations over time")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrendResultDTO(
        @Schema(description = "Slope of mean deviation per hour") double slope,
        @Schema(description = "Two-sided p-value of the slope") double slopeSignificance,
        @Schema(description = "Correlation of window means with time") double correlation,
        @Schema(description = "Direction, non-stable only when significant") TrendDirection trendDirection,
        @Schema(description = "Number of windows used") int windowCount,
        @Schema(description = "CUSUM change points") List<ChangePointDTO> changePoints,
        @Schema(description = "Report timestamp") Instant timestamp)
        implements AnalysisReport {

    public TrendResultDTO {
        changePoints = List.copyOf(changePoints);
    }

    public static TrendResultDTO stable(int windowCount, Instant timestamp) {
        return new TrendResultDTO(0.0, 1.0, 0.0, TrendDirection.STABLE, windowCount, List.of(), timestamp);
    }
}
