/* (C)2026 */
package com.ammann.trialanalysis.dto;

import com.ammann.trialanalysis.enumeration.SignificanceLevel;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/** Z-test of a window mean against N/2. */
@Schema(description = "Z-test of the observed mean against the expected mean")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ZScoreResultDTO(
        @Schema(description = "(mean − N/2) / (sqrt(N/4)/sqrt(n))") double zScore,
        @Schema(description = "Two-tailed p-value") double pValue,
        @Schema(description = "Upper one-tailed p-value") double pValueOneTailed,
        @Schema(description = "Lower bound of the 95% interval for the mean") double confidenceLower,
        @Schema(description = "Upper bound of the 95% interval for the mean") double confidenceUpper,
        @Schema(description = "Standard error of the mean") double standardError,
        @Schema(description = "Cohen's d of the observed mean") double effectSize,
        @Schema(description = "Number of trials") int sampleSize,
        @Schema(description = "Significance band of the two-tailed p-value") SignificanceLevel significance,
        @Schema(description = "Report timestamp") Instant timestamp)
        implements AnalysisReport {}
