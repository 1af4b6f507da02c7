/* (C)2026 */
package com.ammann.trialanalysis.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/** Fitted moments of a baseline window. */
@Schema(description = "Baseline distribution estimate")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BaselineResultDTO(
        @Schema(description = "Sample mean") double mean,
        @Schema(description = "Sample variance (n − 1)") double variance,
        @Schema(description = "Sample standard deviation") double standardDeviation,
        @Schema(description = "Bias-corrected skewness") double skewness,
        @Schema(description = "Bias-corrected excess kurtosis") double kurtosis,
        @Schema(description = "Lower bound of the 95% interval for the mean") double confidence95Lower,
        @Schema(description = "Upper bound of the 95% interval for the mean") double confidence95Upper,
        @Schema(description = "Number of values") int sampleSize,
        @Schema(description = "Report timestamp") Instant timestamp)
        implements AnalysisReport {}
