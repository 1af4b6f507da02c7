/* (C)2026 */
package com.ammann.trialanalysis.dto;

import com.ammann.trialanalysis.enumeration.SignificanceLevel;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Aggregate chi-square test over a trial window.
 *
 * <p>{@code netvar = Σ Z_i²} with {@code Z_i = (value_i − N/2)/sqrt(N/4)} and {@code df = n}.
 */
@Schema(description = "Network variance (sum of squared trial Z-scores) with chi-square significance")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NetworkVarianceResultDTO(
        @Schema(description = "Sum of squared per-trial Z-scores") double netvar,
        @Schema(description = "Degrees of freedom (number of trials)") int degreesOfFreedom,
        @Schema(description = "Upper-tail chi-square probability") double pValue,
        @Schema(description = "Significance band of the p-value") SignificanceLevel significance,
        @Schema(description = "Lower bound of the central 95% chi-square interval") double confidenceLower,
        @Schema(description = "Upper bound of the central 95% chi-square interval") double confidenceUpper,
        @Schema(description = "Expected netvar under the null hypothesis") double expectedNetvar,
        @Schema(description = "Standard error of netvar, sqrt(2·df)") double standardError,
        @Schema(description = "Report timestamp") Instant timestamp)
        implements AnalysisReport {

    /**
     * Builds the report from the raw statistic and the derived probability values.
     */
    public static NetworkVarianceResultDTO create(
            double netvar, int df, double pValue, double lower, double upper, Instant timestamp) {
        return new NetworkVarianceResultDTO(
                netvar,
                df,
                pValue,
                SignificanceLevel.fromPValue(pValue),
                lower,
                upper,
                df,
                Math.sqrt(2.0 * df),
                timestamp);
    }

    /** Netvar per degree of freedom; 1.0 is the null expectation. */
    public double normalizedNetvar() {
        return degreesOfFreedom == 0 ? 0.0 : netvar / degreesOfFreedom;
    }
}
