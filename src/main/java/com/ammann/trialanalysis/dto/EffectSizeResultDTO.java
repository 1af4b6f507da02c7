/* (C)2026 */
package com.ammann.trialanalysis.dto;

import com.ammann.trialanalysis.enumeration.EffectMagnitude;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/** Standardized effect of a window's mean deviation, with power analysis. */
@Schema(description = "Effect size of the deviation from the expected mean")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EffectSizeResultDTO(
        @Schema(description = "Cohen's d") double cohensD,
        @Schema(description = "Hedges' g (small-sample corrected d)") double hedgesG,
        @Schema(description = "Point-biserial correlation between deviation and its direction") double pointBiserial,
        @Schema(description = "Lower bound of the interval around d") double confidenceLower,
        @Schema(description = "Upper bound of the interval around d") double confidenceUpper,
        @Schema(description = "Conventional interpretation band of d") EffectMagnitude interpretation,
        @Schema(description = "True when |d| ≥ 0.2") boolean practicalSignificance,
        @Schema(description = "Power analysis for the observed effect") PowerAnalysisDTO power,
        @Schema(description = "Number of trials") int sampleSize,
        @Schema(description = "Report timestamp") Instant timestamp)
        implements AnalysisReport {

    public static EffectSizeResultDTO create(
            double d,
            double g,
            double pointBiserial,
            double lower,
            double upper,
            PowerAnalysisDTO power,
            int n,
            Instant timestamp) {
        return new EffectSizeResultDTO(
                d,
                g,
                pointBiserial,
                lower,
                upper,
                EffectMagnitude.fromCohensD(d),
                Math.abs(d) >= 0.2,
                power,
                n,
                timestamp);
    }
}
