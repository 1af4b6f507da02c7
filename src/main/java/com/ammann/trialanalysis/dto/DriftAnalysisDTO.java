/* (C)2026 */
package com.ammann.trialanalysis.dto;

import com.ammann.trialanalysis.enumeration.TrendDirection;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Drift of baseline means over elapsed hours.
 *
 * @param overallDrift slope multiplied by the covered span in hours
 * @param driftRate slope per hour
 * @param direction direction, stable when |slope| is at most 0.001
 * @param significance two-sided p-value of the slope
 * @param changePoints split indices whose before/after mean difference exceeds the threshold
 * @param confidence |r| · 100
 */
@Schema(description = "Baseline drift analysis")
public record DriftAnalysisDTO(
        double overallDrift,
        double driftRate,
        TrendDirection direction,
        double significance,
        List<Integer> changePoints,
        double confidence) {

    public DriftAnalysisDTO {
        changePoints = List.copyOf(changePoints);
    }

    public static DriftAnalysisDTO stable() {
        return new DriftAnalysisDTO(0.0, 0.0, TrendDirection.STABLE, 0.0, List.of(), 0.0);
    }
}
