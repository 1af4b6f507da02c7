/* (C)2026 */
package com.ammann.trialanalysis.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/** Hardware and source health check. */
@Schema(description = "Hardware health report")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HardwareHealthReportDTO(
        @Schema(description = "Weighted overall health in [0, 100]") double overallHealth,
        @Schema(description = "Sampling throughput score") double rngPerformance,
        @Schema(description = "Quick randomness screen") QuickTestResultDTO quickTests,
        @Schema(description = "Timing accuracy score") double timingAccuracy,
        @Schema(description = "Sample integrity score") double dataIntegrity,
        @Schema(description = "Host resource usage") SystemResourcesDTO systemResources,
        @Schema(description = "Recommendations") List<String> recommendations,
        @Schema(description = "Report timestamp") Instant timestamp)
        implements AnalysisReport {

    public HardwareHealthReportDTO {
        recommendations = List.copyOf(recommendations);
    }
}
