/* (C)2026 */
package com.ammann.trialanalysis.dto;

import com.ammann.trialanalysis.enumeration.AnomalySeverity;
import com.ammann.trialanalysis.enumeration.QualityVerdict;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/** Quality assessment of one trial batch. */
@Schema(description = "Quality report with metrics, anomalies and a verdict")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QualityReportDTO(
        @Schema(description = "Score in [0, 100]") double score,
        @Schema(description = "pass, warning or fail") QualityVerdict verdict,
        @Schema(description = "Number of trials assessed") int sampleSize,
        @Schema(description = "Timestamp of the first trial") Instant windowStart,
        @Schema(description = "Timestamp of the last trial") Instant windowEnd,
        @Schema(description = "Metric results") List<QualityMetricDTO> metrics,
        @Schema(description = "Detected anomalies") List<AnomalyReportDTO> anomalies,
        @Schema(description = "Integrity summary") DataIntegrityDTO integrity,
        @Schema(description = "Recommendations") List<String> recommendations,
        @Schema(description = "True when an alert should be raised") boolean alert,
        @Schema(description = "Report timestamp") Instant timestamp)
        implements AnalysisReport {

    public static final String NO_DATA_RECOMMENDATION = "No data available for quality assessment";

    public QualityReportDTO {
        metrics = List.copyOf(metrics);
        anomalies = List.copyOf(anomalies);
        recommendations = List.copyOf(recommendations);
    }

    /** Canonical report for an empty batch: score 0, verdict fail, no-data recommendation. */
    public static QualityReportDTO empty(Instant timestamp) {
        return new QualityReportDTO(
                0.0,
                QualityVerdict.FAIL,
                0,
                null,
                null,
                List.of(),
                List.of(),
                DataIntegrityDTO.empty(),
                List.of(NO_DATA_RECOMMENDATION),
                false,
                timestamp);
    }

    public long countBySeverity(AnomalySeverity severity) {
        return anomalies.stream().filter(a -> a.severity() == severity).count();
    }

    public boolean isEmpty() {
        return sampleSize == 0;
    }
}
