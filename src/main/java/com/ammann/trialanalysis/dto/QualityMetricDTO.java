/* (C)2026 */
package com.ammann.trialanalysis.dto;

import com.ammann.trialanalysis.enumeration.MetricStatus;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * One quality metric with its status band.
 *
 * @param name metric name
 * @param value observed value
 * @param threshold configured threshold
 * @param status status band
 * @param higherIsBetter whether larger values are better
 * @param description human-readable summary
 */
@Schema(description = "Quality metric")
public record QualityMetricDTO(
        String name, double value, double threshold, MetricStatus status, boolean higherIsBetter, String description) {

    public static QualityMetricDTO lowerIsBetter(String name, double value, double threshold, String description) {
        return new QualityMetricDTO(
                name, value, threshold, MetricStatus.lowerIsBetter(value, threshold), false, description);
    }

    public static QualityMetricDTO higherIsBetter(String name, double value, double threshold, String description) {
        return new QualityMetricDTO(
                name, value, threshold, MetricStatus.higherIsBetter(value, threshold), true, description);
    }
}
