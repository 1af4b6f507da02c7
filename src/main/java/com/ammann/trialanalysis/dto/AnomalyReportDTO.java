/* (C)2026 */
package com.ammann.trialanalysis.dto;

import com.ammann.trialanalysis.enumeration.AnomalySeverity;
import com.ammann.trialanalysis.enumeration.AnomalyType;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * One anomaly found by a quality sub-detector.
 *
 * @param type detector that raised it
 * @param severity severity band
 * @param description human-readable description
 * @param confidence detector confidence in [0, 100]
 * @param value measured quantity (bias, run length, correlation, z-score, gap, CV)
 * @param startIndex first affected trial index
 * @param endIndex last affected trial index
 * @param startTime timestamp of the first affected trial
 * @param endTime timestamp of the last affected trial
 * @param affectedTrials trials affected, or estimated missing trials for gaps
 */
@Schema(description = "Detected anomaly")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnomalyReportDTO(
        AnomalyType type,
        AnomalySeverity severity,
        String description,
        double confidence,
        double value,
        int startIndex,
        int endIndex,
        Instant startTime,
        Instant endTime,
        long affectedTrials) {}
