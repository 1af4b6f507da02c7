/* (C)2026 */
package com.ammann.trialanalysis.dto;

import com.ammann.trialanalysis.enumeration.ChangeType;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Comparison of a current baseline against a reference baseline.
 *
 * @param current current baseline
 * @param reference reference baseline
 * @param significantChange whether anything changed
 * @param changeType what changed
 * @param zScore pooled-variance z of the mean difference
 * @param pValue two-tailed p-value of zScore
 * @param recommendation textual recommendation
 */
@Schema(description = "Baseline comparison")
public record BaselineComparisonDTO(
        BaselineResultDTO current,
        BaselineResultDTO reference,
        boolean significantChange,
        ChangeType changeType,
        double zScore,
        double pValue,
        String recommendation) {}
