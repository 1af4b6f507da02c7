/* (C)2026 */
package com.ammann.trialanalysis.dto;

import com.ammann.trialanalysis.enumeration.PeriodType;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Periodic pattern of baseline means grouped by hour of day or day of week.
 *
 * @param period grouping
 * @param frequency 1 / number of groups
 * @param amplitude root-mean-square deviation of the group means
 * @param phase angle of the group with the largest deviation
 * @param fStatistic between-group over within-group variance ratio
 * @param confidence min(95, 10·F) when F exceeds 2, else 0
 */
@Schema(description = "Periodic baseline pattern")
public record PeriodicPatternDTO(
        PeriodType period, double frequency, double amplitude, double phase, double fStatistic, double confidence) {}
