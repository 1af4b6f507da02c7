/* (C)2026 */
package com.ammann.trialanalysis.dto;

import java.time.Instant;

/**
 * Closed set of immutable report records produced by one analysis pass.
 *
 * <p>Consumers dispatch on the concrete record type. Reports carry no reference to mutable
 * engine state and are handed to the report repository as-is.
 */
public sealed interface AnalysisReport
        permits NetworkVarianceResultDTO,
                ZScoreResultDTO,
                EffectSizeResultDTO,
                CumulativeResultDTO,
                TrendResultDTO,
                RandomnessSuiteResultDTO,
                QualityReportDTO,
                BaselineResultDTO,
                CalibrationResultDTO,
                ExtendedCalibrationResultDTO,
                HardwareHealthReportDTO {

    /** Time the report was produced. */
    Instant timestamp();

    /** Stable kind name used as the persisted discriminator. */
    default String reportKind() {
        return getClass().getSimpleName().replace("DTO", "");
    }
}
