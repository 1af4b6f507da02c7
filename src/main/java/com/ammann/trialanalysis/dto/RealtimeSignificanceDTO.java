/* (C)2026 */
package com.ammann.trialanalysis.dto;

import com.ammann.trialanalysis.enumeration.SignificanceLevel;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Significance derived from a live running aggregate.
 *
 * @param trials trials folded in so far
 * @param cumulativeZ cumulativeDeviation / sqrt(N/4 · n)
 * @param pValue two-tailed p-value of cumulativeZ
 * @param significance band of pValue
 * @param effectSize Cohen's d of the running mean
 * @param power observed power of a two-sided test at the configured α
 */
@Schema(description = "Running significance")
public record RealtimeSignificanceDTO(
        long trials,
        double cumulativeZ,
        double pValue,
        SignificanceLevel significance,
        double effectSize,
        double power) {}
