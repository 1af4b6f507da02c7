/* (C)2026 */
package com.ammann.trialanalysis.dto;

import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * One point of the cumulative-deviation series.
 *
 * @param trialIndex zero-based index in the window
 * @param timestamp trial timestamp
 * @param cumulativeDeviation Σ (value − N/2) up to and including this trial
 * @param runningMean mean of the values so far
 * @param zScore cumulativeDeviation / sqrt(N/4 · (index + 1))
 */
@Schema(description = "Point of the cumulative deviation series")
public record CumulativePointDTO(
        int trialIndex, Instant timestamp, double cumulativeDeviation, double runningMean, double zScore) {}
