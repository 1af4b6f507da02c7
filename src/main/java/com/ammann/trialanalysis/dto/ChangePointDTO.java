/* (C)2026 */
package com.ammann.trialanalysis.dto;

import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Change point found by the CUSUM scan over window means.
 *
 * @param index window index of the running extremum
 * @param timestamp mean timestamp of that window
 * @param confidence min(0.99, magnitude / 5)
 * @param magnitudeChange |cumulative sum| in units of the window-mean standard deviation
 */
@Schema(description = "Detected change point")
public record ChangePointDTO(int index, Instant timestamp, double confidence, double magnitudeChange) {}
