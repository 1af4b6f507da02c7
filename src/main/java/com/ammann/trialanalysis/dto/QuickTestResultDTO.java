/* (C)2026 */
package com.ammann.trialanalysis.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Lightweight randomness screen used by health checks.
 *
 * @param frequencyBias |ones/n − 0.5|
 * @param runsDeviation |runs − expected runs|
 * @param lag1Correlation lag-1 autocorrelation of the bits
 * @param quality score starting at 100 with fixed penalties per failed check
 * @param issues one entry per failed check
 */
@Schema(description = "Quick randomness screen")
public record QuickTestResultDTO(
        double frequencyBias, double runsDeviation, double lag1Correlation, double quality, List<String> issues) {

    public QuickTestResultDTO {
        issues = List.copyOf(issues);
    }

    public boolean passed() {
        return issues.isEmpty();
    }
}
