/* (C)2026 */
package com.ammann.trialanalysis.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Power of a two-sided z-test.
 *
 * @param effectSize effect size the power refers to
 * @param sampleSize sample size the power refers to
 * @param alpha significance level
 * @param power probability of detecting the effect at this sample size
 * @param requiredSampleSize trials needed for 80% power at this effect size, 0 when the effect is zero
 * @param minimumDetectableEffect smallest d detectable with 80% power at this sample size
 */
@Schema(description = "Statistical power analysis")
public record PowerAnalysisDTO(
        double effectSize,
        int sampleSize,
        double alpha,
        double power,
        long requiredSampleSize,
        double minimumDetectableEffect) {

    public boolean adequatelyPowered() {
        return power >= 0.8;
    }
}
