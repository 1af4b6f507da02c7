/* (C)2026 */
package com.ammann.trialanalysis.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Outcome of one randomness test.
 *
 * @param testName short test name
 * @param statistic test statistic
 * @param pValue p-value, or the metric itself for heuristic byte-level tests
 * @param passed whether the test passed at its threshold
 * @param threshold α or heuristic cut-off used for the decision
 * @param description human-readable summary
 */
@Schema(description = "Single randomness test result")
public record RandomnessTestResultDTO(
        String testName, double statistic, double pValue, boolean passed, double threshold, String description) {

    /** Result of a p-value test that passes when {@code pValue ≥ alpha}. */
    public static RandomnessTestResultDTO pValueTest(
            String testName, double statistic, double pValue, double alpha, String description) {
        return new RandomnessTestResultDTO(testName, statistic, pValue, pValue >= alpha, alpha, description);
    }
}
