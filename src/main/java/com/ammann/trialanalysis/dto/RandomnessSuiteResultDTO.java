/* (C)2026 */
package com.ammann.trialanalysis.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/** Results of the full randomness battery over one bit sequence. */
@Schema(description = "Randomness test suite result")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RandomnessSuiteResultDTO(
        @Schema(description = "Bit-level tests: frequency, block frequency, runs, longest run, cumulative sums")
        TestBatteryDTO bitTests,
        @Schema(description = "Byte-level tests: entropy, compression, chi-square, serial correlation")
        TestBatteryDTO byteTests,
        @Schema(description = "Autocorrelation scan") AutocorrelationResultDTO autocorrelation,
        @Schema(description = "Weighted overall quality in [0, 100]") double overallQuality,
        @Schema(description = "Recommendation derived from the quality band") String recommendation,
        @Schema(description = "Number of bits tested") int bitCount,
        @Schema(description = "Report timestamp") Instant timestamp)
        implements AnalysisReport {

    /** Every individual test result, bit-level first. */
    public List<RandomnessTestResultDTO> allResults() {
        List<RandomnessTestResultDTO> all = new ArrayList<>(bitTests.results());
        all.addAll(byteTests.results());
        return all;
    }

    /** Percentage of individual tests that passed. */
    public double passRatePercent() {
        List<RandomnessTestResultDTO> all = allResults();
        if (all.isEmpty()) {
            return 0.0;
        }
        long passed = all.stream().filter(RandomnessTestResultDTO::passed).count();
        return passed * 100.0 / all.size();
    }

    public RandomnessTestResultDTO result(String testName) {
        RandomnessTestResultDTO found = bitTests.result(testName);
        return found != null ? found : byteTests.result(testName);
    }
}
