/* (C)2026 */
package com.ammann.trialanalysis.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Group of randomness tests that passes as a whole when its pass rate reaches a floor.
 *
 * @param name battery name
 * @param results individual test results
 * @param passRate fraction of passing tests in [0, 1]
 * @param requiredPassRate pass-rate floor of the battery
 * @param passed whether passRate reaches requiredPassRate
 */
@Schema(description = "Randomness test battery")
public record TestBatteryDTO(
        String name, List<RandomnessTestResultDTO> results, double passRate, double requiredPassRate, boolean passed) {

    public TestBatteryDTO {
        results = List.copyOf(results);
    }

    public static TestBatteryDTO of(String name, List<RandomnessTestResultDTO> results, double requiredPassRate) {
        long passedCount = results.stream().filter(RandomnessTestResultDTO::passed).count();
        double passRate = results.isEmpty() ? 0.0 : (double) passedCount / results.size();
        return new TestBatteryDTO(name, results, passRate, requiredPassRate, passRate >= requiredPassRate);
    }

    public long passedCount() {
        return results.stream().filter(RandomnessTestResultDTO::passed).count();
    }

    public RandomnessTestResultDTO result(String testName) {
        return results.stream().filter(r -> r.testName().equals(testName)).findFirst().orElse(null);
    }
}
