/* (C)2026 */
package com.ammann.trialanalysis.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Integrity of a trial batch, each component a fraction in [0, 1].
 *
 * @param completeness received / (received + estimated missing)
 * @param temporalConsistency fraction of intervals that are neither negative nor gaps
 * @param valueConsistency fraction of values inside [0, N]
 * @param sequenceIntegrity fraction of steps with non-decreasing sequence numbers
 * @param overall weighted blend 0.3 / 0.25 / 0.25 / 0.2
 * @param missingTrials estimated missing trials from sequence gaps
 * @param duplicateSequences number of repeated sequence numbers
 */
@Schema(description = "Data integrity summary")
public record DataIntegrityDTO(
        double completeness,
        double temporalConsistency,
        double valueConsistency,
        double sequenceIntegrity,
        double overall,
        long missingTrials,
        long duplicateSequences) {

    public static DataIntegrityDTO create(
            double completeness,
            double temporalConsistency,
            double valueConsistency,
            double sequenceIntegrity,
            long missingTrials,
            long duplicateSequences) {
        double overall = completeness * 0.3
                + temporalConsistency * 0.25
                + valueConsistency * 0.25
                + sequenceIntegrity * 0.2;
        return new DataIntegrityDTO(
                completeness, temporalConsistency, valueConsistency, sequenceIntegrity, overall,
                missingTrials, duplicateSequences);
    }

    public static DataIntegrityDTO empty() {
        return new DataIntegrityDTO(0, 0, 0, 0, 0, 0, 0);
    }
}
