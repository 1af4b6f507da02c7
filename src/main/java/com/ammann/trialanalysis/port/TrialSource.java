/* (C)2026 */
package com.ammann.trialanalysis.port;

/**
 * Source of binary draws used by calibrations and health checks.
 *
 * <p>Implementations wrap the generator hardware; failures surface as unchecked exceptions
 * and abort the running calibration.
 */
public interface TrialSource {

    /** Next binary draw, 0 or 1. */
    int nextBit();

    /** Draws {@code count} bits. */
    default int[] nextBits(int count) {
        int[] bits = new int[count];
        for (int i = 0; i < count; i++) {
            bits[i] = nextBit();
        }
        return bits;
    }

    /** Sum of {@code bitsPerTrial} draws. */
    default int nextTrialValue(int bitsPerTrial) {
        int sum = 0;
        for (int i = 0; i < bitsPerTrial; i++) {
            sum += nextBit();
        }
        return sum;
    }
}
