/* (C)2026 */
package com.ammann.trialanalysis.service;

import com.ammann.trialanalysis.port.TrialSource;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import java.security.SecureRandom;

/**
 * Software trial source used when no hardware source bean is deployed.
 */
@DefaultBean
@ApplicationScoped
public class SecureRandomTrialSource implements TrialSource {

    private final SecureRandom random = new SecureRandom();

    @Override
    public int nextBit() {
        return random.nextBoolean() ? 1 : 0;
    }

    @Override
    public int[] nextBits(int count) {
        int[] bits = new int[count];
        byte[] buffer = new byte[(count + 7) / 8];
        random.nextBytes(buffer);
        for (int i = 0; i < count; i++) {
            bits[i] = (buffer[i / 8] >> (7 - i % 8)) & 1;
        }
        return bits;
    }
}
