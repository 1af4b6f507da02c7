/* (C)2026 */
package com.ammann.trialanalysis.enumeration;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class EffectMagnitudeTest {

    @ParameterizedTest
    @CsvSource({"0.1,NEGLIGIBLE", "-0.3,SMALL", "0.5,MEDIUM", "-0.8,LARGE", "2.0,LARGE"})
    void bandsUseAbsoluteCohensD(double d, EffectMagnitude expected) {
        assertThat(EffectMagnitude.fromCohensD(d)).isEqualTo(expected);
    }
}
