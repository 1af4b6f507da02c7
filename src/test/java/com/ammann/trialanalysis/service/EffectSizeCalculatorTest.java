/* (C)2026 */
package com.ammann.trialanalysis.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ammann.trialanalysis.config.AnalysisConfig;
import com.ammann.trialanalysis.dto.EffectSizeResultDTO;
import com.ammann.trialanalysis.dto.PowerAnalysisDTO;
import com.ammann.trialanalysis.enumeration.EffectMagnitude;
import com.ammann.trialanalysis.exception.InsufficientDataException;
import com.ammann.trialanalysis.support.TrialFixtures;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class EffectSizeCalculatorTest {

    private final EffectSizeCalculator calculator = new EffectSizeCalculator(AnalysisConfig.withBitsPerTrial(100));

    @Test
    void cohensDOfConstantShift() {
        // N = 100: expected 50, sd 5; a shift of +2 gives d = 0.4
        EffectSizeResultDTO result = calculator.calculate(TrialFixtures.constant(40, 52));

        assertThat(result.cohensD()).isCloseTo(0.4, within(1e-12));
        assertThat(result.hedgesG()).isCloseTo(0.4 * (1 - 3.0 / 155), within(1e-12));
        assertThat(result.interpretation()).isEqualTo(EffectMagnitude.SMALL);
        assertThat(result.practicalSignificance()).isTrue();
        assertThat(result.confidenceLower()).isLessThan(0.4);
        assertThat(result.confidenceUpper()).isGreaterThan(0.4);
        assertThat(result.sampleSize()).isEqualTo(40);
    }

    @Test
    void pointBiserialIsZeroWhenOnlyOneDirectionOccurs() {
        EffectSizeResultDTO result = calculator.calculate(TrialFixtures.constant(10, 55));

        assertThat(result.pointBiserial()).isZero();
    }

    @Test
    void pointBiserialIsPositiveForMixedDirections() {
        EffectSizeResultDTO result = calculator.calculate(TrialFixtures.fromValues(45, 55, 45, 55));

        assertThat(result.cohensD()).isZero();
        assertThat(result.pointBiserial()).isCloseTo(1.0, within(1e-12));
        assertThat(result.interpretation()).isEqualTo(EffectMagnitude.NEGLIGIBLE);
    }

    @Test
    void emptyWindowIsRejected() {
        assertThatThrownBy(() -> calculator.calculate(List.of()))
                .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void hedgesCorrectionLeavesTinySamplesUnchanged() {
        assertThat(EffectSizeCalculator.hedgesG(0.5, 1)).isEqualTo(0.5);
        assertThat(EffectSizeCalculator.standardError(0.5, 3)).isZero();
    }

    @ParameterizedTest
    @CsvSource({
            "0.2, 197",
            "0.5, 32",
            "0.8, 13"
    })
    void requiredSampleSizeForEightyPercentPower(double d, long expected) {
        assertThat(EffectSizeCalculator.requiredSampleSize(d, 0.05, 0.8)).isEqualTo(expected);
    }

    @Test
    void powerAnalysisIsConsistent() {
        PowerAnalysisDTO power = calculator.powerAnalysis(0.5, 32);

        assertThat(power.power()).isGreaterThanOrEqualTo(0.8).isLessThan(0.82);
        assertThat(power.adequatelyPowered()).isTrue();
        assertThat(power.minimumDetectableEffect()).isCloseTo(2.801585 / Math.sqrt(32), within(1e-5));
        assertThat(calculator.powerAnalysis(0.0, 100).requiredSampleSize()).isZero();
        assertThat(EffectSizeCalculator.observedPower(0.0, 100, 0.05)).isCloseTo(0.05, within(1e-9));
        assertThat(EffectSizeCalculator.observedPower(0.3, 0, 0.05)).isZero();
    }
}
