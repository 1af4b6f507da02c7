/* (C)2026 */
package com.ammann.trialanalysis.enumeration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.trialanalysis.exception.ValidationException;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class CalibrationIntervalTest {

    @ParameterizedTest
    @CsvSource({"daily,DAILY", "WEEKLY,WEEKLY", " Monthly ,MONTHLY", "quarterly,QUARTERLY"})
    void parsesNamesIgnoringCase(String value, CalibrationInterval expected) {
        assertThat(CalibrationInterval.fromString(value)).isEqualTo(expected);
    }

    @Test
    void rejectsUnknownNames() {
        assertThatThrownBy(() -> CalibrationInterval.fromString("hourly"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("hourly");
        assertThatThrownBy(() -> CalibrationInterval.fromString(null)).isInstanceOf(ValidationException.class);
    }

    @Test
    void periods() {
        assertThat(CalibrationInterval.DAILY.getPeriod()).isEqualTo(Duration.ofDays(1));
        assertThat(CalibrationInterval.WEEKLY.getPeriod()).isEqualTo(Duration.ofDays(7));
        assertThat(CalibrationInterval.MONTHLY.getPeriod()).isEqualTo(Duration.ofDays(30));
        assertThat(CalibrationInterval.QUARTERLY.getPeriod()).isEqualTo(Duration.ofDays(90));
    }
}
