/* (C)2026 */
package com.ammann.trialanalysis.config;

import com.ammann.trialanalysis.exception.InvalidConfigurationException;

/** Range checks shared by the configuration records. */
final class ConfigChecks {

    private ConfigChecks() {}

    static void positive(String property, double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new InvalidConfigurationException(property, value, "a finite value > 0");
        }
    }

    static void positive(String property, long value) {
        if (value <= 0) {
            throw new InvalidConfigurationException(property, value, "a value > 0");
        }
    }

    static void probability(String property, double value) {
        if (!(value > 0 && value < 1)) {
            throw new InvalidConfigurationException(property, value, "a value in (0, 1)");
        }
    }

    static void inRange(String property, double value, double min, double max) {
        if (!(value >= min && value <= max)) {
            throw new InvalidConfigurationException(
                    property, value, String.format("a value in [%s, %s]", min, max));
        }
    }

    static void atLeast(String property, long value, long min) {
        if (value < min) {
            throw new InvalidConfigurationException(property, value, "a value >= " + min);
        }
    }
}
