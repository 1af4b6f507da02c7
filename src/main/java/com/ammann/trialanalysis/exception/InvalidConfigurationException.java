/* (C)2026 */
package com.ammann.trialanalysis.exception;

/**
 * Raised while building the analysis configuration when a threshold, window size or
 * significance level lies outside its domain.
 */
public class InvalidConfigurationException extends ApiException {

    private final String property;

    public InvalidConfigurationException(String property, Object value, String expected) {
        super(String.format(
                "Invalid configuration '%s': got '%s', expected %s", property, value, expected));
        this.property = property;
    }

    public String getProperty() {
        return property;
    }
}
