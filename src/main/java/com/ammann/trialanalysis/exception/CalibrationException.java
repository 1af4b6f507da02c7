package com.ammann.trialanalysis.exception;

/**
 * Exception indicating that the trial source failed while a calibration was sampling.
 *
 * <p>Mapped to HTTP 503 (Service Unavailable) by {@link GlobalExceptionHandler}.
 */
public class CalibrationException extends ApiException {

    public CalibrationException(String message, Throwable cause) {
        super(message, cause);
    }
    public CalibrationException(String message) {
        super(message);
    }
}
