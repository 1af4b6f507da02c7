package com.ammann.trialanalysis.exception;

/**
 * Base unchecked exception for every contract violation raised by the analysis engine.
 *
 * <p>Low quality scores, anomalies and failed randomness tests are reported as data and
 * never surface through this hierarchy. Subclasses are mapped to HTTP status codes by
 * {@link GlobalExceptionHandler}.
 */
public class ApiException extends RuntimeException
{
    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }
    public ApiException(String message) {
        super(message);
    }

    public ApiException(Throwable cause) {
        super(cause);
    }
}
