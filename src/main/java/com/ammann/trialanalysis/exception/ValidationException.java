package com.ammann.trialanalysis.exception;

/**
 * Exception indicating that a caller-supplied parameter or trial window does not meet
 * the constraints of the requested analysis.
 *
 * <p>Mapped to HTTP 400 (Bad Request) by {@link GlobalExceptionHandler}.
 */
public class ValidationException extends ApiException {

    public ValidationException(String message) {
        super(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates validation exception for insufficient data.
     */
    public static ValidationException insufficientData(String resourceType, int required, int actual) {
        return new InsufficientDataException(resourceType, required, actual);
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }
}
