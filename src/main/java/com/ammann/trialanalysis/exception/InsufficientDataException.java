/* (C)2026 */
package com.ammann.trialanalysis.exception;

/**
 * Raised when an analysis that needs at least one observation (network variance, z-score,
 * effect size, baseline moments) is invoked with a window that is too small.
 */
public class InsufficientDataException extends ValidationException {

    private final String resourceType;
    private final int required;
    private final int actual;

    public InsufficientDataException(String resourceType, int required, int actual) {
        super(String.format(
                "Insufficient %s: need at least %d, but got %d", resourceType, required, actual));
        this.resourceType = resourceType;
        this.required = required;
        this.actual = actual;
    }

    public String getResourceType() {
        return resourceType;
    }

    public int getRequired() {
        return required;
    }

    public int getActual() {
        return actual;
    }
}
