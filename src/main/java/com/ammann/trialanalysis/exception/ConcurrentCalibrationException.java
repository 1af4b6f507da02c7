/* (C)2026 */
package com.ammann.trialanalysis.exception;

/**
 * Thrown synchronously when a calibration is requested while another one is running.
 * Requests are never queued.
 */
public class ConcurrentCalibrationException extends ApiException {

    private final String activeCalibrationId;

    public ConcurrentCalibrationException(String activeCalibrationId) {
        super("Calibration already in progress: " + activeCalibrationId);
        this.activeCalibrationId = activeCalibrationId;
    }

    public String getActiveCalibrationId() {
        return activeCalibrationId;
    }
}
