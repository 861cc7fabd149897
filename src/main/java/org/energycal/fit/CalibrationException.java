package org.energycal.fit;

/**
 * Base class of the recoverable failures raised while fitting or inverting a calibration.
 */
public class CalibrationException extends RuntimeException {

    public CalibrationException(String message) {
        super(message);
    }
}
