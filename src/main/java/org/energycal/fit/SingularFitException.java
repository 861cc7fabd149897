package org.energycal.fit;

/**
 * The design matrix of a fit is rank-deficient, usually because there are fewer distinct
 * x values than coefficients to determine.
 */
public class SingularFitException extends CalibrationException {

    public SingularFitException(String message) {
        super(message);
    }
}
