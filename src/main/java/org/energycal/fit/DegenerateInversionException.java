package org.energycal.fit;

/** Inverting a constant polynomial at its own value: every x is a root. */
public class DegenerateInversionException extends CalibrationException {

    private final double target;

    public DegenerateInversionException(double target) {
        super("Polynomial is constant and equal to " + target + "; every x is a solution.");
        this.target = target;
    }

    public double getTarget() { return target; }
}
