package org.energycal.fit;

/** A fit was requested with a negative degree or fewer than {@code degree + 1} points. */
public class InsufficientDataException extends CalibrationException {

    private final int pointCount;
    private final int degree;

    public InsufficientDataException(int pointCount, int degree) {
        super(degree < 0
                ? "Polynomial degree must be non-negative, got " + degree + "."
                : "A degree " + degree + " fit needs at least " + (degree + 1L)
                        + " points, got " + pointCount + ".");
        this.pointCount = pointCount;
        this.degree = degree;
    }

    public int getPointCount() { return pointCount; }

    public int getDegree() { return degree; }
}
