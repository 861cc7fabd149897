package org.energycal.fit;

import java.util.Objects;

/** One reference pair: a channel reading and its known energy. */
public final class CalibrationPoint {

    private final double x;
    private final double y;

    public CalibrationPoint(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public double getX() { return x; }

    public double getY() { return y; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CalibrationPoint)) return false;
        CalibrationPoint that = (CalibrationPoint) o;
        return Double.compare(x, that.x) == 0 && Double.compare(y, that.y) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
