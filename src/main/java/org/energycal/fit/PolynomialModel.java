package org.energycal.fit;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A least-squares polynomial linking an independent quantity (e.g. channel) to a dependent
 * one (e.g. energy). Instances are immutable; refitting always produces a new model.
 */
public final class PolynomialModel {

    // relative to the unit-scaled design matrix, see fit()
    private static final double RANK_THRESHOLD = 1e-10;

    private final double[] coefficients; // [c0, c1, ..., cn] for c0 + c1 x + ... + cn x^n
    private final double xRange;
    private final String xvar;
    private final String yvar;

    private PolynomialModel(double[] coefficients, double xRange, String xvar, String yvar) {
        this.coefficients = coefficients;
        this.xRange = xRange;
        this.xvar = Objects.requireNonNull(xvar, "xvar");
        this.yvar = Objects.requireNonNull(yvar, "yvar");
    }

    /**
     * Fits a polynomial of the given degree to the points by least squares.
     *
     * @throws InsufficientDataException if {@code degree} is negative or fewer than
     *         {@code degree + 1} points are given
     * @throws SingularFitException if the points cannot determine every coefficient
     */
    public static PolynomialModel fit(List<CalibrationPoint> points, int degree, String xvar, String yvar) {
        if (degree < 0 || points.size() <= degree) throw new InsufficientDataException(points.size(), degree);

        long distinct = points.stream().mapToDouble(CalibrationPoint::getX).distinct().count();
        if (distinct <= degree) {
            throw new SingularFitException("A degree " + degree + " fit needs " + (degree + 1)
                    + " distinct x values, got " + distinct + ".");
        }

        // Scale x into [-1, 1] so the rank test does not depend on the channel range
        double scale = points.stream().mapToDouble(p -> Math.abs(p.getX())).max().orElse(0);
        if (scale == 0) scale = 1;

        int n = points.size();
        RealMatrix design = new Array2DRowRealMatrix(n, degree + 1);
        RealVector ys = new ArrayRealVector(n);
        for (int i = 0; i < n; i++) {
            CalibrationPoint p = points.get(i);
            double u = p.getX() / scale;
            double power = 1;
            for (int k = 0; k <= degree; k++) {
                design.setEntry(i, k, power);
                power *= u;
            }
            ys.setEntry(i, p.getY());
        }

        DecompositionSolver solver = new QRDecomposition(design, RANK_THRESHOLD).getSolver();
        RealVector scaled;
        try {
            scaled = solver.solve(ys);
        } catch (SingularMatrixException ex) {
            throw new SingularFitException("Design matrix is rank-deficient for degree " + degree + ".");
        }

        double[] coefficients = new double[degree + 1];
        double factor = 1;
        for (int k = 0; k <= degree; k++) {
            coefficients[k] = scaled.getEntry(k) / factor;
            factor *= scale;
        }
        return new PolynomialModel(coefficients, scale, xvar, yvar);
    }

    /** Evaluates the polynomial at {@code x} with Horner's scheme. */
    public double evaluate(double x) {
        double y = 0;
        for (int k = coefficients.length - 1; k >= 0; k--) {
            y = y * x + coefficients[k];
        }
        return y;
    }

    /**
     * Unreduced chi-squared: the residual sum of squares over {@code points}. Divide by the
     * degrees of freedom externally for a reduced statistic.
     */
    public double chi2(List<CalibrationPoint> points) {
        double sum = 0;
        for (CalibrationPoint p : points) {
            double residual = p.getY() - evaluate(p.getX());
            sum += residual * residual;
        }
        return sum;
    }

    public String render() {
        return EquationFormatter.format(this);
    }

    public int getDegree() { return coefficients.length - 1; }

    /** Coefficient of {@code x^power}. */
    public double getCoefficient(int power) { return coefficients[power]; }

    public double[] getCoefficients() { return coefficients.clone(); }

    /** Largest |x| among the fitted points, or 1 if they are all zero. */
    public double getXRange() { return xRange; }

    public String getXvar() { return xvar; }

    public String getYvar() { return yvar; }

    @Override
    public String toString() {
        return render();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PolynomialModel)) return false;
        PolynomialModel that = (PolynomialModel) o;
        return Arrays.equals(coefficients, that.coefficients)
                && Double.compare(xRange, that.xRange) == 0
                && xvar.equals(that.xvar) && yvar.equals(that.yvar);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(coefficients) + xvar.hashCode()) + yvar.hashCode();
    }
}
