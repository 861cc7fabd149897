package org.energycal.fit;

import org.apache.commons.math3.analysis.solvers.LaguerreSolver;
import org.apache.commons.math3.complex.Complex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Inverts a {@link PolynomialModel}: finds every x, real or complex, with
 * {@code model.evaluate(x) == target}. Roots come from Laguerre's method with deflation,
 * which works for any degree and stays accurate when a fit of near-linear data leaves a
 * vanishingly small leading coefficient.
 */
public final class RootSolver {

    private static final double DEGENERATE_TOLERANCE = 1e-12;
    private static final double ROOT_ACCURACY = 1e-12;

    private RootSolver() { }

    /**
     * Returns the roots of {@code model(x) - target}, one per degree of the polynomial left
     * once exactly-zero leading coefficients are dropped. Roots are not deduplicated.
     *
     * @throws DegenerateInversionException if the polynomial is constant and equal to
     *         {@code target}
     */
    public static List<Complex> reverse(PolynomialModel model, double target) {
        double[] c = model.getCoefficients();
        c[0] -= target;

        int high = c.length - 1;
        while (high > 0 && c[high] == 0) high--;

        if (high == 0) {
            if (Math.abs(c[0]) <= DEGENERATE_TOLERANCE * Math.max(1, Math.abs(target))) {
                throw new DegenerateInversionException(target);
            }
            return Collections.emptyList();
        }

        // x = 0 is a root once per vanishing low-order coefficient
        int low = 0;
        while (low < high && c[low] == 0) low++;

        List<Complex> roots = new ArrayList<>(high);
        int n = high - low;
        if (n == 1) {
            roots.add(new Complex(-c[low] / c[high], 0));
        } else if (n > 1) {
            double[] reduced = Arrays.copyOfRange(c, low, high + 1);
            // Deflating from x = 0 finds the roots nearest the origin (the channel range) first
            Complex[] found = new LaguerreSolver(ROOT_ACCURACY).solveAllComplex(reduced, 0);
            roots.addAll(Arrays.asList(found));
        }
        for (int i = 0; i < low; i++) {
            roots.add(Complex.ZERO);
        }
        return roots;
    }

    /**
     * Real parts of the roots whose imaginary part is below {@code tolerance} in magnitude,
     * in the order given.
     */
    public static List<Double> realRoots(List<Complex> roots, double tolerance) {
        List<Double> real = new ArrayList<>();
        for (Complex r : roots) {
            if (Math.abs(r.getImaginary()) < tolerance) real.add(r.getReal());
        }
        return real;
    }
}
