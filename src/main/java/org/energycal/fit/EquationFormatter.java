package org.energycal.fit;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Renders polynomials as {@code "Energy = 0.5*Chan^2 + 3*Chan - 1"}, highest power first.
 */
public final class EquationFormatter {

    /**
     * A term is left out when its size at {@code |x| = range} is below this fraction of the
     * largest term (or of 1, whichever is greater).
     */
    static final double ZERO_TOLERANCE = 1e-10;

    private EquationFormatter() { }

    public static String format(PolynomialModel model) {
        return format(model.getCoefficients(), model.getXRange(), model.getXvar(), model.getYvar());
    }

    public static String format(double[] coefficients, String xvar, String yvar) {
        return format(coefficients, 1, xvar, yvar);
    }

    /**
     * @param range largest |x| the equation is used at; terms are judged by their size there
     */
    public static String format(double[] coefficients, double range, String xvar, String yvar) {
        double[] terms = new double[coefficients.length];
        double largest = 1;
        double xk = 1;
        for (int k = 0; k < coefficients.length; k++) {
            terms[k] = Math.abs(coefficients[k]) * xk;
            largest = Math.max(largest, terms[k]);
            xk *= range;
        }
        double cutoff = ZERO_TOLERANCE * largest;

        StringBuilder sb = new StringBuilder(yvar).append(" = ");
        boolean first = true;
        for (int power = coefficients.length - 1; power >= 0; power--) {
            double c = coefficients[power];
            if (terms[power] < cutoff || c == 0) continue;

            if (first) {
                if (c < 0) sb.append('-');
            } else {
                sb.append(c < 0 ? " - " : " + ");
            }
            sb.append(number(Math.abs(c)));
            if (power == 1) {
                sb.append('*').append(xvar);
            } else if (power > 1) {
                sb.append('*').append(xvar).append('^').append(power);
            }
            first = false;
        }
        if (first) sb.append('0');
        return sb.toString();
    }

    static String number(double v) {
        // Fixed decimals for moderate magnitudes, scientific for large/small
        DecimalFormatSymbols symbols = DecimalFormatSymbols.getInstance(Locale.US);
        if (Math.abs(v) >= 1e-3 && Math.abs(v) < 1e4) {
            return new DecimalFormat("0.######", symbols).format(v);
        }
        return new DecimalFormat("0.#####E0", symbols).format(v);
    }
}
