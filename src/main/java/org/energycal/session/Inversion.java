package org.energycal.session;

import org.apache.commons.math3.complex.Complex;
import org.energycal.fit.DegenerateInversionException;
import org.energycal.fit.PolynomialModel;
import org.energycal.fit.RootSolver;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/** Outcome of converting a dependent value back to the independent quantity. */
public final class Inversion {

    public enum Kind {
        REAL_ROOTS,
        NO_REAL_ROOTS,
        NO_UNIQUE_SOLUTION
    }

    static final String NO_REAL_ROOTS_TEXT = "No real roots";
    static final String NO_UNIQUE_SOLUTION_TEXT = "No unique solution";

    private final Kind kind;
    private final List<Double> roots;

    private Inversion(Kind kind, List<Double> roots) {
        this.kind = kind;
        this.roots = roots;
    }

    /**
     * Solves {@code model(x) = target} and keeps the roots whose imaginary part is below
     * {@code tolerance}.
     */
    public static Inversion solve(PolynomialModel model, double target, double tolerance) {
        List<Complex> all;
        try {
            all = RootSolver.reverse(model, target);
        } catch (DegenerateInversionException ex) {
            return new Inversion(Kind.NO_UNIQUE_SOLUTION, Collections.emptyList());
        }
        List<Double> real = RootSolver.realRoots(all, tolerance);
        if (real.isEmpty()) return new Inversion(Kind.NO_REAL_ROOTS, Collections.emptyList());
        return new Inversion(Kind.REAL_ROOTS, Collections.unmodifiableList(real));
    }

    public Kind getKind() { return kind; }

    /** Real solutions; empty unless the kind is {@link Kind#REAL_ROOTS}. */
    public List<Double> getRoots() { return roots; }

    public String toDisplayString() {
        switch (kind) {
            case REAL_ROOTS:
                return roots.stream().map(String::valueOf).collect(Collectors.joining(", "));
            case NO_REAL_ROOTS:
                return NO_REAL_ROOTS_TEXT;
            case NO_UNIQUE_SOLUTION:
                return NO_UNIQUE_SOLUTION_TEXT;
            default:
                return "";
        }
    }
}
