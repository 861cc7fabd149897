package org.energycal.session;

import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Reads numbers typed into free-text boxes. A failed parse is an empty result, which callers
 * treat as "no input" rather than as an error.
 */
public final class NumberParsing {

    private static final Pattern DECIMAL =
            Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    // "1,332" reads as a thousands group, so it is not taken as a decimal comma
    private static final Pattern THOUSANDS_GROUP = Pattern.compile("[+-]?[1-9]\\d{0,2},\\d{3}([eE][+-]?\\d+)?");
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

    private NumberParsing() { }

    /**
     * Parses a finite decimal number. A lone decimal comma is accepted ({@code "1,5"}), as are
     * exponents; {@code NaN}, infinities, hex literals, type suffixes and text that could be a
     * thousands group ({@code "1,332"}) are not.
     */
    public static OptionalDouble parseDouble(String text) {
        if (text == null) return OptionalDouble.empty();
        String s = text.trim();
        // allow decimal comma
        if (s.indexOf(',') >= 0 && s.indexOf('.') < 0) {
            if (THOUSANDS_GROUP.matcher(s).matches()) return OptionalDouble.empty();
            s = s.replace(',', '.');
        }
        if (!DECIMAL.matcher(s).matches()) return OptionalDouble.empty();
        double value = Double.parseDouble(s);
        return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    /** Parses a polynomial degree; negative or non-integer text gives an empty result. */
    public static OptionalInt parseDegree(String text) {
        if (text == null) return OptionalInt.empty();
        String s = text.trim();
        if (!INTEGER.matcher(s).matches()) return OptionalInt.empty();
        try {
            int degree = Integer.parseInt(s);
            return degree < 0 ? OptionalInt.empty() : OptionalInt.of(degree);
        } catch (NumberFormatException tooLarge) {
            return OptionalInt.empty();
        }
    }
}
