package org.energycal.fit;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class EquationFormatterTest {

    @Test
    void highestPowerFirst() {
        assertEquals("y = 3*x^2 + 2*x + 1", EquationFormatter.format(new double[]{1, 2, 3}, "x", "y"));
    }

    @Test
    void negativeCoefficientsAreSubtracted() {
        assertEquals("E = -0.5*C^2 - 1", EquationFormatter.format(new double[]{-1, 0, -0.5}, "C", "E"));
    }

    @Test
    void allZeroRendersConstant() {
        assertEquals("y = 0", EquationFormatter.format(new double[]{0, 1e-14, 0}, "x", "y"));
        assertEquals("y = 5", EquationFormatter.format(new double[]{5}, "x", "y"));
    }

    @Test
    void negligibleConstantIsDropped() {
        assertEquals("y = 1*x", EquationFormatter.format(new double[]{1e-12, 1}, "x", "y"));
    }

    @Test
    void smallAndLargeCoefficientsUseScientificNotation() {
        assertEquals("Energy = 2.5E-7*Chan + 0.01",
                EquationFormatter.format(new double[]{0.01, 2.5e-7}, "Chan", "Energy"));
        assertEquals("y = 1.23456E5", EquationFormatter.format(new double[]{123456}, "x", "y"));
    }

    @Test
    void moderateCoefficientsRoundToSixDecimals() {
        assertEquals("y = 1.234568*x", EquationFormatter.format(new double[]{0, 1.23456789}, "x", "y"));
        assertEquals("y = 2*x", EquationFormatter.format(new double[]{0, 2.0000000000000004}, "x", "y"));
    }

    @Test
    void termsAreJudgedAtTheRangeTheyAreUsedAt() {
        double[] c = {3, 0.5, 0, 5e-11};

        assertEquals("Energy = 5E-11*Chan^3 + 0.5*Chan + 3", EquationFormatter.format(c, 4000, "Chan", "Energy"));
        assertEquals("Energy = 0.5*Chan + 3", EquationFormatter.format(c, 1, "Chan", "Energy"));
    }
}
