package org.energycal.fit;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.DoubleUnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

class PolynomialModelTest {

    private static final double EPS = 1e-9;

    static List<CalibrationPoint> sample(DoubleUnaryOperator f, double... xs) {
        List<CalibrationPoint> points = new ArrayList<>();
        for (double x : xs) points.add(new CalibrationPoint(x, f.applyAsDouble(x)));
        return points;
    }

    @Test
    void linearFitThroughThreePointsExtrapolates() {
        PolynomialModel model = PolynomialModel.fit(sample(x -> x, 0, 1, 2), 1, "Chan", "Energy");

        assertEquals(1, model.getDegree());
        assertEquals(5.0, model.evaluate(5), EPS);
    }

    @Test
    void interpolatesDegreePlusOneDistinctPoints() {
        DoubleUnaryOperator cubic = x -> 1 - 2 * x + 0.5 * x * x + 0.25 * x * x * x;
        List<CalibrationPoint> points = sample(cubic, -2, 0, 1, 3);

        PolynomialModel model = PolynomialModel.fit(points, 3, "x", "y");

        for (CalibrationPoint p : points) {
            assertEquals(p.getY(), model.evaluate(p.getX()), EPS);
        }
        double[] c = model.getCoefficients();
        assertArrayEquals(new double[]{1, -2, 0.5, 0.25}, c, 1e-9);
    }

    @Test
    void recoversQuadraticAtChannelScale() {
        DoubleUnaryOperator energy = ch -> 0.01 + 0.5 * ch + 1e-6 * ch * ch;
        PolynomialModel model = PolynomialModel.fit(
                sample(energy, 100, 500, 1000, 2000, 4000, 8000), 2, "Chan", "Energy");

        assertEquals(0.01, model.getCoefficient(0), 1e-6);
        assertEquals(0.5, model.getCoefficient(1), 1e-9);
        assertEquals(1e-6, model.getCoefficient(2), 1e-12);
        assertEquals(energy.applyAsDouble(3000), model.evaluate(3000), 1e-6);
    }

    @Test
    void degreeZeroFitIsTheMean() {
        List<CalibrationPoint> points = Arrays.asList(
                new CalibrationPoint(0, 1), new CalibrationPoint(4, 2), new CalibrationPoint(9, 3));

        PolynomialModel model = PolynomialModel.fit(points, 0, "x", "y");

        assertEquals(0, model.getDegree());
        assertEquals(2.0, model.evaluate(123), EPS);
    }

    @Test
    void chi2IsZeroForExactFit() {
        List<CalibrationPoint> points = sample(x -> 3 * x * x - x + 7, -1, 2, 5, 6);
        PolynomialModel model = PolynomialModel.fit(points, 2, "x", "y");

        assertEquals(0.0, model.chi2(points), 1e-12);
    }

    @Test
    void chi2IsUnreducedResidualSumOfSquares() {
        List<CalibrationPoint> points = Arrays.asList(
                new CalibrationPoint(0, 0), new CalibrationPoint(1, 1), new CalibrationPoint(2, 1));

        PolynomialModel model = PolynomialModel.fit(points, 1, "x", "y");

        // best line is y = 1/6 + x/2, residuals -1/6, 1/3, -1/6
        assertEquals(1.0 / 6, model.getCoefficient(0), EPS);
        assertEquals(0.5, model.getCoefficient(1), EPS);
        assertEquals(1.0 / 6, model.chi2(points), EPS);
        assertTrue(model.chi2(points) >= 0);
    }

    @Test
    void tooFewPointsIsInsufficientData() {
        InsufficientDataException ex = assertThrows(InsufficientDataException.class,
                () -> PolynomialModel.fit(sample(x -> x, 0, 1), 2, "x", "y"));
        assertEquals(2, ex.getPointCount());
        assertEquals(2, ex.getDegree());
    }

    @Test
    void repeatedChannelsAreSingular() {
        List<CalibrationPoint> points = Arrays.asList(
                new CalibrationPoint(1, 1), new CalibrationPoint(1, 2), new CalibrationPoint(2, 3));

        assertThrows(SingularFitException.class, () -> PolynomialModel.fit(points, 2, "x", "y"));
    }

    @Test
    void repeatedChannelsAreFineWhenEnoughRemainDistinct() {
        List<CalibrationPoint> points = Arrays.asList(
                new CalibrationPoint(1, 1), new CalibrationPoint(1, 3), new CalibrationPoint(3, 4));

        PolynomialModel model = PolynomialModel.fit(points, 1, "x", "y");

        assertEquals(2.0, model.evaluate(1), EPS);
        assertEquals(4.0, model.evaluate(3), EPS);
    }

    @Test
    void negativeDegreeIsInsufficientData() {
        InsufficientDataException ex = assertThrows(InsufficientDataException.class,
                () -> PolynomialModel.fit(sample(x -> x, 0, 1), -1, "x", "y"));
        assertEquals(-1, ex.getDegree());
    }

    @Test
    void hugeDegreeIsInsufficientDataNotOverflow() {
        assertThrows(InsufficientDataException.class,
                () -> PolynomialModel.fit(sample(x -> x, 0, 1), Integer.MAX_VALUE, "x", "y"));
    }

    @Test
    void refitToLowerDegreeKeepsNoHigherTerms() {
        PolynomialModel cubic = PolynomialModel.fit(sample(x -> x * x * x, -1, 0, 1, 2), 3, "x", "y");
        PolynomialModel line = PolynomialModel.fit(sample(x -> 2 * x + 1, -1, 0, 1, 2), 1, "x", "y");

        assertEquals(3, cubic.getDegree());
        assertEquals(1, line.getDegree());
        assertEquals(2, line.getCoefficients().length);
        assertEquals(2 * 10 + 1, line.evaluate(10), EPS);
    }

    @Test
    void coefficientsCannotBeModifiedThroughAccessor() {
        PolynomialModel model = PolynomialModel.fit(sample(x -> x, 0, 1), 1, "x", "y");

        model.getCoefficients()[1] = 42;

        assertEquals(1.0, model.getCoefficient(1), EPS);
    }

    @Test
    void rendersWithoutZeroTerms() {
        PolynomialModel model = PolynomialModel.fit(sample(x -> 2 * x, 0, 1, 2, 3), 2, "xvar", "yvar");

        assertEquals("yvar = 2*xvar", model.render());
        assertEquals(model.render(), model.toString());
    }

    @Test
    void rendersSmallCubicTermThatMattersAtHighChannels() {
        // 5e-11 * 4000^3 shifts the energy by 3.2 at the top of the range
        PolynomialModel model = PolynomialModel.fit(
                sample(ch -> 3 + 0.5 * ch + 5e-11 * ch * ch * ch, 0, 1000, 2000, 3000, 4000), 3, "Chan", "Energy");

        assertEquals(4000, model.getXRange(), 0);
        assertTrue(model.render().contains("*Chan^3"), model.render());
        assertTrue(model.render().endsWith("0.5*Chan + 3"), model.render());
    }

    @Test
    void hidesVanishingTermsOfNearLinearFit() {
        PolynomialModel model = PolynomialModel.fit(
                sample(ch -> 0.5 * ch + 3, 100, 500, 1000, 2000, 4000), 2, "Chan", "Energy");

        assertEquals("Energy = 0.5*Chan + 3", model.render());
    }
}
