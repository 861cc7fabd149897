package org.energycal.session;

import org.energycal.fit.CalibrationException;
import org.energycal.fit.CalibrationPoint;
import org.energycal.fit.PolynomialModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Holds the current calibration of one window and turns typed text into display strings.
 *
 * <p>The session is either unfit (no model) or fit. Each {@link #refit} replaces the model
 * wholesale; the fit classes themselves keep no state. Not thread-safe: confine to the
 * Swing event thread.
 */
public class CalibrationSession {

    private static final Logger LOGGER = LoggerFactory.getLogger(CalibrationSession.class);

    private final String xvar;
    private final String yvar;
    private final double realRootTolerance;

    private PolynomialModel model;
    private List<CalibrationPoint> points = Collections.emptyList();

    public CalibrationSession(String xvar, String yvar, double realRootTolerance) {
        this.xvar = xvar;
        this.yvar = yvar;
        this.realRootTolerance = realRootTolerance;
    }

    /**
     * Refits from the table rows and degree text. Unparseable rows are ignored; a missing
     * degree, too few points or a singular fit leave the session unfit.
     *
     * @return true if a model is now available
     */
    public boolean refit(List<PointEntry> rows, String degreeText) {
        List<CalibrationPoint> parsed = PointEntry.toPoints(rows);
        OptionalInt degree = NumberParsing.parseDegree(degreeText);

        points = Collections.unmodifiableList(parsed);
        if (degree.isEmpty() || parsed.size() <= degree.getAsInt()) {
            clear();
            return false;
        }
        // Unfit until the new model exists, so no failure can leave the old one in place
        clear();
        try {
            model = PolynomialModel.fit(parsed, degree.getAsInt(), xvar, yvar);
            LOGGER.debug("Fitted {} to {} points", model, parsed.size());
            return true;
        } catch (CalibrationException ex) {
            LOGGER.debug("No fit: {}", ex.getMessage());
            return false;
        }
    }

    private void clear() {
        if (model != null) LOGGER.debug("Discarding fit {}", model);
        model = null;
    }

    public Optional<PolynomialModel> currentModel() {
        return Optional.ofNullable(model);
    }

    /** Points the last refit parsed, whether or not it produced a model. */
    public List<CalibrationPoint> getPoints() {
        return points;
    }

    public String equationText() {
        return model == null ? yvar + " = " : model.render();
    }

    public String chi2Text() {
        if (model == null) return "Chi^2 = ";
        return String.format(Locale.US, "Chi^2 = %.3f", model.chi2(points));
    }

    /** Channel to energy; empty if unfit or the text is not a number. */
    public String forward(String text) {
        OptionalDouble x = NumberParsing.parseDouble(text);
        if (model == null || x.isEmpty()) return "";
        return String.valueOf(model.evaluate(x.getAsDouble()));
    }

    /** Energy to channel(s); empty if unfit or the text is not a number. */
    public String reverse(String text) {
        return inversion(text).map(Inversion::toDisplayString).orElse("");
    }

    public Optional<Inversion> inversion(String text) {
        OptionalDouble y = NumberParsing.parseDouble(text);
        if (model == null || y.isEmpty()) return Optional.empty();
        return Optional.of(Inversion.solve(model, y.getAsDouble(), realRootTolerance));
    }
}
