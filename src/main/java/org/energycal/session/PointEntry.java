package org.energycal.session;

import org.energycal.fit.CalibrationPoint;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/** One row of the point table as typed: channel and energy text plus a free comment. */
public final class PointEntry {

    private final String channel;
    private final String energy;
    private final String comment;

    public PointEntry(String channel, String energy, String comment) {
        this.channel = channel == null ? "" : channel;
        this.energy = energy == null ? "" : energy;
        this.comment = comment == null ? "" : comment;
    }

    public String getChannel() { return channel; }

    public String getEnergy() { return energy; }

    public String getComment() { return comment; }

    /** Rows where either number fails to parse are skipped. */
    public static List<CalibrationPoint> toPoints(List<PointEntry> rows) {
        List<CalibrationPoint> points = new ArrayList<>();
        for (PointEntry row : rows) {
            OptionalDouble x = NumberParsing.parseDouble(row.channel);
            OptionalDouble y = NumberParsing.parseDouble(row.energy);
            if (x.isPresent() && y.isPresent()) {
                points.add(new CalibrationPoint(x.getAsDouble(), y.getAsDouble()));
            }
        }
        return points;
    }
}
