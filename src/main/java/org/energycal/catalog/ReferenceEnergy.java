package org.energycal.catalog;

/** A known emission energy of a calibration source. */
public final class ReferenceEnergy {

    private final double value;
    private final String description;

    public ReferenceEnergy(double value, String description) {
        this.value = value;
        this.description = description == null ? "" : description;
    }

    public double getValue() { return value; }

    public String getDescription() { return description; }

    @Override
    public String toString() {
        return value + " (" + description + ")";
    }
}
