package org.energycal;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Start-up settings, read from JVM system properties ({@code -Dcalibrator.degree=2}).
 */
public final class CalibratorSettings {

    public static final String CATALOG = "calibrator.catalog";
    public static final String DEGREE = "calibrator.degree";
    public static final String REAL_ROOT_TOLERANCE = "calibrator.realRootTolerance";
    public static final String CHANNEL_LABEL = "calibrator.channelLabel";
    public static final String ENERGY_LABEL = "calibrator.energyLabel";

    private final Path catalogPath;
    private final String initialDegree;
    private final double realRootTolerance;
    private final String channelLabel;
    private final String energyLabel;

    CalibratorSettings(Path catalogPath, String initialDegree, double realRootTolerance,
                       String channelLabel, String energyLabel) {
        if (!(realRootTolerance > 0)) {
            throw new IllegalArgumentException(REAL_ROOT_TOLERANCE + " must be positive, got " + realRootTolerance);
        }
        this.catalogPath = catalogPath;
        this.initialDegree = initialDegree;
        this.realRootTolerance = realRootTolerance;
        this.channelLabel = channelLabel;
        this.energyLabel = energyLabel;
    }

    public static CalibratorSettings fromSystemProperties() {
        return new CalibratorSettings(
                Paths.get(System.getProperty(CATALOG, "sources.json")),
                System.getProperty(DEGREE, "1"),
                Double.parseDouble(System.getProperty(REAL_ROOT_TOLERANCE, "1e-6")),
                System.getProperty(CHANNEL_LABEL, "Chan"),
                System.getProperty(ENERGY_LABEL, "Energy"));
    }

    public Path getCatalogPath() { return catalogPath; }

    public String getInitialDegree() { return initialDegree; }

    public double getRealRootTolerance() { return realRootTolerance; }

    public String getChannelLabel() { return channelLabel; }

    public String getEnergyLabel() { return energyLabel; }
}
