package nl.bytesoflife.deltasch.connectivity;

import nl.bytesoflife.deltasch.config.SchematicConfig;

public class ConnectivityOptions {

    private double tolerance;
    private boolean unifyGlobalLabels;
    private boolean includeBuses;

    private ConnectivityOptions(SchematicConfig config) {
        this.tolerance = config.getDouble(SchematicConfig.CONNECTIVITY_TOLERANCE);
        this.unifyGlobalLabels = config.getBoolean(SchematicConfig.CONNECTIVITY_UNIFY_GLOBALS);
        this.includeBuses = config.getBoolean(SchematicConfig.CONNECTIVITY_INCLUDE_BUSES);
    }

    public static ConnectivityOptions defaults() {
        return new ConnectivityOptions(SchematicConfig.defaults());
    }

    public static ConnectivityOptions from(SchematicConfig config) {
        return new ConnectivityOptions(config);
    }

    /**
     * Maximum distance in mm at which two points count as the same point.
     */
    public ConnectivityOptions withTolerance(double tolerance) {
        if (tolerance < 0) {
            throw new IllegalArgumentException("Tolerance must not be negative: " + tolerance);
        }
        this.tolerance = tolerance;
        return this;
    }

    public ConnectivityOptions withUnifyGlobalLabels(boolean unifyGlobalLabels) {
        this.unifyGlobalLabels = unifyGlobalLabels;
        return this;
    }

    public ConnectivityOptions withIncludeBuses(boolean includeBuses) {
        this.includeBuses = includeBuses;
        return this;
    }

    public double getTolerance() {
        return tolerance;
    }

    public boolean isUnifyGlobalLabels() {
        return unifyGlobalLabels;
    }

    public boolean isIncludeBuses() {
        return includeBuses;
    }
}
