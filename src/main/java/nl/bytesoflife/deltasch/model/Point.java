package nl.bytesoflife.deltasch.model;

import java.util.Locale;

/**
 * A location on the sheet in millimetres, Y growing downwards.
 */
public record Point(double x, double y) {

    private static final double SNAP = 1e4;

    public Point translate(double dx, double dy) {
        return new Point(x + dx, y + dy);
    }

    public double distance(Point other) {
        return Math.hypot(x - other.x, y - other.y);
    }

    public boolean isNear(Point other, double tolerance) {
        return Math.abs(x - other.x) <= tolerance && Math.abs(y - other.y) <= tolerance;
    }

    /**
     * Rounded to 1e-4 mm, the resolution KiCad stores.
     */
    public Point snapped() {
        return new Point(snap(x), snap(y));
    }

    private static double snap(double v) {
        double snapped = Math.round(v * SNAP) / SNAP;
        return snapped == 0.0 ? 0.0 : snapped;
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "(%.4f, %.4f)", x, y);
    }
}
