package nl.bytesoflife.deltasch.geometry;

import nl.bytesoflife.deltasch.model.Point;
import org.locationtech.jts.geom.Envelope;

import java.util.Collection;
import java.util.Locale;

/**
 * Axis-aligned rectangle.
 */
public record BoundingBox(double minX, double minY, double maxX, double maxY) {

    public BoundingBox {
        if (minX > maxX || minY > maxY) {
            throw new IllegalArgumentException("Inverted bounding box: " + minX + "," + minY + " " + maxX + "," + maxY);
        }
    }

    public static BoundingBox of(Point corner1, Point corner2) {
        return new BoundingBox(Math.min(corner1.x(), corner2.x()), Math.min(corner1.y(), corner2.y()),
                Math.max(corner1.x(), corner2.x()), Math.max(corner1.y(), corner2.y()));
    }

    /**
     * Smallest box around the points, {@code null} when there are none.
     */
    public static BoundingBox around(Collection<Point> points) {
        if (points.isEmpty()) return null;
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (Point p : points) {
            minX = Math.min(minX, p.x());
            minY = Math.min(minY, p.y());
            maxX = Math.max(maxX, p.x());
            maxY = Math.max(maxY, p.y());
        }
        return new BoundingBox(minX, minY, maxX, maxY);
    }

    public double width() {
        return maxX - minX;
    }

    public double height() {
        return maxY - minY;
    }

    public Point center() {
        return new Point((minX + maxX) / 2, (minY + maxY) / 2);
    }

    public boolean contains(Point p) {
        return p.x() >= minX && p.x() <= maxX && p.y() >= minY && p.y() <= maxY;
    }

    public boolean contains(BoundingBox other) {
        return other.minX >= minX && other.maxX <= maxX && other.minY >= minY && other.maxY <= maxY;
    }

    public boolean intersects(BoundingBox other) {
        return other.minX <= maxX && other.maxX >= minX && other.minY <= maxY && other.maxY >= minY;
    }

    public BoundingBox union(BoundingBox other) {
        return new BoundingBox(Math.min(minX, other.minX), Math.min(minY, other.minY),
                Math.max(maxX, other.maxX), Math.max(maxY, other.maxY));
    }

    public BoundingBox expandBy(double margin) {
        return new BoundingBox(minX - margin, minY - margin, maxX + margin, maxY + margin);
    }

    public Envelope toEnvelope() {
        return new Envelope(minX, maxX, minY, maxY);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "[%.4f, %.4f .. %.4f, %.4f]", minX, minY, maxX, maxY);
    }
}
