package nl.bytesoflife.deltasch.geometry;

import nl.bytesoflife.deltasch.model.Point;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.index.strtree.STRtree;

import java.util.ArrayList;
import java.util.List;

/**
 * Points, segments and boxes in an STR tree, each carrying a payload. Fill it first, then query:
 * the tree is built on the first query and rejects inserts afterwards.
 */
public class SpatialIndex<T> {

    private static final GeometryFactory FACTORY = new GeometryFactory();

    private final STRtree tree = new STRtree();
    private final List<Entry<T>> entries = new ArrayList<>();
    private boolean built = false;

    public void insertPoint(Point point, T payload) {
        insert(FACTORY.createPoint(coordinate(point)), payload);
    }

    public void insertSegment(Point start, Point end, T payload) {
        insert(FACTORY.createLineString(new Coordinate[]{coordinate(start), coordinate(end)}), payload);
    }

    public void insertBox(BoundingBox box, T payload) {
        insert(FACTORY.toGeometry(box.toEnvelope()), payload);
    }

    private void insert(Geometry geometry, T payload) {
        if (built) {
            throw new IllegalStateException("Spatial index is already built");
        }
        Entry<T> entry = new Entry<>(geometry, payload);
        entries.add(entry);
        tree.insert(geometry.getEnvelopeInternal(), entry);
    }

    public List<T> query(Point point, double tolerance) {
        return query(FACTORY.createPoint(coordinate(point)), tolerance);
    }

    public List<T> query(Point start, Point end, double tolerance) {
        return query(FACTORY.createLineString(new Coordinate[]{coordinate(start), coordinate(end)}), tolerance);
    }

    private List<T> query(Geometry probe, double tolerance) {
        List<T> result = new ArrayList<>();
        for (Entry<T> entry : queryNeighbors(probe, tolerance)) {
            if (entry.geometry().distance(probe) <= tolerance) {
                result.add(entry.payload());
            }
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    public List<T> query(BoundingBox box) {
        ensureBuilt();
        Geometry area = FACTORY.toGeometry(box.toEnvelope());
        List<T> result = new ArrayList<>();
        for (Entry<T> entry : (List<Entry<T>>) tree.query(box.toEnvelope())) {
            if (entry.geometry().intersects(area)) {
                result.add(entry.payload());
            }
        }
        return result;
    }

    public int size() {
        return entries.size();
    }

    @SuppressWarnings("unchecked")
    private List<Entry<T>> queryNeighbors(Geometry geometry, double searchDistance) {
        ensureBuilt();
        Envelope searchEnvelope = geometry.getEnvelopeInternal().copy();
        searchEnvelope.expandBy(searchDistance);
        return (List<Entry<T>>) tree.query(searchEnvelope);
    }

    private void ensureBuilt() {
        if (!built) {
            tree.build();
            built = true;
        }
    }

    private static Coordinate coordinate(Point point) {
        return new Coordinate(point.x(), point.y());
    }

    private record Entry<T>(Geometry geometry, T payload) {}
}
