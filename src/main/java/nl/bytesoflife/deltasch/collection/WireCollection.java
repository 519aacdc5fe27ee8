package nl.bytesoflife.deltasch.collection;

import nl.bytesoflife.deltasch.geometry.SpatialIndex;
import nl.bytesoflife.deltasch.model.Point;
import nl.bytesoflife.deltasch.model.Wire;
import nl.bytesoflife.deltasch.model.WireKind;
import nl.bytesoflife.deltasch.sexpr.SNode.SList;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Wires and buses, indexed by vertex and by kind.
 */
public class WireCollection extends IndexedCollection<Wire> {

    public static final double DEFAULT_TOLERANCE = 0.01;

    private final Map<Point, List<Wire>> byVertex = new HashMap<>();
    private final Map<WireKind, List<Wire>> byKind = new EnumMap<>(WireKind.class);
    private SpatialIndex<Wire> segments = new SpatialIndex<>();
    private SpatialIndex<Wire> vertices = new SpatialIndex<>();

    public WireCollection(SList root, Runnable onChange) {
        super(root, onChange);
    }

    @Override
    protected String elementType() {
        return "wire";
    }

    @Override
    protected void rebuildIndexes() {
        byVertex.clear();
        byKind.clear();
        segments = new SpatialIndex<>();
        vertices = new SpatialIndex<>();
        for (Wire wire : items()) {
            addToIndex(byKind, wire.getKind(), wire);
            List<Point> points = wire.getPoints();
            for (Point vertex : points) {
                addToIndex(byVertex, vertex.snapped(), wire);
                vertices.insertPoint(vertex, wire);
            }
            if (points.size() == 1) {
                segments.insertPoint(points.get(0), wire);
            }
            for (int i = 0; i + 1 < points.size(); i++) {
                segments.insertSegment(points.get(i), points.get(i + 1), wire);
            }
        }
    }

    public Wire addWire(Point start, Point end) {
        return add(Wire.create(start, end));
    }

    public Wire addPolyline(List<Point> points) {
        return add(Wire.create(WireKind.WIRE, points));
    }

    public Wire addBus(List<Point> points) {
        return add(Wire.create(WireKind.BUS, points));
    }

    public List<Wire> byKind(WireKind kind) {
        ensureIndexes();
        return List.copyOf(byKind.getOrDefault(kind, List.of()));
    }

    /**
     * Wires with a vertex exactly at {@code point}, after snapping to 1e-4.
     */
    public List<Wire> byVertex(Point point) {
        ensureIndexes();
        return List.copyOf(byVertex.getOrDefault(point.snapped(), List.of()));
    }

    /**
     * Wires with a vertex at {@code point} or a segment passing through it.
     */
    public List<Wire> wiresAt(Point point, double tolerance) {
        ensureIndexes();
        return inCollectionOrder(segments.query(point, tolerance));
    }

    public List<Wire> wiresAt(Point point) {
        return wiresAt(point, DEFAULT_TOLERANCE);
    }

    /**
     * All wires of the same kind reachable from {@code wire} through shared vertices or a vertex
     * lying on another wire's segment, {@code wire} included.
     */
    public List<Wire> connectedWires(Wire wire, double tolerance) {
        ensureIndexes();
        Set<Wire> seen = identitySet();
        Deque<Wire> queue = new ArrayDeque<>();
        queue.add(wire);
        seen.add(wire);
        while (!queue.isEmpty()) {
            Wire current = queue.poll();
            for (Wire other : adjacent(current, tolerance)) {
                if (other.getKind() == current.getKind() && seen.add(other)) {
                    queue.add(other);
                }
            }
        }
        return inCollectionOrder(seen);
    }

    public List<Wire> connectedWires(Wire wire) {
        return connectedWires(wire, DEFAULT_TOLERANCE);
    }

    /**
     * Groups the wires into connected groups, in order of their first wire.
     */
    public List<List<Wire>> networks() {
        Set<Wire> assigned = identitySet();
        List<List<Wire>> networks = new ArrayList<>();
        for (Wire wire : items()) {
            if (assigned.contains(wire)) continue;
            List<Wire> network = connectedWires(wire);
            assigned.addAll(network);
            networks.add(network);
        }
        return networks;
    }

    /**
     * Wires with a vertex on one of {@code wire}'s segments, or a segment through one of its
     * vertices. Crossing segments alone do not count.
     */
    private List<Wire> adjacent(Wire wire, double tolerance) {
        List<Wire> result = new ArrayList<>();
        List<Point> points = wire.getPoints();
        for (Point vertex : points) {
            result.addAll(segments.query(vertex, tolerance));
        }
        if (points.size() == 1) {
            result.addAll(vertices.query(points.get(0), tolerance));
        }
        for (int i = 0; i + 1 < points.size(); i++) {
            result.addAll(vertices.query(points.get(i), points.get(i + 1), tolerance));
        }
        return result;
    }

    private List<Wire> inCollectionOrder(Collection<Wire> wires) {
        Set<Wire> members = identitySet();
        members.addAll(wires);
        return filter(members::contains);
    }

    private static Set<Wire> identitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }

    /**
     * Replaces the path of the wire with the given uuid.
     *
     * @return {@code false} if there is no such wire
     */
    public boolean modifyPath(String uuid, List<Point> points) {
        Optional<Wire> wire = get(uuid);
        wire.ifPresent(w -> w.setPoints(points));
        return wire.isPresent();
    }

    /**
     * Removes every wire touching {@code point}.
     *
     * @return number of wires removed
     */
    public int removeAt(Point point) {
        Set<Wire> touching = identitySet();
        touching.addAll(wiresAt(point));
        return removeIf(touching::contains);
    }

    public int bulkUpdateStroke(double width, String type) {
        return bulkUpdate(w -> true, w -> {
            w.setStrokeWidth(width);
            w.setStrokeType(type);
        });
    }

    @Override
    protected Map<String, Integer> counts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (WireKind kind : WireKind.values()) {
            counts.put(kind.getTag(), byKind.getOrDefault(kind, List.of()).size());
        }
        return counts;
    }
}
