package nl.bytesoflife.deltasch.model;

import nl.bytesoflife.deltasch.sexpr.SNode.SAtom;
import nl.bytesoflife.deltasch.sexpr.SNode.SList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A wire or bus: {@code (wire (pts (xy ..) (xy ..)) (stroke ...) (uuid ...))}.
 */
public final class Wire extends SchematicElement {

    public Wire(SList node) {
        super(node);
    }

    public static Wire create(WireKind kind, List<Point> points) {
        requireTwoPoints(points);
        SList node = SList.of(kind.getTag(),
                pts(points),
                SList.of("stroke",
                        SList.of("width", SAtom.number(0)),
                        SList.of("type", SAtom.symbol("default"))),
                uuidNode(newUuid()));
        return new Wire(node);
    }

    public static Wire create(Point start, Point end) {
        return create(WireKind.WIRE, List.of(start, end));
    }

    private static SList pts(List<Point> points) {
        SList pts = SList.of("pts");
        for (Point p : points) {
            pts.add(xy(p));
        }
        return pts;
    }

    private static void requireTwoPoints(List<Point> points) {
        if (points.size() < 2) {
            throw new IllegalArgumentException("A wire needs at least two points, got " + points.size());
        }
    }

    public WireKind getKind() {
        return WireKind.fromTag(getTag());
    }

    public boolean isBus() {
        return getKind() == WireKind.BUS;
    }

    public List<Point> getPoints() {
        SList pts = node.find("pts");
        if (pts == null) return List.of();
        List<Point> points = new ArrayList<>();
        for (SList xy : pts.findAll("xy")) {
            points.add(readPoint(xy));
        }
        return Collections.unmodifiableList(points);
    }

    /**
     * Replaces the path. The {@code pts} list is rebuilt, the rest of the wire keeps its text.
     */
    public void setPoints(List<Point> points) {
        requireTwoPoints(points);
        SList pts = node.find("pts");
        if (pts == null) {
            node.insert(1, pts(points));
        } else {
            node.set(node.indexOf(pts), pts(points));
        }
        changed();
    }

    public Point getStart() {
        return getPoints().get(0);
    }

    public Point getEnd() {
        List<Point> points = getPoints();
        return points.get(points.size() - 1);
    }

    public double getStrokeWidth() {
        SList stroke = node.find("stroke");
        SList width = stroke != null ? stroke.find("width") : null;
        return width != null ? width.number(1, 0) : 0;
    }

    public void setStrokeWidth(double width) {
        stroke().put(SList.of("width", SAtom.number(width)));
        changed();
    }

    public String getStrokeType() {
        SList stroke = node.find("stroke");
        SList type = stroke != null ? stroke.find("type") : null;
        return type != null ? type.value(1) : "default";
    }

    public void setStrokeType(String type) {
        stroke().put(SList.of("type", SAtom.symbol(type)));
        changed();
    }

    private SList stroke() {
        SList stroke = node.find("stroke");
        if (stroke == null) {
            stroke = SList.of("stroke");
            insertBeforeUuid(stroke);
        }
        return stroke;
    }

    public double length() {
        List<Point> points = getPoints();
        double length = 0;
        for (int i = 0; i + 1 < points.size(); i++) {
            length += points.get(i).distance(points.get(i + 1));
        }
        return length;
    }

    @Override
    public String toString() {
        return getTag() + " " + getPoints();
    }
}
