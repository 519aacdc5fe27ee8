package nl.bytesoflife.deltasch.model;

import nl.bytesoflife.deltasch.sexpr.SNode.SAtom;
import nl.bytesoflife.deltasch.sexpr.SNode.SList;

import java.util.List;

/**
 * Any other top-level item: text, shapes, images, bus entries, netclass flags, rule areas and
 * tables. Items whose tag is not known at all are kept the same way when the parser runs
 * permissively, flagged as opaque.
 */
public final class GraphicItem extends SchematicElement {

    private final boolean opaque;

    public GraphicItem(SList node, boolean opaque) {
        super(node);
        this.opaque = opaque;
    }

    public GraphicItem(SList node) {
        this(node, false);
    }

    public static GraphicItem text(String text, Point position) {
        SList node = SList.of("text", SAtom.string(text),
                SList.of("exclude_from_sim", SAtom.bool(false)),
                at(position, 0),
                effects("left", "bottom"),
                uuidNode(newUuid()));
        return new GraphicItem(node);
    }

    public static GraphicItem polyline(List<Point> points) {
        if (points.size() < 2) {
            throw new IllegalArgumentException("A polyline needs at least two points");
        }
        SList pts = SList.of("pts");
        for (Point p : points) {
            pts.add(xy(p));
        }
        SList node = SList.of("polyline", pts,
                SList.of("stroke",
                        SList.of("width", SAtom.number(0)),
                        SList.of("type", SAtom.symbol("default"))),
                uuidNode(newUuid()));
        return new GraphicItem(node);
    }

    public boolean isOpaque() {
        return opaque;
    }

    /**
     * Leading string of text-like items, {@code null} for shapes.
     */
    public String getText() {
        SAtom first = node.atom(1);
        return first != null ? first.value() : null;
    }

    public void setText(String text) {
        SAtom first = node.atom(1);
        if (first == null) {
            throw new IllegalStateException(getTag() + " has no text");
        }
        setAtom(node, 1, SAtom.string(text));
        changed();
    }

    /**
     * Anchor of the item: its {@code at}, otherwise its {@code start}, otherwise the first point.
     */
    public Point getPosition() {
        SList at = node.find("at");
        if (at != null) return readPoint(at);
        SList start = node.find("start");
        if (start != null) return readPoint(start);
        SList pts = node.find("pts");
        if (pts != null && pts.find("xy") != null) return readPoint(pts.find("xy"));
        return new Point(0, 0);
    }

    @Override
    public String toString() {
        return getTag() + (opaque ? " (opaque)" : "") + " at " + getPosition();
    }
}
