package nl.bytesoflife.deltasch.model;

import nl.bytesoflife.deltasch.sexpr.SNode;
import nl.bytesoflife.deltasch.sexpr.SNode.SAtom;
import nl.bytesoflife.deltasch.sexpr.SNode.SList;

import java.util.UUID;

/**
 * Typed view over one top-level list of a schematic. All state lives in the backing node, the
 * element only interprets it, so whatever is not touched through a setter stays as it was read.
 */
public abstract sealed class SchematicElement
        permits Component, Wire, Junction, NoConnect, Label, Sheet, GraphicItem {

    protected final SList node;
    private ElementListener listener;

    protected SchematicElement(SList node) {
        this.node = node;
    }

    public SList getNode() {
        return node;
    }

    public String getTag() {
        return node.tag();
    }

    public String getUuid() {
        SList uuid = node.find("uuid");
        return uuid != null ? uuid.value(1) : null;
    }

    /**
     * Registers the collection that owns this element. Called by the collection when the element
     * joins it, and with {@code null} when it leaves.
     */
    public void setListener(ElementListener listener) {
        this.listener = listener;
    }

    protected void changed() {
        node.markModified();
        if (listener != null) {
            listener.elementChanged(this);
        }
    }

    // Node helpers shared by the element types

    public static String newUuid() {
        return UUID.randomUUID().toString();
    }

    protected static SList uuidNode(String uuid) {
        return SList.of("uuid", SAtom.string(uuid));
    }

    protected static SList at(Point p, double rotation) {
        return SList.of("at", SAtom.number(p.x()), SAtom.number(p.y()), SAtom.number(rotation));
    }

    protected static SList at(Point p) {
        return SList.of("at", SAtom.number(p.x()), SAtom.number(p.y()));
    }

    protected static SList xy(Point p) {
        return SList.of("xy", SAtom.number(p.x()), SAtom.number(p.y()));
    }

    protected static SList font() {
        return SList.of("font", SList.of("size", SAtom.number(1.27), SAtom.number(1.27)));
    }

    protected static SList effects(String... justify) {
        SList effects = SList.of("effects", font());
        if (justify.length > 0) {
            SList j = SList.of("justify");
            for (String s : justify) {
                j.add(SAtom.symbol(s));
            }
            effects.add(j);
        }
        return effects;
    }

    protected static Point readPoint(SList list) {
        if (list == null) return new Point(0, 0);
        return new Point(list.number(1, 0), list.number(2, 0));
    }

    protected Point readAt() {
        return readPoint(node.find("at"));
    }

    protected double readRotation() {
        SList at = node.find("at");
        return at != null ? at.number(3, 0) : 0;
    }

    /**
     * Writes the coordinates of {@code at} atom by atom so the list keeps its own formatting.
     */
    protected static void writePoint(SList list, Point p) {
        setAtom(list, 1, SAtom.number(p.x()));
        setAtom(list, 2, SAtom.number(p.y()));
    }

    protected void writeAt(Point p) {
        SList at = node.find("at");
        if (at == null) {
            node.insert(Math.min(2, node.size()), at(p));
        } else {
            writePoint(at, p);
        }
    }

    protected void writeRotation(double rotation) {
        SList at = node.find("at");
        if (at == null) {
            node.insert(Math.min(2, node.size()), at(new Point(0, 0), rotation));
        } else {
            while (at.size() < 3) {
                at.add(SAtom.number(0));
            }
            setAtom(at, 3, SAtom.number(rotation));
        }
    }

    protected static void setAtom(SList list, int index, SAtom atom) {
        if (index < list.size()) {
            SNode current = list.get(index);
            if (current instanceof SAtom a && a.sameStructure(atom)) {
                return;
            }
            list.set(index, atom);
        } else {
            list.add(atom);
        }
    }

    protected String childValue(String tag) {
        SList child = node.find(tag);
        return child != null ? child.value(1) : null;
    }

    /**
     * Replaces the value of {@code (tag value)}, creating the list before the uuid when missing.
     */
    protected void setChildValue(String tag, SAtom value) {
        SList child = node.find(tag);
        if (child == null) {
            insertBeforeUuid(SList.of(tag, value));
        } else {
            setAtom(child, 1, value);
        }
    }

    protected void insertBeforeUuid(SList child) {
        SList uuid = node.find("uuid");
        int index = uuid != null ? node.indexOf(uuid) : node.size();
        node.insert(index, child);
    }

    protected boolean readFlag(String tag, boolean defaultValue) {
        SList flag = node.find(tag);
        if (flag == null) return defaultValue;
        String value = flag.value(1);
        return value == null || "yes".equals(value);
    }

    protected void writeFlag(String tag, boolean value) {
        setChildValue(tag, SAtom.bool(value));
    }
}
