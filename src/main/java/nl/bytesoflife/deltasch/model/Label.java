package nl.bytesoflife.deltasch.model;

import nl.bytesoflife.deltasch.sexpr.SNode.SAtom;
import nl.bytesoflife.deltasch.sexpr.SNode.SList;

/**
 * Net label of any of the three kinds. Global and hierarchical labels carry a shape; a
 * hierarchical label without one is an input.
 */
public final class Label extends SchematicElement {

    public Label(SList node) {
        super(node);
    }

    public static Label create(String text, Point position, LabelType type) {
        return create(text, position, type, LabelShape.INPUT);
    }

    public static Label create(String text, Point position, LabelType type, LabelShape shape) {
        SList node = SList.of(type.getTag(), SAtom.string(text));
        if (type != LabelType.LOCAL) {
            node.add(SList.of("shape", SAtom.symbol(shape.kicadName())));
        }
        node.add(at(position, 0));
        node.add(effects(type == LabelType.LOCAL ? new String[]{"left", "bottom"} : new String[]{"left"}));
        node.add(uuidNode(newUuid()));
        return new Label(node);
    }

    public LabelType getType() {
        return LabelType.fromTag(getTag());
    }

    public String getText() {
        String text = node.value(1);
        return text != null ? text : "";
    }

    public void setText(String text) {
        setAtom(node, 1, SAtom.string(text));
        changed();
    }

    public Point getPosition() {
        return readAt();
    }

    public void setPosition(Point position) {
        writeAt(position);
        changed();
    }

    public double getRotation() {
        return readRotation();
    }

    public void setRotation(double rotation) {
        writeRotation(Component.normalizeRotation(rotation));
        changed();
    }

    /**
     * Shape of a global or hierarchical label, {@code null} for local labels.
     */
    public LabelShape getShape() {
        if (getType() == LabelType.LOCAL) return null;
        String shape = childValue("shape");
        return shape != null ? LabelShape.fromKicadName(shape) : LabelShape.INPUT;
    }

    public void setShape(LabelShape shape) {
        if (getType() == LabelType.LOCAL) {
            throw new IllegalStateException("Local labels have no shape");
        }
        SList existing = node.find("shape");
        if (existing != null) {
            setAtom(existing, 1, SAtom.symbol(shape.kicadName()));
        } else {
            node.insert(2, SList.of("shape", SAtom.symbol(shape.kicadName())));
        }
        changed();
    }

    @Override
    public String toString() {
        return getTag() + " '" + getText() + "' at " + getPosition();
    }
}
