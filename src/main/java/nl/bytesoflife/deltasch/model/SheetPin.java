package nl.bytesoflife.deltasch.model;

import nl.bytesoflife.deltasch.sexpr.SNode.SAtom;
import nl.bytesoflife.deltasch.sexpr.SNode.SList;

/**
 * {@code (pin "NAME" input (at x y r) (effects ...) (uuid ...))} on the border of a sheet symbol.
 */
public class SheetPin {

    private final SList node;
    private final Runnable onChange;

    SheetPin(SList node, Runnable onChange) {
        this.node = node;
        this.onChange = onChange;
    }

    static SList create(String name, LabelShape shape, Point position, double rotation) {
        return SList.of("pin", SAtom.string(name), SAtom.symbol(shape.kicadName()),
                SchematicElement.at(position, rotation),
                SchematicElement.effects(rotation == 180 ? "left" : "right"),
                SchematicElement.uuidNode(SchematicElement.newUuid()));
    }

    public SList getNode() {
        return node;
    }

    public String getName() {
        return node.value(1);
    }

    public void setName(String name) {
        SchematicElement.setAtom(node, 1, SAtom.string(name));
        onChange.run();
    }

    public LabelShape getShape() {
        String shape = node.value(2);
        return shape != null ? LabelShape.fromKicadName(shape) : LabelShape.UNSPECIFIED;
    }

    public void setShape(LabelShape shape) {
        SchematicElement.setAtom(node, 2, SAtom.symbol(shape.kicadName()));
        onChange.run();
    }

    public Point getPosition() {
        return SchematicElement.readPoint(node.find("at"));
    }

    public double getRotation() {
        SList at = node.find("at");
        return at != null ? at.number(3, 0) : 0;
    }

    public String getUuid() {
        SList uuid = node.find("uuid");
        return uuid != null ? uuid.value(1) : null;
    }

    @Override
    public String toString() {
        return getName() + " (" + getShape().kicadName() + ")";
    }
}
