package nl.bytesoflife.deltasch.model;

import nl.bytesoflife.deltasch.sexpr.SNode.SAtom;
import nl.bytesoflife.deltasch.sexpr.SNode.SList;

public final class Junction extends SchematicElement {

    public Junction(SList node) {
        super(node);
    }

    public static Junction create(Point position) {
        SList node = SList.of("junction",
                at(position),
                SList.of("diameter", SAtom.number(0)),
                SList.of("color", SAtom.number(0), SAtom.number(0), SAtom.number(0), SAtom.number(0)),
                uuidNode(newUuid()));
        return new Junction(node);
    }

    public Point getPosition() {
        return readAt();
    }

    public void setPosition(Point position) {
        writeAt(position);
        changed();
    }

    public double getDiameter() {
        SList diameter = node.find("diameter");
        return diameter != null ? diameter.number(1, 0) : 0;
    }

    public void setDiameter(double diameter) {
        setChildValue("diameter", SAtom.number(diameter));
        changed();
    }

    /**
     * RGBA colour, all zero meaning the theme default.
     */
    public double[] getColor() {
        SList color = node.find("color");
        if (color == null) return new double[4];
        return new double[]{color.number(1, 0), color.number(2, 0), color.number(3, 0), color.number(4, 0)};
    }

    @Override
    public String toString() {
        return "junction at " + getPosition();
    }
}
