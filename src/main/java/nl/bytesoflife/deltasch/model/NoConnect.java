package nl.bytesoflife.deltasch.model;

import nl.bytesoflife.deltasch.sexpr.SNode.SList;

public final class NoConnect extends SchematicElement {

    public NoConnect(SList node) {
        super(node);
    }

    public static NoConnect create(Point position) {
        return new NoConnect(SList.of("no_connect", at(position), uuidNode(newUuid())));
    }

    public Point getPosition() {
        return readAt();
    }

    public void setPosition(Point position) {
        writeAt(position);
        changed();
    }

    @Override
    public String toString() {
        return "no_connect at " + getPosition();
    }
}
