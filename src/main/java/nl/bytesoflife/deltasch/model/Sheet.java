package nl.bytesoflife.deltasch.model;

import nl.bytesoflife.deltasch.sexpr.SNode.SAtom;
import nl.bytesoflife.deltasch.sexpr.SNode.SList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A hierarchical sheet symbol referencing a child schematic file.
 */
public final class Sheet extends SchematicElement {

    public static final String NAME = "Sheetname";
    public static final String FILE = "Sheetfile";
    private static final String LEGACY_NAME = "Sheet name";
    private static final String LEGACY_FILE = "Sheet file";

    public Sheet(SList node) {
        super(node);
    }

    public static Sheet create(String name, String filename, Point position, double width, double height) {
        SList node = SList.of("sheet",
                at(position),
                SList.of("size", SAtom.number(width), SAtom.number(height)),
                SList.of("stroke",
                        SList.of("width", SAtom.number(0.1524)),
                        SList.of("type", SAtom.symbol("solid"))),
                SList.of("fill",
                        SList.of("color", SAtom.number(0), SAtom.number(0), SAtom.number(0), SAtom.number(0))),
                uuidNode(newUuid()),
                Property.create(NAME, name, position.translate(0, -0.7116), false, "left", "bottom"),
                Property.create(FILE, filename, position.translate(0, height + 0.5846), false, "left", "top"));
        return new Sheet(node);
    }

    public String getName() {
        return propertyValue(NAME, LEGACY_NAME);
    }

    public void setName(String name) {
        setPropertyValue(NAME, LEGACY_NAME, name);
        changed();
    }

    /**
     * Child schematic file, relative to the directory of the file holding this sheet.
     */
    public String getFilename() {
        return propertyValue(FILE, LEGACY_FILE);
    }

    public void setFilename(String filename) {
        setPropertyValue(FILE, LEGACY_FILE, filename);
        changed();
    }

    public Point getPosition() {
        return readAt();
    }

    public void setPosition(Point position) {
        Point old = getPosition();
        double dx = position.x() - old.x();
        double dy = position.y() - old.y();
        writeAt(position);
        for (SList property : node.findAll("property")) {
            new Property(property, this::changed).translate(dx, dy);
        }
        for (SList pin : node.findAll("pin")) {
            SList at = pin.find("at");
            if (at != null) {
                writePoint(at, readPoint(at).translate(dx, dy));
            }
        }
        changed();
    }

    public double getWidth() {
        SList size = node.find("size");
        return size != null ? size.number(1, 0) : 0;
    }

    public double getHeight() {
        SList size = node.find("size");
        return size != null ? size.number(2, 0) : 0;
    }

    public List<Property> getProperties() {
        List<Property> properties = new ArrayList<>();
        for (SList list : node.findAll("property")) {
            properties.add(new Property(list, this::changed));
        }
        return properties;
    }

    public List<SheetPin> getPins() {
        List<SheetPin> pins = new ArrayList<>();
        for (SList list : node.findAll("pin")) {
            pins.add(new SheetPin(list, this::changed));
        }
        return pins;
    }

    public Optional<SheetPin> getPin(String name) {
        for (SheetPin pin : getPins()) {
            if (name.equals(pin.getName())) return Optional.of(pin);
        }
        return Optional.empty();
    }

    /**
     * Adds a pin. Pins on the left edge face left (rotation 180), all others face right.
     */
    public SheetPin addPin(String name, LabelShape shape, Point position) {
        if (getPin(name).isPresent()) {
            throw new IllegalArgumentException("Sheet " + getName() + " already has a pin named " + name);
        }
        double rotation = Math.abs(position.x() - getPosition().x()) < 1e-6 ? 180 : 0;
        SList pinNode = SheetPin.create(name, shape, position, rotation);
        SList instances = node.find("instances");
        if (instances != null) {
            node.insert(node.indexOf(instances), pinNode);
        } else {
            node.add(pinNode);
        }
        changed();
        return new SheetPin(pinNode, this::changed);
    }

    public boolean removePin(String name) {
        Optional<SheetPin> pin = getPin(name);
        if (pin.isEmpty()) return false;
        node.remove(pin.get().getNode());
        changed();
        return true;
    }

    private String propertyValue(String name, String legacyName) {
        for (SList property : node.findAll("property")) {
            String key = property.value(1);
            if (name.equals(key) || legacyName.equals(key)) {
                String value = property.value(2);
                return value != null ? value : "";
            }
        }
        return "";
    }

    private void setPropertyValue(String name, String legacyName, String value) {
        for (SList property : node.findAll("property")) {
            String key = property.value(1);
            if (name.equals(key) || legacyName.equals(key)) {
                setAtom(property, 2, SAtom.string(value));
                return;
            }
        }
        insertBeforeUuid(Property.create(name, value, getPosition(), false, "left", "bottom"));
    }

    @Override
    public String toString() {
        return "sheet '" + getName() + "' -> " + getFilename();
    }
}
