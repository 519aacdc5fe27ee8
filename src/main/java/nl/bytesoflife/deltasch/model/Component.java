package nl.bytesoflife.deltasch.model;

import nl.bytesoflife.deltasch.sexpr.SNode;
import nl.bytesoflife.deltasch.sexpr.SNode.SAtom;
import nl.bytesoflife.deltasch.sexpr.SNode.SList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A placed symbol, the {@code (symbol (lib_id ...) ...)} list at the top level of a schematic.
 */
public final class Component extends SchematicElement {

    public static final String REFERENCE = "Reference";
    public static final String VALUE = "Value";
    public static final String FOOTPRINT = "Footprint";
    public static final String DATASHEET = "Datasheet";

    public Component(SList node) {
        super(node);
    }

    /**
     * Builds a new placement in the KiCad 8 layout with unit 1, rotation 0 and no mirror.
     */
    public static Component create(String libId, String reference, String value, Point position) {
        SList node = SList.of("symbol",
                SList.of("lib_id", SAtom.string(libId)),
                at(position, 0),
                SList.of("unit", SAtom.integer(1)),
                SList.of("exclude_from_sim", SAtom.bool(false)),
                SList.of("in_bom", SAtom.bool(true)),
                SList.of("on_board", SAtom.bool(true)),
                SList.of("dnp", SAtom.bool(false)),
                uuidNode(newUuid()),
                Property.create(REFERENCE, reference, position.translate(2.54, -1.27), false, "left"),
                Property.create(VALUE, value, position.translate(2.54, 1.27), false, "left"),
                Property.create(FOOTPRINT, "", position, true),
                Property.create(DATASHEET, "~", position, true));
        return new Component(node);
    }

    public String getLibId() {
        String libId = childValue("lib_id");
        return libId != null ? libId : "";
    }

    public void setLibId(String libId) {
        setChildValue("lib_id", SAtom.string(libId));
        changed();
    }

    public String getLibraryName() {
        String libId = getLibId();
        int colon = libId.indexOf(':');
        return colon >= 0 ? libId.substring(0, colon) : "";
    }

    public String getReference() {
        return getProperty(REFERENCE).orElse("");
    }

    /**
     * Renames the component. The reference is also stored per instance path in KiCad 7 and later,
     * those copies are updated too.
     */
    public void setReference(String reference) {
        setPropertyValue(REFERENCE, reference);
        SList instances = node.find("instances");
        if (instances != null) {
            for (SList project : instances.findAll("project")) {
                for (SList path : project.findAll("path")) {
                    SList ref = path.find("reference");
                    if (ref != null) {
                        setAtom(ref, 1, SAtom.string(reference));
                    }
                }
            }
        }
        changed();
    }

    public String getReferencePrefix() {
        String reference = getReference();
        int end = reference.length();
        while (end > 0 && (Character.isDigit(reference.charAt(end - 1)) || reference.charAt(end - 1) == '?')) {
            end--;
        }
        return reference.substring(0, end);
    }

    public String getValue() {
        return getProperty(VALUE).orElse("");
    }

    public void setValue(String value) {
        setPropertyValue(VALUE, value);
        changed();
    }

    public String getFootprint() {
        return getProperty(FOOTPRINT).orElse("");
    }

    public void setFootprint(String footprint) {
        setPropertyValue(FOOTPRINT, footprint);
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
        for (Property property : getProperties()) {
            property.translate(dx, dy);
        }
        changed();
    }

    public double getRotation() {
        return readRotation();
    }

    public void setRotation(double rotation) {
        writeRotation(normalizeRotation(rotation));
        changed();
    }

    /**
     * Maps a rotation onto 0, 90, 180 or 270.
     *
     * @throws IllegalArgumentException if the angle is not a multiple of 90 degrees
     */
    public static int normalizeRotation(double rotation) {
        double normalized = ((rotation % 360) + 360) % 360;
        long rounded = Math.round(normalized);
        if (Math.abs(normalized - rounded) > 1e-6 || rounded % 90 != 0) {
            throw new IllegalArgumentException("Rotation must be a multiple of 90 degrees: " + rotation);
        }
        return (int) (rounded % 360);
    }

    public MirrorAxis getMirror() {
        return MirrorAxis.fromKicadName(childValue("mirror"));
    }

    public void setMirror(MirrorAxis mirror) {
        if (mirror == MirrorAxis.NONE) {
            node.removeAll("mirror");
        } else {
            SList existing = node.find("mirror");
            if (existing != null) {
                setAtom(existing, 1, SAtom.symbol(mirror.kicadName()));
            } else {
                SList at = node.find("at");
                int index = at != null ? node.indexOf(at) + 1 : node.size();
                node.insert(index, SList.of("mirror", SAtom.symbol(mirror.kicadName())));
            }
        }
        changed();
    }

    public int getUnit() {
        SList unit = node.find("unit");
        return unit != null ? (int) unit.number(1, 1) : 1;
    }

    public void setUnit(int unit) {
        setChildValue("unit", SAtom.integer(unit));
        changed();
    }

    public boolean isInBom() {
        return readFlag("in_bom", true);
    }

    public void setInBom(boolean inBom) {
        writeFlag("in_bom", inBom);
        changed();
    }

    public boolean isOnBoard() {
        return readFlag("on_board", true);
    }

    public void setOnBoard(boolean onBoard) {
        writeFlag("on_board", onBoard);
        changed();
    }

    public boolean isDnp() {
        return readFlag("dnp", false);
    }

    public void setDnp(boolean dnp) {
        writeFlag("dnp", dnp);
        changed();
    }

    /**
     * Power symbols are named after the {@code power:} library or carry a {@code #PWR} reference.
     * Symbols flagged {@code (power)} in their definition are recognised by the symbol resolver.
     */
    public boolean isPowerSymbol() {
        return getLibId().startsWith("power:") || getReference().startsWith("#PWR");
    }

    public List<Property> getProperties() {
        List<Property> properties = new ArrayList<>();
        for (SList list : node.findAll("property")) {
            properties.add(new Property(list, this::changed));
        }
        return properties;
    }

    public Map<String, String> getPropertyMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (Property property : getProperties()) {
            map.putIfAbsent(property.getName(), property.getValue());
        }
        return map;
    }

    public Optional<Property> findProperty(String name) {
        for (Property property : getProperties()) {
            if (name.equals(property.getName())) {
                return Optional.of(property);
            }
        }
        return Optional.empty();
    }

    public Optional<String> getProperty(String name) {
        return findProperty(name).map(Property::getValue);
    }

    /**
     * Sets a property value. A property that does not exist yet is added hidden, at the
     * component position.
     */
    public void setProperty(String name, String value) {
        setPropertyValue(name, value);
        changed();
    }

    public boolean removeProperty(String name) {
        Optional<Property> property = findProperty(name);
        if (property.isEmpty()) return false;
        node.remove(property.get().getNode());
        changed();
        return true;
    }

    private void setPropertyValue(String name, String value) {
        Optional<Property> property = findProperty(name);
        if (property.isPresent()) {
            SList list = property.get().getNode();
            setAtom(list, 2, SAtom.string(value));
            return;
        }
        SList created = Property.create(name, value, getPosition(), true);
        List<SList> existing = node.findAll("property");
        int index = existing.isEmpty() ? node.size() : node.indexOf(existing.get(existing.size() - 1)) + 1;
        node.insert(index, created);
    }

    public Map<String, String> getPinUuids() {
        Map<String, String> pins = new LinkedHashMap<>();
        for (SList pin : node.findAll("pin")) {
            SList uuid = pin.find("uuid");
            pins.put(pin.value(1), uuid != null ? uuid.value(1) : null);
        }
        return Collections.unmodifiableMap(pins);
    }

    public void setPinUuid(String pinNumber, String uuid) {
        for (SList pin : node.findAll("pin")) {
            if (pinNumber.equals(pin.value(1))) {
                pin.put(uuidNode(uuid));
                changed();
                return;
            }
        }
        SList pin = SList.of("pin", SAtom.string(pinNumber), uuidNode(uuid));
        SNode instances = node.find("instances");
        int index = instances != null ? node.indexOf(instances) : node.size();
        node.insert(index, pin);
        changed();
    }

    /**
     * Adds the KiCad 7+ instance record that stores the reference per sheet path.
     */
    public void addInstance(String project, String path, String reference, int unit) {
        SList instances = node.find("instances");
        if (instances == null) {
            instances = SList.of("instances");
            node.add(instances);
        }
        SList projectNode = null;
        for (SList p : instances.findAll("project")) {
            if (project.equals(p.value(1))) {
                projectNode = p;
            }
        }
        if (projectNode == null) {
            projectNode = SList.of("project", SAtom.string(project));
            instances.add(projectNode);
        }
        projectNode.add(SList.of("path", SAtom.string(path),
                SList.of("reference", SAtom.string(reference)),
                SList.of("unit", SAtom.integer(unit))));
        changed();
    }

    /**
     * Reference stored for the instance path, falling back to the Reference property when the
     * path has no instance record.
     */
    public String getInstanceReference(String instancePath) {
        SList instances = node.find("instances");
        if (instances != null) {
            for (SList project : instances.findAll("project")) {
                for (SList path : project.findAll("path")) {
                    SList ref = path.find("reference");
                    if (instancePath.equals(path.value(1)) && ref != null && ref.value(1) != null) {
                        return ref.value(1);
                    }
                }
            }
        }
        return getReference();
    }

    @Override
    public String toString() {
        return getReference() + " (" + getLibId() + ") " + getValue() + " at " + getPosition();
    }
}
