package nl.bytesoflife.deltasch.model;

import nl.bytesoflife.deltasch.sexpr.SNode;
import nl.bytesoflife.deltasch.sexpr.SNode.SAtom;
import nl.bytesoflife.deltasch.sexpr.SNode.SList;

/**
 * A named field of a component or sheet: {@code (property "Name" "Value" (at x y r) (effects ...))}.
 */
public class Property {

    private final SList node;
    private final Runnable onChange;

    Property(SList node, Runnable onChange) {
        this.node = node;
        this.onChange = onChange;
    }

    static SList create(String name, String value, Point position, boolean hidden, String... justify) {
        SList effects = SchematicElement.effects(justify);
        if (hidden) {
            effects.add(SList.of("hide", SAtom.bool(true)));
        }
        return SList.of("property", SAtom.string(name), SAtom.string(value),
                SchematicElement.at(position, 0), effects);
    }

    public SList getNode() {
        return node;
    }

    public String getName() {
        return node.value(1);
    }

    public String getValue() {
        String value = node.value(2);
        return value != null ? value : "";
    }

    public void setValue(String value) {
        if (value.equals(getValue())) return;
        SchematicElement.setAtom(node, 2, SAtom.string(value));
        onChange.run();
    }

    public Point getPosition() {
        return SchematicElement.readPoint(node.find("at"));
    }

    public void setPosition(Point position) {
        SList at = node.find("at");
        if (at == null) {
            node.insert(Math.min(3, node.size()), SchematicElement.at(position, 0));
        } else {
            SchematicElement.writePoint(at, position);
        }
        onChange.run();
    }

    public double getRotation() {
        SList at = node.find("at");
        return at != null ? at.number(3, 0) : 0;
    }

    /**
     * Hidden via {@code (hide yes)} on the property (KiCad 9), inside its effects (KiCad 7 and 8)
     * or as a bare {@code hide} atom in its effects (KiCad 6).
     */
    public boolean isHidden() {
        SList hide = node.find("hide");
        if (hide != null) return !"no".equals(hide.value(1));
        SList effects = node.find("effects");
        if (effects == null) return false;
        SList effectsHide = effects.find("hide");
        if (effectsHide != null) return !"no".equals(effectsHide.value(1));
        return effects.hasSymbol("hide");
    }

    public void setHidden(boolean hidden) {
        if (hidden == isHidden()) return;
        SList hide = node.find("hide");
        SList effects = node.find("effects");
        if (hide != null) {
            SchematicElement.setAtom(hide, 1, SAtom.bool(hidden));
        } else if (effects != null && effects.find("hide") != null) {
            SchematicElement.setAtom(effects.find("hide"), 1, SAtom.bool(hidden));
        } else if (effects != null && effects.hasSymbol("hide")) {
            for (int i = effects.size() - 1; i >= 1; i--) {
                if (effects.get(i) instanceof SAtom atom && "hide".equals(atom.value())) {
                    effects.remove(i);
                }
            }
        } else if (effects != null) {
            effects.add(SList.of("hide", SAtom.bool(true)));
        } else {
            SList created = SchematicElement.effects();
            created.add(SList.of("hide", SAtom.bool(true)));
            node.add(created);
        }
        onChange.run();
    }

    void translate(double dx, double dy) {
        SList at = node.find("at");
        if (at != null) {
            Point p = SchematicElement.readPoint(at);
            SchematicElement.writePoint(at, p.translate(dx, dy));
        }
    }

    static boolean isProperty(SNode node) {
        return node instanceof SList list && list.hasTag("property");
    }

    @Override
    public String toString() {
        return getName() + "=" + getValue();
    }
}
