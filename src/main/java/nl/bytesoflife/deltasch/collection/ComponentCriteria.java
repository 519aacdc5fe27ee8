package nl.bytesoflife.deltasch.collection;

import nl.bytesoflife.deltasch.geometry.BoundingBox;
import nl.bytesoflife.deltasch.model.Component;
import nl.bytesoflife.deltasch.model.Point;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Conjunction of component filters, e.g.
 * {@code ComponentCriteria.any().withLibId("Device:R").withValue("10k")}.
 */
public class ComponentCriteria implements Predicate<Component> {

    private final List<Predicate<Component>> conditions = new ArrayList<>();
    private final List<String> description = new ArrayList<>();

    public static ComponentCriteria any() {
        return new ComponentCriteria();
    }

    public ComponentCriteria withLibId(String libId) {
        conditions.add(c -> c.getLibId().equals(libId));
        description.add("lib_id=" + libId);
        return this;
    }

    public ComponentCriteria withValue(String value) {
        conditions.add(c -> c.getValue().equals(value));
        description.add("value=" + value);
        return this;
    }

    public ComponentCriteria withReferencePrefix(String prefix) {
        conditions.add(c -> c.getReferencePrefix().equals(prefix));
        description.add("prefix=" + prefix);
        return this;
    }

    public ComponentCriteria withProperty(String name, String value) {
        conditions.add(c -> c.getProperty(name).map(value::equals).orElse(false));
        description.add(name + "=" + value);
        return this;
    }

    /**
     * Placement point inside the rectangle spanned by the two corners, edges included.
     */
    public ComponentCriteria inRegion(Point corner1, Point corner2) {
        BoundingBox region = BoundingBox.of(corner1, corner2);
        conditions.add(c -> region.contains(c.getPosition()));
        description.add("region=" + corner1 + ".." + corner2);
        return this;
    }

    public ComponentCriteria matching(Predicate<Component> predicate) {
        conditions.add(predicate);
        description.add("custom");
        return this;
    }

    @Override
    public boolean test(Component component) {
        for (Predicate<Component> condition : conditions) {
            if (!condition.test(component)) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return description.isEmpty() ? "any" : String.join(", ", description);
    }
}
