package nl.bytesoflife.deltasch.collection;

import nl.bytesoflife.deltasch.geometry.BoundingBox;
import nl.bytesoflife.deltasch.geometry.PinResolver;
import nl.bytesoflife.deltasch.geometry.SpatialIndex;
import nl.bytesoflife.deltasch.model.Component;
import nl.bytesoflife.deltasch.model.Point;
import nl.bytesoflife.deltasch.sexpr.SNode.SList;
import nl.bytesoflife.deltasch.symbol.SymbolDefinition;
import nl.bytesoflife.deltasch.symbol.SymbolResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Placed symbols, indexed by reference, lib id and value.
 */
public class ComponentCollection extends IndexedCollection<Component> {

    private static final Logger log = LoggerFactory.getLogger(ComponentCollection.class);

    private static final Map<String, String> REFERENCE_PREFIXES = Map.ofEntries(
            Map.entry("R", "R"),
            Map.entry("Resistor", "R"),
            Map.entry("C", "C"),
            Map.entry("Capacitor", "C"),
            Map.entry("L", "L"),
            Map.entry("Inductor", "L"),
            Map.entry("D", "D"),
            Map.entry("Diode", "D"),
            Map.entry("LED", "D"),
            Map.entry("Q", "Q"),
            Map.entry("Transistor", "Q"),
            Map.entry("U", "U"),
            Map.entry("IC", "U"),
            Map.entry("Amplifier", "U"),
            Map.entry("J", "J"),
            Map.entry("Connector", "J"),
            Map.entry("SW", "SW"),
            Map.entry("Switch", "SW"),
            Map.entry("F", "F"),
            Map.entry("Fuse", "F"),
            Map.entry("TP", "TP"),
            Map.entry("TestPoint", "TP")
    );

    private final Supplier<String> instancePath;
    private final Map<String, List<Component>> byReference = new HashMap<>();
    private final Map<String, List<Component>> byLibId = new HashMap<>();
    private final Map<String, List<Component>> byValue = new HashMap<>();

    /**
     * @param instancePath sheet path recorded in the instance data of added components, or
     *                     {@code null} to add components without instance data
     */
    public ComponentCollection(SList root, Runnable onChange, Supplier<String> instancePath) {
        super(root, onChange);
        this.instancePath = instancePath;
    }

    @Override
    protected String elementType() {
        return "component";
    }

    @Override
    protected void rebuildIndexes() {
        byReference.clear();
        byLibId.clear();
        byValue.clear();
        for (Component component : items()) {
            addToIndex(byReference, component.getReference(), component);
            addToIndex(byLibId, component.getLibId(), component);
            addToIndex(byValue, component.getValue(), component);
        }
    }

    /**
     * Places a new component. A {@code null} reference, or one ending in {@code ?}, is replaced
     * by the next free reference for the symbol.
     *
     * @throws IllegalArgumentException if the reference is already used
     */
    public Component add(String libId, String reference, String value, Point position) {
        String ref = reference == null || reference.endsWith("?") ? generateReference(libId) : reference;
        if (byReference(ref).isPresent()) {
            throw new IllegalArgumentException("Reference already in use: " + ref);
        }
        Component component = Component.create(libId, ref, value, position);
        if (instancePath != null) {
            component.addInstance("", instancePath.get(), ref, 1);
        }
        add(component);
        log.debug("Added {} ({}) at {}", ref, libId, position);
        return component;
    }

    public Optional<Component> byReference(String reference) {
        ensureIndexes();
        List<Component> matches = byReference.get(reference);
        return matches == null ? Optional.empty() : Optional.of(matches.get(0));
    }

    public List<Component> byLibId(String libId) {
        ensureIndexes();
        return List.copyOf(byLibId.getOrDefault(libId, List.of()));
    }

    public List<Component> byValue(String value) {
        ensureIndexes();
        return List.copyOf(byValue.getOrDefault(value, List.of()));
    }

    public Set<String> references() {
        ensureIndexes();
        return Set.copyOf(byReference.keySet());
    }

    /**
     * References used by more than one component, in sorted order.
     */
    public Map<String, List<Component>> duplicateReferences() {
        ensureIndexes();
        Map<String, List<Component>> duplicates = new TreeMap<>();
        for (Map.Entry<String, List<Component>> entry : byReference.entrySet()) {
            if (entry.getValue().size() > 1) {
                duplicates.put(entry.getKey(), List.copyOf(entry.getValue()));
            }
        }
        return duplicates;
    }

    /**
     * Changes a reference.
     *
     * @return {@code false} if no component has {@code oldReference}
     * @throws IllegalArgumentException if {@code newReference} is already taken
     */
    public boolean rename(String oldReference, String newReference) {
        Optional<Component> component = byReference(oldReference);
        if (component.isEmpty()) {
            return false;
        }
        if (!oldReference.equals(newReference) && byReference(newReference).isPresent()) {
            throw new IllegalArgumentException("Reference already in use: " + newReference);
        }
        component.get().setReference(newReference);
        return true;
    }

    /**
     * Next unused reference for the symbol: prefix from the symbol name ({@code R} for
     * {@code Device:R}, {@code U} when unknown, {@code #PWR} for power symbols) plus the lowest
     * free number.
     */
    public String generateReference(String libId) {
        String prefix = referencePrefix(libId);
        Set<String> used = references();
        int number = 1;
        while (used.contains(prefix + number)) {
            number++;
        }
        return prefix + number;
    }

    static String referencePrefix(String libId) {
        if (libId.startsWith("power:")) {
            return "#PWR";
        }
        int colon = libId.indexOf(':');
        String name = colon >= 0 ? libId.substring(colon + 1) : libId;
        return REFERENCE_PREFIXES.getOrDefault(name, "U");
    }

    /**
     * Components whose transformed symbol bounds intersect {@code region}. A component whose
     * symbol cannot be resolved is matched by its placement point.
     */
    public List<Component> overlapping(BoundingBox region, SymbolResolver resolver) {
        PinResolver pins = new PinResolver();
        SpatialIndex<Component> outlines = new SpatialIndex<>();
        for (Component c : items()) {
            Optional<SymbolDefinition> definition = resolver.find(c.getLibId());
            BoundingBox box = definition.map(d -> pins.boundingBox(c, d)).orElse(null);
            if (box != null) {
                outlines.insertBox(box, c);
            } else {
                outlines.insertPoint(c.getPosition(), c);
            }
        }
        Set<Component> hits = Collections.newSetFromMap(new IdentityHashMap<>());
        hits.addAll(outlines.query(region));
        return filter(hits::contains);
    }

    @Override
    protected Map<String, Integer> counts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Map.Entry<String, List<Component>> entry : new TreeMap<>(byLibId).entrySet()) {
            counts.put(entry.getKey(), entry.getValue().size());
        }
        return counts;
    }
}
