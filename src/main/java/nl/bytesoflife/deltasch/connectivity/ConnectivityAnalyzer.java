package nl.bytesoflife.deltasch.connectivity;

import nl.bytesoflife.deltasch.geometry.PinResolver;
import nl.bytesoflife.deltasch.geometry.SpatialIndex;
import nl.bytesoflife.deltasch.model.Component;
import nl.bytesoflife.deltasch.model.Junction;
import nl.bytesoflife.deltasch.model.Label;
import nl.bytesoflife.deltasch.model.LabelType;
import nl.bytesoflife.deltasch.model.Point;
import nl.bytesoflife.deltasch.model.Schematic;
import nl.bytesoflife.deltasch.model.Sheet;
import nl.bytesoflife.deltasch.model.SheetPin;
import nl.bytesoflife.deltasch.model.Wire;
import nl.bytesoflife.deltasch.sexpr.Atoms;
import nl.bytesoflife.deltasch.symbol.SymbolDefinition;
import nl.bytesoflife.deltasch.symbol.SymbolNotFoundException;
import nl.bytesoflife.deltasch.symbol.SymbolResolver;
import nl.bytesoflife.deltasch.validation.ValidationIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Electrical nets of one schematic.
 * <p>
 * Pins, wire vertices, junctions, label anchors and sheet pins are graph nodes. Nodes closer
 * than the tolerance are joined, consecutive vertices of a wire are joined, and a node lying on
 * a wire segment joins that wire. Two wires that merely cross are not connected. Labels then join
 * by text: local and hierarchical labels within the schematic, power symbols always, global
 * labels when {@link ConnectivityOptions#isUnifyGlobalLabels()} is set.
 * <p>
 * Results are cached and recomputed on the first query after the schematic changed.
 */
public class ConnectivityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ConnectivityAnalyzer.class);

    private enum NodeKind { PIN, POWER_PIN, WIRE_VERTEX, JUNCTION, LABEL, SHEET_PIN }

    private record Node(NodeKind kind, Point position, PinRef pin, String text, Wire wire, Label label,
                        SheetPinRef sheetPin) {}

    private final Schematic schematic;
    private final SymbolResolver resolver;
    private final ConnectivityOptions options;
    private final PinResolver pinResolver = new PinResolver();

    private State state;

    public ConnectivityAnalyzer(Schematic schematic, SymbolResolver resolver, ConnectivityOptions options) {
        this.schematic = schematic;
        this.resolver = resolver;
        this.options = options;
    }

    public ConnectivityAnalyzer(Schematic schematic, SymbolResolver resolver) {
        this(schematic, resolver, ConnectivityOptions.defaults());
    }

    /**
     * Key used for a sheet in {@link SheetPinRef}: its uuid, or its name when it has none.
     */
    public static String sheetKey(Sheet sheet) {
        return sheet.getUuid() != null ? sheet.getUuid() : sheet.getName();
    }

    public Schematic getSchematic() {
        return schematic;
    }

    public Optional<Net> getNetForPin(String reference, String pinNumber) {
        return Optional.ofNullable(state().byPin.get(new PinRef(reference, pinNumber)));
    }

    public boolean arePinsConnected(String referenceA, String pinA, String referenceB, String pinB) {
        Optional<Net> a = getNetForPin(referenceA, pinA);
        return a.isPresent() && a.get().containsPin(referenceB, pinB);
    }

    /**
     * The other pins on the same net, empty when the pin is unknown.
     */
    public Set<PinRef> getConnectedPins(String reference, String pinNumber) {
        Optional<Net> net = getNetForPin(reference, pinNumber);
        if (net.isEmpty()) return Set.of();
        SortedSet<PinRef> pins = new TreeSet<>(net.get().getPins());
        pins.remove(new PinRef(reference, pinNumber));
        return Collections.unmodifiableSortedSet(pins);
    }

    /**
     * All nets, sorted by name.
     */
    public List<Net> getNets() {
        return state().nets;
    }

    public Optional<Net> getNet(String name) {
        return Optional.ofNullable(state().byName.get(name));
    }

    /**
     * Net of whatever lies at {@code point}: a pin, a wire vertex, a junction, a label or a sheet
     * pin, the nearest one winning; otherwise the net of the wire segment through the point.
     * Empty when nothing is there, or when only segments of different nets cross there.
     */
    public Optional<Net> netAt(Point point) {
        State s = state();
        double tolerance = options.getTolerance();
        Integer nearest = null;
        Set<Net> crossing = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Integer id : s.index.query(point, tolerance)) {
            double distance = s.positions[id].distance(point);
            if (distance <= tolerance) {
                if (nearest == null || distance < s.positions[nearest].distance(point)) {
                    nearest = id;
                }
            } else {
                crossing.add(s.netOfNode[id]);
            }
        }
        if (nearest != null) {
            return Optional.of(s.netOfNode[nearest]);
        }
        return crossing.size() == 1 ? Optional.of(crossing.iterator().next()) : Optional.empty();
    }

    public Optional<Net> netForSheetPin(String sheetUuid, String pinName) {
        return Optional.ofNullable(state().bySheetPin.get(new SheetPinRef(sheetUuid, pinName)));
    }

    public Optional<Net> netForHierarchicalLabel(String text) {
        return Optional.ofNullable(state().byHierarchicalLabel.get(text));
    }

    /**
     * Problems met while building the nets, such as symbols that could not be resolved.
     */
    public List<ValidationIssue> getIssues() {
        return state().issues;
    }

    private State state() {
        if (state == null || state.revision != schematic.getRevision()) {
            state = build();
        }
        return state;
    }

    private State build() {
        List<Node> nodes = new ArrayList<>();
        List<ValidationIssue> issues = new ArrayList<>();
        List<Point[]> segments = new ArrayList<>();
        List<Integer> segmentNodes = new ArrayList<>();
        UnionFind uf = new UnionFind();

        Map<String, Component> owners = new HashMap<>();
        for (Component component : schematic.components()) {
            checkReferenceOwner(component, owners, issues);
            addComponentPins(component, nodes, uf, issues);
        }

        for (Wire wire : schematic.wires()) {
            if (wire.isBus() && !options.isIncludeBuses()) continue;
            List<Point> points = wire.getPoints();
            int previous = -1;
            for (int i = 0; i < points.size(); i++) {
                int id = addNode(nodes, uf, new Node(NodeKind.WIRE_VERTEX, points.get(i), null, null, wire, null, null));
                if (previous >= 0) {
                    uf.union(previous, id);
                    segments.add(new Point[]{points.get(i - 1), points.get(i)});
                    segmentNodes.add(id);
                }
                previous = id;
            }
        }

        for (Junction junction : schematic.junctions()) {
            addNode(nodes, uf, new Node(NodeKind.JUNCTION, junction.getPosition(), null, null, null, null, null));
        }

        for (Label label : schematic.labels()) {
            addNode(nodes, uf, new Node(NodeKind.LABEL, label.getPosition(), null, label.getText(), null, label, null));
        }

        for (Sheet sheet : schematic.sheets()) {
            String sheetId = sheetKey(sheet);
            for (SheetPin pin : sheet.getPins()) {
                addNode(nodes, uf, new Node(NodeKind.SHEET_PIN, pin.getPosition(), null, pin.getName(), null, null,
                        new SheetPinRef(sheetId, pin.getName())));
            }
        }

        SpatialIndex<Integer> index = new SpatialIndex<>();
        for (int id = 0; id < nodes.size(); id++) {
            index.insertPoint(nodes.get(id).position(), id);
        }
        for (int i = 0; i < segments.size(); i++) {
            index.insertSegment(segments.get(i)[0], segments.get(i)[1], segmentNodes.get(i));
        }
        for (int id = 0; id < nodes.size(); id++) {
            for (Integer other : index.query(nodes.get(id).position(), options.getTolerance())) {
                uf.union(id, other);
            }
        }

        joinByText(nodes, uf);

        State built = collectNets(nodes, uf, index, issues);
        log.debug("Built {} nets from {} nodes (revision {})", built.nets.size(), nodes.size(), built.revision);
        return built;
    }

    /**
     * Pins are looked up by reference, so a second component with the same reference and unit
     * is only reachable through the nets it joins.
     */
    private static void checkReferenceOwner(Component component, Map<String, Component> owners,
                                            List<ValidationIssue> issues) {
        if (component.isPowerSymbol()) return;
        String key = component.getReference() + "#" + component.getUnit();
        Component first = owners.putIfAbsent(key, component);
        if (first != null && first != component) {
            log.warn("Reference {} is used by components {} and {}", component.getReference(),
                    first.getUuid(), component.getUuid());
            issues.add(ValidationIssue.warning("Reference " + component.getReference()
                    + " is also used by component " + first.getUuid()
                    + ", pin lookups by reference return the first component's pins",
                    "component", component.getUuid()));
        }
    }

    private void addComponentPins(Component component, List<Node> nodes, UnionFind uf, List<ValidationIssue> issues) {
        SymbolDefinition definition;
        try {
            definition = resolver.resolve(component.getLibId());
        } catch (SymbolNotFoundException e) {
            log.warn("Leaving out the pins of {}: {}", component.getReference(), e.getMessage());
            issues.add(ValidationIssue.warning("Symbol " + component.getLibId() + " of " + component.getReference()
                    + " cannot be resolved, its pins are not connected", "component", component.getUuid()));
            return;
        }
        Map<String, Point> pins;
        try {
            pins = pinResolver.resolveAll(component, definition);
        } catch (IllegalArgumentException e) {
            issues.add(ValidationIssue.error(component.getReference() + ": " + e.getMessage(),
                    "component", component.getUuid()));
            return;
        }
        boolean power = component.isPowerSymbol() || definition.isPowerSymbol();
        for (Map.Entry<String, Point> pin : pins.entrySet()) {
            PinRef ref = new PinRef(component.getReference(), pin.getKey());
            Node node = power
                    ? new Node(NodeKind.POWER_PIN, pin.getValue(), ref, component.getValue(), null, null, null)
                    : new Node(NodeKind.PIN, pin.getValue(), ref, null, null, null, null);
            addNode(nodes, uf, node);
        }
    }

    private static int addNode(List<Node> nodes, UnionFind uf, Node node) {
        nodes.add(node);
        return uf.add();
    }

    private void joinByText(List<Node> nodes, UnionFind uf) {
        Map<String, Integer> local = new HashMap<>();
        Map<String, Integer> hierarchical = new HashMap<>();
        Map<String, Integer> global = new HashMap<>();
        for (int id = 0; id < nodes.size(); id++) {
            Node node = nodes.get(id);
            Map<String, Integer> group = null;
            if (node.kind() == NodeKind.POWER_PIN) {
                group = global;
            } else if (node.kind() == NodeKind.LABEL) {
                LabelType type = node.label().getType();
                if (type == LabelType.LOCAL) {
                    group = local;
                } else if (type == LabelType.HIERARCHICAL) {
                    group = hierarchical;
                } else if (options.isUnifyGlobalLabels()) {
                    group = global;
                }
            }
            if (group != null) {
                Integer first = group.putIfAbsent(node.text(), id);
                if (first != null) {
                    uf.union(first, id);
                }
            }
        }
    }

    private State collectNets(List<Node> nodes, UnionFind uf, SpatialIndex<Integer> index,
                              List<ValidationIssue> issues) {
        Map<Integer, List<Integer>> groups = new LinkedHashMap<>();
        for (int id = 0; id < nodes.size(); id++) {
            groups.computeIfAbsent(uf.find(id), k -> new ArrayList<>()).add(id);
        }

        Net[] netOfNode = new Net[nodes.size()];
        Point[] positions = new Point[nodes.size()];
        for (int id = 0; id < nodes.size(); id++) {
            positions[id] = nodes.get(id).position();
        }
        List<Net> nets = new ArrayList<>();
        for (List<Integer> members : groups.values()) {
            Net net = createNet(nodes, members);
            nets.add(net);
            for (Integer id : members) {
                netOfNode[id] = net;
            }
        }
        nets.sort(Comparator.comparing(Net::getName)
                .thenComparing(n -> n.getPins().isEmpty() ? "" : n.getPins().first().toString()));

        State s = new State(schematic.getRevision(), List.copyOf(nets), netOfNode, positions, index,
                List.copyOf(issues));
        for (Net net : s.nets) {
            s.byName.putIfAbsent(net.getName(), net);
            for (PinRef pin : net.getPins()) {
                s.byPin.putIfAbsent(pin, net);
            }
            for (SheetPinRef sheetPin : net.getSheetPins()) {
                s.bySheetPin.putIfAbsent(sheetPin, net);
            }
            for (String label : net.getHierarchicalLabels()) {
                s.byHierarchicalLabel.putIfAbsent(label, net);
            }
        }
        return s;
    }

    private static Net createNet(List<Node> nodes, List<Integer> members) {
        SortedSet<PinRef> pins = new TreeSet<>();
        SortedSet<PinRef> powerPins = new TreeSet<>();
        SortedSet<String> wires = new TreeSet<>();
        List<Point> junctions = new ArrayList<>();
        SortedSet<String> local = new TreeSet<>();
        SortedSet<String> hierarchical = new TreeSet<>();
        SortedSet<String> global = new TreeSet<>();
        SortedSet<SheetPinRef> sheetPins = new TreeSet<>();
        List<Point> points = new ArrayList<>();
        boolean power = false;

        for (Integer id : members) {
            Node node = nodes.get(id);
            points.add(node.position());
            switch (node.kind()) {
                case PIN -> pins.add(node.pin());
                case POWER_PIN -> {
                    powerPins.add(node.pin());
                    global.add(node.text());
                    power = true;
                }
                case WIRE_VERTEX -> {
                    if (node.wire().getUuid() != null) wires.add(node.wire().getUuid());
                }
                case JUNCTION -> junctions.add(node.position());
                case LABEL -> {
                    switch (node.label().getType()) {
                        case LOCAL -> local.add(node.text());
                        case GLOBAL -> global.add(node.text());
                        case HIERARCHICAL -> hierarchical.add(node.text());
                    }
                }
                case SHEET_PIN -> sheetPins.add(node.sheetPin());
            }
        }
        junctions.sort(Comparator.comparingDouble(Point::x).thenComparingDouble(Point::y));

        String name;
        if (!global.isEmpty()) {
            name = global.first();
        } else if (!local.isEmpty()) {
            name = local.first();
        } else if (!hierarchical.isEmpty()) {
            name = hierarchical.first();
        } else if (!pins.isEmpty()) {
            PinRef first = pins.first();
            name = "Net-(" + first.reference() + "-Pad" + first.pinNumber() + ")";
        } else if (!powerPins.isEmpty()) {
            PinRef first = powerPins.first();
            name = "Net-(" + first.reference() + "-Pad" + first.pinNumber() + ")";
        } else {
            Point anchor = points.stream()
                    .min(Comparator.comparingDouble(Point::x).thenComparingDouble(Point::y))
                    .orElse(new Point(0, 0));
            name = "Net-@(" + Atoms.formatNumber(anchor.x()) + "," + Atoms.formatNumber(anchor.y()) + ")";
        }
        return new Net(name, pins, wires, junctions, local, hierarchical, global, sheetPins, power);
    }

    private static final class State {
        final long revision;
        final List<Net> nets;
        final Net[] netOfNode;
        final Point[] positions;
        final SpatialIndex<Integer> index;
        final List<ValidationIssue> issues;
        final Map<String, Net> byName = new HashMap<>();
        final Map<PinRef, Net> byPin = new HashMap<>();
        final Map<SheetPinRef, Net> bySheetPin = new HashMap<>();
        final Map<String, Net> byHierarchicalLabel = new HashMap<>();

        State(long revision, List<Net> nets, Net[] netOfNode, Point[] positions, SpatialIndex<Integer> index,
              List<ValidationIssue> issues) {
            this.revision = revision;
            this.nets = nets;
            this.netOfNode = netOfNode;
            this.positions = positions;
            this.index = index;
            this.issues = issues;
        }
    }
}
