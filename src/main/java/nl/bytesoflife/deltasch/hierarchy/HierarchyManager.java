package nl.bytesoflife.deltasch.hierarchy;

import nl.bytesoflife.deltasch.connectivity.ConnectivityAnalyzer;
import nl.bytesoflife.deltasch.connectivity.Net;
import nl.bytesoflife.deltasch.connectivity.SheetPinRef;
import nl.bytesoflife.deltasch.connectivity.UnionFind;
import nl.bytesoflife.deltasch.model.Component;
import nl.bytesoflife.deltasch.model.Label;
import nl.bytesoflife.deltasch.model.LabelType;
import nl.bytesoflife.deltasch.model.Schematic;
import nl.bytesoflife.deltasch.model.Sheet;
import nl.bytesoflife.deltasch.model.SheetPin;
import nl.bytesoflife.deltasch.model.Wire;
import nl.bytesoflife.deltasch.symbol.CompositeSymbolResolver;
import nl.bytesoflife.deltasch.symbol.EmbeddedSymbolResolver;
import nl.bytesoflife.deltasch.validation.ValidationIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds and inspects sheet hierarchies.
 * <p>
 * {@link #build} walks the sheets of a root schematic through a {@link SchematicLoader} into a
 * {@link HierarchyTree}. The other operations work on a built tree: binding checks between sheet
 * pins and hierarchical labels, reuse detection, flattening, signal tracing and nets that cross
 * sheets.
 */
public class HierarchyManager {

    private static final Logger log = LoggerFactory.getLogger(HierarchyManager.class);

    private final SchematicLoader loader;
    private final HierarchyOptions options;

    public HierarchyManager(SchematicLoader loader, HierarchyOptions options) {
        this.loader = loader;
        this.options = options;
    }

    public HierarchyManager(SchematicLoader loader) {
        this(loader, HierarchyOptions.defaults());
    }

    /**
     * Resolves all sheets below {@code root}. Files that fail to load and sheets that would
     * include one of their own ancestors become nodes without a schematic plus an issue on the
     * tree; their siblings are still built.
     */
    public HierarchyTree build(Schematic root, String rootFilename) {
        HierarchyTree tree = new HierarchyTree();
        String rootKey = loader.identify(rootFilename, null);
        HierarchyNode rootNode = tree.addNode(-1, "/", "/" + root.getUuid(), rootFilename, rootKey, null);
        rootNode.setSchematic(root);

        List<String> ancestors = new ArrayList<>();
        ancestors.add(rootKey);
        expand(tree, rootNode, ancestors);

        log.info("Built hierarchy of {} sheets from {} ({} issues)", tree.size(), rootFilename,
                tree.getIssues().size());
        return tree;
    }

    private void expand(HierarchyTree tree, HierarchyNode node, List<String> ancestors) {
        Schematic schematic = node.getSchematic().orElseThrow();
        for (Sheet sheet : schematic.sheets()) {
            String path = node.getPath() + sheet.getName() + "/";
            if (tree.hasPath(path)) {
                path = node.getPath() + sheet.getName() + "[" + sheet.getUuid() + "]/";
            }
            String uuidPath = node.getUuidPath() + "/" + sheet.getUuid();
            SheetInstance instance = new SheetInstance(sheet, path, uuidPath, node.getPath());
            String filename = sheet.getFilename();

            if (filename == null || filename.isBlank()) {
                HierarchyNode child = tree.addNode(node.getIndex(), path, uuidPath, "", "", instance);
                refuse(tree, child, "Sheet " + path + " has no file name");
                continue;
            }

            String key = loader.identify(filename, schematic);
            HierarchyNode child = tree.addNode(node.getIndex(), path, uuidPath, filename, key, instance);
            if (ancestors.contains(key)) {
                refuse(tree, child, "Sheet " + path + " refers to " + filename
                        + " which already contains it; the cycle is not followed");
                continue;
            }

            try {
                child.setSchematic(loader.load(filename, schematic));
            } catch (LoadException e) {
                log.warn("Cannot load sheet {} ({}): {}", path, filename, e.getMessage());
                refuse(tree, child, "Sheet " + path + " cannot be loaded: " + e.getMessage());
                continue;
            }
            ancestors.add(key);
            expand(tree, child, ancestors);
            ancestors.remove(ancestors.size() - 1);
        }
    }

    private static void refuse(HierarchyTree tree, HierarchyNode node, String message) {
        node.setError(message);
        Sheet sheet = node.getInstance().getSheet();
        tree.addIssue(ValidationIssue.error(message, "sheet", sheet.getUuid()).atPath(node.getPath()));
    }

    /**
     * Issues of the tree itself plus the pin bindings of every loaded sheet instance: each sheet
     * pin needs exactly one hierarchical label of its name with a compatible direction, and each
     * hierarchical label should have a sheet pin.
     */
    public List<ValidationIssue> validate(HierarchyTree tree) {
        List<ValidationIssue> issues = new ArrayList<>(tree.getIssues());
        for (HierarchyNode node : tree.getNodes()) {
            if (node.isRoot() || !node.isLoaded()) continue;
            Sheet sheet = node.getInstance().getSheet();
            Schematic child = node.getSchematic().orElseThrow();

            Map<String, List<Label>> labels = new LinkedHashMap<>();
            for (Label label : child.labels().byType(LabelType.HIERARCHICAL)) {
                labels.computeIfAbsent(label.getText(), k -> new ArrayList<>()).add(label);
            }

            Set<String> pinNames = new HashSet<>();
            for (SheetPin pin : sheet.getPins()) {
                pinNames.add(pin.getName());
                List<Label> matches = labels.getOrDefault(pin.getName(), List.of());
                if (matches.isEmpty()) {
                    issues.add(ValidationIssue.error("Sheet pin '" + pin.getName() + "' of sheet " + node.getPath()
                                    + " has no hierarchical label in " + node.getFilename(),
                            "sheet_pin", pin.getUuid()).atPath(node.getPath()));
                } else if (matches.size() > 1) {
                    issues.add(ValidationIssue.error("Sheet pin '" + pin.getName() + "' of sheet " + node.getPath()
                                    + " matches " + matches.size() + " hierarchical labels in " + node.getFilename(),
                            "sheet_pin", pin.getUuid()).atPath(node.getPath()));
                } else {
                    Label label = matches.get(0);
                    if (!options.getDirectionPolicy().isCompatible(pin.getShape(), label.getShape())) {
                        issues.add(ValidationIssue.error("Sheet pin '" + pin.getName() + "' of sheet "
                                        + node.getPath() + " is " + pin.getShape().kicadName()
                                        + " but its hierarchical label is " + label.getShape().kicadName(),
                                "sheet_pin", pin.getUuid()).atPath(node.getPath()));
                    }
                }
            }

            for (Map.Entry<String, List<Label>> entry : labels.entrySet()) {
                if (!pinNames.contains(entry.getKey())) {
                    issues.add(ValidationIssue.warning("Hierarchical label '" + entry.getKey() + "' in "
                                    + node.getFilename() + " has no pin on sheet " + node.getPath(),
                            "hierarchical_label", entry.getValue().get(0).getUuid()).atPath(node.getPath()));
                }
            }
        }
        log.debug("Hierarchy validation found {} issues", issues.size());
        return issues;
    }

    /**
     * Files placed by more than one sheet, keyed by the file name of their first placement.
     */
    public Map<String, List<SheetInstance>> findReusedSheets(HierarchyTree tree) {
        Map<String, List<SheetInstance>> byKey = new LinkedHashMap<>();
        for (HierarchyNode node : tree.getNodes()) {
            if (node.isRoot() || node.getFileKey().isEmpty()) continue;
            byKey.computeIfAbsent(node.getFileKey(), k -> new ArrayList<>()).add(node.getInstance());
        }
        Map<String, List<SheetInstance>> reused = new LinkedHashMap<>();
        for (List<SheetInstance> instances : byKey.values()) {
            if (instances.size() > 1) {
                reused.put(instances.get(0).getFilename(), List.copyOf(instances));
            }
        }
        return reused;
    }

    /**
     * Lists the components, wires and labels of every loaded instance. With
     * {@code prefixReferences} a component below the root gets its sheet path in front of its
     * reference, e.g. {@code Power/R1}.
     */
    public FlattenedSchematic flatten(HierarchyTree tree, boolean prefixReferences) {
        FlattenedSchematic flat = new FlattenedSchematic();
        for (HierarchyNode node : tree.getNodes()) {
            Optional<Schematic> schematic = node.getSchematic();
            if (schematic.isEmpty()) continue;
            String prefix = node.isRoot() ? "" : node.getPath().substring(1);
            for (Component component : schematic.get().components()) {
                String reference = component.getInstanceReference(node.getUuidPath());
                flat.addComponent(node.getPath(), prefixReferences ? prefix + reference : reference,
                        reference, component);
            }
            for (Wire wire : schematic.get().wires()) {
                flat.addWire(node.getPath(), wire);
            }
            for (Label label : schematic.get().labels()) {
                flat.addLabel(node.getPath(), label);
            }
        }
        log.debug("Flattened {} sheets into {} components", tree.size(), flat.getComponents().size());
        return flat;
    }

    /**
     * Follows the net named {@code netName} in the sheet at {@code startPath} down through sheet
     * pins and up through hierarchical labels. The trace is empty when the net does not exist
     * there.
     *
     * @throws IllegalArgumentException if no sheet has the path
     */
    public SignalTrace traceSignal(HierarchyTree tree, String netName, String startPath) {
        HierarchyNode start = tree.getNode(startPath)
                .orElseThrow(() -> new IllegalArgumentException("No sheet at path " + startPath));
        SignalTrace trace = new SignalTrace(netName, startPath);
        Map<Schematic, ConnectivityAnalyzer> analyzers = new IdentityHashMap<>();
        if (!start.isLoaded()) return trace;

        Optional<Net> first = analyzer(analyzers, start).getNet(netName);
        if (first.isEmpty()) return trace;

        record Visit(HierarchyNode node, Net net) {}
        Deque<Visit> queue = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        queue.add(new Visit(start, first.get()));
        visited.add(start.getPath() + "\n" + first.get().getName());
        trace.addStep(new SignalTrace.Step(start.getPath(), first.get().getName(), "start"));

        while (!queue.isEmpty()) {
            Visit visit = queue.poll();
            HierarchyNode node = visit.node();

            for (SheetPinRef sheetPin : visit.net().getSheetPins()) {
                for (HierarchyNode child : tree.getChildren(node)) {
                    if (!child.isLoaded()
                            || !ConnectivityAnalyzer.sheetKey(child.getInstance().getSheet()).equals(sheetPin.sheetUuid())) {
                        continue;
                    }
                    Optional<Net> inner = analyzer(analyzers, child).netForHierarchicalLabel(sheetPin.pinName());
                    if (inner.isPresent() && visited.add(child.getPath() + "\n" + inner.get().getName())) {
                        queue.add(new Visit(child, inner.get()));
                        trace.addStep(new SignalTrace.Step(child.getPath(), inner.get().getName(),
                                "sheet pin " + sheetPin.pinName()));
                    }
                }
            }

            Optional<HierarchyNode> parent = tree.getParent(node);
            if (parent.isEmpty() || !parent.get().isLoaded()) continue;
            String sheetKey = ConnectivityAnalyzer.sheetKey(node.getInstance().getSheet());
            for (String label : visit.net().getHierarchicalLabels()) {
                Optional<Net> outer = analyzer(analyzers, parent.get()).netForSheetPin(sheetKey, label);
                if (outer.isPresent() && visited.add(parent.get().getPath() + "\n" + outer.get().getName())) {
                    queue.add(new Visit(parent.get(), outer.get()));
                    trace.addStep(new SignalTrace.Step(parent.get().getPath(), outer.get().getName(),
                            "hierarchical label " + label));
                }
            }
        }
        return trace;
    }

    /**
     * Nets of all loaded instances joined across sheet pin to hierarchical label bridges, and
     * across global labels when global label unification is on. Sorted by name.
     */
    public List<HierarchicalNet> hierarchicalNets(HierarchyTree tree) {
        Map<Schematic, ConnectivityAnalyzer> analyzers = new IdentityHashMap<>();
        List<HierarchicalNet.Member> members = new ArrayList<>();
        Map<Integer, Map<Net, Integer>> memberIds = new HashMap<>();
        UnionFind uf = new UnionFind();

        for (HierarchyNode node : tree.getNodes()) {
            if (!node.isLoaded()) continue;
            Map<Net, Integer> ids = new IdentityHashMap<>();
            for (Net net : analyzer(analyzers, node).getNets()) {
                ids.put(net, uf.add());
                members.add(new HierarchicalNet.Member(node.getPath(), node.getDepth(), net));
            }
            memberIds.put(node.getIndex(), ids);
        }

        for (HierarchyNode node : tree.getNodes()) {
            if (node.isRoot() || !node.isLoaded()) continue;
            HierarchyNode parent = tree.getNode(node.getParentIndex());
            Sheet sheet = node.getInstance().getSheet();
            String sheetKey = ConnectivityAnalyzer.sheetKey(sheet);
            for (SheetPin pin : sheet.getPins()) {
                Optional<Net> outer = analyzer(analyzers, parent).netForSheetPin(sheetKey, pin.getName());
                Optional<Net> inner = analyzer(analyzers, node).netForHierarchicalLabel(pin.getName());
                if (outer.isPresent() && inner.isPresent()) {
                    uf.union(memberIds.get(parent.getIndex()).get(outer.get()),
                            memberIds.get(node.getIndex()).get(inner.get()));
                }
            }
        }

        if (options.getConnectivity().isUnifyGlobalLabels()) {
            Map<String, Integer> firstByGlobal = new HashMap<>();
            for (int id = 0; id < members.size(); id++) {
                for (String global : members.get(id).net().getGlobalLabels()) {
                    Integer first = firstByGlobal.putIfAbsent(global, id);
                    if (first != null) {
                        uf.union(first, id);
                    }
                }
            }
        }

        Map<Integer, List<HierarchicalNet.Member>> groups = new LinkedHashMap<>();
        for (int id = 0; id < members.size(); id++) {
            groups.computeIfAbsent(uf.find(id), k -> new ArrayList<>()).add(members.get(id));
        }
        List<HierarchicalNet> nets = new ArrayList<>();
        for (List<HierarchicalNet.Member> group : groups.values()) {
            group.sort(Comparator.comparingInt(HierarchicalNet.Member::depth)
                    .thenComparing(HierarchicalNet.Member::path));
            nets.add(new HierarchicalNet(hierarchicalName(group), group));
        }
        nets.sort(Comparator.comparing(HierarchicalNet::getName));
        log.debug("Found {} hierarchical nets over {} sheets", nets.size(), tree.size());
        return nets;
    }

    private static String hierarchicalName(List<HierarchicalNet.Member> group) {
        TreeSet<String> globals = new TreeSet<>();
        for (HierarchicalNet.Member member : group) {
            globals.addAll(member.net().getGlobalLabels());
        }
        if (!globals.isEmpty()) {
            return globals.first();
        }
        HierarchicalNet.Member top = group.get(0);
        return top.path() + top.net().getName();
    }

    /**
     * Indented text tree of the hierarchy, one line per sheet instance.
     */
    public String render(HierarchyTree tree, boolean withCounts) {
        StringBuilder sb = new StringBuilder();
        for (HierarchyNode node : tree.getNodes()) {
            sb.append("  ".repeat(node.getDepth()));
            sb.append(node.isRoot() ? "/" : node.getInstance().getSheetName());
            sb.append(" (").append(node.getFilename()).append(')');
            if (withCounts && node.isLoaded()) {
                Schematic schematic = node.getSchematic().orElseThrow();
                sb.append(": ").append(schematic.components().size()).append(" components, ")
                        .append(schematic.wires().size()).append(" wires, ")
                        .append(schematic.labels().size()).append(" labels, ")
                        .append(schematic.sheets().size()).append(" sheets");
            }
            if (node.getError() != null) {
                sb.append(" [").append(node.getError()).append(']');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private ConnectivityAnalyzer analyzer(Map<Schematic, ConnectivityAnalyzer> analyzers, HierarchyNode node) {
        Schematic schematic = node.getSchematic().orElseThrow();
        return analyzers.computeIfAbsent(schematic, s -> new ConnectivityAnalyzer(s,
                new CompositeSymbolResolver(new EmbeddedSymbolResolver(s), options.getLibraryResolver()),
                options.getConnectivity()));
    }
}
