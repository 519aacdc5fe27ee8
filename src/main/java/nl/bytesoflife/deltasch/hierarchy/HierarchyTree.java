package nl.bytesoflife.deltasch.hierarchy;

import nl.bytesoflife.deltasch.validation.ValidationIssue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sheet hierarchy stored as a flat list of nodes in depth-first order, addressed by index or by
 * instance path.
 */
public class HierarchyTree {

    private final List<HierarchyNode> nodes = new ArrayList<>();
    private final Map<String, Integer> byPath = new HashMap<>();
    private final List<ValidationIssue> issues = new ArrayList<>();

    HierarchyNode addNode(int parentIndex, String path, String uuidPath, String filename, String fileKey,
                          SheetInstance instance) {
        int depth = parentIndex < 0 ? 0 : nodes.get(parentIndex).getDepth() + 1;
        HierarchyNode node = new HierarchyNode(nodes.size(), parentIndex, depth, path, uuidPath, filename,
                fileKey, instance);
        nodes.add(node);
        byPath.put(path, node.getIndex());
        if (parentIndex >= 0) {
            nodes.get(parentIndex).addChild(node.getIndex());
        }
        return node;
    }

    void addIssue(ValidationIssue issue) {
        issues.add(issue);
    }

    boolean hasPath(String path) {
        return byPath.containsKey(path);
    }

    public HierarchyNode getRoot() {
        return nodes.get(0);
    }

    public List<HierarchyNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public HierarchyNode getNode(int index) {
        return nodes.get(index);
    }

    public Optional<HierarchyNode> getNode(String path) {
        Integer index = byPath.get(path);
        return index == null ? Optional.empty() : Optional.of(nodes.get(index));
    }

    public Optional<HierarchyNode> getParent(HierarchyNode node) {
        return node.isRoot() ? Optional.empty() : Optional.of(nodes.get(node.getParentIndex()));
    }

    public List<HierarchyNode> getChildren(HierarchyNode node) {
        List<HierarchyNode> children = new ArrayList<>();
        for (Integer index : node.getChildren()) {
            children.add(nodes.get(index));
        }
        return children;
    }

    /**
     * All sheet instances, root excluded, in depth-first order.
     */
    public List<SheetInstance> getInstances() {
        List<SheetInstance> instances = new ArrayList<>();
        for (HierarchyNode node : nodes) {
            if (node.getInstance() != null) {
                instances.add(node.getInstance());
            }
        }
        return instances;
    }

    /**
     * Problems met while building: unreadable files and refused cycles.
     */
    public List<ValidationIssue> getIssues() {
        return Collections.unmodifiableList(issues);
    }

    public int size() {
        return nodes.size();
    }

    public int getMaxDepth() {
        int max = 0;
        for (HierarchyNode node : nodes) {
            max = Math.max(max, node.getDepth());
        }
        return max;
    }
}
