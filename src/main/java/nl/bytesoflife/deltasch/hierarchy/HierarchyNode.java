package nl.bytesoflife.deltasch.hierarchy;

import nl.bytesoflife.deltasch.model.Schematic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Entry of a {@link HierarchyTree}. Parent and children are indexes into the tree.
 */
public class HierarchyNode {

    private final int index;
    private final int parentIndex;
    private final int depth;
    private final String path;
    private final String uuidPath;
    private final String filename;
    private final String fileKey;
    private final SheetInstance instance;
    private final List<Integer> children = new ArrayList<>();
    private Schematic schematic;
    private String error;

    HierarchyNode(int index, int parentIndex, int depth, String path, String uuidPath, String filename,
                  String fileKey, SheetInstance instance) {
        this.index = index;
        this.parentIndex = parentIndex;
        this.depth = depth;
        this.path = path;
        this.uuidPath = uuidPath;
        this.filename = filename;
        this.fileKey = fileKey;
        this.instance = instance;
    }

    public int getIndex() {
        return index;
    }

    public int getParentIndex() {
        return parentIndex;
    }

    public boolean isRoot() {
        return parentIndex < 0;
    }

    public int getDepth() {
        return depth;
    }

    public String getPath() {
        return path;
    }

    public String getUuidPath() {
        return uuidPath;
    }

    public String getFilename() {
        return filename;
    }

    public String getFileKey() {
        return fileKey;
    }

    public SheetInstance getInstance() {
        return instance;
    }

    public List<Integer> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public Optional<Schematic> getSchematic() {
        return Optional.ofNullable(schematic);
    }

    public boolean isLoaded() {
        return schematic != null;
    }

    /**
     * Why the schematic is missing: a load failure or a refused cycle.
     */
    public String getError() {
        return error;
    }

    void addChild(int childIndex) {
        children.add(childIndex);
    }

    void setSchematic(Schematic schematic) {
        this.schematic = schematic;
    }

    void setError(String error) {
        this.error = error;
    }

    @Override
    public String toString() {
        return path + " [" + filename + "]" + (error != null ? " (" + error + ")" : "");
    }
}
