package nl.bytesoflife.deltasch.sexpr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Top-level nodes of a parsed text together with the text between them.
 */
public final class SDocument {

    private final List<SNode> nodes;
    private final List<String> gaps;
    private final String trailing;

    public SDocument(List<SNode> nodes, List<String> gaps, String trailing) {
        this.nodes = new ArrayList<>(nodes);
        this.gaps = new ArrayList<>(gaps);
        this.trailing = trailing;
    }

    public static SDocument of(SNode.SList root) {
        List<String> gaps = new ArrayList<>();
        gaps.add(null);
        return new SDocument(List.of(root), gaps, null);
    }

    public List<SNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    /**
     * Text before the node at {@code index}, {@code null} for nodes that were not parsed.
     */
    public String gap(int index) {
        return gaps.get(index);
    }

    /**
     * Text after the last node, {@code null} for documents that were not parsed.
     */
    public String trailing() {
        return trailing;
    }

    public SNode.SList root() {
        for (SNode node : nodes) {
            if (node instanceof SNode.SList list) {
                return list;
            }
        }
        return null;
    }
}
