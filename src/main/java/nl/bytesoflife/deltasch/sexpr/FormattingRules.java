package nl.bytesoflife.deltasch.sexpr;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Layout rules for lists that have no captured formatting, keyed by list tag.
 * <p>
 * The defaults reproduce KiCad 8: tab indentation, atoms on the opening line, every child list
 * on a line of its own and the closing parenthesis on its own line when the list broke.
 */
public final class FormattingRules {

    public enum Layout {
        /** Atoms on the opening line, child lists one per line. */
        BLOCK,
        /** Everything on one line. */
        INLINE,
        /** Children on one indented line, as in {@code pts}. */
        POINTS
    }

    private static final Map<String, Layout> KICAD_LAYOUTS = Map.ofEntries(
            Map.entry("pts", Layout.POINTS),
            Map.entry("xy", Layout.INLINE),
            Map.entry("at", Layout.INLINE),
            Map.entry("size", Layout.INLINE),
            Map.entry("color", Layout.INLINE),
            Map.entry("start", Layout.INLINE),
            Map.entry("mid", Layout.INLINE),
            Map.entry("end", Layout.INLINE),
            Map.entry("center", Layout.INLINE),
            Map.entry("offset", Layout.INLINE)
    );

    private static final Set<String> TRAILING_TAGS = Set.of(
            "sheet_instances", "symbol_instances", "embedded_fonts", "embedded_files");

    private final Map<String, Layout> layouts;
    private String indent = "\t";
    private int decimals = Atoms.DEFAULT_DECIMALS;

    private FormattingRules(Map<String, Layout> layouts) {
        this.layouts = new HashMap<>(layouts);
    }

    public static FormattingRules kicad() {
        return new FormattingRules(KICAD_LAYOUTS);
    }

    public FormattingRules withLayout(String tag, Layout layout) {
        layouts.put(tag, layout);
        return this;
    }

    public FormattingRules withIndent(String indent) {
        this.indent = indent;
        return this;
    }

    public FormattingRules withDecimals(int decimals) {
        if (decimals < 0) {
            throw new IllegalArgumentException("decimals must not be negative: " + decimals);
        }
        this.decimals = decimals;
        return this;
    }

    public Layout layout(String tag) {
        return layouts.getOrDefault(tag, Layout.BLOCK);
    }

    public String getIndent() {
        return indent;
    }

    public int getDecimals() {
        return decimals;
    }

    /**
     * Position at which a new top-level list with the given tag goes: after the last sibling
     * with the same tag, otherwise before the trailing instance and font sections, otherwise at
     * the end.
     */
    public static int insertionIndex(SNode.SList root, String tag) {
        int lastSame = -1;
        int firstTrailing = -1;
        for (int i = 1; i < root.size(); i++) {
            if (root.get(i) instanceof SNode.SList list) {
                if (list.hasTag(tag)) {
                    lastSame = i;
                } else if (firstTrailing < 0 && TRAILING_TAGS.contains(list.tag())) {
                    firstTrailing = i;
                }
            }
        }
        if (lastSame >= 0) return lastSame + 1;
        if (firstTrailing >= 0) return firstTrailing;
        return root.size();
    }
}
