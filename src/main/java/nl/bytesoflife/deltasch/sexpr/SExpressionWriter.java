package nl.bytesoflife.deltasch.sexpr;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a document back into text.
 * <p>
 * In {@link FormatMode#PRESERVE} every captured gap and atom text is written unchanged, so a
 * document that was parsed and not modified comes out byte-identical. Gaps that were never
 * captured, because the list or child was created or inserted in memory, are computed from the
 * {@link FormattingRules}; indentation for those follows the indentation already used by
 * neighbouring lines.
 */
public class SExpressionWriter {

    private final FormatMode mode;
    private final FormattingRules rules;
    private String indentUnit;
    private String lineBreak = "\n";

    public SExpressionWriter() {
        this(FormatMode.PRESERVE, FormattingRules.kicad());
    }

    public SExpressionWriter(FormatMode mode, FormattingRules rules) {
        this.mode = mode;
        this.rules = rules;
    }

    public String write(SDocument document) {
        indentUnit = mode == FormatMode.PRESERVE ? inferIndent(document.root()) : rules.getIndent();
        lineBreak = inferLineBreak(document);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < document.nodes().size(); i++) {
            String gap = mode == FormatMode.PRESERVE ? document.gap(i) : null;
            if (gap == null) {
                gap = i == 0 ? "" : (mode == FormatMode.COMPACT ? " " : lineBreak);
            }
            sb.append(gap);
            writeNode(document.nodes().get(i), 0, sb);
        }
        String trailing = mode == FormatMode.PRESERVE ? document.trailing() : null;
        sb.append(trailing != null ? trailing : lineBreak);
        return sb.toString();
    }

    /**
     * Writes a single node as if it were at the top of a document.
     */
    public String write(SNode node) {
        indentUnit = rules.getIndent();
        lineBreak = "\n";
        StringBuilder sb = new StringBuilder();
        writeNode(node, 0, sb);
        return sb.toString();
    }

    private void writeNode(SNode node, int depth, StringBuilder sb) {
        if (node instanceof SNode.SList list) {
            writeList(list, depth, sb);
        } else if (node instanceof SNode.SAtom atom) {
            sb.append(Atoms.text(atom, rules.getDecimals()));
        }
    }

    private void writeList(SNode.SList list, int depth, StringBuilder sb) {
        FormattingRules.Layout layout = rules.layout(list.tag());
        sb.append('(');
        boolean brokeLine = false;
        boolean sawList = false;
        for (int i = 0; i < list.size(); i++) {
            SNode child = list.get(i);
            String gap = mode == FormatMode.PRESERVE ? list.gap(i) : null;
            if (gap == null) {
                gap = computeGap(list, i, depth, layout, sawList);
                brokeLine |= gap.indexOf('\n') >= 0;
            }
            sb.append(gap);
            writeNode(child, depth + 1, sb);
            sawList |= child instanceof SNode.SList;
        }
        String closing = mode == FormatMode.PRESERVE ? list.closingGap() : null;
        if (closing == null || (brokeLine && closing.indexOf('\n') < 0)) {
            closing = computeClosing(list, depth, layout);
        }
        sb.append(closing).append(')');
    }

    private String computeGap(SNode.SList list, int index, int depth, FormattingRules.Layout layout,
                              boolean sawList) {
        if (index == 0) return "";
        if (mode == FormatMode.COMPACT) return " ";
        SNode child = list.get(index);
        boolean newLine = switch (layout) {
            case INLINE -> false;
            case POINTS -> index == 1;
            case BLOCK -> child instanceof SNode.SList || sawList;
        };
        if (!newLine) return " ";
        if (mode == FormatMode.PRESERVE) {
            String sibling = siblingIndent(list, index);
            if (sibling != null) return sibling;
        }
        return lineBreak + indent(depth + 1);
    }

    private String computeClosing(SNode.SList list, int depth, FormattingRules.Layout layout) {
        if (mode == FormatMode.COMPACT) return "";
        boolean broken = switch (layout) {
            case INLINE -> false;
            case POINTS -> list.size() > 1;
            case BLOCK -> hasListChild(list);
        };
        return broken ? lineBreak + indent(depth) : "";
    }

    private static boolean hasListChild(SNode.SList list) {
        for (SNode child : list.children()) {
            if (child instanceof SNode.SList) return true;
        }
        return false;
    }

    /**
     * Line break plus the indentation of the nearest captured sibling line, preferring earlier
     * siblings.
     */
    private String siblingIndent(SNode.SList list, int index) {
        for (int i = index - 1; i >= 1; i--) {
            String indent = lineIndent(list.gap(i));
            if (indent != null) return indent;
        }
        for (int i = index + 1; i < list.size(); i++) {
            String indent = lineIndent(list.gap(i));
            if (indent != null) return indent;
        }
        return null;
    }

    private String lineIndent(String gap) {
        if (gap == null) return null;
        int newline = gap.lastIndexOf('\n');
        if (newline < 0) return null;
        return lineBreak + gap.substring(newline + 1);
    }

    /**
     * {@code "\r\n"} when the first captured line break of the document is one, else {@code "\n"}.
     */
    private static String inferLineBreak(SDocument document) {
        List<String> gaps = new ArrayList<>();
        for (int i = 0; i < document.nodes().size(); i++) {
            gaps.add(document.gap(i));
        }
        SNode.SList root = document.root();
        if (root != null) {
            for (int i = 0; i < root.size(); i++) {
                gaps.add(root.gap(i));
            }
            gaps.add(root.closingGap());
        }
        gaps.add(document.trailing());
        for (String gap : gaps) {
            if (gap == null) continue;
            int newline = gap.indexOf('\n');
            if (newline >= 0) {
                return newline > 0 && gap.charAt(newline - 1) == '\r' ? "\r\n" : "\n";
            }
        }
        return "\n";
    }

    private String inferIndent(SNode.SList root) {
        if (root != null) {
            for (int i = 1; i < root.size(); i++) {
                String gap = root.gap(i);
                if (gap == null) continue;
                int newline = gap.lastIndexOf('\n');
                if (newline >= 0 && newline < gap.length() - 1) {
                    return gap.substring(newline + 1);
                }
            }
        }
        return rules.getIndent();
    }

    private String indent(int depth) {
        return indentUnit.repeat(Math.max(0, depth));
    }
}
