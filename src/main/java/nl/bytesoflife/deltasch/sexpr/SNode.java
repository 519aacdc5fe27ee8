package nl.bytesoflife.deltasch.sexpr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Node of a parsed S-expression document.
 * <p>
 * Atoms keep the exact lexical text they were read from, lists keep the whitespace found before
 * each child and before the closing parenthesis. Together that is enough to reproduce the source
 * text byte-for-byte for everything that was not touched after parsing.
 */
public sealed interface SNode permits SNode.SAtom, SNode.SList {

    int line();

    int column();

    /**
     * Compares type and value recursively, ignoring lexical text and whitespace.
     */
    boolean sameStructure(SNode other);

    record SAtom(AtomType type, String value, String raw, int line, int column) implements SNode {

        public SAtom {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(value, "value");
        }

        public static SAtom symbol(String value) {
            return new SAtom(AtomType.SYMBOL, value, null, 0, 0);
        }

        public static SAtom string(String value) {
            return new SAtom(AtomType.STRING, value, null, 0, 0);
        }

        public static SAtom number(double value) {
            String text = Atoms.formatNumber(value);
            AtomType type = text.indexOf('.') >= 0 ? AtomType.FLOAT : AtomType.INTEGER;
            return new SAtom(type, text, null, 0, 0);
        }

        public static SAtom integer(long value) {
            return new SAtom(AtomType.INTEGER, Long.toString(value), null, 0, 0);
        }

        public static SAtom bool(boolean value) {
            return symbol(value ? "yes" : "no");
        }

        public boolean hasRaw() {
            return raw != null;
        }

        public double asDouble() {
            return Double.parseDouble(value);
        }

        public int asInt() {
            if (type == AtomType.FLOAT) {
                return (int) Math.round(asDouble());
            }
            return Integer.parseInt(value);
        }

        public boolean isNumber() {
            return type.isNumeric();
        }

        @Override
        public boolean sameStructure(SNode other) {
            if (!(other instanceof SAtom atom)) return false;
            if (type.isNumeric() && atom.type.isNumeric()) {
                return Double.compare(asDouble(), atom.asDouble()) == 0;
            }
            return type == atom.type && value.equals(atom.value);
        }

        @Override
        public String toString() {
            return value;
        }
    }

    /**
     * List node. Mutations mark the list as modified and drop the captured gap of the touched
     * position so the writer lays it out with the formatting rules instead.
     */
    final class SList implements SNode {

        private final List<SNode> children;
        private final List<String> gaps;
        private String closingGap;
        private final int line;
        private final int column;
        private boolean modified;

        public SList(List<SNode> children) {
            this(children, null, null, 0, 0);
        }

        SList(List<SNode> children, List<String> gaps, String closingGap, int line, int column) {
            this.children = new ArrayList<>(children);
            this.gaps = new ArrayList<>(children.size());
            for (int i = 0; i < children.size(); i++) {
                this.gaps.add(gaps != null ? gaps.get(i) : null);
            }
            this.closingGap = closingGap;
            this.line = line;
            this.column = column;
        }

        public static SList of(String tag, SNode... items) {
            List<SNode> nodes = new ArrayList<>(items.length + 1);
            nodes.add(SAtom.symbol(tag));
            Collections.addAll(nodes, items);
            return new SList(nodes);
        }

        public List<SNode> children() {
            return Collections.unmodifiableList(children);
        }

        public int size() {
            return children.size();
        }

        public SNode get(int index) {
            return children.get(index);
        }

        public String tag() {
            if (children.isEmpty()) return "";
            if (children.get(0) instanceof SAtom atom) {
                return atom.value();
            }
            return "";
        }

        public boolean hasTag(String tag) {
            return tag.equals(tag());
        }

        public String value(int index) {
            if (index >= children.size()) return null;
            if (children.get(index) instanceof SAtom atom) {
                return atom.value();
            }
            return null;
        }

        public SAtom atom(int index) {
            if (index >= children.size()) return null;
            if (children.get(index) instanceof SAtom atom) {
                return atom;
            }
            return null;
        }

        public double number(int index, double defaultValue) {
            SAtom atom = atom(index);
            if (atom == null || !atom.isNumber()) return defaultValue;
            return atom.asDouble();
        }

        public SList find(String tag) {
            for (SNode child : children) {
                if (child instanceof SList list && list.hasTag(tag)) {
                    return list;
                }
            }
            return null;
        }

        public List<SList> findAll(String tag) {
            List<SList> result = new ArrayList<>();
            for (SNode child : children) {
                if (child instanceof SList list && list.hasTag(tag)) {
                    result.add(list);
                }
            }
            return result;
        }

        public List<SList> lists() {
            List<SList> result = new ArrayList<>();
            for (SNode child : children) {
                if (child instanceof SList list) {
                    result.add(list);
                }
            }
            return result;
        }

        public boolean hasSymbol(String symbol) {
            for (int i = 1; i < children.size(); i++) {
                if (children.get(i) instanceof SAtom atom
                        && atom.type() == AtomType.SYMBOL && atom.value().equals(symbol)) {
                    return true;
                }
            }
            return false;
        }

        public int indexOf(SNode child) {
            for (int i = 0; i < children.size(); i++) {
                if (children.get(i) == child) return i;
            }
            return -1;
        }

        public void add(SNode child) {
            children.add(child);
            gaps.add(null);
            modified = true;
        }

        public void insert(int index, SNode child) {
            children.add(index, child);
            gaps.add(index, null);
            modified = true;
        }

        /**
         * Replaces a child. The captured gap in front of it is kept: the position in the text
         * does not move, only the node itself is regenerated.
         */
        public void set(int index, SNode child) {
            children.set(index, child);
            modified = true;
        }

        public SNode remove(int index) {
            gaps.remove(index);
            modified = true;
            return children.remove(index);
        }

        public boolean remove(SNode child) {
            int index = indexOf(child);
            if (index < 0) return false;
            remove(index);
            return true;
        }

        public void put(SList child) {
            for (int i = 0; i < children.size(); i++) {
                if (children.get(i) instanceof SList list && list.hasTag(child.tag())) {
                    set(i, child);
                    return;
                }
            }
            add(child);
        }

        public boolean removeAll(String tag) {
            boolean removed = false;
            for (int i = children.size() - 1; i >= 0; i--) {
                if (children.get(i) instanceof SList list && list.hasTag(tag)) {
                    remove(i);
                    removed = true;
                }
            }
            return removed;
        }

        public String gap(int index) {
            return gaps.get(index);
        }

        public String closingGap() {
            return closingGap;
        }

        public boolean isModified() {
            return modified;
        }

        public void markModified() {
            modified = true;
        }

        /**
         * Drops all captured whitespace below this list, so it is laid out from scratch.
         */
        public void clearFormatting() {
            Collections.fill(gaps, null);
            closingGap = null;
            modified = true;
            for (SNode child : children) {
                if (child instanceof SList list) {
                    list.clearFormatting();
                }
            }
        }

        public SList deepCopy() {
            List<SNode> copies = new ArrayList<>(children.size());
            for (SNode child : children) {
                copies.add(child instanceof SList list ? list.deepCopy() : child);
            }
            return new SList(copies, gaps, closingGap, line, column);
        }

        @Override
        public int line() {
            return line;
        }

        @Override
        public int column() {
            return column;
        }

        @Override
        public boolean sameStructure(SNode other) {
            if (!(other instanceof SList list) || list.children.size() != children.size()) {
                return false;
            }
            for (int i = 0; i < children.size(); i++) {
                if (!children.get(i).sameStructure(list.children.get(i))) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) sb.append(' ');
                sb.append(children.get(i));
            }
            sb.append(')');
            return sb.toString();
        }
    }
}
