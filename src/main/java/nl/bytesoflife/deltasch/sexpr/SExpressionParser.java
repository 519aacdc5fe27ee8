package nl.bytesoflife.deltasch.sexpr;

import nl.bytesoflife.deltasch.parser.ParseException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads S-expression text into an {@link SDocument}, keeping every character of whitespace and
 * the exact text of every atom so the writer can reproduce the input.
 */
public class SExpressionParser {

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Pattern FLOAT = Pattern.compile("[-+]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][-+]?\\d+)?");

    private final boolean comments;

    private String input;
    private int pos;
    private int[] lineStarts;

    public SExpressionParser() {
        this(false);
    }

    /**
     * @param comments treat {@code #} up to the end of the line as whitespace
     */
    public SExpressionParser(boolean comments) {
        this.comments = comments;
    }

    public SDocument parse(String text) {
        this.input = text;
        this.pos = 0;
        this.lineStarts = computeLineStarts(text);
        List<SNode> nodes = new ArrayList<>();
        List<String> gaps = new ArrayList<>();
        while (true) {
            String gap = skipWhitespaceAndComments();
            if (pos >= input.length()) {
                return new SDocument(nodes, gaps, gap);
            }
            char c = input.charAt(pos);
            if (c != '(') {
                throw error(c == ')' ? "Unbalanced ')'" : "Unexpected text outside of a list", pos);
            }
            gaps.add(gap);
            nodes.add(parseList());
        }
    }

    private SNode.SList parseList() {
        int start = pos;
        expect('(');
        List<SNode> children = new ArrayList<>();
        List<String> gaps = new ArrayList<>();
        while (true) {
            String gap = skipWhitespaceAndComments();
            if (pos >= input.length()) {
                throw error("Unexpected end of input, expected ')'", start);
            }
            char c = input.charAt(pos);
            if (c == ')') {
                pos++;
                return new SNode.SList(children, gaps, gap, lineOf(start), columnOf(start));
            }
            gaps.add(gap);
            if (c == '(') {
                children.add(parseList());
            } else if (c == '"') {
                children.add(parseQuotedString());
            } else {
                children.add(parseAtom());
            }
        }
    }

    private SNode.SAtom parseQuotedString() {
        int start = pos;
        expect('"');
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '"') {
                pos++;
                return new SNode.SAtom(AtomType.STRING, sb.toString(), input.substring(start, pos),
                        lineOf(start), columnOf(start));
            }
            if (c == '\\' && pos + 1 < input.length()) {
                pos++;
                sb.append(unescape(input.charAt(pos)));
            } else {
                sb.append(c);
            }
            pos++;
        }
        throw error("Unterminated quoted string", start);
    }

    private static char unescape(char c) {
        return switch (c) {
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 't' -> '\t';
            default -> c;
        };
    }

    private SNode.SAtom parseAtom() {
        int start = pos;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '(' || c == ')' || c == '"' || Character.isWhitespace(c)) {
                break;
            }
            pos++;
        }
        if (pos == start) {
            throw error("Expected atom", pos);
        }
        String text = input.substring(start, pos);
        return new SNode.SAtom(classify(text), text, text, lineOf(start), columnOf(start));
    }

    static AtomType classify(String text) {
        if (INTEGER.matcher(text).matches()) {
            return AtomType.INTEGER;
        }
        if (FLOAT.matcher(text).matches()) {
            return AtomType.FLOAT;
        }
        return AtomType.SYMBOL;
    }

    private String skipWhitespaceAndComments() {
        int start = pos;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (comments && c == '#') {
                while (pos < input.length() && input.charAt(pos) != '\n') {
                    pos++;
                }
            } else {
                break;
            }
        }
        return input.substring(start, pos);
    }

    private void expect(char expected) {
        if (pos >= input.length() || input.charAt(pos) != expected) {
            throw error("Expected '" + expected + "'", pos);
        }
        pos++;
    }

    private ParseException error(String message, int position) {
        return new ParseException(message, lineOf(position), columnOf(position));
    }

    private static int[] computeLineStarts(String text) {
        int[] starts = new int[16];
        int count = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        return Arrays.copyOf(starts, count);
    }

    private int lineOf(int position) {
        int index = Arrays.binarySearch(lineStarts, position);
        return (index >= 0 ? index : -index - 2) + 1;
    }

    private int columnOf(int position) {
        return position - lineStarts[lineOf(position) - 1] + 1;
    }
}
