package nl.bytesoflife.deltasch.parser;

public class UnknownElementException extends SchematicException {
    private final String tag;
    private final int line;
    private final int column;

    public UnknownElementException(String tag, int line, int column) {
        super("Unknown top-level element '" + tag + "' at line " + line + ", column " + column);
        this.tag = tag;
        this.line = line;
        this.column = column;
    }

    public String getTag() {
        return tag;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
