package nl.bytesoflife.deltasch.sexpr;

public enum AtomType {
    SYMBOL,
    INTEGER,
    FLOAT,
    STRING;

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }
}
