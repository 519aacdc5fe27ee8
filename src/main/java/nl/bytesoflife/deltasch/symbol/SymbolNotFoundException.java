package nl.bytesoflife.deltasch.symbol;

public class SymbolNotFoundException extends Exception {
    private final String libId;

    public SymbolNotFoundException(String libId) {
        super("Symbol not found: " + libId);
        this.libId = libId;
    }

    public String getLibId() {
        return libId;
    }
}
