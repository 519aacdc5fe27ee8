package nl.bytesoflife.deltasch.symbol;

import nl.bytesoflife.deltasch.model.Schematic;
import nl.bytesoflife.deltasch.sexpr.SNode.SList;

import java.util.HashMap;
import java.util.Map;

/**
 * Resolves against the {@code lib_symbols} copy stored inside a schematic, which is what KiCad
 * itself uses to draw a schematic without its libraries.
 */
public class EmbeddedSymbolResolver implements SymbolResolver {

    private final Schematic schematic;
    private final Map<String, SymbolDefinition> definitions = new HashMap<>();
    private long revision = -1;

    public EmbeddedSymbolResolver(Schematic schematic) {
        this.schematic = schematic;
    }

    @Override
    public SymbolDefinition resolve(String libId) throws SymbolNotFoundException {
        if (revision != schematic.getRevision()) {
            definitions.clear();
            revision = schematic.getRevision();
        }
        SymbolDefinition cached = definitions.get(libId);
        if (cached != null) {
            return cached;
        }
        SList libSymbols = schematic.getLibSymbols();
        SList symbol = libSymbols != null ? findSymbol(libSymbols, libId) : null;
        if (symbol == null) {
            throw new SymbolNotFoundException(libId);
        }
        LibrarySymbolReader reader = new LibrarySymbolReader(name -> findParent(libSymbols, libId, name));
        SymbolDefinition definition = reader.read(libId, symbol);
        definitions.put(libId, definition);
        return definition;
    }

    private static SList findSymbol(SList libSymbols, String name) {
        for (SList symbol : libSymbols.findAll("symbol")) {
            if (name.equals(symbol.value(1))) {
                return symbol;
            }
        }
        return null;
    }

    /**
     * Embedded symbols carry the library prefix, {@code extends} names do not.
     */
    private static SList findParent(SList libSymbols, String childLibId, String parentName) {
        int colon = childLibId.indexOf(':');
        if (colon >= 0) {
            SList qualified = findSymbol(libSymbols, childLibId.substring(0, colon + 1) + parentName);
            if (qualified != null) return qualified;
        }
        return findSymbol(libSymbols, parentName);
    }
}
