package nl.bytesoflife.deltasch.symbol;

import nl.bytesoflife.deltasch.parser.ParseException;
import nl.bytesoflife.deltasch.sexpr.SDocument;
import nl.bytesoflife.deltasch.sexpr.SExpressionParser;
import nl.bytesoflife.deltasch.sexpr.SNode.SList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One {@code .kicad_sym} library, answering for lib ids with its nickname.
 */
public class SymbolLibrary implements SymbolResolver {

    private static final Logger log = LoggerFactory.getLogger(SymbolLibrary.class);

    private final String nickname;
    private final Map<String, SList> symbols;

    private SymbolLibrary(String nickname, Map<String, SList> symbols) {
        this.nickname = nickname;
        this.symbols = symbols;
    }

    public static SymbolLibrary parse(String nickname, String content) {
        SDocument document = new SExpressionParser().parse(content);
        SList root = document.root();
        if (root == null || !root.hasTag("kicad_symbol_lib")) {
            int line = root != null ? root.line() : 1;
            int column = root != null ? root.column() : 1;
            throw new ParseException("Expected a kicad_symbol_lib document", line, column);
        }
        Map<String, SList> symbols = new LinkedHashMap<>();
        for (SList symbol : root.findAll("symbol")) {
            symbols.put(symbol.value(1), symbol);
        }
        log.debug("Loaded symbol library {} with {} symbols", nickname, symbols.size());
        return new SymbolLibrary(nickname, symbols);
    }

    public static SymbolLibrary load(String nickname, Path file) throws IOException {
        return parse(nickname, Files.readString(file, StandardCharsets.UTF_8));
    }

    public String getNickname() {
        return nickname;
    }

    public Set<String> getSymbolNames() {
        return Collections.unmodifiableSet(symbols.keySet());
    }

    /**
     * The raw symbol list, e.g. to embed it into a schematic's {@code lib_symbols}.
     */
    public SList getSymbolNode(String name) {
        return symbols.get(name);
    }

    @Override
    public SymbolDefinition resolve(String libId) throws SymbolNotFoundException {
        int colon = libId.indexOf(':');
        if (colon < 0 || !libId.substring(0, colon).equals(nickname)) {
            throw new SymbolNotFoundException(libId);
        }
        SList symbol = symbols.get(libId.substring(colon + 1));
        if (symbol == null) {
            throw new SymbolNotFoundException(libId);
        }
        return new LibrarySymbolReader(symbols::get).read(libId, symbol);
    }
}
