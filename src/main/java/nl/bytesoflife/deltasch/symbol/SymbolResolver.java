package nl.bytesoflife.deltasch.symbol;

import java.util.Optional;

public interface SymbolResolver {

    SymbolDefinition resolve(String libId) throws SymbolNotFoundException;

    default Optional<SymbolDefinition> find(String libId) {
        try {
            return Optional.of(resolve(libId));
        } catch (SymbolNotFoundException e) {
            return Optional.empty();
        }
    }
}
