package nl.bytesoflife.deltasch.symbol;

import java.util.List;

public class CompositeSymbolResolver implements SymbolResolver {

    private final List<SymbolResolver> resolvers;

    public CompositeSymbolResolver(List<SymbolResolver> resolvers) {
        this.resolvers = List.copyOf(resolvers);
    }

    public CompositeSymbolResolver(SymbolResolver... resolvers) {
        this(List.of(resolvers));
    }

    @Override
    public SymbolDefinition resolve(String libId) throws SymbolNotFoundException {
        for (SymbolResolver resolver : resolvers) {
            try {
                return resolver.resolve(libId);
            } catch (SymbolNotFoundException e) {
                // try the next one
            }
        }
        throw new SymbolNotFoundException(libId);
    }
}
