package nl.bytesoflife.deltasch.symbol;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Remembers hits and misses of a delegate. Safe for concurrent use; each lib id is looked up in
 * the delegate at most once.
 */
public class CachingSymbolResolver implements SymbolResolver {

    private final SymbolResolver delegate;
    private final ConcurrentMap<String, Optional<SymbolDefinition>> cache = new ConcurrentHashMap<>();

    public CachingSymbolResolver(SymbolResolver delegate) {
        this.delegate = delegate;
    }

    @Override
    public SymbolDefinition resolve(String libId) throws SymbolNotFoundException {
        Optional<SymbolDefinition> definition = cache.computeIfAbsent(libId, delegate::find);
        if (definition.isEmpty()) {
            throw new SymbolNotFoundException(libId);
        }
        return definition.get();
    }

    public int size() {
        return cache.size();
    }

    public void clear() {
        cache.clear();
    }
}
