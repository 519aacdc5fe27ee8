package nl.bytesoflife.deltasch.hierarchy;

import nl.bytesoflife.deltasch.config.SchematicConfig;
import nl.bytesoflife.deltasch.connectivity.ConnectivityOptions;
import nl.bytesoflife.deltasch.symbol.BuiltinSymbols;
import nl.bytesoflife.deltasch.symbol.SymbolResolver;

public class HierarchyOptions {

    private DirectionPolicy directionPolicy;
    private ConnectivityOptions connectivity;
    private SymbolResolver libraryResolver;

    private HierarchyOptions(SchematicConfig config) {
        this.directionPolicy = config.getEnum(SchematicConfig.HIERARCHY_DIRECTION_POLICY, DirectionPolicy.class);
        this.connectivity = ConnectivityOptions.from(config);
        this.libraryResolver = BuiltinSymbols.resolver();
    }

    public static HierarchyOptions defaults() {
        return new HierarchyOptions(SchematicConfig.defaults());
    }

    public static HierarchyOptions from(SchematicConfig config) {
        return new HierarchyOptions(config);
    }

    public HierarchyOptions withDirectionPolicy(DirectionPolicy directionPolicy) {
        this.directionPolicy = directionPolicy;
        return this;
    }

    public HierarchyOptions withConnectivity(ConnectivityOptions connectivity) {
        this.connectivity = connectivity;
        return this;
    }

    /**
     * Resolver consulted for symbols a sheet does not embed in its own {@code lib_symbols}.
     */
    public HierarchyOptions withLibraryResolver(SymbolResolver libraryResolver) {
        this.libraryResolver = libraryResolver;
        return this;
    }

    public DirectionPolicy getDirectionPolicy() {
        return directionPolicy;
    }

    public ConnectivityOptions getConnectivity() {
        return connectivity;
    }

    public SymbolResolver getLibraryResolver() {
        return libraryResolver;
    }
}
