package nl.bytesoflife.deltasch.model;

import nl.bytesoflife.deltasch.collection.ComponentCollection;
import nl.bytesoflife.deltasch.collection.GraphicCollection;
import nl.bytesoflife.deltasch.collection.IndexedCollection;
import nl.bytesoflife.deltasch.collection.JunctionCollection;
import nl.bytesoflife.deltasch.collection.LabelCollection;
import nl.bytesoflife.deltasch.collection.NoConnectCollection;
import nl.bytesoflife.deltasch.collection.SheetCollection;
import nl.bytesoflife.deltasch.collection.WireCollection;
import nl.bytesoflife.deltasch.config.SchematicConfig;
import nl.bytesoflife.deltasch.sexpr.SDocument;
import nl.bytesoflife.deltasch.sexpr.SNode.SAtom;
import nl.bytesoflife.deltasch.sexpr.SNode.SList;

import java.nio.file.Path;
import java.util.List;

/**
 * A schematic document: the parsed text plus typed collections over its top-level elements.
 * <p>
 * The document tree is the single source of truth. Collections and elements are views that
 * edit it in place, which is what lets untouched text survive a save unchanged.
 */
public class Schematic {

    private final SDocument document;
    private final SList root;
    private final ComponentCollection components;
    private final WireCollection wires;
    private final JunctionCollection junctions;
    private final LabelCollection labels;
    private final SheetCollection sheets;
    private final NoConnectCollection noConnects;
    private final GraphicCollection graphics;
    private final TitleBlock titleBlock;

    private long revision;
    private boolean headerModified;
    private Path sourcePath;

    /**
     * Wraps a document whose root is a {@code kicad_sch} list. The collections start empty, the
     * parser fills them.
     */
    public Schematic(SDocument document) {
        this.document = document;
        this.root = document.root();
        if (root == null || !root.hasTag("kicad_sch")) {
            throw new IllegalArgumentException("Document root is not a kicad_sch list");
        }
        Runnable onChange = this::touch;
        this.components = new ComponentCollection(root, onChange, () -> "/" + getUuid());
        this.wires = new WireCollection(root, onChange);
        this.junctions = new JunctionCollection(root, onChange);
        this.labels = new LabelCollection(root, onChange);
        this.sheets = new SheetCollection(root, onChange);
        this.noConnects = new NoConnectCollection(root, onChange);
        this.graphics = new GraphicCollection(root, onChange);
        this.titleBlock = new TitleBlock(this);
    }

    /**
     * An empty A4 schematic with the configured format version and a fresh uuid.
     */
    public static Schematic create() {
        SchematicConfig config = SchematicConfig.defaults();
        SList root = SList.of("kicad_sch",
                SList.of("version", SAtom.integer(config.getInt(SchematicConfig.FORMAT_VERSION))),
                SList.of("generator", SAtom.string(config.getString(SchematicConfig.FORMAT_GENERATOR))),
                SList.of("generator_version",
                        SAtom.string(config.getString(SchematicConfig.FORMAT_GENERATOR_VERSION))),
                SList.of("uuid", SAtom.string(SchematicElement.newUuid())),
                SList.of("paper", SAtom.string("A4")),
                SList.of("lib_symbols"),
                SList.of("sheet_instances",
                        SList.of("path", SAtom.string("/"), SList.of("page", SAtom.string("1")))),
                SList.of("embedded_fonts", SAtom.bool(false)));
        return new Schematic(SDocument.of(root));
    }

    public SDocument getDocument() {
        return document;
    }

    public SList getRoot() {
        return root;
    }

    public String getVersion() {
        return headerValue("version");
    }

    public String getGenerator() {
        return headerValue("generator");
    }

    public String getGeneratorVersion() {
        return headerValue("generator_version");
    }

    public String getUuid() {
        return headerValue("uuid");
    }

    public String getPaper() {
        return headerValue("paper");
    }

    public void setPaper(String paper) {
        SList node = root.find("paper");
        if (node == null) {
            SList uuid = root.find("uuid");
            root.insert(uuid != null ? root.indexOf(uuid) + 1 : Math.min(root.size(), 3),
                    SList.of("paper", SAtom.string(paper)));
        } else {
            node.set(1, SAtom.string(paper));
        }
        headerChanged();
    }

    public TitleBlock getTitleBlock() {
        return titleBlock;
    }

    public SList getLibSymbols() {
        return root.find("lib_symbols");
    }

    /**
     * Embeds a library symbol definition, replacing an existing one with the same name.
     */
    public void embedLibSymbol(SList symbol) {
        SList libSymbols = getLibSymbols();
        if (libSymbols == null) {
            libSymbols = SList.of("lib_symbols");
            SList paper = root.find("title_block") != null ? root.find("title_block") : root.find("paper");
            root.insert(paper != null ? root.indexOf(paper) + 1 : root.size(), libSymbols);
        }
        String name = symbol.value(1);
        for (SList existing : libSymbols.findAll("symbol")) {
            if (name != null && name.equals(existing.value(1))) {
                libSymbols.set(libSymbols.indexOf(existing), symbol);
                headerChanged();
                return;
            }
        }
        libSymbols.add(symbol);
        headerChanged();
    }

    public ComponentCollection components() {
        return components;
    }

    public WireCollection wires() {
        return wires;
    }

    public JunctionCollection junctions() {
        return junctions;
    }

    public LabelCollection labels() {
        return labels;
    }

    public SheetCollection sheets() {
        return sheets;
    }

    public NoConnectCollection noConnects() {
        return noConnects;
    }

    public GraphicCollection graphics() {
        return graphics;
    }

    public List<IndexedCollection<?>> collections() {
        return List.of(components, wires, junctions, labels, sheets, noConnects, graphics);
    }

    /**
     * Counter bumped by every mutation. Derived data such as nets compares it to decide whether
     * it is stale.
     */
    public long getRevision() {
        return revision;
    }

    public boolean isModified() {
        if (headerModified) return true;
        for (IndexedCollection<?> collection : collections()) {
            if (collection.isModified()) return true;
        }
        return false;
    }

    public void markClean() {
        headerModified = false;
        for (IndexedCollection<?> collection : collections()) {
            collection.markClean();
        }
    }

    public Path getSourcePath() {
        return sourcePath;
    }

    public void setSourcePath(Path sourcePath) {
        this.sourcePath = sourcePath;
    }

    void headerChanged() {
        headerModified = true;
        touch();
    }

    private void touch() {
        revision++;
    }

    private String headerValue(String tag) {
        SList node = root.find(tag);
        return node != null ? node.value(1) : null;
    }

    @Override
    public String toString() {
        return String.format("Schematic[version=%s, components=%d, wires=%d, labels=%d, sheets=%d]",
                getVersion(), components.size(), wires.size(), labels.size(), sheets.size());
    }
}
