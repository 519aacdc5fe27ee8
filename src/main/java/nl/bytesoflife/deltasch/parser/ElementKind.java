package nl.bytesoflife.deltasch.parser;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Every top-level tag a {@code kicad_sch} document may contain, and what it becomes.
 */
public enum ElementKind {
    VERSION("version", Category.HEADER),
    GENERATOR("generator", Category.HEADER),
    GENERATOR_VERSION("generator_version", Category.HEADER),
    UUID("uuid", Category.HEADER),
    PAPER("paper", Category.HEADER),
    TITLE_BLOCK("title_block", Category.HEADER),
    LIB_SYMBOLS("lib_symbols", Category.LIB_SYMBOLS),

    SYMBOL("symbol", Category.COMPONENT),
    WIRE("wire", Category.WIRE),
    BUS("bus", Category.WIRE),
    JUNCTION("junction", Category.JUNCTION),
    NO_CONNECT("no_connect", Category.NO_CONNECT),
    LABEL("label", Category.LABEL),
    GLOBAL_LABEL("global_label", Category.LABEL),
    HIERARCHICAL_LABEL("hierarchical_label", Category.LABEL),
    SHEET("sheet", Category.SHEET),

    TEXT("text", Category.GRAPHIC),
    TEXT_BOX("text_box", Category.GRAPHIC),
    RECTANGLE("rectangle", Category.GRAPHIC),
    POLYLINE("polyline", Category.GRAPHIC),
    IMAGE("image", Category.GRAPHIC),
    CIRCLE("circle", Category.GRAPHIC),
    ARC("arc", Category.GRAPHIC),
    BEZIER("bezier", Category.GRAPHIC),
    BUS_ENTRY("bus_entry", Category.GRAPHIC),
    NETCLASS_FLAG("netclass_flag", Category.GRAPHIC),
    DIRECTIVE_LABEL("directive_label", Category.GRAPHIC),
    RULE_AREA("rule_area", Category.GRAPHIC),
    TABLE("table", Category.GRAPHIC),

    SHEET_INSTANCES("sheet_instances", Category.METADATA),
    SYMBOL_INSTANCES("symbol_instances", Category.METADATA),
    BUS_ALIAS("bus_alias", Category.METADATA),
    EMBEDDED_FONTS("embedded_fonts", Category.METADATA),
    EMBEDDED_FILES("embedded_files", Category.METADATA);

    public enum Category {
        HEADER,
        LIB_SYMBOLS,
        COMPONENT,
        WIRE,
        JUNCTION,
        NO_CONNECT,
        LABEL,
        SHEET,
        GRAPHIC,
        METADATA
    }

    private static final Map<String, ElementKind> BY_TAG = new HashMap<>();

    static {
        for (ElementKind kind : values()) {
            BY_TAG.put(kind.tag, kind);
        }
    }

    private final String tag;
    private final Category category;

    ElementKind(String tag, Category category) {
        this.tag = tag;
        this.category = category;
    }

    public String getTag() {
        return tag;
    }

    public Category getCategory() {
        return category;
    }

    public static Optional<ElementKind> fromTag(String tag) {
        return Optional.ofNullable(BY_TAG.get(tag));
    }
}
