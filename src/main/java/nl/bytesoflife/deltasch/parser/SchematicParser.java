package nl.bytesoflife.deltasch.parser;

import nl.bytesoflife.deltasch.model.Component;
import nl.bytesoflife.deltasch.model.GraphicItem;
import nl.bytesoflife.deltasch.model.Junction;
import nl.bytesoflife.deltasch.model.Label;
import nl.bytesoflife.deltasch.model.NoConnect;
import nl.bytesoflife.deltasch.model.Schematic;
import nl.bytesoflife.deltasch.model.Sheet;
import nl.bytesoflife.deltasch.model.Wire;
import nl.bytesoflife.deltasch.sexpr.SDocument;
import nl.bytesoflife.deltasch.sexpr.SExpressionParser;
import nl.bytesoflife.deltasch.sexpr.SNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads {@code .kicad_sch} text into a {@link Schematic}.
 */
public class SchematicParser {

    private static final Logger log = LoggerFactory.getLogger(SchematicParser.class);

    private final ParserOptions options;

    public SchematicParser() {
        this(ParserOptions.defaults());
    }

    public SchematicParser(ParserOptions options) {
        this.options = options;
    }

    public Schematic parse(Path file) throws IOException {
        Schematic schematic = parse(Files.readString(file, StandardCharsets.UTF_8));
        schematic.setSourcePath(file);
        return schematic;
    }

    public Schematic parse(String content) {
        SDocument document = new SExpressionParser(options.isComments()).parse(content);
        if (document.nodes().isEmpty()) {
            throw new ParseException("Empty document", 1, 1);
        }
        if (document.nodes().size() > 1) {
            SNode extra = document.nodes().get(1);
            throw new ParseException("Unexpected content after the root list", extra.line(), extra.column());
        }
        SNode.SList root = (SNode.SList) document.nodes().get(0);
        if (!root.hasTag("kicad_sch")) {
            throw new ParseException("Expected a kicad_sch document but found '" + root.tag() + "'",
                    root.line(), root.column());
        }
        checkVersion(root);

        Schematic schematic = new Schematic(document);
        for (int i = 1; i < root.size(); i++) {
            SNode child = root.get(i);
            if (child instanceof SNode.SList list) {
                addElement(schematic, list);
            } else {
                throw new ParseException("Unexpected atom '" + child + "' in kicad_sch", child.line(), child.column());
            }
        }
        schematic.markClean();
        log.debug("Parsed schematic version {}: {} components, {} wires, {} labels, {} sheets",
                schematic.getVersion(), schematic.components().size(), schematic.wires().size(),
                schematic.labels().size(), schematic.sheets().size());
        return schematic;
    }

    private void addElement(Schematic schematic, SNode.SList list) {
        Optional<ElementKind> kind = ElementKind.fromTag(list.tag());
        if (kind.isEmpty()) {
            if (options.isStrict()) {
                throw new UnknownElementException(list.tag(), list.line(), list.column());
            }
            log.warn("Keeping unknown element '{}' at line {} as opaque item", list.tag(), list.line());
            schematic.graphics().load(new GraphicItem(list, true));
            return;
        }
        switch (kind.get().getCategory()) {
            case COMPONENT -> schematic.components().load(new Component(list));
            case WIRE -> schematic.wires().load(parseWire(list));
            case JUNCTION -> schematic.junctions().load(new Junction(list));
            case NO_CONNECT -> schematic.noConnects().load(new NoConnect(list));
            case LABEL -> schematic.labels().load(new Label(list));
            case SHEET -> schematic.sheets().load(new Sheet(list));
            case GRAPHIC -> schematic.graphics().load(new GraphicItem(list));
            case HEADER, LIB_SYMBOLS, METADATA -> {
                // read on demand from the document
            }
        }
    }

    private static Wire parseWire(SNode.SList list) {
        Wire wire = new Wire(list);
        if (wire.getPoints().size() < 2) {
            throw new ParseException(list.tag() + " needs at least two points", list.line(), list.column());
        }
        return wire;
    }

    private void checkVersion(SNode.SList root) {
        SNode.SList version = root.find("version");
        if (version == null || version.value(1) == null) {
            throw new VersionException("Document has no format version", null);
        }
        String text = version.value(1);
        int number;
        try {
            number = Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new VersionException("Format version is not a number: " + text, text);
        }
        if (number < options.getMinVersion() || number > options.getMaxVersion()) {
            throw new VersionException("Unsupported format version " + number + ", supported range is "
                    + options.getMinVersion() + ".." + options.getMaxVersion(), text);
        }
    }
}
