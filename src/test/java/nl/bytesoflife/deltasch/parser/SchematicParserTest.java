package nl.bytesoflife.deltasch.parser;

import nl.bytesoflife.deltasch.Fixtures;
import nl.bytesoflife.deltasch.model.Component;
import nl.bytesoflife.deltasch.model.GraphicItem;
import nl.bytesoflife.deltasch.model.LabelType;
import nl.bytesoflife.deltasch.model.Point;
import nl.bytesoflife.deltasch.model.Schematic;
import nl.bytesoflife.deltasch.writer.SchematicWriter;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchematicParserTest {

    private final SchematicParser parser = new SchematicParser();

    @Test
    void parseSingleResistor() {
        Schematic schematic = parser.parse(Fixtures.read("single_resistor.kicad_sch"));
        assertEquals("20231120", schematic.getVersion());
        assertEquals("eeschema", schematic.getGenerator());
        assertEquals("A4", schematic.getPaper());
        assertEquals("single_resistor", schematic.getTitleBlock().getTitle());
        assertEquals(1, schematic.components().size());

        Component r1 = schematic.components().byReference("R1").orElseThrow();
        assertEquals("Device:R", r1.getLibId());
        assertEquals("10k", r1.getValue());
        assertEquals("Resistor_SMD:R_0603_1608Metric", r1.getFootprint());
        assertEquals(new Point(100.33, 100.33), r1.getPosition());
        assertEquals(0, r1.getRotation());
        assertFalse(schematic.isModified());
    }

    @Test
    void parseDividerElements() {
        Schematic schematic = parser.parse(Fixtures.read("voltage_divider.kicad_sch"));
        assertEquals(4, schematic.components().size());
        assertEquals(3, schematic.wires().size());
        assertEquals(1, schematic.junctions().size());
        assertEquals(2, schematic.labels().byType(LabelType.LOCAL).size());
        assertEquals(2, schematic.labels().byText("VOUT").size());
    }

    @Test
    void parseSheetsWithPins() {
        Schematic schematic = parser.parse(Fixtures.read("hier_root.kicad_sch"));
        assertEquals(1, schematic.sheets().size());
        var sheet = schematic.sheets().byName("Power").orElseThrow();
        assertEquals("hier_power.kicad_sch", sheet.getFilename());
        assertEquals(20, sheet.getWidth(), 1e-9);
        assertEquals(List.of("VCC", "VOUT"), sheet.getPins().stream().map(p -> p.getName()).toList());
    }

    @Test
    void parseFromPathRecordsSource() throws IOException {
        Schematic schematic = parser.parse(Fixtures.path("single_resistor.kicad_sch"));
        assertEquals(Fixtures.path("single_resistor.kicad_sch"), schematic.getSourcePath());
    }

    @Test
    void strictModeRejectsUnknownElementWithPosition() {
        String text = "(kicad_sch\n\t(version 20231120)\n\t(frobnicate 1)\n)\n";
        UnknownElementException e = assertThrows(UnknownElementException.class,
                () -> new SchematicParser(ParserOptions.strict()).parse(text));
        assertEquals("frobnicate", e.getTag());
        assertEquals(3, e.getLine());
        assertEquals(2, e.getColumn());
    }

    @Test
    void permissiveModeKeepsUnknownElementOpaque() {
        String text = "(kicad_sch\n\t(version 20231120)\n\t(frobnicate 1)\n)\n";
        Schematic schematic = new SchematicParser(ParserOptions.permissive()).parse(text);
        List<GraphicItem> opaque = schematic.graphics().opaque();
        assertEquals(1, opaque.size());
        assertEquals("frobnicate", opaque.get(0).getTag());
        assertEquals(text, new SchematicWriter().write(schematic));
    }

    @Test
    void rejectVersionOutsideRange() {
        String text = "(kicad_sch (version 20200101) (generator eeschema))";
        VersionException e = assertThrows(VersionException.class, () -> parser.parse(text));
        assertEquals("20200101", e.getVersion());
    }

    @Test
    void acceptVersionWithWidenedRange() {
        String text = "(kicad_sch (version 20200101) (generator eeschema))";
        Schematic schematic = new SchematicParser(ParserOptions.defaults().withVersionRange(20200101, 20301231))
                .parse(text);
        assertEquals("20200101", schematic.getVersion());
    }

    @Test
    void rejectMissingVersion() {
        assertThrows(VersionException.class, () -> parser.parse("(kicad_sch (generator eeschema))"));
    }

    @Test
    void rejectOtherRootTag() {
        ParseException e = assertThrows(ParseException.class,
                () -> parser.parse("(kicad_pcb (version 20240108))"));
        assertEquals(1, e.getLine());
    }

    @Test
    void rejectTwoRoots() {
        assertThrows(ParseException.class,
                () -> parser.parse("(kicad_sch (version 20231120))\n(kicad_sch (version 20231120))"));
    }

    @Test
    void rejectWireWithSinglePoint() {
        String text = "(kicad_sch (version 20231120)\n (wire (pts (xy 0 0)) (uuid \"w\")))";
        ParseException e = assertThrows(ParseException.class, () -> parser.parse(text));
        assertEquals(2, e.getLine());
    }

    @Test
    void keepDuplicateUuidsForValidation() {
        String text = "(kicad_sch (version 20231120)\n"
                + " (junction (at 1 1) (uuid \"same\"))\n"
                + " (junction (at 2 2) (uuid \"same\")))";
        Schematic schematic = parser.parse(text);
        assertEquals(2, schematic.junctions().size());
        assertEquals(new Point(1, 1), schematic.junctions().get("same").orElseThrow().getPosition());
    }
}
