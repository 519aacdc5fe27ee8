package nl.bytesoflife.deltasch.writer;

import nl.bytesoflife.deltasch.Fixtures;
import nl.bytesoflife.deltasch.collection.ComponentCriteria;
import nl.bytesoflife.deltasch.model.Component;
import nl.bytesoflife.deltasch.model.LabelType;
import nl.bytesoflife.deltasch.model.Point;
import nl.bytesoflife.deltasch.model.Schematic;
import nl.bytesoflife.deltasch.model.Wire;
import nl.bytesoflife.deltasch.parser.SchematicParser;
import nl.bytesoflife.deltasch.sexpr.FormatMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchematicWriterTest {

    private final SchematicParser parser = new SchematicParser();
    private final SchematicWriter writer = new SchematicWriter();

    @Test
    void singleResistorRoundTripsExactly() {
        String original = Fixtures.read("single_resistor.kicad_sch");
        Schematic schematic = parser.parse(original);
        assertEquals("R1", schematic.components().all().get(0).getReference());
        assertEquals("10k", schematic.components().all().get(0).getValue());
        assertEquals(original, writer.write(schematic));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "single_resistor.kicad_sch",
            "voltage_divider.kicad_sch",
            "hier_root.kicad_sch",
            "hier_power.kicad_sch",
            "reuse_root.kicad_sch",
            "reuse_channel.kicad_sch",
            "missing_root.kicad_sch"
    })
    void unmodifiedFixturesRoundTripExactly(String fixture) {
        String original = Fixtures.read(fixture);
        String written = writer.write(parser.parse(original));
        assertEquals(original, written);
        assertTrue(parser.parse(written).getRoot().sameStructure(parser.parse(original).getRoot()));
    }

    @ParameterizedTest
    @ValueSource(strings = {"single_resistor.kicad_sch", "voltage_divider.kicad_sch", "hier_root.kicad_sch"})
    void cleanOutputParsesToTheSameModel(String fixture) {
        Schematic original = parser.parse(Fixtures.read(fixture));
        String clean = new SchematicWriter().withMode(FormatMode.CLEAN).write(original);
        Schematic reparsed = parser.parse(clean);
        assertTrue(reparsed.getRoot().sameStructure(original.getRoot()));
        assertEquals(original.components().size(), reparsed.components().size());
    }

    @Test
    void compactOutputIsASingleLine() {
        Schematic schematic = parser.parse(Fixtures.read("voltage_divider.kicad_sch"));
        String compact = new SchematicWriter().withMode(FormatMode.COMPACT).write(schematic);
        assertEquals(1, compact.strip().lines().count());
        assertTrue(parser.parse(compact).getRoot().sameStructure(schematic.getRoot()));
    }

    @Test
    void bulkValueChangeTouchesOnlyThoseValues() {
        String original = Fixtures.read("voltage_divider.kicad_sch");
        Schematic schematic = parser.parse(original);

        int changed = schematic.components().bulkUpdate(
                ComponentCriteria.any().withLibId("Device:R"), c -> c.setValue("22k"));

        assertEquals(2, changed);
        String expected = original.replace("\"10k\"", "\"22k\"").replace("\"4k7\"", "\"22k\"");
        assertEquals(expected, writer.write(schematic));
    }

    @Test
    void removingAWireLeavesTheRestUntouched() {
        String original = Fixtures.read("voltage_divider.kicad_sch");
        Schematic schematic = parser.parse(original);
        Wire first = schematic.wires().all().get(0);

        assertTrue(schematic.wires().remove(first));

        int start = original.indexOf("\n\t(wire");
        int end = original.indexOf("\n\t)", start + 1) + 3;
        String expected = original.substring(0, start) + original.substring(end);
        assertEquals(expected, writer.write(schematic));
    }

    @Test
    void addedComponentIsInsertedAfterExistingSymbols() {
        String original = Fixtures.read("single_resistor.kicad_sch");
        Schematic schematic = parser.parse(original);

        Component added = schematic.components().add("Device:R", null, "1k", new Point(120.65, 100.33));
        assertEquals("R2", added.getReference());

        String written = writer.write(schematic);
        int split = original.indexOf("\n\t(sheet_instances");
        assertTrue(written.startsWith(original.substring(0, split)));
        assertTrue(written.endsWith(original.substring(split)));
        assertTrue(written.contains("\n\t(symbol\n\t\t(lib_id \"Device:R\")\n\t\t(at 120.65 100.33 0)"));

        Schematic reparsed = parser.parse(written);
        Component r2 = reparsed.components().byReference("R2").orElseThrow();
        assertEquals(new Point(120.65, 100.33), r2.getPosition());
        assertEquals("1k", r2.getValue());
    }

    @Test
    void editedCrlfDocumentKeepsCrlfLineEndings() {
        String original = Fixtures.read("single_resistor.kicad_sch").replace("\n", "\r\n");
        Schematic schematic = parser.parse(original);
        assertEquals(original, writer.write(schematic));

        schematic.wires().addWire(new Point(100, 103.81), new Point(100, 110));
        schematic.components().byReference("R1").orElseThrow().setValue("22k");
        String written = writer.write(schematic);

        assertEquals(-1, written.replace("\r\n", "").indexOf('\n'));
        assertTrue(written.contains("\r\n\t(wire\r\n\t\t(pts"));
        assertTrue(written.endsWith(")\r\n"));
        Schematic reparsed = parser.parse(written);
        assertEquals(1, reparsed.wires().size());
        assertEquals("22k", reparsed.components().byReference("R1").orElseThrow().getValue());
    }

    @Test
    void createdSchematicWritesAndReparses() {
        Schematic schematic = Schematic.create();
        schematic.components().add("Device:R", "R1", "10k", new Point(100, 100));
        schematic.wires().addWire(new Point(100, 103.81), new Point(100, 110));
        schematic.labels().add("OUT", new Point(100, 110), LabelType.LOCAL);
        schematic.junctions().add(new Point(100, 110));

        String text = writer.write(schematic);
        assertTrue(text.startsWith("(kicad_sch\n\t(version "));
        assertTrue(text.endsWith(")\n"));

        Schematic reparsed = parser.parse(text);
        assertEquals(1, reparsed.components().size());
        assertEquals(List.of(new Point(100, 103.81), new Point(100, 110)),
                reparsed.wires().all().get(0).getPoints());
        assertEquals("OUT", reparsed.labels().all().get(0).getText());
        assertEquals(1, reparsed.junctions().size());
        assertEquals(text, writer.write(reparsed));
    }

    @Test
    void writeToFileKeepsBackupAndMarksClean(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("divider.kicad_sch");
        String original = Fixtures.read("voltage_divider.kicad_sch");
        Files.writeString(file, original, StandardCharsets.UTF_8);

        Schematic schematic = parser.parse(file);
        schematic.components().byReference("R1").orElseThrow().setValue("12k");
        assertTrue(schematic.isModified());

        new SchematicWriter().backup().write(schematic, file);

        assertFalse(schematic.isModified());
        assertEquals(original, Files.readString(dir.resolve("divider.kicad_sch.bak"), StandardCharsets.UTF_8));
        assertEquals("12k", parser.parse(file).components().byReference("R1").orElseThrow().getValue());
    }

    @Test
    void writeWithoutBackupCreatesNoBackupFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("single.kicad_sch");
        Files.writeString(file, "old", StandardCharsets.UTF_8);
        new SchematicWriter().write(parser.parse(Fixtures.read("single_resistor.kicad_sch")), file);
        assertFalse(Files.exists(dir.resolve("single.kicad_sch.bak")));
        assertEquals(Fixtures.read("single_resistor.kicad_sch"), Files.readString(file, StandardCharsets.UTF_8));
    }
}
