package nl.bytesoflife.deltasch.collection;

import nl.bytesoflife.deltasch.model.GraphicItem;
import nl.bytesoflife.deltasch.model.Point;
import nl.bytesoflife.deltasch.model.Schematic;
import nl.bytesoflife.deltasch.model.Sheet;
import nl.bytesoflife.deltasch.parser.ParserOptions;
import nl.bytesoflife.deltasch.parser.SchematicParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SheetCollectionTest {

    private final Schematic schematic = Schematic.create();

    @Test
    void sheetsIndexedByNameAndFile() {
        Sheet left = schematic.sheets().add("Left", "channel.kicad_sch", new Point(20, 20), 20, 15);
        Sheet right = schematic.sheets().add("Right", "channel.kicad_sch", new Point(60, 20), 20, 15);

        assertEquals(List.of(left, right), schematic.sheets().byFilename("channel.kicad_sch"));
        assertSame(right, schematic.sheets().byName("Right").orElseThrow());
        assertTrue(schematic.sheets().byName("Other").isEmpty());
    }

    @Test
    void duplicateSheetNameRejected() {
        schematic.sheets().add("Power", "power.kicad_sch", new Point(20, 20), 20, 15);
        assertThrows(IllegalArgumentException.class,
                () -> schematic.sheets().add("Power", "other.kicad_sch", new Point(60, 20), 20, 15));
    }

    @Test
    void renamedSheetIsReindexed() {
        Sheet sheet = schematic.sheets().add("Power", "power.kicad_sch", new Point(20, 20), 20, 15);
        sheet.setName("Supply");
        assertTrue(schematic.sheets().byName("Power").isEmpty());
        assertSame(sheet, schematic.sheets().byName("Supply").orElseThrow());
    }

    @Test
    void graphicsKeepUnknownElementsApart() {
        String text = "(kicad_sch\n"
                + "\t(version 20231120)\n"
                + "\t(generator \"eeschema\")\n"
                + "\t(uuid \"root\")\n"
                + "\t(text \"note\" (at 10 10 0) (uuid \"t1\"))\n"
                + "\t(future_thing (uuid \"f1\"))\n"
                + ")\n";
        Schematic parsed = new SchematicParser(ParserOptions.permissive()).parse(text);

        assertEquals(2, parsed.graphics().size());
        List<GraphicItem> opaque = parsed.graphics().opaque();
        assertEquals(1, opaque.size());
        assertEquals("future_thing", opaque.get(0).getTag());
        assertEquals("note", parsed.graphics().byTag("text").get(0).getText());
    }

    @Test
    void addedGraphicsAreWritableItems() {
        GraphicItem note = schematic.graphics().addText("hello", new Point(5, 5));
        schematic.graphics().addPolyline(List.of(new Point(0, 0), new Point(10, 0)));
        assertEquals("hello", note.getText());
        assertEquals(1, schematic.graphics().byTag("polyline").size());
        assertTrue(schematic.graphics().opaque().isEmpty());
    }
}
