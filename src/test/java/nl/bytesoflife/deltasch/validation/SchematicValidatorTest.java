package nl.bytesoflife.deltasch.validation;

import nl.bytesoflife.deltasch.Fixtures;
import nl.bytesoflife.deltasch.model.Component;
import nl.bytesoflife.deltasch.model.Point;
import nl.bytesoflife.deltasch.model.Schematic;
import nl.bytesoflife.deltasch.parser.SchematicParser;
import nl.bytesoflife.deltasch.symbol.BuiltinSymbols;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchematicValidatorTest {

    private final SchematicValidator validator = SchematicValidator.standard(BuiltinSymbols.resolver());

    @Test
    void cleanSchematicHasNoIssues() {
        Schematic divider = new SchematicParser().parse(Fixtures.read("voltage_divider.kicad_sch"));
        ValidationReport report = validator.run(divider);
        assertTrue(report.isEmpty(), report::toString);
        assertFalse(report.hasErrors());
    }

    @Test
    void duplicateReferenceSuggestsFreeOne() {
        Schematic schematic = Schematic.create();
        schematic.components().add("Device:R", "R1", "1k", new Point(0, 0));
        Component second = schematic.components().add("Device:R", "R2", "1k", new Point(10, 0));
        second.setReference("R1");

        ValidationReport report = validator.run(schematic);

        assertEquals(1, report.getErrors().size());
        ValidationIssue issue = report.getErrors().get(0);
        assertTrue(issue.getMessage().contains("R1"));
        assertEquals(List.of("rename one of them, e.g. to R2"), issue.getSuggestions());
    }

    @Test
    void unitsOfOnePartAreNotDuplicates() {
        Schematic schematic = Schematic.create();
        schematic.components().add("Device:R", "R1", "1k", new Point(0, 0));
        Component unitB = schematic.components().add("Device:R", "R2", "1k", new Point(10, 0));
        unitB.setReference("R1");
        unitB.setUnit(2);

        assertTrue(validator.run(schematic).getErrors().isEmpty());
    }

    @Test
    void powerAndUnannotatedReferencesAreExempt() {
        Schematic schematic = Schematic.create();
        schematic.components().add("power:GND", "#PWR01", "GND", new Point(0, 0));
        schematic.components().add("power:GND", "#PWR02", "GND", new Point(10, 0)).setReference("#PWR01");
        schematic.components().add("Device:R", "R1", "1k", new Point(20, 0)).setReference("R?");
        schematic.components().add("Device:C", "C1", "1u", new Point(30, 0)).setReference("R?");

        assertTrue(validator.run(schematic).getErrors().isEmpty());
    }

    @Test
    void duplicateUuidAcrossElementKinds() {
        String text = "(kicad_sch (version 20231120) (generator \"eeschema\") (uuid \"root\")\n"
                + "\t(junction (at 10 10) (diameter 0) (color 0 0 0 0) (uuid \"same\"))\n"
                + "\t(wire (pts (xy 0 0) (xy 10 0)) (uuid \"same\"))\n"
                + ")\n";
        Schematic schematic = new SchematicParser().parse(text);

        ValidationReport report = validator.run(schematic);

        assertEquals(1, report.getErrors().size());
        assertTrue(report.getErrors().get(0).getMessage().contains("same"));
    }

    @Test
    void sheetWithoutFileAndDuplicatePins() {
        String text = "(kicad_sch (version 20231120) (generator \"eeschema\") (uuid \"root\")\n"
                + "\t(sheet (at 10 10) (size 20 10) (uuid \"s1\")\n"
                + "\t\t(property \"Sheetname\" \"Empty\" (at 10 9 0))\n"
                + "\t\t(property \"Sheetfile\" \"\" (at 10 21 0))\n"
                + "\t\t(pin \"A\" input (at 10 12 180) (uuid \"p1\"))\n"
                + "\t\t(pin \"A\" output (at 10 14 180) (uuid \"p2\")))\n"
                + ")\n";
        Schematic schematic = new SchematicParser().parse(text);

        List<ValidationIssue> errors = validator.run(schematic).getErrors();

        assertEquals(2, errors.size());
        assertEquals("sheet", errors.get(0).getElementType());
        assertEquals("p2", errors.get(1).getElementId());
    }

    @Test
    void unresolvedSymbolIsAWarning() {
        Schematic schematic = Schematic.create();
        schematic.components().add("Vendor:Widget", "U1", "X", new Point(0, 0));

        ValidationReport report = validator.run(schematic);

        assertFalse(report.hasErrors());
        assertEquals(1, report.getWarnings().size());
        assertTrue(SchematicValidator.standard(null).run(schematic).isEmpty());
    }

    @Test
    void customChecksRunAfterStandardOnes() {
        Schematic schematic = Schematic.create();
        schematic.components().add("Device:R", "R1", "", new Point(0, 0));
        validator.registerCheck(new SchematicCheck() {
            @Override
            public List<ValidationIssue> check(Schematic s) {
                return s.components().filter(c -> c.getValue().isEmpty()).stream()
                        .map(c -> ValidationIssue.warning(c.getReference() + " has no value", "component", c.getUuid()))
                        .toList();
            }

            @Override
            public String getName() {
                return "empty-value";
            }
        });

        ValidationReport report = validator.run(schematic);

        assertEquals(1, report.getWarnings().size());
        assertEquals("R1 has no value", report.getWarnings().get(0).getMessage());
    }
}
