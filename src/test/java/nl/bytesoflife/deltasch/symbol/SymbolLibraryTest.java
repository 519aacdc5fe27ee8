package nl.bytesoflife.deltasch.symbol;

import nl.bytesoflife.deltasch.Fixtures;
import nl.bytesoflife.deltasch.geometry.BoundingBox;
import nl.bytesoflife.deltasch.model.Point;
import nl.bytesoflife.deltasch.model.Schematic;
import nl.bytesoflife.deltasch.parser.ParseException;
import nl.bytesoflife.deltasch.parser.SchematicParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SymbolLibraryTest {

    private static final String MULTI_UNIT = "(kicad_symbol_lib\n"
            + "\t(version 20231120)\n"
            + "\t(symbol \"Dual\"\n"
            + "\t\t(property \"Reference\" \"U\")\n"
            + "\t\t(symbol \"Dual_0_1\" (rectangle (start -5 -5) (end 5 5)))\n"
            + "\t\t(symbol \"Dual_1_1\" (pin input line (at -7.62 0 0) (length 2.54) (name \"A\") (number \"1\")))\n"
            + "\t\t(symbol \"Dual_2_1\" (pin input line (at -7.62 0 0) (length 2.54) (name \"B\") (number \"2\")))\n"
            + "\t)\n"
            + "\t(symbol \"DualAlias\" (extends \"Dual\") (property \"Value\" \"DualAlias\"))\n"
            + ")\n";

    @Test
    void builtinResistorHasTwoPassivePins() throws Exception {
        SymbolDefinition r = BuiltinSymbols.resolver().resolve("Device:R");

        assertEquals(2, r.getPins().size());
        SymbolPin pin1 = r.findPin("1").orElseThrow();
        assertEquals(new Point(0, 3.81), pin1.position());
        assertEquals(PinElectricalType.PASSIVE, pin1.type());
        assertEquals(new Point(0, 2.54), pin1.bodyEnd());
        assertEquals("R", r.getReferencePrefix());
        assertEquals(1, r.getUnitCount());
        assertFalse(r.isPowerSymbol());
    }

    @Test
    void powerSymbolsAreFlagged() throws Exception {
        SymbolDefinition gnd = BuiltinSymbols.resolver().resolve("power:GND");
        assertTrue(gnd.isPowerSymbol());
        assertEquals(1, gnd.getPins().size());
        assertEquals(PinElectricalType.POWER_IN, gnd.getPins().get(0).type());
    }

    @Test
    void libraryAnswersOnlyForItsNickname() {
        SymbolLibrary device = BuiltinSymbols.device();
        assertTrue(device.getSymbolNames().containsAll(List.of("R", "C", "L", "D", "LED")));
        assertNotNull(device.getSymbolNode("R"));
        SymbolNotFoundException e = assertThrows(SymbolNotFoundException.class, () -> device.resolve("power:GND"));
        assertEquals("power:GND", e.getLibId());
        assertThrows(SymbolNotFoundException.class, () -> device.resolve("Device:Nope"));
        assertTrue(device.find("Device:Nope").isEmpty());
    }

    @Test
    void unitsAndInheritance() throws Exception {
        SymbolLibrary library = SymbolLibrary.parse("Test", MULTI_UNIT);

        SymbolDefinition dual = library.resolve("Test:Dual");
        assertEquals(2, dual.getUnitCount());
        assertEquals(1, dual.getPins(1).size());
        assertEquals("A", dual.findPin("1", 1).orElseThrow().name());
        assertTrue(dual.findPin("1", 2).isEmpty());
        assertEquals(new BoundingBox(-7.62, -5, 5, 5), dual.getBounds());

        SymbolDefinition alias = library.resolve("Test:DualAlias");
        assertEquals(2, alias.getPins().size());
        assertEquals("DualAlias", alias.getProperties().get("Value"));
        assertEquals("U", alias.getReferencePrefix());
    }

    @Test
    void nonLibraryDocumentIsRejected() {
        assertThrows(ParseException.class, () -> SymbolLibrary.parse("X", "(kicad_sch (version 20231120))"));
    }

    @Test
    void embeddedResolverReadsLibSymbols() throws Exception {
        Schematic schematic = new SchematicParser().parse(Fixtures.read("single_resistor.kicad_sch"));
        EmbeddedSymbolResolver embedded = new EmbeddedSymbolResolver(schematic);

        SymbolDefinition r = embedded.resolve("Device:R");

        assertEquals(2, r.getPins().size());
        assertThrows(SymbolNotFoundException.class, () -> embedded.resolve("Device:C"));
    }

    @Test
    void compositeTriesResolversInOrder() throws Exception {
        Schematic schematic = new SchematicParser().parse(Fixtures.read("voltage_divider.kicad_sch"));
        SymbolResolver composite = new CompositeSymbolResolver(new EmbeddedSymbolResolver(schematic),
                BuiltinSymbols.resolver());

        assertEquals("Device:R", composite.resolve("Device:R").getLibId());
        assertThrows(SymbolNotFoundException.class, () -> composite.resolve("Other:Thing"));
    }

    @Test
    void cachingResolverRemembersHitsAndMisses() throws Exception {
        AtomicInteger lookups = new AtomicInteger();
        SymbolLibrary device = BuiltinSymbols.device();
        SymbolResolver counting = libId -> {
            lookups.incrementAndGet();
            return device.resolve(libId);
        };
        CachingSymbolResolver caching = new CachingSymbolResolver(counting);

        SymbolDefinition first = caching.resolve("Device:R");
        assertSame(first, caching.resolve("Device:R"));
        assertThrows(SymbolNotFoundException.class, () -> caching.resolve("Device:Nope"));
        assertThrows(SymbolNotFoundException.class, () -> caching.resolve("Device:Nope"));

        assertEquals(2, lookups.get());
        assertEquals(2, caching.size());
        caching.clear();
        assertEquals(0, caching.size());
    }
}
