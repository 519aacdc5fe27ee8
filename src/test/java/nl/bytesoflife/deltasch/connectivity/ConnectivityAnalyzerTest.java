package nl.bytesoflife.deltasch.connectivity;

import nl.bytesoflife.deltasch.Fixtures;
import nl.bytesoflife.deltasch.model.Component;
import nl.bytesoflife.deltasch.model.LabelType;
import nl.bytesoflife.deltasch.model.Point;
import nl.bytesoflife.deltasch.model.Schematic;
import nl.bytesoflife.deltasch.parser.SchematicParser;
import nl.bytesoflife.deltasch.symbol.BuiltinSymbols;
import nl.bytesoflife.deltasch.validation.Severity;
import nl.bytesoflife.deltasch.validation.ValidationIssue;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class ConnectivityAnalyzerTest {

    private final Schematic schematic = Schematic.create();

    private ConnectivityAnalyzer analyzer(Schematic s) {
        return new ConnectivityAnalyzer(s, BuiltinSymbols.resolver());
    }

    private static Set<PinRef> pins(String... refs) {
        Set<PinRef> result = new TreeSet<>();
        for (String ref : refs) {
            String[] parts = ref.split("-");
            result.add(new PinRef(parts[0], parts[1]));
        }
        return result;
    }

    @Test
    void voltageDividerNets() {
        Schematic divider = new SchematicParser().parse(Fixtures.read("voltage_divider.kicad_sch"));
        ConnectivityAnalyzer analyzer = analyzer(divider);

        List<Net> nets = analyzer.getNets();

        assertEquals(List.of("+5V", "GND", "VOUT"), nets.stream().map(Net::getName).toList());
        assertEquals(pins("R1-1"), analyzer.getNet("+5V").orElseThrow().getPins());
        assertEquals(pins("R2-2"), analyzer.getNet("GND").orElseThrow().getPins());
        assertEquals(pins("R1-2", "R2-1"), analyzer.getNet("VOUT").orElseThrow().getPins());
        assertTrue(analyzer.getIssues().isEmpty());
    }

    @Test
    void dividerMidpointPinsAreConnected() {
        Schematic divider = new SchematicParser().parse(Fixtures.read("voltage_divider.kicad_sch"));
        ConnectivityAnalyzer analyzer = analyzer(divider);

        assertTrue(analyzer.arePinsConnected("R1", "2", "R2", "1"));
        assertFalse(analyzer.arePinsConnected("R1", "1", "R2", "2"));
        assertEquals(pins("R2-1"), analyzer.getConnectedPins("R1", "2"));
        assertTrue(analyzer.getConnectedPins("R9", "1").isEmpty());
    }

    @Test
    void powerNetsCarryTheirSymbolValue() {
        Schematic divider = new SchematicParser().parse(Fixtures.read("voltage_divider.kicad_sch"));
        Net supply = analyzer(divider).getNetForPin("R1", "1").orElseThrow();

        assertEquals("+5V", supply.getName());
        assertTrue(supply.isPower());
        assertTrue(supply.isGlobal());
        assertFalse(supply.containsPin("#PWR01", "1"));
    }

    @Test
    void netAtFindsSegmentsAndLabels() {
        Schematic divider = new SchematicParser().parse(Fixtures.read("voltage_divider.kicad_sch"));
        ConnectivityAnalyzer analyzer = analyzer(divider);

        assertEquals("VOUT", analyzer.netAt(new Point(105, 108)).orElseThrow().getName());
        assertEquals("VOUT", analyzer.netAt(new Point(100, 112)).orElseThrow().getName());
        assertEquals(List.of(new Point(100, 108)), analyzer.getNet("VOUT").orElseThrow().getJunctions());
        assertTrue(analyzer.netAt(new Point(10, 10)).isEmpty());
    }

    @Test
    void netAtCrossingOfUnconnectedWiresIsEmpty() {
        schematic.wires().addWire(new Point(0, 5), new Point(10, 5));
        schematic.wires().addWire(new Point(5, 0), new Point(5, 10));
        schematic.labels().add("H", new Point(0, 5), LabelType.LOCAL);
        schematic.labels().add("V", new Point(5, 0), LabelType.LOCAL);
        ConnectivityAnalyzer analyzer = analyzer(schematic);

        assertTrue(analyzer.netAt(new Point(5, 5)).isEmpty());
        assertEquals("V", analyzer.netAt(new Point(5, 2)).orElseThrow().getName());
        assertEquals("H", analyzer.netAt(new Point(10, 5)).orElseThrow().getName());

        schematic.junctions().add(new Point(5, 5));

        assertEquals("H", analyzer.netAt(new Point(5, 5)).orElseThrow().getName());
    }

    @Test
    void unnamedNetUsesFirstPin() {
        schematic.components().add("Device:R", "R1", "1k", new Point(50, 50));
        schematic.components().add("Device:R", "R2", "1k", new Point(80, 50));
        schematic.wires().addWire(new Point(50, 53.81), new Point(80, 53.81));

        ConnectivityAnalyzer analyzer = analyzer(schematic);

        assertEquals("Net-(R1-Pad2)", analyzer.getNetForPin("R2", "2").orElseThrow().getName());
        assertEquals("Net-(R1-Pad1)", analyzer.getNetForPin("R1", "1").orElseThrow().getName());
        assertEquals(3, analyzer.getNets().size());
    }

    @Test
    void danglingWireIsNamedByPosition() {
        schematic.wires().addWire(new Point(10, 10), new Point(20, 10.5));
        List<Net> nets = analyzer(schematic).getNets();
        assertEquals(1, nets.size());
        assertEquals("Net-@(10,10)", nets.get(0).getName());
        assertEquals(1, nets.get(0).getWireUuids().size());
    }

    @Test
    void crossingWiresStayApartUntilJunction() {
        schematic.components().add("Device:R", "R1", "1k", new Point(50, 50));
        Component r2 = schematic.components().add("Device:R", "R2", "1k", new Point(30, 60));
        r2.setRotation(90);
        schematic.wires().addWire(new Point(50, 53.81), new Point(50, 70));
        schematic.wires().addWire(new Point(33.81, 60), new Point(70, 60));
        ConnectivityAnalyzer analyzer = analyzer(schematic);

        assertFalse(analyzer.arePinsConnected("R1", "2", "R2", "2"));

        schematic.junctions().add(new Point(50, 60));

        assertTrue(analyzer.arePinsConnected("R1", "2", "R2", "2"));
    }

    @Test
    void wireEndingOnSegmentConnects() {
        schematic.components().add("Device:R", "R1", "1k", new Point(50, 50));
        Component r2 = schematic.components().add("Device:R", "R2", "1k", new Point(30, 60));
        r2.setRotation(90);
        schematic.wires().addWire(new Point(50, 53.81), new Point(50, 60));
        schematic.wires().addWire(new Point(33.81, 60), new Point(70, 60));

        assertTrue(analyzer(schematic).arePinsConnected("R1", "2", "R2", "2"));
    }

    @Test
    void localLabelsJoinByText() {
        schematic.components().add("Device:R", "R1", "1k", new Point(50, 50));
        schematic.components().add("Device:R", "R2", "1k", new Point(150, 50));
        schematic.labels().add("SDA", new Point(50, 53.81), LabelType.LOCAL);
        schematic.labels().add("SDA", new Point(150, 53.81), LabelType.LOCAL);
        schematic.labels().add("sda", new Point(150, 46.19), LabelType.LOCAL);

        ConnectivityAnalyzer analyzer = analyzer(schematic);

        assertTrue(analyzer.arePinsConnected("R1", "2", "R2", "2"));
        assertFalse(analyzer.arePinsConnected("R1", "2", "R2", "1"));
        assertEquals(pins("R1-2", "R2-2"), analyzer.getNet("SDA").orElseThrow().getPins());
    }

    @Test
    void globalLabelsUnifyUnlessDisabled() {
        schematic.components().add("Device:R", "R1", "1k", new Point(50, 50));
        schematic.components().add("Device:R", "R2", "1k", new Point(150, 50));
        schematic.labels().add("SIG", new Point(50, 46.19), LabelType.GLOBAL);
        schematic.labels().add("SIG", new Point(150, 46.19), LabelType.GLOBAL);

        assertTrue(analyzer(schematic).arePinsConnected("R1", "1", "R2", "1"));

        ConnectivityAnalyzer separate = new ConnectivityAnalyzer(schematic, BuiltinSymbols.resolver(),
                ConnectivityOptions.defaults().withUnifyGlobalLabels(false));
        assertFalse(separate.arePinsConnected("R1", "1", "R2", "1"));
        assertEquals(2, separate.getNets().stream().filter(n -> n.getName().equals("SIG")).count());
    }

    @Test
    void busesAreIgnoredByDefault() {
        schematic.components().add("Device:R", "R1", "1k", new Point(50, 50));
        schematic.components().add("Device:R", "R2", "1k", new Point(80, 50));
        schematic.wires().addBus(List.of(new Point(50, 53.81), new Point(80, 53.81)));

        assertFalse(analyzer(schematic).arePinsConnected("R1", "2", "R2", "2"));
        ConnectivityAnalyzer withBuses = new ConnectivityAnalyzer(schematic, BuiltinSymbols.resolver(),
                ConnectivityOptions.defaults().withIncludeBuses(true));
        assertTrue(withBuses.arePinsConnected("R1", "2", "R2", "2"));
    }

    @Test
    void resultIndependentOfInsertionOrder() {
        List<Consumer<Schematic>> steps = new ArrayList<>(List.of(
                s -> s.components().add("Device:R", "R1", "10k", new Point(100, 100)),
                s -> s.components().add("Device:R", "R2", "4k7", new Point(100, 120)),
                s -> s.components().add("Device:C", "C1", "100n", new Point(120, 120)),
                s -> s.wires().addWire(new Point(100, 103.81), new Point(100, 116.19)),
                s -> s.wires().addPolyline(List.of(new Point(100, 110), new Point(120, 110), new Point(120, 116.19))),
                s -> s.labels().add("MID", new Point(120, 110), LabelType.LOCAL),
                s -> s.wires().addWire(new Point(100, 123.81), new Point(120, 123.81)),
                s -> s.labels().add("LOW", new Point(110, 123.81), LabelType.LOCAL)
        ));

        Map<String, Set<PinRef>> expected = netsOf(build(steps));
        Collections.reverse(steps);
        Map<String, Set<PinRef>> reversed = netsOf(build(steps));
        Collections.swap(steps, 0, 5);
        Collections.swap(steps, 2, 7);
        Map<String, Set<PinRef>> shuffled = netsOf(build(steps));

        assertEquals(pins("R1-2", "R2-1", "C1-1"), expected.get("MID"));
        assertEquals(pins("R2-2", "C1-2"), expected.get("LOW"));
        assertEquals(expected, reversed);
        assertEquals(expected, shuffled);
    }

    private static Schematic build(List<Consumer<Schematic>> steps) {
        Schematic s = Schematic.create();
        steps.forEach(step -> step.accept(s));
        return s;
    }

    private Map<String, Set<PinRef>> netsOf(Schematic s) {
        Map<String, Set<PinRef>> nets = new TreeMap<>();
        for (Net net : analyzer(s).getNets()) {
            nets.put(net.getName(), Set.copyOf(net.getPins()));
        }
        return nets;
    }

    @Test
    void unresolvedSymbolIsReported() {
        schematic.components().add("Vendor:Widget", "U1", "X", new Point(50, 50));
        ConnectivityAnalyzer analyzer = analyzer(schematic);

        assertTrue(analyzer.getNets().isEmpty());
        List<ValidationIssue> issues = analyzer.getIssues();
        assertEquals(1, issues.size());
        assertEquals(Severity.WARNING, issues.get(0).getSeverity());
        assertTrue(issues.get(0).getMessage().contains("Vendor:Widget"));
        assertTrue(analyzer.getNetForPin("U1", "1").isEmpty());
    }

    @Test
    void sharedReferenceIsReported() {
        Component first = schematic.components().add("Device:R", "R1", "1k", new Point(50, 50));
        Component second = schematic.components().add("Device:R", "R2", "1k", new Point(80, 50));
        second.setReference("R1");
        ConnectivityAnalyzer analyzer = analyzer(schematic);

        List<ValidationIssue> issues = analyzer.getIssues();

        assertEquals(1, issues.size());
        assertEquals(Severity.WARNING, issues.get(0).getSeverity());
        assertEquals(second.getUuid(), issues.get(0).getElementId());
        assertTrue(issues.get(0).getMessage().contains(first.getUuid()));
        assertEquals(4, analyzer.getNets().size());
    }

    @Test
    void unitsOfOnePartShareAReferenceWithoutIssues() {
        Component unitA = schematic.components().add("Device:R", "R1", "1k", new Point(50, 50));
        Component unitB = schematic.components().add("Device:R", "R2", "1k", new Point(80, 50));
        unitB.setReference("R1");
        unitB.setUnit(2);

        assertTrue(analyzer(schematic).getIssues().isEmpty());
        assertEquals(1, unitA.getUnit());
    }

    @Test
    void oddRotationIsAnError() {
        String text = "(kicad_sch (version 20231120) (generator \"eeschema\") (uuid \"root\")\n"
                + "\t(symbol (lib_id \"Device:R\") (at 50 50 45) (unit 1) (uuid \"s1\")\n"
                + "\t\t(property \"Reference\" \"R1\" (at 50 50 0))\n"
                + "\t\t(property \"Value\" \"1k\" (at 50 50 0)))\n"
                + ")\n";
        Schematic tilted = new SchematicParser().parse(text);

        List<ValidationIssue> issues = analyzer(tilted).getIssues();

        assertEquals(1, issues.size());
        assertEquals(Severity.ERROR, issues.get(0).getSeverity());
        assertEquals("s1", issues.get(0).getElementId());
    }

    @Test
    void netsAreCachedUntilTheSchematicChanges() {
        schematic.components().add("Device:R", "R1", "1k", new Point(50, 50));
        ConnectivityAnalyzer analyzer = analyzer(schematic);

        List<Net> first = analyzer.getNets();
        assertSame(first, analyzer.getNets());

        schematic.wires().addWire(new Point(50, 53.81), new Point(60, 53.81));

        List<Net> second = analyzer.getNets();
        assertNotSame(first, second);
        assertEquals(1, analyzer.getNetForPin("R1", "2").orElseThrow().getWireUuids().size());
    }

    @Test
    void toleranceWidensMatching() {
        schematic.components().add("Device:R", "R1", "1k", new Point(50, 50));
        schematic.wires().addWire(new Point(50.02, 53.81), new Point(60, 53.81));

        assertTrue(analyzer(schematic).getNetForPin("R1", "2").orElseThrow().getWireUuids().isEmpty());
        ConnectivityAnalyzer loose = new ConnectivityAnalyzer(schematic, BuiltinSymbols.resolver(),
                ConnectivityOptions.defaults().withTolerance(0.05));
        assertEquals(1, loose.getNetForPin("R1", "2").orElseThrow().getWireUuids().size());
        assertThrows(IllegalArgumentException.class, () -> ConnectivityOptions.defaults().withTolerance(-1));
    }

    @Test
    void pinRefsSortNaturally() {
        List<PinRef> refs = new ArrayList<>(List.of(new PinRef("R10", "1"), new PinRef("R2", "10"),
                new PinRef("R2", "2"), new PinRef("C1", "1")));
        Collections.sort(refs);
        assertEquals(List.of(new PinRef("C1", "1"), new PinRef("R2", "2"), new PinRef("R2", "10"),
                new PinRef("R10", "1")), refs);
    }
}
