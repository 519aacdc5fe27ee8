package nl.bytesoflife.deltasch.collection;

import nl.bytesoflife.deltasch.model.Label;
import nl.bytesoflife.deltasch.model.LabelShape;
import nl.bytesoflife.deltasch.model.LabelType;
import nl.bytesoflife.deltasch.model.Point;
import nl.bytesoflife.deltasch.model.Schematic;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LabelCollectionTest {

    private final Schematic schematic = Schematic.create();
    private final LabelCollection labels = schematic.labels();

    @Test
    void byTextIgnoresCase() {
        Label upper = labels.add("VOUT", new Point(10, 10), LabelType.LOCAL);
        Label lower = labels.add("vout", new Point(20, 10), LabelType.LOCAL);
        labels.add("GND", new Point(30, 10), LabelType.GLOBAL);

        List<Label> found = labels.byText("Vout");

        assertEquals(2, found.size());
        assertTrue(found.containsAll(List.of(upper, lower)));
    }

    @Test
    void renameNetMatchesExactly() {
        labels.add("VOUT", new Point(10, 10), LabelType.LOCAL);
        labels.add("VOUT", new Point(20, 10), LabelType.GLOBAL, LabelShape.OUTPUT);
        Label other = labels.add("vout", new Point(30, 10), LabelType.LOCAL);

        assertEquals(2, labels.renameNet("VOUT", "ADC_IN"));
        assertEquals(2, labels.byText("adc_in").size());
        assertEquals("vout", other.getText());
        assertEquals(1, labels.byText("VOUT").size());
    }

    @Test
    void byTypeAndShape() {
        labels.add("A", new Point(0, 0), LabelType.LOCAL);
        Label global = labels.add("B", new Point(0, 10), LabelType.GLOBAL, LabelShape.BIDIRECTIONAL);
        Label hier = labels.add("C", new Point(0, 20), LabelType.HIERARCHICAL);

        assertEquals(List.of(global), labels.byType(LabelType.GLOBAL));
        assertEquals(List.of(hier), labels.byType(LabelType.HIERARCHICAL));
        assertEquals(LabelShape.BIDIRECTIONAL, global.getShape());
        assertEquals(LabelShape.INPUT, hier.getShape());
        assertNull(labels.byType(LabelType.LOCAL).get(0).getShape());
    }

    @Test
    void positionIndexFollowsMoves() {
        Label label = labels.add("NET", new Point(10, 10), LabelType.LOCAL);
        assertEquals(List.of(label), labels.at(new Point(10, 10)));

        label.setPosition(new Point(40, 40));

        assertTrue(labels.at(new Point(10, 10)).isEmpty());
        assertEquals(List.of(label), labels.at(new Point(40, 40)));
    }

    @Test
    void inRegionAcceptsCornersInAnyOrder() {
        Label inside = labels.add("IN", new Point(15, 15), LabelType.LOCAL);
        labels.add("OUT", new Point(50, 50), LabelType.LOCAL);
        assertEquals(List.of(inside), labels.inRegion(new Point(20, 20), new Point(10, 10)));
    }

    @Test
    void inRegionIncludesEdgesAndFollowsMovedLabels() {
        Label edge = labels.add("EDGE", new Point(10, 12), LabelType.GLOBAL);
        Label moved = labels.add("MOVED", new Point(100, 100), LabelType.LOCAL);
        assertEquals(List.of(edge), labels.inRegion(new Point(10, 10), new Point(20, 20)));

        moved.setPosition(new Point(20, 20));

        assertEquals(List.of(edge, moved), labels.inRegion(new Point(10, 10), new Point(20, 20)));
    }

    @Test
    void localLabelRejectsShape() {
        Label label = labels.add("A", new Point(0, 0), LabelType.LOCAL);
        assertThrows(IllegalStateException.class, () -> label.setShape(LabelShape.OUTPUT));
    }

    @Test
    void statisticsCountByType() {
        labels.add("A", new Point(0, 0), LabelType.LOCAL);
        labels.add("B", new Point(0, 10), LabelType.LOCAL);
        labels.add("C", new Point(0, 20), LabelType.GLOBAL);
        CollectionStatistics statistics = labels.statistics();
        assertEquals(2, statistics.counts().get("label"));
        assertEquals(1, statistics.counts().get("global_label"));
        assertEquals(0, statistics.counts().get("hierarchical_label"));
    }
}
