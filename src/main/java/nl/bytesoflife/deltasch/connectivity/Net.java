package nl.bytesoflife.deltasch.connectivity;

import nl.bytesoflife.deltasch.model.Point;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One electrically connected group of a single schematic. Nets are snapshots: any edit of the
 * schematic makes the analyzer compute new ones.
 */
public class Net {

    private final String name;
    private final SortedSet<PinRef> pins;
    private final SortedSet<String> wireUuids;
    private final List<Point> junctions;
    private final SortedSet<String> labels;
    private final SortedSet<String> hierarchicalLabels;
    private final SortedSet<String> globalLabels;
    private final SortedSet<SheetPinRef> sheetPins;
    private final boolean power;

    Net(String name, SortedSet<PinRef> pins, SortedSet<String> wireUuids, List<Point> junctions,
        SortedSet<String> labels, SortedSet<String> hierarchicalLabels, SortedSet<String> globalLabels,
        SortedSet<SheetPinRef> sheetPins, boolean power) {
        this.name = name;
        this.pins = Collections.unmodifiableSortedSet(pins);
        this.wireUuids = Collections.unmodifiableSortedSet(wireUuids);
        this.junctions = List.copyOf(junctions);
        this.labels = Collections.unmodifiableSortedSet(labels);
        this.hierarchicalLabels = Collections.unmodifiableSortedSet(hierarchicalLabels);
        this.globalLabels = Collections.unmodifiableSortedSet(globalLabels);
        this.sheetPins = Collections.unmodifiableSortedSet(sheetPins);
        this.power = power;
    }

    public String getName() {
        return name;
    }

    public SortedSet<PinRef> getPins() {
        return pins;
    }

    public boolean containsPin(String reference, String pinNumber) {
        return pins.contains(new PinRef(reference, pinNumber));
    }

    public SortedSet<String> getWireUuids() {
        return wireUuids;
    }

    public List<Point> getJunctions() {
        return junctions;
    }

    public SortedSet<String> getLabels() {
        return labels;
    }

    public SortedSet<String> getHierarchicalLabels() {
        return hierarchicalLabels;
    }

    public SortedSet<String> getGlobalLabels() {
        return globalLabels;
    }

    public SortedSet<SheetPinRef> getSheetPins() {
        return sheetPins;
    }

    public Set<String> getAllLabelTexts() {
        Set<String> all = new TreeSet<>(labels);
        all.addAll(hierarchicalLabels);
        all.addAll(globalLabels);
        return all;
    }

    public boolean isPower() {
        return power;
    }

    public boolean isGlobal() {
        return !globalLabels.isEmpty();
    }

    @Override
    public String toString() {
        return name + " " + pins;
    }
}
