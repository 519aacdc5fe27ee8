package nl.bytesoflife.deltasch.hierarchy;

import nl.bytesoflife.deltasch.model.Component;
import nl.bytesoflife.deltasch.model.Label;
import nl.bytesoflife.deltasch.model.Wire;
import nl.bytesoflife.deltasch.validation.ValidationIssue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Every instance of every sheet laid side by side. Elements are the live elements of the sheet
 * schematics; a reused sheet contributes its elements once per instance path.
 */
public class FlattenedSchematic {

    public record FlatComponent(String path, String reference, String originalReference, Component component) {}

    public record FlatWire(String path, Wire wire) {}

    public record FlatLabel(String path, Label label) {}

    public record ReferenceOrigin(String path, String reference) {}

    private final List<FlatComponent> components = new ArrayList<>();
    private final List<FlatWire> wires = new ArrayList<>();
    private final List<FlatLabel> labels = new ArrayList<>();
    private final Map<String, ReferenceOrigin> references = new LinkedHashMap<>();
    private final List<ValidationIssue> issues = new ArrayList<>();

    void addComponent(String path, String reference, String originalReference, Component component) {
        components.add(new FlatComponent(path, reference, originalReference, component));
        ReferenceOrigin previous = references.putIfAbsent(reference, new ReferenceOrigin(path, originalReference));
        if (previous != null) {
            issues.add(ValidationIssue.warning("Reference " + reference + " at " + path
                    + " is already used at " + previous.path(), "symbol", component.getUuid()).atPath(path));
        }
    }

    void addWire(String path, Wire wire) {
        wires.add(new FlatWire(path, wire));
    }

    void addLabel(String path, Label label) {
        labels.add(new FlatLabel(path, label));
    }

    public List<FlatComponent> getComponents() {
        return Collections.unmodifiableList(components);
    }

    public List<FlatWire> getWires() {
        return Collections.unmodifiableList(wires);
    }

    public List<FlatLabel> getLabels() {
        return Collections.unmodifiableList(labels);
    }

    /**
     * Flattened reference to the sheet path and reference it came from.
     */
    public Map<String, ReferenceOrigin> getReferences() {
        return Collections.unmodifiableMap(references);
    }

    public Optional<ReferenceOrigin> origin(String reference) {
        return Optional.ofNullable(references.get(reference));
    }

    /**
     * Reference collisions. Only possible when references are not prefixed.
     */
    public List<ValidationIssue> getIssues() {
        return Collections.unmodifiableList(issues);
    }
}
