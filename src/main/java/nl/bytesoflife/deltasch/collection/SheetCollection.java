package nl.bytesoflife.deltasch.collection;

import nl.bytesoflife.deltasch.model.Point;
import nl.bytesoflife.deltasch.model.Sheet;
import nl.bytesoflife.deltasch.sexpr.SNode.SList;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class SheetCollection extends IndexedCollection<Sheet> {

    private final Map<String, List<Sheet>> byFilename = new HashMap<>();
    private final Map<String, List<Sheet>> byName = new HashMap<>();

    public SheetCollection(SList root, Runnable onChange) {
        super(root, onChange);
    }

    @Override
    protected String elementType() {
        return "sheet";
    }

    @Override
    protected void rebuildIndexes() {
        byFilename.clear();
        byName.clear();
        for (Sheet sheet : items()) {
            addToIndex(byFilename, sheet.getFilename(), sheet);
            addToIndex(byName, sheet.getName(), sheet);
        }
    }

    public Sheet add(String name, String filename, Point position, double width, double height) {
        if (byName(name).isPresent()) {
            throw new IllegalArgumentException("Sheet name already in use: " + name);
        }
        return add(Sheet.create(name, filename, position, width, height));
    }

    public List<Sheet> byFilename(String filename) {
        ensureIndexes();
        return List.copyOf(byFilename.getOrDefault(filename, List.of()));
    }

    public Optional<Sheet> byName(String name) {
        ensureIndexes();
        List<Sheet> matches = byName.get(name);
        return matches == null ? Optional.empty() : Optional.of(matches.get(0));
    }
}
