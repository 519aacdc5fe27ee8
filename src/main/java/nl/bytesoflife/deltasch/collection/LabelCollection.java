package nl.bytesoflife.deltasch.collection;

import nl.bytesoflife.deltasch.geometry.BoundingBox;
import nl.bytesoflife.deltasch.geometry.SpatialIndex;
import nl.bytesoflife.deltasch.model.Label;
import nl.bytesoflife.deltasch.model.LabelShape;
import nl.bytesoflife.deltasch.model.LabelType;
import nl.bytesoflife.deltasch.model.Point;
import nl.bytesoflife.deltasch.sexpr.SNode.SList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Local, global and hierarchical labels. {@link #byText} ignores case; callers wanting an exact
 * match filter the result.
 */
public class LabelCollection extends IndexedCollection<Label> {

    private static final Logger log = LoggerFactory.getLogger(LabelCollection.class);

    private final Map<String, List<Label>> byText = new HashMap<>();
    private final Map<LabelType, List<Label>> byType = new EnumMap<>(LabelType.class);
    private final Map<Point, List<Label>> byPosition = new HashMap<>();
    private SpatialIndex<Label> anchors = new SpatialIndex<>();

    public LabelCollection(SList root, Runnable onChange) {
        super(root, onChange);
    }

    @Override
    protected String elementType() {
        return "label";
    }

    @Override
    protected void rebuildIndexes() {
        byText.clear();
        byType.clear();
        byPosition.clear();
        anchors = new SpatialIndex<>();
        for (Label label : items()) {
            anchors.insertPoint(label.getPosition(), label);
            addToIndex(byText, key(label.getText()), label);
            addToIndex(byType, label.getType(), label);
            addToIndex(byPosition, label.getPosition().snapped(), label);
        }
    }

    private static String key(String text) {
        return text.toLowerCase(Locale.ROOT);
    }

    public Label add(String text, Point position, LabelType type) {
        return add(Label.create(text, position, type));
    }

    public Label add(String text, Point position, LabelType type, LabelShape shape) {
        return add(Label.create(text, position, type, shape));
    }

    public List<Label> byText(String text) {
        ensureIndexes();
        return List.copyOf(byText.getOrDefault(key(text), List.of()));
    }

    public List<Label> byType(LabelType type) {
        ensureIndexes();
        return List.copyOf(byType.getOrDefault(type, List.of()));
    }

    public List<Label> at(Point position) {
        ensureIndexes();
        return List.copyOf(byPosition.getOrDefault(position.snapped(), List.of()));
    }

    public List<Label> inRegion(Point corner1, Point corner2) {
        ensureIndexes();
        Set<Label> hits = Collections.newSetFromMap(new IdentityHashMap<>());
        hits.addAll(anchors.query(BoundingBox.of(corner1, corner2)));
        return filter(hits::contains);
    }

    /**
     * Renames every label whose text equals {@code oldName} exactly.
     *
     * @return number of labels renamed
     */
    public int renameNet(String oldName, String newName) {
        int renamed = bulkUpdate(l -> l.getText().equals(oldName), l -> l.setText(newName));
        log.info("Renamed net {} to {} on {} labels", oldName, newName, renamed);
        return renamed;
    }

    @Override
    protected Map<String, Integer> counts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (LabelType type : LabelType.values()) {
            counts.put(type.getTag(), byType.getOrDefault(type, List.of()).size());
        }
        return counts;
    }
}
