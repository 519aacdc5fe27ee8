package nl.bytesoflife.deltasch.collection;

import nl.bytesoflife.deltasch.model.GraphicItem;
import nl.bytesoflife.deltasch.model.Point;
import nl.bytesoflife.deltasch.sexpr.SNode.SList;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Text, shapes and every other item without connectivity meaning, indexed by tag.
 */
public class GraphicCollection extends IndexedCollection<GraphicItem> {

    private final Map<String, List<GraphicItem>> byTag = new HashMap<>();

    public GraphicCollection(SList root, Runnable onChange) {
        super(root, onChange);
    }

    @Override
    protected String elementType() {
        return "graphic";
    }

    @Override
    protected void rebuildIndexes() {
        byTag.clear();
        for (GraphicItem item : items()) {
            addToIndex(byTag, item.getTag(), item);
        }
    }

    public GraphicItem addText(String text, Point position) {
        return add(GraphicItem.text(text, position));
    }

    public GraphicItem addPolyline(List<Point> points) {
        return add(GraphicItem.polyline(points));
    }

    public List<GraphicItem> byTag(String tag) {
        ensureIndexes();
        return List.copyOf(byTag.getOrDefault(tag, List.of()));
    }

    public List<GraphicItem> opaque() {
        return filter(GraphicItem::isOpaque);
    }

    @Override
    protected Map<String, Integer> counts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Map.Entry<String, List<GraphicItem>> entry : new TreeMap<>(byTag).entrySet()) {
            counts.put(entry.getKey(), entry.getValue().size());
        }
        return counts;
    }
}
