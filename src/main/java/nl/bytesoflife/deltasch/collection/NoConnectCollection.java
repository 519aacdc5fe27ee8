package nl.bytesoflife.deltasch.collection;

import nl.bytesoflife.deltasch.model.NoConnect;
import nl.bytesoflife.deltasch.model.Point;
import nl.bytesoflife.deltasch.sexpr.SNode.SList;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class NoConnectCollection extends IndexedCollection<NoConnect> {

    private final Map<Point, List<NoConnect>> byPosition = new HashMap<>();

    public NoConnectCollection(SList root, Runnable onChange) {
        super(root, onChange);
    }

    @Override
    protected String elementType() {
        return "no_connect";
    }

    @Override
    protected void rebuildIndexes() {
        byPosition.clear();
        for (NoConnect noConnect : items()) {
            addToIndex(byPosition, noConnect.getPosition().snapped(), noConnect);
        }
    }

    public NoConnect add(Point position) {
        return add(NoConnect.create(position));
    }

    public Optional<NoConnect> at(Point position) {
        ensureIndexes();
        List<NoConnect> matches = byPosition.get(position.snapped());
        return matches == null ? Optional.empty() : Optional.of(matches.get(0));
    }
}
