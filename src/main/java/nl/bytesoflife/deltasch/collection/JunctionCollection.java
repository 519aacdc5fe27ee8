package nl.bytesoflife.deltasch.collection;

import nl.bytesoflife.deltasch.model.Junction;
import nl.bytesoflife.deltasch.model.Point;
import nl.bytesoflife.deltasch.sexpr.SNode.SList;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class JunctionCollection extends IndexedCollection<Junction> {

    private final Map<Point, List<Junction>> byPosition = new HashMap<>();

    public JunctionCollection(SList root, Runnable onChange) {
        super(root, onChange);
    }

    @Override
    protected String elementType() {
        return "junction";
    }

    @Override
    protected void rebuildIndexes() {
        byPosition.clear();
        for (Junction junction : items()) {
            addToIndex(byPosition, junction.getPosition().snapped(), junction);
        }
    }

    public Junction add(Point position) {
        return add(Junction.create(position));
    }

    public Optional<Junction> at(Point position) {
        ensureIndexes();
        List<Junction> matches = byPosition.get(position.snapped());
        return matches == null ? Optional.empty() : Optional.of(matches.get(0));
    }

    public Optional<Junction> near(Point position, double tolerance) {
        Optional<Junction> exact = at(position);
        if (exact.isPresent()) return exact;
        return stream().filter(j -> j.getPosition().isNear(position, tolerance)).findFirst();
    }

    public boolean removeAt(Point position) {
        Optional<Junction> junction = at(position);
        return junction.isPresent() && remove(junction.get());
    }
}
