package nl.bytesoflife.deltasch.collection;

import nl.bytesoflife.deltasch.model.ElementListener;
import nl.bytesoflife.deltasch.model.SchematicElement;
import nl.bytesoflife.deltasch.sexpr.FormattingRules;
import nl.bytesoflife.deltasch.sexpr.SNode.SList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Ordered list of one element type, indexed by uuid.
 * <p>
 * Secondary indexes are owned by the subclasses. Any mutation, whether through the collection or
 * through a setter of one of its elements, marks them stale; they are rebuilt on the next query
 * that needs them.
 * <p>
 * Adding and removing also inserts and removes the element's list in the document root, so the
 * collection and the text always agree.
 */
public abstract class IndexedCollection<T extends SchematicElement> implements Iterable<T>, ElementListener {

    private static final Logger log = LoggerFactory.getLogger(IndexedCollection.class);

    private final SList root;
    private final Runnable onChange;
    private final List<T> items = new ArrayList<>();
    private final Map<String, T> byUuid = new HashMap<>();
    private boolean indexesDirty = true;
    private boolean modified;
    private int indexRebuilds;

    protected IndexedCollection(SList root, Runnable onChange) {
        this.root = root;
        this.onChange = onChange;
    }

    /**
     * Short name of the element type, used in messages.
     */
    protected abstract String elementType();

    /**
     * Rebuilds the secondary indexes from {@link #items()}.
     */
    protected abstract void rebuildIndexes();

    /**
     * Registers an element whose list is already part of the document, as the parser does.
     * A uuid seen before stays mapped to its first element; the duplicate is still kept in order
     * so the validator can report it.
     */
    public void load(T element) {
        items.add(element);
        String uuid = element.getUuid();
        if (uuid != null && byUuid.putIfAbsent(uuid, element) != null) {
            log.debug("Duplicate {} uuid {} kept for validation", elementType(), uuid);
        }
        element.setListener(this);
        indexesDirty = true;
    }

    /**
     * Adds an element and inserts its list next to the existing elements of the same tag.
     *
     * @throws IllegalArgumentException if an element with the same uuid is already present
     */
    public T add(T element) {
        String uuid = element.getUuid();
        if (uuid != null && byUuid.containsKey(uuid)) {
            throw new IllegalArgumentException("Duplicate " + elementType() + " uuid: " + uuid);
        }
        if (containsInstance(element)) {
            throw new IllegalArgumentException(elementType() + " is already part of this collection");
        }
        root.insert(FormattingRules.insertionIndex(root, element.getTag()), element.getNode());
        items.add(element);
        if (uuid != null) {
            byUuid.put(uuid, element);
        }
        element.setListener(this);
        mutated();
        return element;
    }

    public boolean remove(String uuid) {
        T element = byUuid.get(uuid);
        return element != null && remove(element);
    }

    public boolean remove(T element) {
        int index = indexOfInstance(element);
        if (index < 0) {
            return false;
        }
        items.remove(index);
        root.remove(element.getNode());
        String uuid = element.getUuid();
        if (uuid != null && byUuid.get(uuid) == element) {
            byUuid.remove(uuid);
            for (T other : items) {
                if (uuid.equals(other.getUuid())) {
                    byUuid.put(uuid, other);
                    break;
                }
            }
        }
        element.setListener(null);
        mutated();
        return true;
    }

    /**
     * Removes every element matching the predicate.
     *
     * @return number of elements removed
     */
    public int removeIf(Predicate<? super T> predicate) {
        List<T> matches = filter(predicate);
        for (T element : matches) {
            remove(element);
        }
        return matches.size();
    }

    public Optional<T> get(String uuid) {
        return Optional.ofNullable(byUuid.get(uuid));
    }

    public boolean contains(String uuid) {
        return byUuid.containsKey(uuid);
    }

    public boolean contains(T element) {
        return containsInstance(element);
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    @Override
    public Iterator<T> iterator() {
        return Collections.unmodifiableList(items).iterator();
    }

    public Stream<T> stream() {
        return items.stream();
    }

    public List<T> all() {
        return List.copyOf(items);
    }

    public List<T> filter(Predicate<? super T> predicate) {
        List<T> result = new ArrayList<>();
        for (T element : items) {
            if (predicate.test(element)) {
                result.add(element);
            }
        }
        return result;
    }

    /**
     * Applies {@code patch} to every element matching {@code criteria}.
     *
     * @return number of elements patched
     */
    public int bulkUpdate(Predicate<? super T> criteria, Consumer<? super T> patch) {
        List<T> matches = filter(criteria);
        for (T element : matches) {
            patch.accept(element);
        }
        if (!matches.isEmpty()) {
            mutated();
        }
        log.info("Bulk update changed {} of {} {} elements", matches.size(), items.size(), elementType());
        return matches.size();
    }

    public boolean isModified() {
        return modified;
    }

    public void markClean() {
        modified = false;
    }

    public CollectionStatistics statistics() {
        ensureIndexes();
        return new CollectionStatistics(elementType(), items.size(), modified, indexRebuilds, counts());
    }

    /**
     * Breakdown reported by {@link #statistics()}.
     */
    protected Map<String, Integer> counts() {
        return Map.of();
    }

    @Override
    public void elementChanged(SchematicElement element) {
        mutated();
    }

    protected List<T> items() {
        return items;
    }

    protected SList root() {
        return root;
    }

    protected void ensureIndexes() {
        if (indexesDirty) {
            rebuildIndexes();
            indexesDirty = false;
            indexRebuilds++;
            log.debug("Rebuilt {} indexes over {} elements", elementType(), items.size());
        }
    }

    protected void mutated() {
        indexesDirty = true;
        modified = true;
        onChange.run();
    }

    protected static <K, V> void addToIndex(Map<K, List<V>> index, K key, V value) {
        index.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
    }

    private boolean containsInstance(T element) {
        return indexOfInstance(element) >= 0;
    }

    private int indexOfInstance(T element) {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i) == element) return i;
        }
        return -1;
    }
}
