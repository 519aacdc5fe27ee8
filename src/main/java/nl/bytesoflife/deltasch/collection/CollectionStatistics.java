package nl.bytesoflife.deltasch.collection;

import java.util.Map;

/**
 * Snapshot of a collection for diagnostics.
 *
 * @param counts per-collection breakdown, e.g. elements per lib id or per label kind
 */
public record CollectionStatistics(String elementType, int size, boolean modified, int indexRebuilds,
                                   Map<String, Integer> counts) {
}
