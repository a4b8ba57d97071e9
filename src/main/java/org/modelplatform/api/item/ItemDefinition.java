package org.modelplatform.api.item;

import java.util.List;

/**
 * Declaration of an item: kind, name and the index sets it is defined over.
 *
 * @param type       kind of the item
 * @param name       name, unique within a scenario across all kinds
 * @param indexSets  names of the sets indexing this item; empty for 0-dimensional items
 * @param indexNames dimension names, one per index set
 */
public record ItemDefinition(ItemType type, String name, List<String> indexSets, List<String> indexNames) {

    public ItemDefinition {
        indexSets = List.copyOf(indexSets);
        indexNames = List.copyOf(indexNames);
    }

    public int dimension() {
        return indexSets.size();
    }

    /**
     * @return true for a set without index sets, whose elements are plain strings
     */
    public boolean isIndexSet() {
        return type == ItemType.SET && indexSets.isEmpty();
    }
}
