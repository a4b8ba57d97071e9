package org.modelplatform.api.item;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Elements of a plain index set, in insertion order.
 */
public final class IndexSetData implements ItemData {

    private final List<String> keys;

    public IndexSetData(List<String> keys) {
        this.keys = Collections.unmodifiableList(new ArrayList<>(keys));
    }

    public List<String> keys() {
        return keys;
    }

    @Override
    public ItemType type() {
        return ItemType.SET;
    }

    @Override
    public IndexSetData copy() {
        return new IndexSetData(keys);
    }

    @Override
    public int size() {
        return keys.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof IndexSetData other && keys.equals(other.keys);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keys);
    }

    @Override
    public String toString() {
        return "IndexSetData" + keys;
    }
}
