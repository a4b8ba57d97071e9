package org.modelplatform.api.item;

import java.util.List;

/**
 * One stored element of an item.
 * <p>
 * Parameters populate {@code value} and {@code unit}; variables and equations populate
 * {@code level} and {@code marginal}; sets only carry the key. The key is empty for
 * 0-dimensional items.
 */
public record ItemRow(List<String> key, Double value, String unit, Double level, Double marginal) {

    public ItemRow {
        key = List.copyOf(key);
    }

    public static ItemRow ofSet(List<String> key) {
        return new ItemRow(key, null, null, null, null);
    }

    public static ItemRow ofParameter(List<String> key, Double value, String unit) {
        return new ItemRow(key, value, unit, null, null);
    }

    public static ItemRow ofSolution(List<String> key, Double level, Double marginal) {
        return new ItemRow(key, null, null, level, marginal);
    }

    /**
     * @param dimension position along the key
     * @return the key component at {@code dimension}
     */
    public String keyAt(int dimension) {
        return key.get(dimension);
    }
}
