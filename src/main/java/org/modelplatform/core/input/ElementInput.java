package org.modelplatform.core.input;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.modelplatform.api.exceptions.ValidationException;

/**
 * Keys, and possibly values, of item elements in one of the accepted input shapes.
 * <p>
 * {@link ElementInputParser} turns every shape into canonical elements. The shape is decided
 * here, when the input is built; interpretation against an item's dimensions happens later.
 * <ul>
 *   <li>{@link #key(Object)}: one bare key component, e.g. {@code "a"} or {@code 2020}</li>
 *   <li>{@link #keys(List)}: a flat list of key components, or a list of key lists</li>
 *   <li>{@link #table(List)}: rows mapping column name to value</li>
 *   <li>{@link #columns(Map)}: column name to parallel lists</li>
 *   <li>{@link #none()}: no key, for 0-dimensional parameters</li>
 * </ul>
 */
public final class ElementInput {

    public enum Shape {
        NONE,
        SCALAR,
        FLAT,
        NESTED,
        TABLE,
        COLUMNS
    }

    private static final ElementInput NONE = new ElementInput(Shape.NONE, null, List.of(), List.of());

    private final Shape shape;
    private final Object scalar;
    private final List<?> keys;
    private final List<Map<String, Object>> rows;

    private ElementInput(Shape shape, Object scalar, List<?> keys, List<Map<String, Object>> rows) {
        this.shape = shape;
        this.scalar = scalar;
        this.keys = keys;
        this.rows = rows;
    }

    public static ElementInput none() {
        return NONE;
    }

    /**
     * @param key a string, number or boolean
     */
    public static ElementInput key(Object key) {
        if (key == null) {
            throw new ValidationException("Element key must not be null; use ElementInput.none() for scalars");
        }
        if (key instanceof List<?> || key instanceof Map<?, ?>) {
            throw new ValidationException("ElementInput.key() takes a single key component, got " + key);
        }
        return new ElementInput(Shape.SCALAR, key, List.of(), List.of());
    }

    /**
     * @param keys either only key components or only key lists
     * @throws ValidationException if the list mixes components and lists
     */
    public static ElementInput keys(List<?> keys) {
        Objects.requireNonNull(keys, "keys");
        int nested = 0;
        for (Object key : keys) {
            if (key instanceof List<?>) {
                nested++;
            } else if (key instanceof Map<?, ?>) {
                throw new ValidationException("Keys must be key components or lists of them, got " + key);
            }
        }
        if (nested > 0 && nested < keys.size()) {
            throw new ValidationException("Keys mix single components and key lists: " + keys);
        }
        Shape shape = nested > 0 ? Shape.NESTED : Shape.FLAT;
        return new ElementInput(shape, null, Collections.unmodifiableList(new ArrayList<>(keys)), List.of());
    }

    public static ElementInput keys(Object... keys) {
        return keys(Arrays.asList(keys));
    }

    /**
     * @param rows one map per element, with a column per index name or a {@code key} column, and
     *             optionally {@code value}, {@code unit} and {@code comment} columns
     */
    public static ElementInput table(List<? extends Map<String, ?>> rows) {
        Objects.requireNonNull(rows, "rows");
        List<Map<String, Object>> copy = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) {
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        return new ElementInput(Shape.TABLE, null, List.of(), Collections.unmodifiableList(copy));
    }

    /**
     * @param columns column name to values; all lists must have the same length
     * @throws ValidationException if the lists differ in length
     */
    public static ElementInput columns(Map<String, ? extends List<?>> columns) {
        Objects.requireNonNull(columns, "columns");
        int length = -1;
        for (Map.Entry<String, ? extends List<?>> column : columns.entrySet()) {
            if (length >= 0 && column.getValue().size() != length) {
                throw new ValidationException("Column '" + column.getKey() + "' has " + column.getValue().size()
                        + " values, other columns have " + length);
            }
            length = column.getValue().size();
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < Math.max(length, 0); i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (Map.Entry<String, ? extends List<?>> column : columns.entrySet()) {
                row.put(column.getKey(), column.getValue().get(i));
            }
            rows.add(Collections.unmodifiableMap(row));
        }
        return new ElementInput(Shape.COLUMNS, null, List.of(), Collections.unmodifiableList(rows));
    }

    public Shape shape() {
        return shape;
    }

    Object scalar() {
        return scalar;
    }

    List<?> keyList() {
        return keys;
    }

    List<Map<String, Object>> rows() {
        return rows;
    }

    /**
     * @return whether the input carries its own columns besides keys
     */
    public boolean isTabular() {
        return shape == Shape.TABLE || shape == Shape.COLUMNS;
    }

    boolean hasColumn(String column) {
        for (Map<String, Object> row : rows) {
            if (row.containsKey(column)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return switch (shape) {
            case NONE -> "ElementInput[none]";
            case SCALAR -> "ElementInput[" + scalar + "]";
            case FLAT, NESTED -> "ElementInput" + keys;
            case TABLE, COLUMNS -> "ElementInput[" + rows.size() + " rows]";
        };
    }
}
