package org.modelplatform.api.item;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Tabular item data: one column per index name followed by the value columns of the kind
 * ({@code value, unit} for parameters, {@code lvl, mrg} for variables and equations, none for
 * sets).
 */
public final class TableData implements ItemData {

    private final ItemType type;
    private final List<String> indexNames;
    private final List<ItemRow> rows;

    public TableData(ItemType type, List<String> indexNames, List<ItemRow> rows) {
        this.type = type;
        this.indexNames = List.copyOf(indexNames);
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public List<String> indexNames() {
        return indexNames;
    }

    public List<ItemRow> rows() {
        return rows;
    }

    /**
     * @return index names followed by the value columns of this kind
     */
    public List<String> columns() {
        List<String> columns = new ArrayList<>(indexNames);
        switch (type) {
            case PAR -> {
                columns.add("value");
                columns.add("unit");
            }
            case VAR, EQU -> {
                columns.add("lvl");
                columns.add("mrg");
            }
            case SET, TS -> {
                // keys only
            }
        }
        return columns;
    }

    /**
     * @param indexName a dimension name of the item
     * @return the values of that dimension, one per row
     */
    public List<String> column(String indexName) {
        int position = indexNames.indexOf(indexName);
        if (position < 0) {
            throw new IllegalArgumentException("No dimension '" + indexName + "' in " + indexNames);
        }
        List<String> values = new ArrayList<>(rows.size());
        for (ItemRow row : rows) {
            values.add(row.keyAt(position));
        }
        return values;
    }

    @Override
    public ItemType type() {
        return type;
    }

    @Override
    public TableData copy() {
        return new TableData(type, indexNames, rows);
    }

    @Override
    public int size() {
        return rows.size();
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof TableData other)) {
            return false;
        }
        return type == other.type && indexNames.equals(other.indexNames) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, indexNames, rows);
    }

    @Override
    public String toString() {
        return "TableData[" + type + ", " + indexNames + ", " + rows.size() + " rows]";
    }
}
