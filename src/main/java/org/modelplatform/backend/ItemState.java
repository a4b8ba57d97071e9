package org.modelplatform.backend;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.modelplatform.api.item.ItemDefinition;
import org.modelplatform.api.item.ItemRow;

/**
 * Definition and elements of one item inside a {@link RunContent}.
 * Rows are keyed by their key tuple and keep insertion order.
 */
public final class ItemState {

    private final ItemDefinition definition;
    private final LinkedHashMap<List<String>, ItemRow> rows = new LinkedHashMap<>();
    private final Map<List<String>, String> comments = new LinkedHashMap<>();

    public ItemState(ItemDefinition definition) {
        this.definition = definition;
    }

    public ItemDefinition definition() {
        return definition;
    }

    public LinkedHashMap<List<String>, ItemRow> rows() {
        return rows;
    }

    public Map<List<String>, String> comments() {
        return comments;
    }

    public void put(ItemRow row, String comment) {
        rows.put(row.key(), row);
        if (comment != null) {
            comments.put(row.key(), comment);
        }
    }

    public void remove(List<String> key) {
        rows.remove(key);
        comments.remove(key);
    }

    public ItemState copy() {
        ItemState copy = new ItemState(definition);
        copy.rows.putAll(rows);
        copy.comments.putAll(comments);
        return copy;
    }
}
