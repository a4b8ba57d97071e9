package org.modelplatform.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import org.modelplatform.api.item.ItemData;
import org.modelplatform.api.item.ItemRow;
import org.modelplatform.api.item.ItemType;
import org.modelplatform.api.item.ScalarData;
import org.modelplatform.api.item.TableData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Element-wise comparison of the parameters of two scenarios.
 * <p>
 * Rows of a parameter are matched on their key. Parameters present in only one scenario yield
 * rows that are all {@link Presence#LEFT_ONLY} or all {@link Presence#RIGHT_ONLY}. Parameters of
 * {@code a} come first, in its order, followed by those only {@code b} has.
 */
public final class ScenarioDiff {

    private static final Logger log = LoggerFactory.getLogger(ScenarioDiff.class);

    private static final Comparator<List<String>> KEY_ORDER = (x, y) -> {
        for (int i = 0; i < Math.min(x.size(), y.size()); i++) {
            int c = Objects.toString(x.get(i), "").compareTo(Objects.toString(y.get(i), ""));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(x.size(), y.size());
    };

    public enum Presence {
        LEFT_ONLY,
        RIGHT_ONLY,
        BOTH
    }

    /**
     * One matched key; the fields of the side the key is missing on are null.
     */
    public record Row(List<String> key, Double valueA, String unitA, Double valueB, String unitB,
                      Presence presence) {

        /**
         * @return true unless the key is on both sides with equal value and unit
         */
        public boolean differs() {
            return presence != Presence.BOTH || !Objects.equals(valueA, valueB) || !Objects.equals(unitA, unitB);
        }
    }

    public record ParameterDiff(String name, List<String> indexNames, List<Row> rows) {

        public boolean hasDifferences() {
            for (Row row : rows) {
                if (row.differs()) {
                    return true;
                }
            }
            return false;
        }
    }

    private ScenarioDiff() {
    }

    public static List<ParameterDiff> diff(Scenario a, Scenario b) {
        return diff(a, b, Map.of());
    }

    /**
     * @param filters dimension name to allowed values, applied to both sides like
     *                {@link Scenario#iterItemData}
     */
    public static List<ParameterDiff> diff(Scenario a, Scenario b, Map<String, ? extends Collection<?>> filters) {
        Map<String, Side> left = parameters(a, filters);
        Map<String, Side> right = parameters(b, filters);

        List<ParameterDiff> result = new ArrayList<>();
        for (Map.Entry<String, Side> entry : left.entrySet()) {
            Side other = right.get(entry.getKey());
            result.add(compare(entry.getKey(), entry.getValue(), other == null ? Side.EMPTY : other));
        }
        for (Map.Entry<String, Side> entry : right.entrySet()) {
            if (!left.containsKey(entry.getKey())) {
                result.add(compare(entry.getKey(), Side.EMPTY, entry.getValue()));
            }
        }
        log.debug("Compared {} parameters of {} and {}", result.size(), a, b);
        return result;
    }

    // ==================== Helpers ====================

    private record Side(List<String> indexNames, Map<List<String>, ItemRow> rows) {

        static final Side EMPTY = new Side(null, Map.of());
    }

    private static Map<String, Side> parameters(Scenario scenario, Map<String, ? extends Collection<?>> filters) {
        Map<String, Side> parameters = new LinkedHashMap<>();
        for (Map.Entry<String, ItemData> entry : scenario.iterItemData(ItemType.PAR, filters, null)) {
            Map<List<String>, ItemRow> rows = new LinkedHashMap<>();
            List<String> indexNames;
            ItemData data = entry.getValue();
            if (data instanceof ScalarData scalar) {
                indexNames = List.of();
                rows.put(List.of(), ItemRow.ofParameter(List.of(), scalar.value(), scalar.unit()));
            } else {
                TableData table = (TableData) data;
                indexNames = table.indexNames();
                for (ItemRow row : table.rows()) {
                    rows.put(row.key(), row);
                }
            }
            parameters.put(entry.getKey(), new Side(indexNames, rows));
        }
        return parameters;
    }

    private static ParameterDiff compare(String name, Side a, Side b) {
        Map<List<String>, Row> rows = new TreeMap<>(KEY_ORDER);
        for (Map.Entry<List<String>, ItemRow> entry : a.rows().entrySet()) {
            ItemRow other = b.rows().get(entry.getKey());
            ItemRow row = entry.getValue();
            rows.put(entry.getKey(), other == null
                    ? new Row(entry.getKey(), row.value(), row.unit(), null, null, Presence.LEFT_ONLY)
                    : new Row(entry.getKey(), row.value(), row.unit(), other.value(), other.unit(), Presence.BOTH));
        }
        for (Map.Entry<List<String>, ItemRow> entry : b.rows().entrySet()) {
            if (!a.rows().containsKey(entry.getKey())) {
                ItemRow row = entry.getValue();
                rows.put(entry.getKey(), new Row(entry.getKey(), null, null, row.value(), row.unit(),
                        Presence.RIGHT_ONLY));
            }
        }
        List<String> indexNames = a.indexNames() != null ? a.indexNames() : b.indexNames();
        return new ParameterDiff(name, indexNames, List.copyOf(rows.values()));
    }
}
