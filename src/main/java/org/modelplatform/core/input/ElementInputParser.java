package org.modelplatform.core.input;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.modelplatform.api.exceptions.ValidationException;
import org.modelplatform.api.item.Element;

/**
 * Converts {@link ElementInput} shapes into canonical {@link Element}s for one item.
 * <p>
 * All checks happen here, before anything reaches a backend:
 * <ul>
 *   <li>a bare key for a 1-dimensional item is wrapped into a 1-tuple</li>
 *   <li>a flat list of exactly N components for an N-dimensional item (N &gt; 1) is one key</li>
 *   <li>{@link FieldInput#of(Object)} values apply to every key; {@link FieldInput#each(List)}
 *       values must pair with keys one to one</li>
 *   <li>key components are compared by their string form, so {@code 2020} and {@code "2020"}
 *       name the same element</li>
 * </ul>
 */
public final class ElementInputParser {

    public static final String KEY = "key";
    public static final String VALUE = "value";
    public static final String UNIT = "unit";
    public static final String COMMENT = "comment";

    private ElementInputParser() {
    }

    /**
     * @param name       set name, for messages
     * @param indexNames index names of the set; empty for a plain index set
     * @param key        elements to add
     * @param comment    comments, or {@link FieldInput#none()}
     */
    public static List<Element> parseSet(String name, List<String> indexNames, ElementInput key,
                                         FieldInput<String> comment) {
        if (key.isTabular() && comment.isPresent() && key.hasColumn(COMMENT)) {
            throw new ValidationException("Ambiguous comments for set '" + name
                    + "': both a comment column and a comment argument given");
        }
        if (key.isTabular() && key.hasColumn(VALUE)) {
            throw new ValidationException("Set '" + name + "' does not take values");
        }

        List<List<String>> keys = parseSetKeys(name, indexNames, key);
        List<String> comments = key.isTabular() && key.hasColumn(COMMENT)
                ? stringColumn(key.rows(), COMMENT)
                : comment.expand(keys.size(), COMMENT);

        int dimension = Math.max(indexNames.size(), 1);
        List<Element> elements = new ArrayList<>(keys.size());
        for (int i = 0; i < keys.size(); i++) {
            List<String> k = keys.get(i);
            if (k.size() != dimension) {
                throw new ValidationException(k.size() + "-D key " + k + " invalid for " + dimension + "-D set '"
                        + name + "'" + (indexNames.isEmpty() ? "" : indexNames));
            }
            elements.add(Element.ofKey(k, comments.get(i)));
        }
        return elements;
    }

    /**
     * @param name       parameter name, for messages
     * @param indexNames index names of the parameter; empty for a scalar
     * @param keyOrData  keys, or a table carrying value, unit and comment columns
     * @param value      values unless {@code keyOrData} has a value column
     * @param unit       units unless {@code keyOrData} has a unit column; absent units are left null
     * @param comment    comments unless {@code keyOrData} has a comment column
     */
    public static List<Element> parseParameter(String name, List<String> indexNames, ElementInput keyOrData,
                                               FieldInput<? extends Number> value, FieldInput<String> unit,
                                               FieldInput<String> comment) {
        int dimension = indexNames.size();
        List<List<String>> keys;
        List<Double> values;
        List<String> units;
        List<String> comments;

        if (keyOrData.isTabular()) {
            List<Map<String, Object>> rows = keyOrData.rows();
            keys = tableKeys(name, indexNames, rows);
            values = tabularField(name, keyOrData, VALUE, value, rows.size(), ElementInputParser::toDouble);
            units = tabularField(name, keyOrData, UNIT, unit, rows.size(), ElementInputParser::toText);
            comments = tabularField(name, keyOrData, COMMENT, comment, rows.size(), ElementInputParser::toText);
        } else {
            keys = parameterKeys(name, dimension, keyOrData);
            values = toDoubles(value.expand(keys.size(), VALUE));
            units = unit.expand(keys.size(), UNIT);
            comments = comment.expand(keys.size(), COMMENT);
        }

        List<Element> elements = new ArrayList<>(keys.size());
        for (int i = 0; i < keys.size(); i++) {
            List<String> k = keys.get(i);
            if (values.get(i) == null) {
                throw new ValidationException("No parameter values supplied for '" + name + "'");
            }
            int length = k == null ? 0 : k.size();
            if (length != dimension) {
                throw new ValidationException(length + "-D key " + k + " invalid for " + dimension + "-D parameter '"
                        + name + "'" + indexNames);
            }
            elements.add(new Element(k, values.get(i), units.get(i), comments.get(i)));
        }
        return elements;
    }

    /**
     * Parses keys of elements to delete.
     *
     * @param name       item name, for messages
     * @param indexNames index names of the item
     * @param indexSet   whether the item is a plain index set, whose keys have one component
     * @param key        keys to delete
     * @throws ValidationException if a key does not match the dimension of the item
     */
    public static List<List<String>> parseKeys(String name, List<String> indexNames, boolean indexSet,
                                               ElementInput key) {
        int dimension = indexSet ? 1 : indexNames.size();
        if (key.shape() == ElementInput.Shape.NONE && dimension > 0) {
            throw new ValidationException("Keys of the elements to remove from " + dimension + "-D item '" + name
                    + "' are required");
        }
        List<List<String>> keys = deleteKeys(name, indexNames, key);
        for (List<String> k : keys) {
            if (k.size() != dimension) {
                throw new ValidationException(k.size() + "-D key " + k + " invalid for " + dimension + "-D item '"
                        + name + "'" + (indexNames.isEmpty() ? "" : indexNames));
            }
        }
        return keys;
    }

    private static List<List<String>> deleteKeys(String name, List<String> indexNames, ElementInput key) {
        if (key.isTabular()) {
            return tableKeys(name, indexNames, key.rows());
        }
        return switch (key.shape()) {
            case NONE -> List.of(List.of());
            case SCALAR -> List.of(List.of(component(key.scalar())));
            case FLAT -> indexNames.size() > 1 && key.keyList().size() == indexNames.size()
                    ? List.of(components(key.keyList()))
                    : singleComponentKeys(key.keyList());
            case NESTED -> nestedKeys(key.keyList());
            default -> throw new ValidationException("Unsupported key input " + key + " for '" + name + "'");
        };
    }

    // ==================== Keys ====================

    private static List<List<String>> parseSetKeys(String name, List<String> indexNames, ElementInput key) {
        if (indexNames.isEmpty()) {
            return switch (key.shape()) {
                case SCALAR -> List.of(List.of(component(key.scalar())));
                case FLAT -> singleComponentKeys(key.keyList());
                case NESTED -> nestedKeys(key.keyList());
                default -> throw new ValidationException("Keys for plain set '" + name
                        + "' must be a key or a list of keys, got " + key);
            };
        }
        return switch (key.shape()) {
            case TABLE, COLUMNS -> tableKeys(name, indexNames, key.rows());
            case SCALAR -> List.of(List.of(component(key.scalar())));
            case FLAT -> indexNames.size() == 1 || key.keyList().isEmpty()
                    ? singleComponentKeys(key.keyList())
                    : List.of(components(key.keyList()));
            case NESTED -> nestedKeys(key.keyList());
            case NONE -> throw new ValidationException("Set '" + name + "' needs keys");
        };
    }

    private static List<List<String>> parameterKeys(String name, int dimension, ElementInput key) {
        return switch (key.shape()) {
            case NONE -> {
                List<List<String>> keys = new ArrayList<>(1);
                keys.add(null);
                yield keys;
            }
            case SCALAR -> List.of(List.of(component(key.scalar())));
            case FLAT -> {
                List<?> flat = key.keyList();
                if (dimension > 1 && flat.size() == dimension) {
                    yield List.of(components(flat));
                }
                yield singleComponentKeys(flat);
            }
            case NESTED -> nestedKeys(key.keyList());
            default -> throw new ValidationException("Unsupported key input " + key + " for parameter '" + name + "'");
        };
    }

    private static List<List<String>> tableKeys(String name, List<String> indexNames, List<Map<String, Object>> rows) {
        List<List<String>> keys = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            if (row.containsKey(KEY)) {
                Object k = row.get(KEY);
                keys.add(k instanceof List<?> list ? components(list) : List.of(component(k)));
                continue;
            }
            List<String> k = new ArrayList<>(indexNames.size());
            for (String indexName : indexNames) {
                if (!row.containsKey(indexName)) {
                    throw new ValidationException("Row " + row + " of '" + name + "' has no column '" + indexName
                            + "'; expected columns " + indexNames);
                }
                k.add(component(row.get(indexName)));
            }
            keys.add(k);
        }
        return keys;
    }

    private static List<List<String>> singleComponentKeys(List<?> flat) {
        List<List<String>> keys = new ArrayList<>(flat.size());
        for (Object component : flat) {
            keys.add(List.of(component(component)));
        }
        return keys;
    }

    private static List<List<String>> nestedKeys(List<?> nested) {
        List<List<String>> keys = new ArrayList<>(nested.size());
        for (Object key : nested) {
            keys.add(components((List<?>) key));
        }
        return keys;
    }

    private static List<String> components(List<?> key) {
        List<String> result = new ArrayList<>(key.size());
        for (Object component : key) {
            result.add(component(component));
        }
        return result;
    }

    private static String component(Object component) {
        if (component instanceof String || component instanceof Number || component instanceof Boolean
                || component instanceof Character) {
            return String.valueOf(component);
        }
        throw new ValidationException("Key components must be strings, numbers or booleans, got "
                + (component == null ? "null" : component.getClass().getSimpleName() + " " + component));
    }

    // ==================== Fields ====================

    @FunctionalInterface
    private interface Converter<T> {
        T convert(String name, String column, Object raw);
    }

    private static <T> List<T> tabularField(String name, ElementInput input, String column, FieldInput<?> argument,
                                            int count, Converter<T> converter) {
        if (input.hasColumn(column)) {
            if (argument.isPresent()) {
                throw new ValidationException("Both a '" + column + "' column and a " + column
                        + " argument given for '" + name + "'");
            }
            List<T> result = new ArrayList<>(count);
            for (Map<String, Object> row : input.rows()) {
                result.add(converter.convert(name, column, row.get(column)));
            }
            return result;
        }
        List<T> result = new ArrayList<>(count);
        for (Object raw : argument.expand(count, column)) {
            result.add(converter.convert(name, column, raw));
        }
        return result;
    }

    private static List<String> stringColumn(List<Map<String, Object>> rows, String column) {
        List<String> result = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            result.add(toText(null, column, row.get(column)));
        }
        return result;
    }

    private static List<Double> toDoubles(List<? extends Number> numbers) {
        List<Double> result = new ArrayList<>(numbers.size());
        for (Number number : numbers) {
            result.add(number == null ? null : number.doubleValue());
        }
        return result;
    }

    private static Double toDouble(String name, String column, Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number number) {
            return number.doubleValue();
        }
        if (raw instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new ValidationException("Column '" + column + "' of '" + name + "' holds a non-numeric value '"
                        + text + "'", e);
            }
        }
        throw new ValidationException("Column '" + column + "' of '" + name + "' holds a non-numeric value " + raw);
    }

    private static String toText(String name, String column, Object raw) {
        return raw == null ? null : String.valueOf(raw);
    }
}
