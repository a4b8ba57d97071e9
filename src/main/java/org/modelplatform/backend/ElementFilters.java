package org.modelplatform.backend;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

import org.modelplatform.api.exceptions.ValidationException;

import com.google.gson.Gson;

/**
 * Normalization of element filters.
 * <p>
 * A filter maps an index name to the allowed values along that dimension. Values are compared
 * by their string form, so {@code 42} and {@code "42"} select the same rows. The normalized form
 * is sorted by index name with sorted, de-duplicated values; its JSON rendering is the stable
 * signature used in cache keys.
 */
public final class ElementFilters {

    private static final Gson GSON = new Gson();

    private ElementFilters() {
    }

    /**
     * @param filters raw filters, may be null
     * @return sorted, string-valued filters; empty if {@code filters} is null or empty
     * @throws ValidationException if a value list is null or holds a value without a stable string form
     */
    public static SortedMap<String, List<String>> normalize(Map<String, ? extends Collection<?>> filters) {
        SortedMap<String, List<String>> normalized = new TreeMap<>();
        if (filters == null) {
            return normalized;
        }
        for (Map.Entry<String, ? extends Collection<?>> entry : filters.entrySet()) {
            if (entry.getKey() == null) {
                throw new ValidationException("Filter dimension names must not be null");
            }
            if (entry.getValue() == null) {
                throw new ValidationException("Filter values for '" + entry.getKey() + "' must be a collection, got null");
            }
            TreeSet<String> values = new TreeSet<>();
            for (Object value : entry.getValue()) {
                values.add(toKeyString(value));
            }
            normalized.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(values)));
        }
        return normalized;
    }

    /**
     * @return canonical JSON of the normalized filters, or null when there are none
     */
    public static String signature(SortedMap<String, List<String>> normalized) {
        return normalized.isEmpty() ? null : GSON.toJson(normalized);
    }

    /**
     * Converts a key component or filter value to the string it is stored and compared as.
     *
     * @throws ValidationException for null and for types other than strings, numbers, booleans and characters
     */
    public static String toKeyString(Object value) {
        if (value instanceof CharSequence || value instanceof Character || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte
                || value instanceof BigInteger) {
            return value.toString();
        }
        if (value instanceof Double || value instanceof Float) {
            return value.toString();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        throw new ValidationException("Unsupported key or filter value " + value
                + (value == null ? "" : " of type " + value.getClass().getName())
                + ": only strings, numbers and booleans are allowed");
    }
}
