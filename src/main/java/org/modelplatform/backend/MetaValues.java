package org.modelplatform.backend;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import org.modelplatform.api.exceptions.ValidationException;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

/**
 * Normalization and JSON encoding of meta values.
 * <p>
 * Integral numbers are held as {@link Long}, fractional ones as {@link Double}, so every engine
 * returns the same Java types for the same input.
 */
public final class MetaValues {

    private static final Gson GSON = new Gson();

    private MetaValues() {
    }

    /**
     * @param key   meta key, for messages
     * @param value string, number, boolean or a collection of those
     * @return the normalized value
     */
    public static Object normalize(String key, Object value) {
        if (value instanceof Collection<?> collection) {
            List<Object> items = new ArrayList<>(collection.size());
            for (Object item : collection) {
                items.add(normalizeScalar(key, item));
            }
            return Collections.unmodifiableList(items);
        }
        return normalizeScalar(key, value);
    }

    /**
     * @return one of {@code str}, {@code int}, {@code float}, {@code bool}, {@code list}
     */
    public static String typeOf(Object normalized) {
        if (normalized instanceof List) {
            return "list";
        }
        if (normalized instanceof Long) {
            return "int";
        }
        if (normalized instanceof Double) {
            return "float";
        }
        if (normalized instanceof Boolean) {
            return "bool";
        }
        return "str";
    }

    public static String encode(Object normalized) {
        return GSON.toJson(normalized);
    }

    public static Object decode(String json) {
        JsonElement element = JsonParser.parseString(json);
        if (element.isJsonArray()) {
            List<Object> items = new ArrayList<>();
            for (JsonElement item : element.getAsJsonArray()) {
                items.add(fromPrimitive(item.getAsJsonPrimitive()));
            }
            return Collections.unmodifiableList(items);
        }
        return fromPrimitive(element.getAsJsonPrimitive());
    }

    private static Object fromPrimitive(JsonPrimitive primitive) {
        if (primitive.isBoolean()) {
            return primitive.getAsBoolean();
        }
        if (primitive.isNumber()) {
            String text = primitive.getAsString();
            if (text.contains(".") || text.contains("e") || text.contains("E")) {
                return primitive.getAsDouble();
            }
            return primitive.getAsLong();
        }
        return primitive.getAsString();
    }

    private static Object normalizeScalar(String key, Object value) {
        if (value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Double || value instanceof Float) {
            return ((Number) value).doubleValue();
        }
        throw new ValidationException("Meta value for '" + key + "' must be a string, number, boolean or a list of "
                + "those, got " + (value == null ? "null" : value.getClass().getSimpleName()));
    }
}
