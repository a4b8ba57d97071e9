package org.modelplatform.core.input;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.modelplatform.api.exceptions.ValidationException;

/**
 * Value, unit or comment accompanying element keys.
 * <p>
 * {@link #of(Object)} applies one value to every key. {@link #each(List)} pairs values with keys
 * one to one, so its length must match the number of keys, also when it holds a single value.
 *
 * @param <T> field type
 */
public final class FieldInput<T> {

    private static final FieldInput<?> NONE = new FieldInput<>(null, null);

    private final T single;
    private final List<T> values;

    private FieldInput(T single, List<T> values) {
        this.single = single;
        this.values = values;
    }

    @SuppressWarnings("unchecked")
    public static <T> FieldInput<T> none() {
        return (FieldInput<T>) NONE;
    }

    /**
     * @param value value for every key; null is the same as {@link #none()}
     */
    public static <T> FieldInput<T> of(T value) {
        return value == null ? none() : new FieldInput<>(value, null);
    }

    public static <T> FieldInput<T> each(List<T> values) {
        Objects.requireNonNull(values, "values");
        return new FieldInput<>(null, Collections.unmodifiableList(new ArrayList<>(values)));
    }

    public boolean isPresent() {
        return single != null || values != null;
    }

    public boolean isBroadcast() {
        return single != null;
    }

    /**
     * Expands the field to one entry per key.
     *
     * @param count number of keys
     * @param field field name used in messages
     * @return {@code count} entries; nulls if the field is absent
     * @throws ValidationException if paired values do not match {@code count}
     */
    public List<T> expand(int count, String field) {
        if (values != null) {
            if (values.size() != count) {
                throw new ValidationException("Length mismatch between keys and " + field + "s: " + count
                        + " key(s), " + values.size() + " " + field + "(s)");
            }
            return values;
        }
        return Collections.nCopies(count, single);
    }

    @Override
    public String toString() {
        if (single != null) {
            return "FieldInput[" + single + "]";
        }
        return values == null ? "FieldInput[none]" : "FieldInput" + values;
    }
}
