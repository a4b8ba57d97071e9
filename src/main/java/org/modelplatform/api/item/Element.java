package org.modelplatform.api.item;

import java.util.List;

/**
 * Canonical element form accepted by {@code IBackend#itemSetElements}.
 * <p>
 * {@code key} is null for 0-dimensional parameters. {@code value} and {@code unit} are only
 * meaningful for parameters; {@code comment} is optional for every kind.
 */
public record Element(List<String> key, Double value, String unit, String comment) {

    public Element {
        key = key == null ? null : List.copyOf(key);
    }

    public static Element ofKey(List<String> key) {
        return new Element(key, null, null, null);
    }

    public static Element ofKey(List<String> key, String comment) {
        return new Element(key, null, null, comment);
    }

    public static Element ofValue(List<String> key, double value, String unit) {
        return new Element(key, value, unit, null);
    }

    public static Element ofScalar(double value, String unit) {
        return new Element(null, value, unit, null);
    }
}
