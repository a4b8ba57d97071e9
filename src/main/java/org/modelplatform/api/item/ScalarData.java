package org.modelplatform.api.item;

import java.util.Objects;

/**
 * Value of a 0-dimensional item: (value, unit) for parameters, (level, marginal) for
 * variables and equations. Fields not applicable to the kind are null.
 */
public final class ScalarData implements ItemData {

    private final ItemType type;
    private final Double value;
    private final String unit;
    private final Double level;
    private final Double marginal;

    private ScalarData(ItemType type, Double value, String unit, Double level, Double marginal) {
        this.type = type;
        this.value = value;
        this.unit = unit;
        this.level = level;
        this.marginal = marginal;
    }

    public static ScalarData ofParameter(Double value, String unit) {
        return new ScalarData(ItemType.PAR, value, unit, null, null);
    }

    public static ScalarData ofSolution(ItemType type, Double level, Double marginal) {
        if (!type.isSolution()) {
            throw new IllegalArgumentException("Solution scalars must be variables or equations, got " + type);
        }
        return new ScalarData(type, null, null, level, marginal);
    }

    public Double value() {
        return value;
    }

    public String unit() {
        return unit;
    }

    public Double level() {
        return level;
    }

    public Double marginal() {
        return marginal;
    }

    @Override
    public ItemType type() {
        return type;
    }

    @Override
    public ScalarData copy() {
        return new ScalarData(type, value, unit, level, marginal);
    }

    @Override
    public int size() {
        return 1;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ScalarData other)) {
            return false;
        }
        return type == other.type
                && Objects.equals(value, other.value)
                && Objects.equals(unit, other.unit)
                && Objects.equals(level, other.level)
                && Objects.equals(marginal, other.marginal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value, unit, level, marginal);
    }

    @Override
    public String toString() {
        return type.isSolution()
                ? "ScalarData[" + type + ", level=" + level + ", marginal=" + marginal + "]"
                : "ScalarData[" + type + ", value=" + value + ", unit=" + unit + "]";
    }
}
