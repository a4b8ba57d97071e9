package org.modelplatform.api.item;

import java.util.Locale;

/**
 * Kind of data stored under a scenario.
 * <p>
 * Each constant owns a single flag bit so kinds can be combined into an {@link ItemTypeSet}.
 * Only {@link #SET}, {@link #PAR}, {@link #VAR} and {@link #EQU} are items in the strict sense;
 * {@link #TS} classifies time-series data.
 */
public enum ItemType {
    TS(1),
    SET(2),
    PAR(4),
    VAR(8),
    EQU(16);

    private final int flag;

    ItemType(int flag) {
        this.flag = flag;
    }

    /**
     * @return the flag bit of this kind
     */
    public int flag() {
        return flag;
    }

    /**
     * Human-readable name used in messages and in the stored item tables.
     * <p>
     * The switch has no default branch, so adding a constant without a name fails to compile.
     *
     * @return the display name, e.g. {@code "parameter"}
     */
    public String displayName() {
        return switch (this) {
            case TS -> "timeseries";
            case SET -> "set";
            case PAR -> "parameter";
            case VAR -> "variable";
            case EQU -> "equation";
        };
    }

    /**
     * @return true for variables and equations
     */
    public boolean isSolution() {
        return ItemTypeSet.SOLUTION.contains(this);
    }

    /**
     * Resolves a kind from its constant name or display name, ignoring case.
     *
     * @param name e.g. {@code "par"} or {@code "parameter"}
     * @return the kind
     * @throws IllegalArgumentException if no kind matches
     */
    public static ItemType fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Item type name must not be null");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (ItemType type : values()) {
            if (type.name().toLowerCase(Locale.ROOT).equals(normalized) || type.displayName().equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown item type: " + name);
    }
}
