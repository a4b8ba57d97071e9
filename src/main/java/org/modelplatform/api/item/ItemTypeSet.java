package org.modelplatform.api.item;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable combination of {@link ItemType} flags.
 * <p>
 * The derived unions used throughout the platform are available as constants:
 * <ul>
 *   <li>{@link #MODEL} = SET | PAR | VAR | EQU</li>
 *   <li>{@link #SOLUTION} = VAR | EQU</li>
 *   <li>{@link #ALL} = TS | MODEL</li>
 * </ul>
 */
public final class ItemTypeSet {

    public static final ItemTypeSet NONE = new ItemTypeSet(0);
    public static final ItemTypeSet MODEL = of(ItemType.SET, ItemType.PAR, ItemType.VAR, ItemType.EQU);
    public static final ItemTypeSet SOLUTION = of(ItemType.VAR, ItemType.EQU);
    public static final ItemTypeSet ALL = MODEL.with(ItemType.TS);

    private final int bits;

    private ItemTypeSet(int bits) {
        this.bits = bits;
    }

    public static ItemTypeSet of(ItemType... types) {
        int bits = 0;
        for (ItemType type : types) {
            bits |= type.flag();
        }
        return new ItemTypeSet(bits);
    }

    public ItemTypeSet with(ItemType type) {
        return new ItemTypeSet(bits | type.flag());
    }

    public ItemTypeSet union(ItemTypeSet other) {
        return new ItemTypeSet(bits | other.bits);
    }

    public ItemTypeSet intersect(ItemTypeSet other) {
        return new ItemTypeSet(bits & other.bits);
    }

    public boolean contains(ItemType type) {
        return (bits & type.flag()) != 0;
    }

    public boolean isEmpty() {
        return bits == 0;
    }

    public int bits() {
        return bits;
    }

    /**
     * @return the member kinds in declaration order
     */
    public List<ItemType> members() {
        List<ItemType> result = new ArrayList<>();
        for (ItemType type : ItemType.values()) {
            if (contains(type)) {
                result.add(type);
            }
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ItemTypeSet other && other.bits == bits;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(bits);
    }

    @Override
    public String toString() {
        return "ItemTypeSet" + members();
    }
}
