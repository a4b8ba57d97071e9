package org.modelplatform.api.item;

/**
 * Result of reading the elements of an item.
 * <p>
 * The concrete shape depends on kind and dimensionality:
 * <ul>
 *   <li>{@link IndexSetData} for a set without index sets</li>
 *   <li>{@link ScalarData} for 0-dimensional parameters, variables and equations</li>
 *   <li>{@link TableData} for everything else</li>
 * </ul>
 * Instances are value objects; {@link #copy()} returns an equal but distinct instance.
 */
public interface ItemData {

    /**
     * @return the kind of the item the data was read from
     */
    ItemType type();

    /**
     * @return a copy equal to this instance that shares no mutable state with it
     */
    ItemData copy();

    /**
     * @return number of stored elements
     */
    int size();
}
