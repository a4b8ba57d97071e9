package org.modelplatform.api.item;

/**
 * Selects which index attribute {@code IBackend#itemIndex} returns.
 */
public enum IndexAttribute {
    /** The index sets an item is defined over. */
    SETS,
    /** The dimension names (column labels) of an item. */
    NAMES
}
