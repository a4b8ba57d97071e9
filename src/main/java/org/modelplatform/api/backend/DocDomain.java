package org.modelplatform.api.backend;

/**
 * Namespaces for documentation strings stored by a backend.
 */
public enum DocDomain {
    MODEL,
    SCENARIO,
    ITEM
}
