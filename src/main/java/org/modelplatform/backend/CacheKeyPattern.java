package org.modelplatform.backend;

import java.util.Objects;

import org.modelplatform.api.item.ItemType;

/**
 * Selects cache keys for invalidation. Null {@code type} or {@code name} match any value;
 * {@code anyFilter} matches filtered and unfiltered keys alike.
 */
public record CacheKeyPattern(long sessionId, ItemType type, String name, boolean anyFilter, String filterSignature) {

    /** Every key of a session. */
    public static CacheKeyPattern forSession(long sessionId) {
        return new CacheKeyPattern(sessionId, null, null, true, null);
    }

    /** Every key of one item in a session, filtered or not. */
    public static CacheKeyPattern forItem(long sessionId, ItemType type, String name) {
        return new CacheKeyPattern(sessionId, type, name, true, null);
    }

    /** Exactly one key. */
    public static CacheKeyPattern exact(CacheKey key) {
        return new CacheKeyPattern(key.sessionId(), key.type(), key.name(), false, key.filterSignature());
    }

    public boolean matches(CacheKey key) {
        if (key.sessionId() != sessionId) {
            return false;
        }
        if (type != null && key.type() != type) {
            return false;
        }
        if (name != null && !name.equals(key.name())) {
            return false;
        }
        return anyFilter || Objects.equals(filterSignature, key.filterSignature());
    }
}
