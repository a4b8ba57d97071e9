package org.modelplatform.backend;

import java.util.Collection;
import java.util.Map;

import org.modelplatform.api.backend.SessionRef;
import org.modelplatform.api.item.ItemType;

/**
 * Key of a cached item read.
 *
 * @param sessionId       id of the session handle that performed the read
 * @param type            kind of the item
 * @param name            item name
 * @param filterSignature canonical filter JSON, or null for an unfiltered read
 */
public record CacheKey(long sessionId, ItemType type, String name, String filterSignature) {

    /**
     * @throws org.modelplatform.api.exceptions.ValidationException if a filter value cannot be normalized
     */
    public static CacheKey of(SessionRef session, ItemType type, String name,
                              Map<String, ? extends Collection<?>> filters) {
        return new CacheKey(session.id(), type, name, ElementFilters.signature(ElementFilters.normalize(filters)));
    }

    public boolean isFiltered() {
        return filterSignature != null;
    }
}
