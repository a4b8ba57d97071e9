package org.modelplatform.backend;

import org.modelplatform.api.backend.MetaTarget;

/**
 * A stored meta value with the target it is attached to. {@code value} is normalized by
 * {@link MetaValues#normalize(String, Object)}.
 */
public record MetaEntry(MetaTarget target, String key, Object value) {
}
