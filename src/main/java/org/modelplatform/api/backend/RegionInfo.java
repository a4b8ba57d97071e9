package org.modelplatform.api.backend;

import java.util.List;

/**
 * A region (node) definition. {@code mappedTo} is set for synonyms and names the region the
 * synonym resolves to; it is null for regular regions.
 */
public record RegionInfo(String region, String mappedTo, String parent, String hierarchy) {

    public static final List<String> FIELDS = List.of("region", "mapped_to", "parent", "hierarchy");

    public boolean isSynonym() {
        return mappedTo != null;
    }
}
