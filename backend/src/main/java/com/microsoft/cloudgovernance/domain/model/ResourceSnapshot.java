package com.microsoft.cloudgovernance.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable view of one cloud resource as returned by Resource Graph.
 *
 * Tag keys are unique; insertion order is kept so analyzer output is stable.
 */
public record ResourceSnapshot(
        String resourceId,
        String name,
        String type,
        String resourceGroup,
        String location,
        String subscriptionId,
        Map<String, String> tags,
        String sku,
        String kind
) {
    public ResourceSnapshot {
        tags = tags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }

    public boolean hasTags() {
        return !tags.isEmpty();
    }

    /**
     * Lower-case resource type, e.g. "microsoft.compute/virtualmachines".
     */
    public String normalizedType() {
        return type == null ? "" : type.toLowerCase();
    }
}
