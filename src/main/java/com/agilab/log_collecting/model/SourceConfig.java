package com.agilab.log_collecting.model;

import lombok.Builder;

/**
 * Collection settings of one source.
 */
@Builder(toBuilder = true)
public record SourceConfig(SourceKind sourceKind,
                           String path,
                           boolean enabled,
                           FilterKind filterKind,
                           String filterValue,
                           boolean compress,
                           boolean deleteAfterCollect) {

    public SourceConfig {
        if (filterKind == null) {
            filterKind = FilterKind.ALL;
        }
    }

    public boolean isRemote() {
        return sourceKind.isRemote();
    }

    public String displayName() {
        return sourceKind.getDisplayName();
    }
}
