package com.scratchsync.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Historical merge file: every entity ever published, ended ones included.
 */
public record MergedHistory(Instant updatedAt, int count, List<CatalogEntity> entities) {

    public static MergedHistory of(Instant updatedAt, List<CatalogEntity> entities) {
        return new MergedHistory(updatedAt, entities.size(), entities);
    }

    public static MergedHistory empty() {
        return new MergedHistory(null, 0, List.of());
    }

    public boolean isEmpty() {
        return entities == null || entities.isEmpty();
    }
}
