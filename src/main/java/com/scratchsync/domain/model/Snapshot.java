package com.scratchsync.domain.model;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A list of catalog entities at a point in time.
 */
public record Snapshot(Instant updatedAt, List<CatalogEntity> entities) {

    public Snapshot {
        entities = entities == null ? List.of() : entities;
    }

    public static Snapshot empty() {
        return new Snapshot(null, List.of());
    }

    public boolean isEmpty() {
        return entities.isEmpty();
    }

    public Set<String> ids() {
        return entities.stream()
            .map(CatalogEntity::getId)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
