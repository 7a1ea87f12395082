package com.scratchsync.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * The live index written for consumers: exactly the currently live entities plus the delta.
 */
public record PublishedIndex(
    Instant updatedAt,
    int count,
    Delta deltaIndex,
    List<CatalogEntity> entities
) {
    public static PublishedIndex of(Instant updatedAt, Delta delta, List<CatalogEntity> entities) {
        return new PublishedIndex(updatedAt, entities.size(), delta, entities);
    }

    public Snapshot toSnapshot() {
        return new Snapshot(updatedAt, entities);
    }
}
