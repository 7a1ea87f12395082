package com.scratchsync.domain.service;

import com.scratchsync.domain.model.CatalogEntity;
import com.scratchsync.domain.model.Delta;
import com.scratchsync.domain.model.PublishedIndex;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Current snapshot after diffing against the previously published one.
 *
 * @param updatedAt time of this run
 * @param live      entities to publish, each tagged with its lifecycle
 * @param delta     new, continuing and ended IDs
 * @param endedIds  IDs ended in this run (dropped since last publish or listed ended upstream)
 */
public record ReconciledSnapshot(
    Instant updatedAt,
    List<CatalogEntity> live,
    Delta delta,
    Set<String> endedIds
) {
    public boolean isEmpty() {
        return live.isEmpty();
    }

    public PublishedIndex toPublishedIndex() {
        return PublishedIndex.of(updatedAt, delta, live);
    }
}
