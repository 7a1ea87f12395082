package com.scratchsync.domain.ports;

import com.scratchsync.domain.model.MergedHistory;
import com.scratchsync.domain.model.PublishedIndex;

import java.util.Optional;

/**
 * Port for the published index and the historical merge file of each catalog.
 */
public interface SnapshotStore {

    /**
     * @return The last published index, empty when the catalog was never published
     */
    Optional<PublishedIndex> loadPublished(String catalog);

    /**
     * Read-only variant of {@link #loadPublished(String)}: an unreadable index is reported as
     * absent and left where it is.
     */
    Optional<PublishedIndex> readPublished(String catalog);

    /**
     * @return The historical merge, empty when none exists
     */
    Optional<MergedHistory> loadMerged(String catalog);

    /**
     * Writes the published index (and its latest mirror).
     *
     * @return Serialized bytes written
     */
    byte[] writePublished(String catalog, PublishedIndex index);

    /**
     * Writes the historical merge file.
     */
    void writeMerged(String catalog, MergedHistory merged);

    /**
     * Serialized form of a merge, used to compare sizes before overwriting.
     */
    byte[] serialize(MergedHistory merged);
}
