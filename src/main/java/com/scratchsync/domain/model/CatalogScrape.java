package com.scratchsync.domain.model;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Output of one scraper collaborator run.
 *
 * @param catalog        catalog name, also the storage and output prefix (e.g. "ga/scratchers")
 * @param entities       entities observed as live upstream, asset attributes holding source URLs
 * @param endedIds       IDs the upstream explicitly lists as ended; never published as live
 * @param requiredTables row counts of upstream tables/listings the scrape depends on
 */
public record CatalogScrape(
    String catalog,
    List<CatalogEntity> entities,
    Set<String> endedIds,
    Map<String, Integer> requiredTables
) {
    public CatalogScrape {
        entities = entities == null ? List.of() : entities;
        endedIds = endedIds == null ? Set.of() : Set.copyOf(endedIds);
        requiredTables = requiredTables == null ? Map.of() : Map.copyOf(requiredTables);
    }

    public static CatalogScrape of(String catalog, List<CatalogEntity> entities) {
        return new CatalogScrape(catalog, entities, Set.of(), Map.of());
    }

    /**
     * Namespace under which this catalog's images are stored.
     */
    public String assetNamespace() {
        return catalog + "/images";
    }
}
