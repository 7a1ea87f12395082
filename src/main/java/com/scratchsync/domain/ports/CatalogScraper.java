package com.scratchsync.domain.ports;

import com.scratchsync.domain.model.CatalogScrape;

/**
 * Port for the per-site collaborators that list catalog entities.
 */
public interface CatalogScraper {

    /**
     * Gets the catalog this scraper produces.
     *
     * @return Catalog name (e.g., "ga/scratchers", "ny/scratchers")
     */
    String getName();

    /**
     * Scrapes the upstream site.
     *
     * @return Live entities with source asset URLs, plus upstream-listed ended IDs
     * @throws Exception if scraping fails
     */
    CatalogScrape scrape() throws Exception;
}
