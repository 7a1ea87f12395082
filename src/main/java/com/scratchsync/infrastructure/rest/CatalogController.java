package com.scratchsync.infrastructure.rest;

import com.scratchsync.application.usecase.RefreshCatalogUseCase;
import com.scratchsync.domain.model.PublishedIndex;
import com.scratchsync.domain.ports.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for catalog operations.
 */
@RestController
@RequestMapping("/catalogs")
public class CatalogController {

    private static final Logger logger = LoggerFactory.getLogger(CatalogController.class);

    private final RefreshCatalogUseCase refreshCatalogUseCase;
    private final SnapshotStore snapshotStore;

    public CatalogController(RefreshCatalogUseCase refreshCatalogUseCase, SnapshotStore snapshotStore) {
        this.refreshCatalogUseCase = refreshCatalogUseCase;
        this.snapshotStore = snapshotStore;
    }

    /**
     * Runs the scrapers and publishes their catalogs.
     *
     * POST /catalogs/refresh[?catalog=ga/scratchers]
     *
     * @return One summary per catalog
     */
    @PostMapping("/refresh")
    public ResponseEntity<RefreshCatalogUseCase.RefreshSummary> refreshCatalogs(
            @RequestParam(name = "catalog", required = false) String catalog) {
        logger.info("Received request to refresh catalogs{}", catalog != null ? " (" + catalog + ")" : "");

        try {
            RefreshCatalogUseCase.RefreshSummary summary = refreshCatalogUseCase.execute(catalog);
            logger.info("Catalog refresh completed for {} catalogs, failed: {}",
                summary.catalogs().size(), summary.hasFatal());
            return ResponseEntity.ok(summary);
        } catch (Exception e) {
            logger.error("Error refreshing catalogs", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * Returns the last published index of a catalog.
     *
     * GET /catalogs/{state}/{kind}/index, e.g. /catalogs/ga/scratchers/index
     */
    @GetMapping("/{state}/{kind}/index")
    public ResponseEntity<PublishedIndex> getIndex(@PathVariable String state, @PathVariable String kind) {
        String catalog = state + "/" + kind;
        try {
            return snapshotStore.readPublished(catalog)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
        } catch (Exception e) {
            logger.error("Error reading index of {}", catalog, e);
            return ResponseEntity.internalServerError().build();
        }
    }
}
