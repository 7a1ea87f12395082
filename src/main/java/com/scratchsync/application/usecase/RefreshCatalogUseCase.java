package com.scratchsync.application.usecase;

import com.scratchsync.domain.exception.AssetStorageException;
import com.scratchsync.domain.exception.ReconciliationGuardTrippedException;
import com.scratchsync.domain.model.AssetKind;
import com.scratchsync.domain.model.CatalogScrape;
import com.scratchsync.domain.model.Delta;
import com.scratchsync.domain.model.Manifest;
import com.scratchsync.domain.model.MergedHistory;
import com.scratchsync.domain.model.PublishedIndex;
import com.scratchsync.domain.model.Snapshot;
import com.scratchsync.domain.ports.CatalogScraper;
import com.scratchsync.domain.ports.ManifestStore;
import com.scratchsync.domain.ports.SnapshotStore;
import com.scratchsync.domain.ports.StorageProvider;
import com.scratchsync.domain.service.MergeOutcome;
import com.scratchsync.domain.service.ReconciledSnapshot;
import com.scratchsync.domain.service.SnapshotReconciler;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Use case for refreshing every catalog: scrape, rehost assets, reconcile against the last
 * published snapshot, publish, and merge into history.
 */
@Service
public class RefreshCatalogUseCase {

    private static final Logger logger = LoggerFactory.getLogger(RefreshCatalogUseCase.class);

    private final List<CatalogScraper> scrapers;
    private final RehostAssetsUseCase rehostAssets;
    private final ManifestStore manifestStore;
    private final SnapshotStore snapshotStore;
    private final SnapshotReconciler reconciler;
    private final StorageProvider storage;
    private final CatalogRunSettings settings;
    private final ExecutorService executorService;

    @Autowired
    public RefreshCatalogUseCase(ObjectProvider<CatalogScraper> scrapers,
                                 RehostAssetsUseCase rehostAssets,
                                 ManifestStore manifestStore,
                                 SnapshotStore snapshotStore,
                                 SnapshotReconciler reconciler,
                                 StorageProvider storage,
                                 CatalogRunSettings settings) {
        this(scrapers.orderedStream().toList(), rehostAssets, manifestStore, snapshotStore,
            reconciler, storage, settings);
    }

    public RefreshCatalogUseCase(List<CatalogScraper> scrapers,
                                 RehostAssetsUseCase rehostAssets,
                                 ManifestStore manifestStore,
                                 SnapshotStore snapshotStore,
                                 SnapshotReconciler reconciler,
                                 StorageProvider storage,
                                 CatalogRunSettings settings) {
        this.scrapers = scrapers;
        this.rehostAssets = rehostAssets;
        this.manifestStore = manifestStore;
        this.snapshotStore = snapshotStore;
        this.reconciler = reconciler;
        this.storage = storage;
        this.settings = settings;
        this.executorService = Executors.newFixedThreadPool(Math.max(scrapers.size(), 2));
    }

    /**
     * Runs all scrapers in parallel and processes their catalogs.
     *
     * @return One summary per scraper
     */
    public RefreshSummary execute() {
        return execute(null);
    }

    /**
     * Runs the scrapers whose name matches, or all of them when {@code catalogFilter} is null.
     */
    public RefreshSummary execute(String catalogFilter) {
        List<CatalogScraper> selected = scrapers.stream()
            .filter(s -> catalogFilter == null || catalogFilter.equals(s.getName()))
            .toList();
        logger.info("Starting catalog refresh with {} scrapers", selected.size());

        List<CompletableFuture<CatalogRunSummary>> futures = selected.stream()
            .map(scraper -> CompletableFuture.supplyAsync(() -> refreshCatalog(scraper), executorService))
            .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<CatalogRunSummary> summaries = new ArrayList<>();
        for (CompletableFuture<CatalogRunSummary> future : futures) {
            CatalogRunSummary summary = future.join();
            summaries.add(summary);
            if (summary.isFatal()) {
                logger.error("Catalog {} failed: {}", summary.catalog(), summary.fatal());
            } else {
                logger.info("Catalog {} published {} entities", summary.catalog(), summary.entities());
            }
        }
        return new RefreshSummary(summaries);
    }

    private CatalogRunSummary refreshCatalog(CatalogScraper scraper) {
        String name = scraper.getName();
        logger.info("Starting scraper: {}", name);

        CatalogScrape scrape;
        try {
            scrape = scraper.scrape();
        } catch (Exception e) {
            logger.error("Scraper {} failed", name, e);
            return CatalogRunSummary.failed(name, "scraper failed: " + e.getMessage());
        }
        String catalog = scrape.catalog() != null ? scrape.catalog() : name;
        List<String> fatal = new ArrayList<>();

        if (scrape.entities().isEmpty()) {
            fatal.add("scrape returned zero entities");
        }
        for (Map.Entry<String, Integer> table : scrape.requiredTables().entrySet()) {
            if (table.getValue() == null || table.getValue() == 0) {
                fatal.add("required table '" + table.getKey() + "' has zero rows");
            }
        }

        RehostReport rehost = rehost(catalog, scrape);
        for (AssetKind kind : AssetKind.values()) {
            RehostReport.Coverage coverage = rehost.coverageOf(kind);
            if (coverage.total() > 0 && coverage.ratio() < settings.minCoverage()) {
                fatal.add(kind + " coverage " + coverage + " below minimum "
                    + Math.round(settings.minCoverage() * 100) + "%");
            }
        }

        Snapshot previous = snapshotStore.loadPublished(catalog)
            .map(PublishedIndex::toSnapshot)
            .orElse(Snapshot.empty());
        ReconciledSnapshot reconciled = reconciler.reconcile(previous, scrape, Instant.now());
        Delta delta = reconciled.delta();
        logger.info("Catalog {} delta: {}", catalog, delta.counts());

        if (reconciled.isEmpty()) {
            logger.warn("[guard] {} has no live entities, keeping the published index", catalog);
        } else {
            publish(catalog, reconciled.toPublishedIndex());
        }

        MergedHistory history = snapshotStore.loadMerged(catalog).orElse(MergedHistory.empty());
        MergeOutcome outcome = reconciler.mergeHistory(history, reconciled,
            merged -> snapshotStore.serialize(merged).length);
        if (outcome.refused()) {
            if (settings.failOnGuard()) {
                ReconciliationGuardTrippedException e =
                    new ReconciliationGuardTrippedException(catalog, outcome.reason());
                logger.error(e.getMessage());
                fatal.add(e.getMessage());
            }
        } else {
            snapshotStore.writeMerged(catalog, outcome.history());
        }

        return new CatalogRunSummary(catalog, reconciled.live().size(), delta, rehost, outcome.refused(), fatal);
    }

    private RehostReport rehost(String catalog, CatalogScrape scrape) {
        Manifest manifest = manifestStore.load(catalog);
        if (settings.remoteMirror()) {
            manifest.putAll(manifestStore.loadFromRemoteMirror(catalog, storage));
        }
        try {
            return rehostAssets.execute(scrape.assetNamespace(), scrape.entities(), manifest);
        } finally {
            if (!settings.dryRun()) {
                manifestStore.save(catalog, manifest);
                if (settings.remoteMirror()) {
                    manifestStore.saveToRemoteMirror(catalog, manifest, storage);
                }
            }
        }
    }

    private void publish(String catalog, PublishedIndex index) {
        byte[] json = snapshotStore.writePublished(catalog, index);
        for (String name : List.of("index.json", "index.latest.json")) {
            String key = catalog + "/" + name;
            try {
                storage.put(key, json, "application/json", StorageProvider.NO_STORE_CACHE_CONTROL);
            } catch (AssetStorageException e) {
                logger.warn("[upload] {} skipped: {}", key, e.getMessage());
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        executorService.shutdown();
    }

    public record CatalogRunSummary(
        String catalog,
        int entities,
        Delta delta,
        RehostReport rehost,
        boolean historyGuardTripped,
        List<String> fatal
    ) {
        static CatalogRunSummary failed(String catalog, String reason) {
            return new CatalogRunSummary(catalog, 0, Delta.empty(), null, false, List.of(reason));
        }

        public boolean isFatal() {
            return !fatal.isEmpty();
        }
    }

    public record RefreshSummary(List<CatalogRunSummary> catalogs) {

        public boolean hasFatal() {
            return catalogs.stream().anyMatch(CatalogRunSummary::isFatal);
        }
    }
}
