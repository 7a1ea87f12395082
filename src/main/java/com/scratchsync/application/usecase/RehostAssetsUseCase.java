package com.scratchsync.application.usecase;

import com.scratchsync.domain.exception.IngestionException;
import com.scratchsync.domain.model.AssetKind;
import com.scratchsync.domain.model.CatalogEntity;
import com.scratchsync.domain.model.HostedAsset;
import com.scratchsync.domain.model.KeyTemplate;
import com.scratchsync.domain.model.Manifest;
import com.scratchsync.domain.ports.AssetFetcher;
import com.scratchsync.domain.ports.StorageProvider;
import com.scratchsync.domain.service.ContentAddresser;
import com.scratchsync.domain.service.ContentClassifier;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Use case for replacing the asset URLs of scraped entities with hosted copies.
 */
@Service
public class RehostAssetsUseCase {

    private static final Logger logger = LoggerFactory.getLogger(RehostAssetsUseCase.class);

    private final AssetFetcher fetcher;
    private final ContentClassifier classifier;
    private final ContentAddresser addresser;
    private final StorageProvider storage;
    private final HostingOptions options;
    private final ExecutorService executorService;

    public RehostAssetsUseCase(AssetFetcher fetcher,
                               ContentClassifier classifier,
                               ContentAddresser addresser,
                               StorageProvider storage,
                               HostingOptions options) {
        this.fetcher = fetcher;
        this.classifier = classifier;
        this.addresser = addresser;
        this.storage = storage;
        this.options = options;
        this.executorService = Executors.newFixedThreadPool(options.concurrency());
    }

    /**
     * Hosts the ticket and odds images of every entity, one job per entity.
     *
     * Entities are updated in place. A failed asset is logged and its entity keeps the source URL.
     *
     * @param namespace Storage namespace (e.g. "ga/scratchers/images")
     * @param entities  Entities whose asset attributes hold source URLs
     * @param manifest  Manifest of the catalog, updated with every hosted asset
     * @return Coverage per kind
     */
    public RehostReport execute(String namespace, List<CatalogEntity> entities, Manifest manifest) {
        IngestionOrchestrator orchestrator =
            new IngestionOrchestrator(fetcher, classifier, addresser, storage, manifest, options);
        String hostedPrefix = storage.publicUrlFor("");

        Map<AssetKind, AtomicInteger> hosted = new EnumMap<>(AssetKind.class);
        Map<AssetKind, AtomicInteger> total = new EnumMap<>(AssetKind.class);
        for (AssetKind kind : AssetKind.values()) {
            hosted.put(kind, new AtomicInteger());
            total.put(kind, new AtomicInteger());
        }
        AtomicInteger failures = new AtomicInteger();

        List<CompletableFuture<Void>> futures = entities.stream()
            .map(entity -> CompletableFuture.runAsync(
                () -> rehostEntity(orchestrator, namespace, hostedPrefix, entity, hosted, total, failures),
                executorService))
            .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        Map<AssetKind, RehostReport.Coverage> coverage = new EnumMap<>(AssetKind.class);
        for (AssetKind kind : AssetKind.values()) {
            coverage.put(kind, new RehostReport.Coverage(hosted.get(kind).get(), total.get(kind).get()));
        }
        RehostReport report = new RehostReport(namespace, coverage, failures.get(),
            orchestrator.getDownloads(), orchestrator.getUploads());

        logger.info("[rehost] {} ticket={} odds={} downloads={} uploads={} reused={}",
            namespace,
            report.coverageOf(AssetKind.TICKET),
            report.coverageOf(AssetKind.ODDS),
            report.downloads(),
            report.uploads(),
            orchestrator.getReused());
        return report;
    }

    private void rehostEntity(IngestionOrchestrator orchestrator,
                              String namespace,
                              String hostedPrefix,
                              CatalogEntity entity,
                              Map<AssetKind, AtomicInteger> hosted,
                              Map<AssetKind, AtomicInteger> total,
                              AtomicInteger failures) {
        if (entity.getId() == null || entity.getId().isBlank()) {
            return;
        }
        // ticket before odds; a source shared by both slots is fetched once
        Map<String, HostedAsset> hostedBySource = new HashMap<>();
        for (AssetKind kind : AssetKind.values()) {
            String source = entity.getAssetUrl(kind);
            if (source == null) {
                continue;
            }
            total.get(kind).incrementAndGet();

            if (!hostedPrefix.isEmpty() && source.startsWith(hostedPrefix)) {
                hosted.get(kind).incrementAndGet();
                continue;
            }
            HostedAsset shared = hostedBySource.get(source);
            if (shared != null) {
                entity.setAssetUrl(kind, shared.url());
                hosted.get(kind).incrementAndGet();
                continue;
            }

            try {
                HostedAsset asset = orchestrator.ensureHosted(source,
                    KeyTemplate.forAsset(namespace, entity.getId(), kind));
                hostedBySource.put(source, asset);
                entity.setAssetUrl(kind, asset.url());
                hosted.get(kind).incrementAndGet();
            } catch (IngestionException e) {
                failures.incrementAndGet();
                logger.warn("[rehost] game {} ({}) failed: {}", entity.getId(), kind, e.getMessage());
            } catch (RuntimeException e) {
                failures.incrementAndGet();
                logger.warn("[rehost] game {} ({}) failed: {}", entity.getId(), kind, e.toString());
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        executorService.shutdown();
    }
}
