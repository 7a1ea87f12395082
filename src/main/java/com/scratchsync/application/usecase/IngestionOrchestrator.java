package com.scratchsync.application.usecase;

import com.scratchsync.domain.exception.AssetStorageException;
import com.scratchsync.domain.exception.FetchException;
import com.scratchsync.domain.exception.IngestionException;
import com.scratchsync.domain.exception.UnsupportedFormatException;
import com.scratchsync.domain.model.ContentAddress;
import com.scratchsync.domain.model.FetchedContent;
import com.scratchsync.domain.model.HeadResult;
import com.scratchsync.domain.model.HostedAsset;
import com.scratchsync.domain.model.ImageFormat;
import com.scratchsync.domain.model.KeyTemplate;
import com.scratchsync.domain.model.Manifest;
import com.scratchsync.domain.model.ManifestEntry;
import com.scratchsync.domain.ports.AssetFetcher;
import com.scratchsync.domain.ports.StorageProvider;
import com.scratchsync.domain.service.ContentAddresser;
import com.scratchsync.domain.service.ContentClassifier;
import com.scratchsync.domain.service.SourceUrlPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hosts one source URL at a time under a content-addressed key, reusing earlier work recorded
 * in the manifest.
 *
 * One instance serves one run and is shared by all of its workers. Calls for the same source URL
 * are serialized; different URLs proceed in parallel.
 */
public class IngestionOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(IngestionOrchestrator.class);

    private final AssetFetcher fetcher;
    private final ContentClassifier classifier;
    private final ContentAddresser addresser;
    private final StorageProvider storage;
    private final Manifest manifest;
    private final HostingOptions options;
    private final SourceUrlPolicy sourceUrlPolicy;

    private final ConcurrentMap<String, Object> inFlight = new ConcurrentHashMap<>();

    private final AtomicInteger downloads = new AtomicInteger();
    private final AtomicInteger uploads = new AtomicInteger();
    private final AtomicInteger reused = new AtomicInteger();

    public IngestionOrchestrator(AssetFetcher fetcher,
                                 ContentClassifier classifier,
                                 ContentAddresser addresser,
                                 StorageProvider storage,
                                 Manifest manifest,
                                 HostingOptions options) {
        this.fetcher = fetcher;
        this.classifier = classifier;
        this.addresser = addresser;
        this.storage = storage;
        this.manifest = manifest;
        this.options = options;
        this.sourceUrlPolicy = new SourceUrlPolicy(options.allowLocalhost(), options.upstreamHosts());
    }

    /**
     * Makes sure the content behind {@code sourceUrl} is hosted and returns where.
     *
     * @param sourceUrl Upstream URL of the asset
     * @param template  Key template, e.g. "ga/scratchers/images/42/ticket-&lt;sha&gt;.&lt;ext&gt;"
     * @return The hosted asset
     * @throws IngestionException if the URL is refused, or download, classification or upload failed
     */
    public HostedAsset ensureHosted(String sourceUrl, KeyTemplate template) throws IngestionException {
        try {
            sourceUrlPolicy.check(sourceUrl);
        } catch (IllegalArgumentException e) {
            throw new IngestionException(sourceUrl, e.getMessage(), e);
        }

        Object lock = inFlight.computeIfAbsent(sourceUrl, url -> new Object());
        try {
            synchronized (lock) {
                Optional<HostedAsset> cached = reuseFromManifest(sourceUrl, template);
                if (cached.isPresent()) {
                    reused.incrementAndGet();
                    return cached.get();
                }
                return ingest(sourceUrl, template);
            }
        } finally {
            // waiters still hold this lock; later callers find the manifest entry
            inFlight.remove(sourceUrl, lock);
        }
    }

    int inFlightCount() {
        return inFlight.size();
    }

    private Optional<HostedAsset> reuseFromManifest(String sourceUrl, KeyTemplate template) {
        if (options.rehostAll()) {
            return Optional.empty();
        }
        Optional<ManifestEntry> hit = manifest.get(sourceUrl);
        if (hit.isEmpty() || !hit.get().isValid()) {
            return Optional.empty();
        }
        ManifestEntry entry = hit.get();
        if (!entry.key().startsWith(template.directoryPrefix())) {
            logger.debug("[manifest] cached key {} is outside {}, re-ingesting", entry.key(), template.directoryPrefix());
            return Optional.empty();
        }
        if (options.dryRun()) {
            return Optional.of(entry.toHostedAsset(storage.publicUrlFor(entry.key())));
        }
        HeadResult head = storage.head(entry.key());
        if (!head.exists()) {
            logger.info("[manifest] cached object {} is gone, re-ingesting {}", entry.key(), sourceUrl);
            return Optional.empty();
        }
        HostedAsset asset = entry.toHostedAsset(storage.publicUrlFor(entry.key()));
        return Optional.of(head.etag() != null ? asset.withEtag(head.etag()) : asset);
    }

    private HostedAsset ingest(String sourceUrl, KeyTemplate template) throws IngestionException {
        FetchedContent content;
        try {
            downloads.incrementAndGet();
            content = fetcher.fetch(sourceUrl);
        } catch (FetchException e) {
            throw new IngestionException(sourceUrl, "download failed: " + e.getMessage(), e);
        }

        ImageFormat format;
        try {
            format = classifier.classify(content.bytes(), content.declaredContentType());
        } catch (UnsupportedFormatException e) {
            throw new IngestionException(sourceUrl, "unsupported content: " + e.getMessage(), e);
        }

        ContentAddress address = addresser.addressFor(content.bytes(), format, template);

        HostedAsset hosted;
        HeadResult head = storage.head(address.key());
        if (head.exists() && options.onlyMissing()) {
            logger.debug("[storage] {} already present, skipping upload", address.key());
            hosted = new HostedAsset(address.key(), storage.publicUrlFor(address.key()),
                format.getContentType(), head.size().orElse((long) content.size()), head.etag());
        } else {
            try {
                hosted = storage.put(address.key(), content.bytes(), format.getContentType(),
                    StorageProvider.IMMUTABLE_CACHE_CONTROL);
                uploads.incrementAndGet();
            } catch (AssetStorageException e) {
                throw new IngestionException(sourceUrl, "upload failed: " + e.getMessage(), e);
            }
        }

        manifest.put(sourceUrl, ManifestEntry.of(hosted, address.sha256()));
        return hosted;
    }

    public int getDownloads() {
        return downloads.get();
    }

    public int getUploads() {
        return uploads.get();
    }

    public int getReused() {
        return reused.get();
    }
}
