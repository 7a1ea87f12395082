package com.scratchsync.application.usecase;

import com.scratchsync.domain.exception.AssetStorageException;
import com.scratchsync.domain.exception.FetchException;
import com.scratchsync.domain.exception.IngestionException;
import com.scratchsync.domain.exception.UnsupportedFormatException;
import com.scratchsync.domain.model.AssetKind;
import com.scratchsync.domain.model.FetchedContent;
import com.scratchsync.domain.model.HostedAsset;
import com.scratchsync.domain.model.KeyTemplate;
import com.scratchsync.domain.model.Manifest;
import com.scratchsync.domain.model.ManifestEntry;
import com.scratchsync.domain.ports.AssetFetcher;
import com.scratchsync.domain.ports.StorageProvider;
import com.scratchsync.domain.service.ContentAddresser;
import com.scratchsync.domain.service.ContentClassifier;
import com.scratchsync.testing.InMemoryStorageProvider;
import com.scratchsync.testing.StubAssetFetcher;
import com.scratchsync.testing.TestImages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for IngestionOrchestrator.
 */
class IngestionOrchestratorTest {

    private static final String SOURCE = "https://upstream.example/img/42.png";
    private static final KeyTemplate TEMPLATE = KeyTemplate.forAsset("ns", "42", AssetKind.TICKET);

    private StubAssetFetcher fetcher;
    private InMemoryStorageProvider storage;
    private Manifest manifest;
    private byte[] png;

    @BeforeEach
    void setUp() {
        png = TestImages.png("ticket 42");
        fetcher = new StubAssetFetcher().serve(SOURCE, png, "image/png");
        storage = new InMemoryStorageProvider();
        manifest = Manifest.empty();
    }

    @Test
    void testEndToEndHostsUnderContentAddressedKey() throws Exception {
        HostedAsset hosted = orchestrator(HostingOptions.defaults()).ensureHosted(SOURCE, TEMPLATE);

        String sha = ContentAddresser.sha256Hex(png);
        assertEquals("ns/42/ticket-" + sha + ".png", hosted.key());
        assertEquals(InMemoryStorageProvider.BASE_URL + "/ns/42/ticket-" + sha + ".png", hosted.url());
        assertEquals("image/png", hosted.contentType());
        assertEquals(png.length, hosted.bytes());

        InMemoryStorageProvider.StoredObject stored = storage.objects().get(hosted.key());
        assertArrayEquals(png, stored.bytes());
        assertEquals(StorageProvider.IMMUTABLE_CACHE_CONTROL, stored.cacheControl());

        ManifestEntry entry = manifest.get(SOURCE).orElseThrow();
        assertEquals(hosted.key(), entry.key());
        assertEquals(sha, entry.sha256());
        assertEquals("image/png", entry.contentType());
    }

    @Test
    void testSecondCallDownloadsNothing() throws Exception {
        IngestionOrchestrator orchestrator = orchestrator(HostingOptions.defaults());

        HostedAsset first = orchestrator.ensureHosted(SOURCE, TEMPLATE);
        HostedAsset second = orchestrator.ensureHosted(SOURCE, TEMPLATE);

        assertEquals(first.key(), second.key());
        assertEquals(first.url(), second.url());
        assertEquals(1, fetcher.downloads());
        assertEquals(1, storage.putCount());
        assertEquals(1, orchestrator.getReused());
    }

    @Test
    void testManifestFromEarlierRunIsReusedAfterHeadCheck() throws Exception {
        orchestrator(HostingOptions.defaults()).ensureHosted(SOURCE, TEMPLATE);
        StubAssetFetcher nextRunFetcher = new StubAssetFetcher();

        HostedAsset hosted = new IngestionOrchestrator(nextRunFetcher, new ContentClassifier(),
            new ContentAddresser(), storage, new Manifest(manifest.snapshot()), HostingOptions.defaults())
            .ensureHosted(SOURCE, TEMPLATE);

        assertEquals(0, nextRunFetcher.downloads());
        assertNotNull(hosted.etag());
    }

    @Test
    void testStaleManifestEntryTriggersReingest() throws Exception {
        IngestionOrchestrator orchestrator = orchestrator(HostingOptions.defaults());
        HostedAsset first = orchestrator.ensureHosted(SOURCE, TEMPLATE);
        storage.delete(first.key());

        HostedAsset second = orchestrator.ensureHosted(SOURCE, TEMPLATE);

        assertEquals(first.key(), second.key());
        assertEquals(2, fetcher.downloads());
        assertTrue(storage.objects().containsKey(first.key()));
    }

    @Test
    void testCachedKeyOutsideTemplateDirectoryIsNotReused() throws Exception {
        IngestionOrchestrator orchestrator = orchestrator(HostingOptions.defaults());
        orchestrator.ensureHosted(SOURCE, TEMPLATE);

        HostedAsset moved = orchestrator.ensureHosted(SOURCE, KeyTemplate.forAsset("other", "42", AssetKind.TICKET));

        assertTrue(moved.key().startsWith("other/42/ticket-"));
        assertEquals(2, fetcher.downloads());
    }

    @Test
    void testExistingObjectIsNotUploadedAgain() throws Exception {
        orchestrator(HostingOptions.defaults()).ensureHosted(SOURCE, TEMPLATE);
        int putsBefore = storage.putCount();

        // empty manifest, same bytes: the key already exists
        new IngestionOrchestrator(fetcher, new ContentClassifier(), new ContentAddresser(), storage,
            Manifest.empty(), HostingOptions.defaults()).ensureHosted(SOURCE, TEMPLATE);

        assertEquals(putsBefore, storage.putCount());
    }

    @Test
    void testOnlyMissingDisabledAlwaysUploads() throws Exception {
        HostingOptions options = new HostingOptions(2, false, false, false, false, List.of());
        orchestrator(options).ensureHosted(SOURCE, TEMPLATE);

        new IngestionOrchestrator(fetcher, new ContentClassifier(), new ContentAddresser(), storage,
            Manifest.empty(), options).ensureHosted(SOURCE, TEMPLATE);

        assertEquals(2, storage.putCount());
    }

    @Test
    void testRehostAllIgnoresManifest() throws Exception {
        IngestionOrchestrator orchestrator = orchestrator(new HostingOptions(2, false, true, true, false, List.of()));

        orchestrator.ensureHosted(SOURCE, TEMPLATE);
        orchestrator.ensureHosted(SOURCE, TEMPLATE);

        assertEquals(2, fetcher.downloads());
        assertEquals(1, storage.putCount());
    }

    @Test
    void testDryRunTrustsManifestWithoutHead() throws Exception {
        orchestrator(HostingOptions.defaults()).ensureHosted(SOURCE, TEMPLATE);
        int headsBefore = storage.headCount();

        new IngestionOrchestrator(fetcher, new ContentClassifier(), new ContentAddresser(), storage,
            manifest, new HostingOptions(2, true, false, true, false, List.of())).ensureHosted(SOURCE, TEMPLATE);

        assertEquals(headsBefore, storage.headCount());
        assertEquals(1, fetcher.downloads());
    }

    @Test
    void testLocalhostSourceRejected() {
        IngestionException e = assertThrows(IngestionException.class,
            () -> orchestrator(HostingOptions.defaults()).ensureHosted("http://localhost:3000/cdn/a.png", TEMPLATE));

        assertEquals("http://localhost:3000/cdn/a.png", e.getSourceUrl());
        assertEquals(0, fetcher.downloads());
    }

    @Test
    void testFailuresAreWrapped() {
        fetcher.serve("https://upstream.example/img/webp", TestImages.webp("w"), "image/webp");
        IngestionOrchestrator orchestrator = orchestrator(HostingOptions.defaults());

        IngestionException notFound = assertThrows(IngestionException.class,
            () -> orchestrator.ensureHosted("https://upstream.example/img/missing.png", TEMPLATE));
        assertInstanceOf(FetchException.class, notFound.getCause());

        IngestionException webp = assertThrows(IngestionException.class,
            () -> orchestrator.ensureHosted("https://upstream.example/img/webp", TEMPLATE));
        assertInstanceOf(UnsupportedFormatException.class, webp.getCause());

        storage.setFailPuts(true);
        IngestionException outage = assertThrows(IngestionException.class,
            () -> orchestrator.ensureHosted(SOURCE, TEMPLATE));
        assertInstanceOf(AssetStorageException.class, outage.getCause());
        assertTrue(manifest.get(SOURCE).isEmpty());
    }

    @Test
    void testConcurrentCallsForSameSourceDownloadOnce() throws Exception {
        GatedFetcher gated = new GatedFetcher(fetcher);
        IngestionOrchestrator orchestrator = new IngestionOrchestrator(gated, new ContentClassifier(),
            new ContentAddresser(), storage, manifest, HostingOptions.defaults());
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<HostedAsset> first = executor.submit(() -> orchestrator.ensureHosted(SOURCE, TEMPLATE));
            assertTrue(gated.entered.await(5, TimeUnit.SECONDS));
            Future<HostedAsset> second = executor.submit(() -> orchestrator.ensureHosted(SOURCE, TEMPLATE));
            // second caller is parked on the source URL lock while the first download is held open
            Thread.sleep(100);
            gated.release.countDown();

            assertEquals(first.get(5, TimeUnit.SECONDS).key(), second.get(5, TimeUnit.SECONDS).key());
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, gated.calls.get());
        assertEquals(1, storage.putCount());
        assertEquals(1, orchestrator.getReused());
        assertEquals(0, orchestrator.inFlightCount());
    }

    private IngestionOrchestrator orchestrator(HostingOptions options) {
        return new IngestionOrchestrator(fetcher, new ContentClassifier(), new ContentAddresser(),
            storage, manifest, options);
    }

    /**
     * Fetcher that holds the first download open until released.
     */
    private static class GatedFetcher implements AssetFetcher {
        private final AssetFetcher delegate;
        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);
        private final AtomicInteger calls = new AtomicInteger();

        GatedFetcher(AssetFetcher delegate) {
            this.delegate = delegate;
        }

        @Override
        public FetchedContent fetch(String url, Map<String, String> headers) throws FetchException {
            calls.incrementAndGet();
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FetchException(url, "interrupted");
            }
            return delegate.fetch(url, headers);
        }
    }
}
