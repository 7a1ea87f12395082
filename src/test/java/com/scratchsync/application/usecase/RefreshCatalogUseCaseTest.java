package com.scratchsync.application.usecase;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.scratchsync.domain.model.AssetKind;
import com.scratchsync.domain.model.CatalogEntity;
import com.scratchsync.domain.model.CatalogScrape;
import com.scratchsync.domain.model.PublishedIndex;
import com.scratchsync.domain.ports.CatalogScraper;
import com.scratchsync.domain.ports.StorageProvider;
import com.scratchsync.domain.service.ContentAddresser;
import com.scratchsync.domain.service.ContentClassifier;
import com.scratchsync.domain.service.GuardMode;
import com.scratchsync.domain.service.SnapshotReconciler;
import com.scratchsync.infrastructure.persistence.FileSnapshotStore;
import com.scratchsync.infrastructure.persistence.JsonManifestStore;
import com.scratchsync.testing.InMemoryStorageProvider;
import com.scratchsync.testing.StubAssetFetcher;
import com.scratchsync.testing.TestImages;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RefreshCatalogUseCase.
 */
class RefreshCatalogUseCaseTest {

    private static final String CATALOG = "ga/scratchers";

    @TempDir
    Path outputDir;

    private StubAssetFetcher fetcher;
    private InMemoryStorageProvider storage;
    private RehostAssetsUseCase rehost;
    private ListAppender<ILoggingEvent> appender;
    private final List<RefreshCatalogUseCase> created = new ArrayList<>();

    @BeforeEach
    void setUp() {
        fetcher = new StubAssetFetcher();
        storage = new InMemoryStorageProvider();
        rehost = new RehostAssetsUseCase(fetcher, new ContentClassifier(), new ContentAddresser(), storage,
            new HostingOptions(2, false, false, true, false, List.of()));

        appender = new ListAppender<>();
        appender.start();
        ((Logger) LoggerFactory.getLogger(SnapshotReconciler.class)).addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        ((Logger) LoggerFactory.getLogger(SnapshotReconciler.class)).detachAppender(appender);
        created.forEach(RefreshCatalogUseCase::shutdown);
        rehost.shutdown();
    }

    @Test
    void testExecuteSuccess() throws Exception {
        fetcher.serve("https://www.galottery.com/img/1.png", TestImages.png("1"), "image/png");
        CatalogEntity one = entity("1");
        one.setAssetUrl(AssetKind.TICKET, "https://www.galottery.com/img/1.png");
        List<CatalogScraper> scrapers = List.of(
            new TestScraper(CATALOG, List.of(one, entity("2"))),
            new TestScraper("ny/scratchers", List.of(entity("10"))));

        RefreshCatalogUseCase.RefreshSummary summary = useCase(scrapers, CatalogRunSettings.defaults()).execute();

        assertFalse(summary.hasFatal());
        assertEquals(2, summary.catalogs().size());
        assertTrue(Files.exists(outputDir.resolve(CATALOG).resolve(FileSnapshotStore.INDEX_FILE)));
        assertTrue(Files.exists(outputDir.resolve(CATALOG).resolve(FileSnapshotStore.LATEST_FILE)));
        assertTrue(Files.exists(outputDir.resolve(CATALOG).resolve(FileSnapshotStore.MERGED_FILE)));
        assertTrue(Files.exists(outputDir.resolve(CATALOG).resolve(JsonManifestStore.MANIFEST_FILE)));

        InMemoryStorageProvider.StoredObject index = storage.objects().get(CATALOG + "/index.json");
        assertNotNull(index);
        assertEquals(StorageProvider.NO_STORE_CACHE_CONTROL, index.cacheControl());
        String published = Files.readString(outputDir.resolve(CATALOG).resolve(FileSnapshotStore.INDEX_FILE));
        assertTrue(published.contains(InMemoryStorageProvider.BASE_URL + "/ga/scratchers/images/1/ticket-"));
        assertTrue(published.contains("\"deltaIndex\""));
    }

    @Test
    void testDeltaAcrossRuns() {
        useCase(List.of(new TestScraper(CATALOG, entities("1", "2", "3"))), CatalogRunSettings.defaults()).execute();

        RefreshCatalogUseCase.RefreshSummary summary =
            useCase(List.of(new TestScraper(CATALOG, entities("2", "3", "4"))), CatalogRunSettings.defaults()).execute();

        RefreshCatalogUseCase.CatalogRunSummary run = summary.catalogs().get(0);
        assertEquals(List.of("4"), run.delta().newIds());
        assertEquals(List.of("2", "3"), run.delta().continuing());
        assertEquals(List.of("1"), run.delta().ended());
        assertFalse(run.historyGuardTripped());
    }

    @Test
    void testPreviousIndexIsReadBackAcrossRuns() throws Exception {
        CatalogEntity first = entity("1");
        first.setAttribute("overallOdds", "1 in 3.92");
        useCase(List.of(new TestScraper(CATALOG, List.of(first))), CatalogRunSettings.defaults()).execute();

        RefreshCatalogUseCase.RefreshSummary summary =
            useCase(List.of(new TestScraper(CATALOG, entities("1"))), CatalogRunSettings.defaults()).execute();

        assertEquals(List.of("1"), summary.catalogs().get(0).delta().continuing());
        PublishedIndex index = new FileSnapshotStore(outputDir).loadPublished(CATALOG).orElseThrow();
        CatalogEntity published = index.entities().get(0);
        assertEquals("1 in 3.92", published.getStringAttribute("overallOdds"));
        assertEquals("continuing", published.getStringAttribute(CatalogEntity.LIFECYCLE_ATTRIBUTE));
        try (Stream<Path> files = Files.list(outputDir.resolve(CATALOG))) {
            assertTrue(files.noneMatch(p -> p.getFileName().toString().contains(".corrupt-")));
        }
    }

    @Test
    void testZeroEntitiesLeavesFilesUntouched() throws Exception {
        List<CatalogEntity> hundred = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            hundred.add(entity(String.valueOf(i)));
        }
        useCase(List.of(new TestScraper(CATALOG, hundred)), CatalogRunSettings.defaults()).execute();
        Path merged = outputDir.resolve(CATALOG).resolve(FileSnapshotStore.MERGED_FILE);
        Path index = outputDir.resolve(CATALOG).resolve(FileSnapshotStore.INDEX_FILE);
        byte[] mergedBefore = Files.readAllBytes(merged);
        byte[] indexBefore = Files.readAllBytes(index);

        RefreshCatalogUseCase.RefreshSummary summary =
            useCase(List.of(new TestScraper(CATALOG, List.of())), CatalogRunSettings.defaults()).execute();

        assertArrayEquals(mergedBefore, Files.readAllBytes(merged));
        assertArrayEquals(indexBefore, Files.readAllBytes(index));
        RefreshCatalogUseCase.CatalogRunSummary run = summary.catalogs().get(0);
        assertTrue(run.historyGuardTripped());
        assertTrue(run.fatal().contains("scrape returned zero entities"));
        assertTrue(appender.list.stream()
            .anyMatch(e -> e.getLevel() == Level.WARN && e.getFormattedMessage().startsWith("[guard]")));
    }

    @Test
    void testTrippedGuardFailsRunWhenConfigured() {
        useCase(List.of(new TestScraper(CATALOG, entities("1", "2"))), CatalogRunSettings.defaults()).execute();

        RefreshCatalogUseCase.RefreshSummary summary = useCase(List.of(new TestScraper(CATALOG, List.of())),
            new CatalogRunSettings(false, false, 0.0, true)).execute();

        assertTrue(summary.catalogs().get(0).fatal().stream().anyMatch(f -> f.contains("anti-truncation guard")));
    }

    @Test
    void testRequiredTableWithZeroRowsIsFatal() {
        CatalogScrape scrape = new CatalogScrape(CATALOG, entities("1"), Set.of(), Map.of("topPrizes", 0));

        RefreshCatalogUseCase.RefreshSummary summary =
            useCase(List.of(new TestScraper(CATALOG, scrape)), CatalogRunSettings.defaults()).execute();

        assertTrue(summary.hasFatal());
        assertTrue(summary.catalogs().get(0).fatal().get(0).contains("topPrizes"));
    }

    @Test
    void testLowCoverageIsFatal() {
        CatalogEntity broken = entity("1");
        broken.setAssetUrl(AssetKind.TICKET, "https://www.galottery.com/img/missing.png");

        RefreshCatalogUseCase.RefreshSummary summary = useCase(List.of(new TestScraper(CATALOG, List.of(broken))),
            new CatalogRunSettings(false, false, 0.9, false)).execute();

        assertTrue(summary.hasFatal());
        assertTrue(summary.catalogs().get(0).fatal().get(0).startsWith("ticket coverage 0/1"));
    }

    @Test
    void testExecuteWithErrors() {
        List<CatalogScraper> scrapers = List.of(new TestScraper(CATALOG, entities("1")), new FailingScraper("failing"));

        RefreshCatalogUseCase.RefreshSummary summary = useCase(scrapers, CatalogRunSettings.defaults()).execute();

        assertTrue(summary.hasFatal());
        RefreshCatalogUseCase.CatalogRunSummary failed = summary.catalogs().stream()
            .filter(c -> c.catalog().equals("failing")).findFirst().orElseThrow();
        assertEquals(List.of("scraper failed: Test failure"), failed.fatal());
        assertFalse(summary.catalogs().stream().filter(c -> c.catalog().equals(CATALOG)).findFirst().orElseThrow().isFatal());
    }

    @Test
    void testDryRunLeavesManifestAndStorageUntouched() {
        fetcher.serve("https://www.galottery.com/img/1.png", TestImages.png("1"), "image/png");
        CatalogEntity one = entity("1");
        one.setAssetUrl(AssetKind.TICKET, "https://www.galottery.com/img/1.png");

        useCase(List.of(new TestScraper(CATALOG, List.of(one))), new CatalogRunSettings(true, false, 0.0, false)).execute();

        assertFalse(Files.exists(outputDir.resolve(CATALOG).resolve(JsonManifestStore.MANIFEST_FILE)));
    }

    @Test
    void testFilterRunsOnlyMatchingScraper() {
        List<CatalogScraper> scrapers = List.of(new TestScraper(CATALOG, entities("1")), new FailingScraper("failing"));

        RefreshCatalogUseCase.RefreshSummary summary = useCase(scrapers, CatalogRunSettings.defaults()).execute(CATALOG);

        assertEquals(1, summary.catalogs().size());
        assertFalse(summary.hasFatal());
    }

    private RefreshCatalogUseCase useCase(List<CatalogScraper> scrapers, CatalogRunSettings settings) {
        RefreshCatalogUseCase useCase = new RefreshCatalogUseCase(scrapers, rehost, new JsonManifestStore(outputDir),
            new FileSnapshotStore(outputDir), new SnapshotReconciler(GuardMode.RECORD_COUNT), storage, settings);
        created.add(useCase);
        return useCase;
    }

    private static CatalogEntity entity(String id) {
        CatalogEntity entity = new CatalogEntity(id);
        entity.setAttribute("name", "Game " + id);
        entity.setAttribute("price", 5);
        return entity;
    }

    private static List<CatalogEntity> entities(String... ids) {
        List<CatalogEntity> list = new ArrayList<>();
        for (String id : ids) {
            list.add(entity(id));
        }
        return list;
    }

    /**
     * Test scraper returning a fixed scrape.
     */
    private static class TestScraper implements CatalogScraper {
        private final String name;
        private final CatalogScrape scrape;

        TestScraper(String name, List<CatalogEntity> entities) {
            this(name, CatalogScrape.of(name, entities));
        }

        TestScraper(String name, CatalogScrape scrape) {
            this.name = name;
            this.scrape = scrape;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public CatalogScrape scrape() {
            return scrape;
        }
    }

    /**
     * Test scraper that always fails.
     */
    private static class FailingScraper implements CatalogScraper {
        private final String name;

        FailingScraper(String name) {
            this.name = name;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public CatalogScrape scrape() throws Exception {
            throw new Exception("Test failure");
        }
    }
}
