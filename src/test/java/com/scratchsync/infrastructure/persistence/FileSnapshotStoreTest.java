package com.scratchsync.infrastructure.persistence;

import com.scratchsync.domain.model.CatalogEntity;
import com.scratchsync.domain.model.Delta;
import com.scratchsync.domain.model.Lifecycle;
import com.scratchsync.domain.model.MergedHistory;
import com.scratchsync.domain.model.PublishedIndex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FileSnapshotStore.
 */
class FileSnapshotStoreTest {

    private static final String CATALOG = "fl/scratchers";

    @TempDir
    Path outputDir;

    @Test
    void testWritePublishedWritesBothFiles() throws Exception {
        FileSnapshotStore store = new FileSnapshotStore(outputDir);
        CatalogEntity entity = new CatalogEntity("1501");
        entity.setAttribute("name", "Gold Rush");
        PublishedIndex index = PublishedIndex.of(Instant.parse("2024-05-01T12:00:00Z"), Delta.empty(), List.of(entity));

        byte[] json = store.writePublished(CATALOG, index);

        assertArrayEquals(json, Files.readAllBytes(store.fileFor(CATALOG, FileSnapshotStore.INDEX_FILE)));
        assertArrayEquals(json, Files.readAllBytes(store.fileFor(CATALOG, FileSnapshotStore.LATEST_FILE)));
        String text = new String(json);
        assertTrue(text.contains("\"updatedAt\" : \"2024-05-01T12:00:00Z\""));

        PublishedIndex loaded = store.loadPublished(CATALOG).orElseThrow();
        assertEquals(1, loaded.count());
        assertEquals("1501", loaded.entities().get(0).getId());
        assertEquals("Gold Rush", loaded.entities().get(0).getStringAttribute("name"));
    }

    @Test
    void testMergedRoundTrip() {
        FileSnapshotStore store = new FileSnapshotStore(outputDir);
        MergedHistory merged = MergedHistory.of(Instant.now(), List.of(new CatalogEntity("1"), new CatalogEntity("2")));

        store.writeMerged(CATALOG, merged);

        assertEquals(2, store.loadMerged(CATALOG).orElseThrow().count());
        assertEquals(store.serialize(merged).length, store.fileFor(CATALOG, FileSnapshotStore.MERGED_FILE).toFile().length());
    }

    @Test
    void testMissingFilesAreEmpty() {
        FileSnapshotStore store = new FileSnapshotStore(outputDir);

        assertTrue(store.loadPublished(CATALOG).isEmpty());
        assertTrue(store.loadMerged(CATALOG).isEmpty());
    }

    @Test
    void testCorruptFileIsMovedAside() throws Exception {
        FileSnapshotStore store = new FileSnapshotStore(outputDir);
        Path index = store.fileFor(CATALOG, FileSnapshotStore.INDEX_FILE);
        Files.createDirectories(index.getParent());
        Files.writeString(index, "{\"entities\": [");

        assertTrue(store.loadPublished(CATALOG).isEmpty());

        assertFalse(Files.exists(index));
        try (Stream<Path> files = Files.list(index.getParent())) {
            assertTrue(files.anyMatch(p -> p.getFileName().toString().startsWith("index.json.corrupt-")));
        }
    }

    @Test
    void testLifecycleSurvivesRoundTrip() {
        FileSnapshotStore store = new FileSnapshotStore(outputDir);
        CatalogEntity fresh = new CatalogEntity("1");
        fresh.markLifecycle(Lifecycle.NEW);
        CatalogEntity ended = new CatalogEntity("2");
        ended.setAttribute("overallOdds", "1 in 3.5");
        ended.markLifecycle(Lifecycle.ENDED);
        Delta delta = new Delta(List.of("1"), List.of(), List.of("2"), Map.of("new", 1, "ended", 1));

        store.writePublished(CATALOG, PublishedIndex.of(Instant.now(), delta, List.of(fresh)));
        store.writeMerged(CATALOG, MergedHistory.of(Instant.now(), List.of(fresh, ended)));

        PublishedIndex index = store.loadPublished(CATALOG).orElseThrow();
        assertEquals("new", index.entities().get(0).getStringAttribute(CatalogEntity.LIFECYCLE_ATTRIBUTE));
        assertEquals(List.of("2"), index.deltaIndex().ended());
        MergedHistory merged = store.loadMerged(CATALOG).orElseThrow();
        assertEquals(2, merged.entities().size());
        assertEquals("ended", merged.entities().get(1).getStringAttribute(CatalogEntity.LIFECYCLE_ATTRIBUTE));
        assertEquals("1 in 3.5", merged.entities().get(1).getStringAttribute("overallOdds"));
        assertTrue(Files.exists(store.fileFor(CATALOG, FileSnapshotStore.INDEX_FILE)));
        assertTrue(Files.exists(store.fileFor(CATALOG, FileSnapshotStore.MERGED_FILE)));
    }

    @Test
    void testReadPublishedLeavesCorruptFileInPlace() throws Exception {
        FileSnapshotStore store = new FileSnapshotStore(outputDir);
        Path index = store.fileFor(CATALOG, FileSnapshotStore.INDEX_FILE);
        Files.createDirectories(index.getParent());
        Files.writeString(index, "{\"entities\": [");

        assertTrue(store.readPublished(CATALOG).isEmpty());

        assertTrue(Files.exists(index));
        try (Stream<Path> files = Files.list(index.getParent())) {
            assertEquals(1, files.count());
        }
    }
}
