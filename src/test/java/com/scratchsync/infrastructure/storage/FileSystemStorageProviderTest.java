package com.scratchsync.infrastructure.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.scratchsync.domain.exception.AssetStorageException;
import com.scratchsync.domain.model.HeadResult;
import com.scratchsync.domain.model.HostedAsset;
import com.scratchsync.domain.ports.StorageProvider;
import com.scratchsync.infrastructure.persistence.JsonFiles;
import com.scratchsync.testing.TestImages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FileSystemStorageProvider and DryRunStorageProvider.
 */
class FileSystemStorageProviderTest {

    @TempDir
    Path baseDir;

    private FileSystemStorageProvider provider;

    @BeforeEach
    void setUp() {
        provider = new FileSystemStorageProvider(baseDir, "http://localhost:3000/cdn/");
    }

    @Test
    void testPutWritesObjectAndHeadersSidecar() throws Exception {
        byte[] png = TestImages.png("fs");

        HostedAsset hosted = provider.put("/ga/scratchers/images/42/ticket-abc.png", png, "image/png",
            StorageProvider.IMMUTABLE_CACHE_CONTROL);

        Path file = baseDir.resolve("ga/scratchers/images/42/ticket-abc.png");
        assertArrayEquals(png, Files.readAllBytes(file));
        assertEquals("ga/scratchers/images/42/ticket-abc.png", hosted.key());
        assertEquals("http://localhost:3000/cdn/ga/scratchers/images/42/ticket-abc.png", hosted.url());
        assertNull(hosted.etag());

        JsonNode headers = JsonFiles.OBJECT_MAPPER.readTree(
            baseDir.resolve("ga/scratchers/images/42/ticket-abc.png.headers.json").toFile());
        assertEquals("image/png", headers.get("Content-Type").asText());
        assertEquals(StorageProvider.IMMUTABLE_CACHE_CONTROL, headers.get("Cache-Control").asText());
    }

    @Test
    void testHeadAndRead() {
        assertFalse(provider.head("a/b.png").exists());
        assertTrue(provider.read("a/b.png").isEmpty());

        provider.put("a/b.png", TestImages.png("x"), "image/png", null);

        HeadResult head = provider.head("a/b.png");
        assertTrue(head.exists());
        assertEquals((long) TestImages.png("x").length, head.size().orElseThrow().longValue());
        assertArrayEquals(TestImages.png("x"), provider.read("a/b.png").orElseThrow());
    }

    @Test
    void testKeyEscapingBaseDirectoryIsRejected() {
        assertThrows(AssetStorageException.class,
            () -> provider.put("../outside.png", TestImages.png("x"), "image/png", null));
        assertThrows(IllegalArgumentException.class, () -> provider.resolve("a/../../etc/passwd"));
        assertFalse(provider.head("../outside.png").exists());
        assertFalse(Files.exists(baseDir.getParent().resolve("outside.png")));
    }

    @Test
    void testNormalizeKey() {
        assertEquals("a/b/c.png", FileSystemStorageProvider.normalizeKey("//a\\b/c.png"));
    }

    @Test
    void testDryRunNeverWrites() {
        StorageProvider dryRun = new DryRunStorageProvider(provider);

        HostedAsset hosted = dryRun.put("a/b.png", TestImages.png("x"), "image/png", null);

        assertEquals("http://localhost:3000/cdn/a/b.png", hosted.url());
        assertFalse(Files.exists(baseDir.resolve("a/b.png")));
        assertFalse(dryRun.head("a/b.png").exists());
        assertEquals("filesystem (dry run)", dryRun.name());
    }
}
