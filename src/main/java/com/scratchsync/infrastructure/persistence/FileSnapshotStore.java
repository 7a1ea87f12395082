package com.scratchsync.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.scratchsync.domain.model.MergedHistory;
import com.scratchsync.domain.model.PublishedIndex;
import com.scratchsync.domain.ports.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Catalog snapshots as JSON files under {@code <outputDir>/<catalog>/}:
 * {@code index.json} (with its {@code index.latest.json} mirror) and {@code index.merged.json}.
 */
public class FileSnapshotStore implements SnapshotStore {

    private static final Logger logger = LoggerFactory.getLogger(FileSnapshotStore.class);

    public static final String INDEX_FILE = "index.json";
    public static final String LATEST_FILE = "index.latest.json";
    public static final String MERGED_FILE = "index.merged.json";

    private final Path outputDir;

    public FileSnapshotStore(Path outputDir) {
        this.outputDir = outputDir;
    }

    @Override
    public Optional<PublishedIndex> loadPublished(String catalog) {
        return read(fileFor(catalog, INDEX_FILE), PublishedIndex.class, true);
    }

    @Override
    public Optional<PublishedIndex> readPublished(String catalog) {
        return read(fileFor(catalog, INDEX_FILE), PublishedIndex.class, false);
    }

    @Override
    public Optional<MergedHistory> loadMerged(String catalog) {
        return read(fileFor(catalog, MERGED_FILE), MergedHistory.class, true);
    }

    @Override
    public byte[] writePublished(String catalog, PublishedIndex index) {
        byte[] json = toJson(index);
        write(fileFor(catalog, INDEX_FILE), json);
        write(fileFor(catalog, LATEST_FILE), json);
        logger.info("Published {} entities to {}", index.count(), fileFor(catalog, INDEX_FILE));
        return json;
    }

    @Override
    public void writeMerged(String catalog, MergedHistory merged) {
        write(fileFor(catalog, MERGED_FILE), serialize(merged));
        logger.info("Merged history of {} now holds {} records", catalog, merged.count());
    }

    @Override
    public byte[] serialize(MergedHistory merged) {
        return toJson(merged);
    }

    Path fileFor(String catalog, String name) {
        return outputDir.resolve(catalog).resolve(name);
    }

    /**
     * @param quarantineCorrupt move an unparseable file aside; only the refresh path does this
     */
    private <T> Optional<T> read(Path file, Class<T> type, boolean quarantineCorrupt) {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(JsonFiles.OBJECT_MAPPER.readValue(file.toFile(), type));
        } catch (JsonProcessingException e) {
            if (quarantineCorrupt) {
                quarantine(file, e);
            } else {
                logger.warn("{} is not valid JSON: {}", file, e.getOriginalMessage());
            }
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    // keeps the corrupt copy next to the original for inspection
    private void quarantine(Path file, JsonProcessingException cause) {
        Path aside = file.resolveSibling(file.getFileName() + ".corrupt-" + System.currentTimeMillis());
        try {
            Files.move(file, aside, StandardCopyOption.REPLACE_EXISTING);
            logger.error("{} is not valid JSON, moved to {}: {}", file, aside, cause.getOriginalMessage());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to move corrupt " + file + " aside", e);
        }
    }

    private static byte[] toJson(Object value) {
        try {
            return JsonFiles.OBJECT_MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static void write(Path file, byte[] json) {
        try {
            JsonFiles.writeAtomically(file, json);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }
}
