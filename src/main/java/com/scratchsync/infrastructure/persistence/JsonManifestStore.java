package com.scratchsync.infrastructure.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.scratchsync.domain.exception.AssetStorageException;
import com.scratchsync.domain.model.Manifest;
import com.scratchsync.domain.model.ManifestEntry;
import com.scratchsync.domain.ports.ManifestStore;
import com.scratchsync.domain.ports.StorageProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Manifest kept as {@code <outputDir>/<catalog>/_image_manifest.json}, optionally mirrored
 * to {@code <catalog>/_image_manifest.json} in the object store.
 */
public class JsonManifestStore implements ManifestStore {

    private static final Logger logger = LoggerFactory.getLogger(JsonManifestStore.class);

    public static final String MANIFEST_FILE = "_image_manifest.json";

    private static final TypeReference<LinkedHashMap<String, ManifestEntry>> MANIFEST_TYPE = new TypeReference<>() {
    };

    private final Path outputDir;

    public JsonManifestStore(Path outputDir) {
        this.outputDir = outputDir;
    }

    @Override
    public Manifest load(String catalog) {
        Path file = pathFor(catalog);
        if (!Files.exists(file)) {
            logger.info("[manifest] no manifest for {} yet", catalog);
            return Manifest.empty();
        }
        try {
            Manifest manifest = parse(catalog, Files.readAllBytes(file));
            logger.info("[manifest] loaded {} entries for {}", manifest.size(), catalog);
            return manifest;
        } catch (IOException e) {
            logger.warn("[manifest] {} is unreadable, starting empty: {}", file, e.getMessage());
            return Manifest.empty();
        }
    }

    @Override
    public void save(String catalog, Manifest manifest) {
        Path file = pathFor(catalog);
        try {
            JsonFiles.writeAtomically(file, JsonFiles.OBJECT_MAPPER.writeValueAsBytes(manifest.snapshot()));
            logger.info("[manifest] saved {} entries to {}", manifest.size(), file);
        } catch (IOException e) {
            logger.error("[manifest] failed to save {}", file, e);
        }
    }

    @Override
    public Manifest loadFromRemoteMirror(String catalog, StorageProvider storage) {
        String key = remoteKey(catalog);
        try {
            Optional<byte[]> body = storage.read(key);
            if (body.isEmpty()) {
                return Manifest.empty();
            }
            Manifest manifest = parse(catalog, body.get());
            logger.info("[manifest] loaded {} entries from {} mirror", manifest.size(), storage.name());
            return manifest;
        } catch (IOException | AssetStorageException e) {
            logger.warn("[manifest] remote mirror {} skipped: {}", key, e.getMessage());
            return Manifest.empty();
        }
    }

    @Override
    public void saveToRemoteMirror(String catalog, Manifest manifest, StorageProvider storage) {
        String key = remoteKey(catalog);
        try {
            storage.put(key, JsonFiles.OBJECT_MAPPER.writeValueAsBytes(manifest.snapshot()),
                "application/json", StorageProvider.NO_STORE_CACHE_CONTROL);
        } catch (IOException | AssetStorageException e) {
            logger.warn("[manifest] remote mirror {} not saved: {}", key, e.getMessage());
        }
    }

    Path pathFor(String catalog) {
        return outputDir.resolve(catalog).resolve(MANIFEST_FILE);
    }

    static String remoteKey(String catalog) {
        return catalog + "/" + MANIFEST_FILE;
    }

    private Manifest parse(String catalog, byte[] json) throws IOException {
        Map<String, ManifestEntry> raw = JsonFiles.OBJECT_MAPPER.readValue(json, MANIFEST_TYPE);
        Map<String, ManifestEntry> valid = new LinkedHashMap<>();
        if (raw != null) {
            raw.forEach((sourceUrl, entry) -> {
                if (entry != null && entry.isValid()) {
                    valid.put(sourceUrl, entry);
                } else {
                    logger.warn("[manifest] dropping invalid {} entry for {}", catalog, sourceUrl);
                }
            });
        }
        return new Manifest(valid);
    }
}
