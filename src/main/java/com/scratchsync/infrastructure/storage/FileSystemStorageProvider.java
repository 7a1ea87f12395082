package com.scratchsync.infrastructure.storage;

import com.scratchsync.domain.exception.AssetStorageException;
import com.scratchsync.domain.model.HeadResult;
import com.scratchsync.domain.model.HostedAsset;
import com.scratchsync.domain.ports.StorageProvider;
import com.scratchsync.infrastructure.persistence.JsonFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Local directory served as a static CDN (e.g. by the web app under /cdn).
 *
 * Next to every object a {@code <file>.headers.json} sidecar records the Content-Type and
 * Cache-Control the static server should send.
 */
public class FileSystemStorageProvider implements StorageProvider {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemStorageProvider.class);

    static final String HEADERS_SUFFIX = ".headers.json";

    private final Path baseDir;
    private final String publicBaseUrl;

    /**
     * @param baseDir       directory objects are written under
     * @param publicBaseUrl URL prefix the directory is served at (e.g. "http://localhost:3000/cdn")
     */
    public FileSystemStorageProvider(Path baseDir, String publicBaseUrl) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.publicBaseUrl = publicBaseUrl.replaceAll("/+$", "");
    }

    @Override
    public String name() {
        return "filesystem";
    }

    @Override
    public HeadResult head(String key) {
        try {
            Path file = resolve(key);
            if (!Files.isRegularFile(file)) {
                return HeadResult.missing();
            }
            return HeadResult.found(null, Files.size(file));
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("[storage] head {} failed: {}", key, e.getMessage());
            return HeadResult.missing();
        }
    }

    @Override
    public HostedAsset put(String key, byte[] bytes, String contentType, String cacheControl) {
        String normalized = normalizeKey(key);
        try {
            Path file = resolve(normalized);
            JsonFiles.writeAtomically(file, bytes);

            Map<String, String> headers = new LinkedHashMap<>();
            headers.put("Content-Type", contentType);
            headers.put("Cache-Control", cacheControl != null ? cacheControl : IMMUTABLE_CACHE_CONTROL);
            JsonFiles.writeAtomically(file.resolveSibling(file.getFileName() + HEADERS_SUFFIX),
                JsonFiles.OBJECT_MAPPER.writeValueAsBytes(headers));

            logger.debug("[storage] wrote {} ({} bytes)", file, bytes.length);
            return new HostedAsset(normalized, publicUrlFor(normalized), contentType, bytes.length, null);
        } catch (IOException | IllegalArgumentException e) {
            throw new AssetStorageException(key, "filesystem put failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String publicUrlFor(String key) {
        return publicBaseUrl + "/" + normalizeKey(key);
    }

    @Override
    public Optional<byte[]> read(String key) {
        try {
            return Optional.of(Files.readAllBytes(resolve(key)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException | IllegalArgumentException e) {
            throw new AssetStorageException(key, "filesystem read failed: " + e.getMessage(), e);
        }
    }

    static String normalizeKey(String key) {
        return key.replace('\\', '/').replaceAll("^/+", "");
    }

    /**
     * Maps a key to a file under the base directory.
     *
     * @throws IllegalArgumentException when the key would escape the base directory
     */
    Path resolve(String key) {
        Path file = baseDir.resolve(normalizeKey(key)).normalize();
        if (!file.startsWith(baseDir) || file.equals(baseDir)) {
            throw new IllegalArgumentException("key escapes storage directory: " + key);
        }
        return file;
    }
}
