package com.scratchsync.domain.ports;

import com.scratchsync.domain.model.HeadResult;
import com.scratchsync.domain.model.HostedAsset;

import java.util.Optional;

/**
 * Port for the object store that hosts rehosted assets and published indexes.
 */
public interface StorageProvider {

    String IMMUTABLE_CACHE_CONTROL = "public, max-age=31536000, immutable";
    String NO_STORE_CACHE_CONTROL = "no-store";

    /**
     * Short backend name used in log lines (e.g. "gcs", "s3", "filesystem").
     */
    String name();

    /**
     * Checks whether an object exists.
     * Backend errors are reported as a missing object, never thrown.
     *
     * @param key Storage key
     * @return Existence, ETag and size when known
     */
    HeadResult head(String key);

    /**
     * Writes an object, overwriting any previous content under the same key.
     *
     * @param key          Storage key
     * @param bytes        Object body
     * @param contentType  Content-Type to store with the object
     * @param cacheControl Cache-Control to store with the object
     * @return The hosted asset
     * @throws com.scratchsync.domain.exception.AssetStorageException if the backend rejects the write
     */
    HostedAsset put(String key, byte[] bytes, String contentType, String cacheControl);

    /**
     * Public URL for a key. Pure, no network access.
     */
    String publicUrlFor(String key);

    /**
     * Reads an object.
     *
     * @return The body, or empty when the object does not exist
     * @throws com.scratchsync.domain.exception.AssetStorageException if the backend fails
     */
    Optional<byte[]> read(String key);
}
