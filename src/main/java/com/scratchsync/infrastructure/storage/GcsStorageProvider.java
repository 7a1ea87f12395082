package com.scratchsync.infrastructure.storage;

import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import com.scratchsync.domain.exception.AssetStorageException;
import com.scratchsync.domain.model.HeadResult;
import com.scratchsync.domain.model.HostedAsset;
import com.scratchsync.domain.ports.StorageProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Google Cloud Storage bucket. Credentials come from the application default chain.
 */
public class GcsStorageProvider implements StorageProvider {

    private static final Logger logger = LoggerFactory.getLogger(GcsStorageProvider.class);

    private final Storage storage;
    private final String bucket;
    private final String publicBaseUrl;

    public GcsStorageProvider(Storage storage, String bucket, String publicBaseUrl) {
        this.storage = storage;
        this.bucket = bucket;
        this.publicBaseUrl = publicBaseUrl.replaceAll("/+$", "");
    }

    @Override
    public String name() {
        return "gcs";
    }

    @Override
    public HeadResult head(String key) {
        try {
            Blob blob = storage.get(BlobId.of(bucket, key));
            if (blob == null) {
                return HeadResult.missing();
            }
            return HeadResult.found(blob.getEtag(), blob.getSize());
        } catch (StorageException e) {
            logger.warn("[gcs] head {} failed: {}", key, e.getMessage());
            return HeadResult.missing();
        }
    }

    @Override
    public HostedAsset put(String key, byte[] bytes, String contentType, String cacheControl) {
        BlobInfo info = BlobInfo.newBuilder(BlobId.of(bucket, key))
            .setContentType(contentType)
            .setCacheControl(cacheControl != null ? cacheControl : IMMUTABLE_CACHE_CONTROL)
            .build();
        try {
            Blob blob = storage.create(info, bytes);
            long size = blob.getSize() != null ? blob.getSize() : bytes.length;
            HostedAsset hosted = new HostedAsset(key, publicUrlFor(key), contentType, size,
                HeadResult.found(blob.getEtag(), size).etag());
            logger.info("[gcs] put {} ({} bytes, {}) -> {}", key, size, contentType, hosted.url());
            return hosted;
        } catch (StorageException e) {
            throw new AssetStorageException(key, "gcs put failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String publicUrlFor(String key) {
        return publicBaseUrl + "/" + key;
    }

    @Override
    public Optional<byte[]> read(String key) {
        try {
            Blob blob = storage.get(BlobId.of(bucket, key));
            if (blob == null) {
                return Optional.empty();
            }
            return Optional.of(blob.getContent());
        } catch (StorageException e) {
            throw new AssetStorageException(key, "gcs read failed: " + e.getMessage(), e);
        }
    }
}
