package com.scratchsync.infrastructure.storage;

import com.scratchsync.domain.exception.AssetStorageException;
import com.scratchsync.domain.model.HeadResult;
import com.scratchsync.domain.model.HostedAsset;
import com.scratchsync.domain.ports.StorageProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.util.Optional;

/**
 * S3-compatible bucket (Cloudflare R2 by default) through the AWS SDK.
 */
public class S3StorageProvider implements StorageProvider {

    private static final Logger logger = LoggerFactory.getLogger(S3StorageProvider.class);

    private final S3Client s3;
    private final String bucket;
    private final String publicBaseUrl;

    public S3StorageProvider(S3Client s3, String bucket, String publicBaseUrl) {
        this.s3 = s3;
        this.bucket = bucket;
        this.publicBaseUrl = publicBaseUrl.replaceAll("/+$", "");
    }

    @Override
    public String name() {
        return "s3";
    }

    @Override
    public HeadResult head(String key) {
        try {
            HeadObjectResponse response = s3.headObject(HeadObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build());
            return HeadResult.found(response.eTag(), response.contentLength());
        } catch (NoSuchKeyException e) {
            return HeadResult.missing();
        } catch (S3Exception e) {
            if (e.statusCode() != 404) {
                logger.warn("[s3] head {} failed with status {}: {}", key, e.statusCode(), e.getMessage());
            }
            return HeadResult.missing();
        } catch (SdkException e) {
            logger.warn("[s3] head {} failed: {}", key, e.getMessage());
            return HeadResult.missing();
        }
    }

    @Override
    public HostedAsset put(String key, byte[] bytes, String contentType, String cacheControl) {
        try {
            PutObjectResponse response = s3.putObject(PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .contentType(contentType)
                    .cacheControl(cacheControl != null ? cacheControl : IMMUTABLE_CACHE_CONTROL)
                    .build(),
                RequestBody.fromBytes(bytes));
            HostedAsset hosted = new HostedAsset(key, publicUrlFor(key), contentType, bytes.length,
                HeadResult.found(response.eTag(), (long) bytes.length).etag());
            logger.info("[s3] put {} ({} bytes, {}) -> {}", key, bytes.length, contentType, hosted.url());
            return hosted;
        } catch (SdkException e) {
            throw new AssetStorageException(key, "s3 put failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String publicUrlFor(String key) {
        return publicBaseUrl + "/" + key;
    }

    @Override
    public Optional<byte[]> read(String key) {
        try {
            return Optional.of(s3.getObjectAsBytes(GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build()).asByteArray());
        } catch (NoSuchKeyException e) {
            return Optional.empty();
        } catch (SdkException e) {
            throw new AssetStorageException(key, "s3 read failed: " + e.getMessage(), e);
        }
    }
}
