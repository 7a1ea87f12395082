package com.scratchsync.infrastructure.storage;

/**
 * Resolved storage settings. Which fields are set depends on the backend.
 *
 * @param backend         selected backend
 * @param bucket          bucket name (GCS, S3-compatible)
 * @param publicBaseUrl   URL prefix objects are served from, without trailing slash
 * @param endpoint        S3 endpoint URL
 * @param region          S3 signing region
 * @param accessKeyId     S3 access key
 * @param secretAccessKey S3 secret key
 * @param localDir        base directory of the filesystem backend
 */
public record StorageProviderConfig(
    StorageBackend backend,
    String bucket,
    String publicBaseUrl,
    String endpoint,
    String region,
    String accessKeyId,
    String secretAccessKey,
    String localDir
) {
    @Override
    public String toString() {
        return "StorageProviderConfig[backend=" + backend
            + ", bucket=" + bucket
            + ", publicBaseUrl=" + publicBaseUrl
            + ", endpoint=" + endpoint
            + ", region=" + region
            + ", accessKeyId=" + (accessKeyId == null ? null : "***")
            + ", secretAccessKey=" + (secretAccessKey == null ? null : "***")
            + ", localDir=" + localDir + "]";
    }
}
