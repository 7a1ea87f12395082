package com.scratchsync.infrastructure.storage;

import com.google.cloud.storage.StorageOptions;
import com.scratchsync.domain.ports.StorageProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

import java.net.URI;
import java.nio.file.Path;

/**
 * Builds the storage provider for a resolved configuration.
 */
public final class StorageProviderFactory {

    private static final Logger logger = LoggerFactory.getLogger(StorageProviderFactory.class);

    private StorageProviderFactory() {
    }

    public static StorageProvider create(StorageProviderConfig config, boolean dryRun) {
        StorageProvider provider = switch (config.backend()) {
            case GCS -> new GcsStorageProvider(
                StorageOptions.getDefaultInstance().getService(),
                config.bucket(),
                config.publicBaseUrl());
            case S3_COMPATIBLE -> new S3StorageProvider(
                S3Client.builder()
                    .endpointOverride(URI.create(config.endpoint()))
                    .region(Region.of(config.region()))
                    .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(config.accessKeyId(), config.secretAccessKey())))
                    .forcePathStyle(true)
                    .build(),
                config.bucket(),
                config.publicBaseUrl());
            case FILESYSTEM -> new FileSystemStorageProvider(Path.of(config.localDir()), config.publicBaseUrl());
        };
        logger.info("[storage] using {} provider ({})", provider.name(), config.publicBaseUrl());
        return dryRun ? new DryRunStorageProvider(provider) : provider;
    }
}
