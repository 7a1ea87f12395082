package com.scratchsync.infrastructure.storage;

/**
 * Object store variants, in selection priority order.
 */
public enum StorageBackend {
    GCS,
    S3_COMPATIBLE,
    FILESYSTEM
}
