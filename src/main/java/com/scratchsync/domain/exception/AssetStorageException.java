package com.scratchsync.domain.exception;

/**
 * A storage backend rejected or failed a write or read.
 */
public class AssetStorageException extends RuntimeException {

    private final String key;

    public AssetStorageException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
