package com.scratchsync.infrastructure.storage;

import com.scratchsync.domain.model.HeadResult;
import com.scratchsync.domain.model.HostedAsset;
import com.scratchsync.domain.ports.StorageProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Read-through decorator that never writes: puts are logged and answered with the URL the
 * object would have had.
 */
public class DryRunStorageProvider implements StorageProvider {

    private static final Logger logger = LoggerFactory.getLogger(DryRunStorageProvider.class);

    private final StorageProvider delegate;

    public DryRunStorageProvider(StorageProvider delegate) {
        this.delegate = delegate;
    }

    @Override
    public String name() {
        return delegate.name() + " (dry run)";
    }

    @Override
    public HeadResult head(String key) {
        return delegate.head(key);
    }

    @Override
    public HostedAsset put(String key, byte[] bytes, String contentType, String cacheControl) {
        String url = delegate.publicUrlFor(key);
        logger.info("[dry-run] would put {} ({} bytes, {}) -> {}", key, bytes.length, contentType, url);
        return new HostedAsset(key, url, contentType, bytes.length, null);
    }

    @Override
    public String publicUrlFor(String key) {
        return delegate.publicUrlFor(key);
    }

    @Override
    public Optional<byte[]> read(String key) {
        return delegate.read(key);
    }
}
