package com.scratchsync.domain.ports;

import com.scratchsync.domain.model.Manifest;

/**
 * Port for persisting the per-catalog source URL manifest.
 */
public interface ManifestStore {

    /**
     * Loads the local manifest. A missing or malformed file yields an empty manifest.
     */
    Manifest load(String catalog);

    /**
     * Persists the manifest atomically.
     */
    void save(String catalog, Manifest manifest);

    /**
     * Loads the copy mirrored next to the hosted assets. Failures yield an empty manifest.
     */
    Manifest loadFromRemoteMirror(String catalog, StorageProvider storage);

    /**
     * Uploads the manifest next to the hosted assets. Failures are logged, not thrown.
     */
    void saveToRemoteMirror(String catalog, Manifest manifest, StorageProvider storage);
}
