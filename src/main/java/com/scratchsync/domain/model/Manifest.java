package com.scratchsync.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory cache of source URL to hosted asset, shared by the ingestion workers of one run.
 * All access goes through the instance monitor.
 */
public class Manifest {

    private final Map<String, ManifestEntry> entries = new LinkedHashMap<>();

    public Manifest() {
    }

    public Manifest(Map<String, ManifestEntry> initial) {
        if (initial != null) {
            entries.putAll(initial);
        }
    }

    public static Manifest empty() {
        return new Manifest();
    }

    public synchronized Optional<ManifestEntry> get(String sourceUrl) {
        return Optional.ofNullable(entries.get(sourceUrl));
    }

    public synchronized void put(String sourceUrl, ManifestEntry entry) {
        entries.put(sourceUrl, entry);
    }

    /**
     * Overlays another manifest; its entries win.
     */
    public synchronized void putAll(Manifest other) {
        entries.putAll(other.snapshot());
    }

    public synchronized int size() {
        return entries.size();
    }

    /**
     * Copy of the current entries, safe to serialize while workers keep writing.
     */
    public synchronized Map<String, ManifestEntry> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }
}
