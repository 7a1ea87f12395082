package com.scratchsync.domain.model;

/**
 * Lifecycle of a catalog entity relative to the previously published snapshot.
 */
public enum Lifecycle {
    NEW("new"),
    CONTINUING("continuing"),
    ENDED("ended");

    private final String key;

    Lifecycle(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    @Override
    public String toString() {
        return key;
    }
}
