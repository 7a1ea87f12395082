package com.scratchsync.domain.model;

/**
 * Raw bytes downloaded from an upstream, with the content type the upstream declared
 * (lower-cased, may be empty).
 */
public record FetchedContent(byte[] bytes, String declaredContentType) {

    public FetchedContent {
        declaredContentType = declaredContentType == null ? "" : declaredContentType.trim().toLowerCase();
    }

    public int size() {
        return bytes == null ? 0 : bytes.length;
    }
}
