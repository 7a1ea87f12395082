package com.scratchsync.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Last known hosting of one upstream source URL.
 * The sha256 is the hash of the bytes stored at {@code key} when the entry was written.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ManifestEntry(
    String key,
    String url,
    String etag,
    long bytes,
    String contentType,
    String sha256
) {

    public static ManifestEntry of(HostedAsset hosted, String sha256) {
        return new ManifestEntry(hosted.key(), hosted.url(), hosted.etag(), hosted.bytes(),
            hosted.contentType(), sha256);
    }

    public HostedAsset toHostedAsset(String publicUrl) {
        return new HostedAsset(key, publicUrl, contentType, bytes, etag);
    }

    /**
     * Entries loaded from disk are untrusted; an entry is usable only when these fields are present.
     */
    public boolean isValid() {
        return key != null && !key.isBlank()
            && url != null && !url.isBlank()
            && sha256 != null && !sha256.isBlank()
            && contentType != null && !contentType.isBlank()
            && bytes >= 0;
    }
}
