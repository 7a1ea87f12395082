package com.scratchsync.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * An asset stored under a content-addressed key and reachable at a public URL.
 *
 * @param key         storage key, e.g. "ga/scratchers/images/42/ticket-&lt;sha&gt;.png"
 * @param url         public URL of the stored object
 * @param contentType classified content type
 * @param bytes       stored size in bytes
 * @param etag        backend ETag without quotes, null when the backend has none
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HostedAsset(
    String key,
    String url,
    String contentType,
    long bytes,
    String etag
) {
    public HostedAsset withEtag(String newEtag) {
        return new HostedAsset(key, url, contentType, bytes, newEtag);
    }
}
