package com.scratchsync.domain.model;

/**
 * Result of addressing a byte sequence: the rendered storage key and the hash it was derived from.
 */
public record ContentAddress(String key, String sha256, ImageFormat format) {
}
