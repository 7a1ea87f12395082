package com.scratchsync.domain.model;

import java.util.Optional;

/**
 * Existence check of a storage key. Absence is a normal outcome.
 */
public record HeadResult(boolean exists, String etag, Long bytes) {

    private static final HeadResult MISSING = new HeadResult(false, null, null);

    public static HeadResult missing() {
        return MISSING;
    }

    public static HeadResult found(String etag, Long bytes) {
        return new HeadResult(true, stripQuotes(etag), bytes);
    }

    public Optional<Long> size() {
        return Optional.ofNullable(bytes);
    }

    private static String stripQuotes(String etag) {
        if (etag == null) {
            return null;
        }
        return etag.replaceAll("^\"|\"$", "");
    }
}
