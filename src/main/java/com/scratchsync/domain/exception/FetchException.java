package com.scratchsync.domain.exception;

import java.io.IOException;

/**
 * Download of an upstream asset failed after all retries and fallbacks.
 */
public class FetchException extends IOException {

    private final String url;

    public FetchException(String url, String message) {
        super(message);
        this.url = url;
    }

    public FetchException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
