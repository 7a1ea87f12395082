package com.scratchsync.domain.exception;

/**
 * Hosting of one source URL failed. The cause is the fetch, format, storage or policy error.
 */
public class IngestionException extends Exception {

    private final String sourceUrl;

    public IngestionException(String sourceUrl, String message, Throwable cause) {
        super(message, cause);
        this.sourceUrl = sourceUrl;
    }

    public IngestionException(String sourceUrl, String message) {
        super(message);
        this.sourceUrl = sourceUrl;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }
}
