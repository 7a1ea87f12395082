package com.scratchsync.domain.exception;

/**
 * Downloaded bytes are neither PNG nor JPEG.
 */
public class UnsupportedFormatException extends RuntimeException {

    private final String declaredContentType;

    public UnsupportedFormatException(String message, String declaredContentType) {
        super(message);
        this.declaredContentType = declaredContentType;
    }

    public String getDeclaredContentType() {
        return declaredContentType;
    }
}
