package com.scratchsync.domain.model;

import java.util.Optional;

/**
 * Raster formats accepted for hosting.
 * Anything not listed here is rejected, even when the upstream claims an image type.
 */
public enum ImageFormat {
    PNG("image/png", "png", new int[] {0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A}),
    JPEG("image/jpeg", "jpg", new int[] {0xFF, 0xD8, 0xFF});

    private final String contentType;
    private final String extension;
    private final int[] signature;

    ImageFormat(String contentType, String extension, int[] signature) {
        this.contentType = contentType;
        this.extension = extension;
        this.signature = signature;
    }

    public String getContentType() {
        return contentType;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Checks whether the data starts with this format's magic bytes.
     */
    public boolean matches(byte[] data) {
        if (data == null || data.length < signature.length) {
            return false;
        }
        for (int i = 0; i < signature.length; i++) {
            if ((data[i] & 0xFF) != signature[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Detects the format from magic bytes.
     */
    public static Optional<ImageFormat> sniff(byte[] data) {
        for (ImageFormat format : values()) {
            if (format.matches(data)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves an already normalized content type ("image/png") to a format.
     */
    public static Optional<ImageFormat> fromContentType(String contentType) {
        if (contentType == null) {
            return Optional.empty();
        }
        for (ImageFormat format : values()) {
            if (format.contentType.equals(contentType)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
