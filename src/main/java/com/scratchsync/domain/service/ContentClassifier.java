package com.scratchsync.domain.service;

import com.scratchsync.domain.exception.UnsupportedFormatException;
import com.scratchsync.domain.model.ImageFormat;

import java.util.Optional;

/**
 * Decides whether downloaded bytes may be hosted, and as which format.
 *
 * Magic bytes win over the declared content type. WEBP is always rejected.
 * Bytes with no known signature are accepted only when the declared type is PNG or JPEG.
 */
public class ContentClassifier {

    private static final byte[] RIFF = {'R', 'I', 'F', 'F'};
    private static final byte[] WEBP = {'W', 'E', 'B', 'P'};

    public ImageFormat classify(byte[] bytes, String declaredContentType) {
        String declared = normalize(declaredContentType);
        if (bytes == null || bytes.length == 0) {
            throw new UnsupportedFormatException("empty body", declared);
        }
        if (isWebp(bytes)) {
            throw new UnsupportedFormatException("webp content is not supported", declared);
        }
        Optional<ImageFormat> sniffed = ImageFormat.sniff(bytes);
        if (sniffed.isPresent()) {
            return sniffed.get();
        }
        return ImageFormat.fromContentType(declared)
            .orElseThrow(() -> new UnsupportedFormatException(
                "unrecognized content (declared '" + declared + "')", declared));
    }

    /**
     * Strips parameters and lower-cases: "Image/PNG; charset=x" becomes "image/png".
     */
    static String normalize(String contentType) {
        if (contentType == null) {
            return "";
        }
        int semi = contentType.indexOf(';');
        String base = semi >= 0 ? contentType.substring(0, semi) : contentType;
        return base.trim().toLowerCase();
    }

    static boolean isWebp(byte[] bytes) {
        return bytes.length >= 12 && startsWith(bytes, 0, RIFF) && startsWith(bytes, 8, WEBP);
    }

    private static boolean startsWith(byte[] bytes, int offset, byte[] prefix) {
        for (int i = 0; i < prefix.length; i++) {
            if (bytes[offset + i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
