package com.scratchsync.domain.service;

import com.scratchsync.domain.model.ContentAddress;
import com.scratchsync.domain.model.ImageFormat;
import com.scratchsync.domain.model.KeyTemplate;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Derives content-addressed storage keys from raw bytes.
 */
public class ContentAddresser {

    public ContentAddress addressFor(byte[] bytes, ImageFormat format, KeyTemplate template) {
        String sha = sha256Hex(bytes);
        return new ContentAddress(template.render(sha, format.getExtension()), sha, format);
    }

    /**
     * Lower-case hex SHA-256 of the input.
     */
    public static String sha256Hex(byte[] bytes) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
