package com.scratchsync.domain.model;

/**
 * Storage key pattern with {@code <sha>} and {@code <ext>} placeholders.
 *
 * Example: "ga/scratchers/images/42/ticket-&lt;sha&gt;.&lt;ext&gt;".
 */
public record KeyTemplate(String pattern) {

    public static final String SHA_TOKEN = "<sha>";
    public static final String EXT_TOKEN = "<ext>";

    public KeyTemplate {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("key template required");
        }
        pattern = pattern.replaceAll("^/+", "");
    }

    /**
     * Canonical template for one asset slot: {@code <namespace>/<entityId>/<kind>-<sha>.<ext>}.
     */
    public static KeyTemplate forAsset(String namespace, String entityId, AssetKind kind) {
        String ns = namespace == null ? "" : namespace.replaceAll("/+$", "");
        String prefix = ns.isEmpty() ? "" : ns + "/";
        return new KeyTemplate(prefix + entityId + "/" + kind.getKey() + "-" + SHA_TOKEN + "." + EXT_TOKEN);
    }

    /**
     * Substitutes hash and extension. A pattern without a hash placeholder gets
     * "-&lt;sha&gt;.&lt;ext&gt;" appended so the key stays content-addressed.
     */
    public String render(String sha256, String extension) {
        String key = pattern.replace(SHA_TOKEN, sha256).replace(EXT_TOKEN, extension);
        if (!key.contains(sha256)) {
            key = key + "-" + sha256 + "." + extension;
        }
        return key;
    }

    /**
     * Directory part of the pattern including the trailing slash, or "" for a flat key.
     */
    public String directoryPrefix() {
        int slash = pattern.lastIndexOf('/');
        return slash < 0 ? "" : pattern.substring(0, slash + 1);
    }

    @Override
    public String toString() {
        return pattern;
    }
}
