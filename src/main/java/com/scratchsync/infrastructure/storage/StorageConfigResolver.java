package com.scratchsync.infrastructure.storage;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Chooses the storage backend from environment-style settings.
 *
 * GCS wins when a bucket and a public base URL resolve, then an S3-compatible store when fully
 * configured, otherwise the local filesystem.
 */
public final class StorageConfigResolver {

    public static final String DEFAULT_LOCAL_DIR = "public/cdn";
    public static final String DEFAULT_LOCAL_PUBLIC_BASE_URL = "http://localhost:3000";
    public static final String DEFAULT_S3_REGION = "auto";

    /** Every setting the resolver reads. */
    public static final List<String> KEYS = List.of(
        "GCS_BUCKET", "DATA_BUCKET",
        "PUBLIC_BASE_URL", "NEXT_PUBLIC_DATA_BASE_URL", "NEXT_PUBLIC_DATA_BASE",
        "CLOUDFLARE_ACCOUNT_ID", "R2_ACCESS_KEY_ID", "R2_SECRET_ACCESS_KEY", "R2_BUCKET", "R2_PUBLIC_BASE_URL",
        "S3_ENDPOINT", "S3_REGION",
        "LOCAL_PUBLIC_BASE_URL", "LOCAL_STORAGE_DIR");

    private static final String GCS_HOST = "storage.googleapis.com";
    private static final Pattern GCS_VIRTUAL_HOST = Pattern.compile("^([^.]+)\\.storage\\.googleapis\\.com$",
        Pattern.CASE_INSENSITIVE);

    private StorageConfigResolver() {
    }

    public static StorageProviderConfig resolve(Map<String, String> env) {
        String publicBase = stripTrailingSlashes(firstNonBlank(env,
            "PUBLIC_BASE_URL", "NEXT_PUBLIC_DATA_BASE_URL", "NEXT_PUBLIC_DATA_BASE"));
        String bucket = firstNonBlank(env, "GCS_BUCKET", "DATA_BUCKET");
        if (bucket == null) {
            bucket = deriveBucketFromPublicBaseUrl(publicBase);
        }
        if (bucket != null && publicBase == null) {
            publicBase = "https://" + GCS_HOST + "/" + bucket;
        }
        if (bucket != null) {
            return new StorageProviderConfig(StorageBackend.GCS, bucket, publicBase,
                null, null, null, null, null);
        }

        String accountId = firstNonBlank(env, "CLOUDFLARE_ACCOUNT_ID");
        String endpoint = firstNonBlank(env, "S3_ENDPOINT");
        if (endpoint == null && accountId != null) {
            endpoint = "https://" + accountId + ".r2.cloudflarestorage.com";
        }
        String accessKey = firstNonBlank(env, "R2_ACCESS_KEY_ID");
        String secretKey = firstNonBlank(env, "R2_SECRET_ACCESS_KEY");
        String s3Bucket = firstNonBlank(env, "R2_BUCKET");
        String s3PublicBase = stripTrailingSlashes(firstNonBlank(env, "R2_PUBLIC_BASE_URL"));
        if (endpoint != null && accessKey != null && secretKey != null && s3Bucket != null && s3PublicBase != null) {
            String region = firstNonBlank(env, "S3_REGION");
            return new StorageProviderConfig(StorageBackend.S3_COMPATIBLE, s3Bucket, s3PublicBase,
                endpoint, region != null ? region : DEFAULT_S3_REGION, accessKey, secretKey, null);
        }

        String localBase = stripTrailingSlashes(firstNonBlank(env, "LOCAL_PUBLIC_BASE_URL"));
        String localDir = firstNonBlank(env, "LOCAL_STORAGE_DIR");
        return new StorageProviderConfig(StorageBackend.FILESYSTEM, null,
            (localBase != null ? localBase : DEFAULT_LOCAL_PUBLIC_BASE_URL) + "/cdn",
            null, null, null, null,
            localDir != null ? localDir : DEFAULT_LOCAL_DIR);
    }

    /**
     * Extracts the bucket from "https://storage.googleapis.com/&lt;bucket&gt;/..." or
     * "https://&lt;bucket&gt;.storage.googleapis.com".
     */
    static String deriveBucketFromPublicBaseUrl(String publicBase) {
        if (publicBase == null || publicBase.isBlank()) {
            return null;
        }
        URI uri;
        try {
            uri = URI.create(publicBase.trim());
        } catch (IllegalArgumentException e) {
            return null;
        }
        String host = uri.getHost();
        if (host == null) {
            return null;
        }
        if (host.equalsIgnoreCase(GCS_HOST)) {
            String path = uri.getPath() == null ? "" : uri.getPath().replaceAll("^/+", "");
            String first = path.isEmpty() ? "" : path.split("/")[0];
            return first.isEmpty() ? null : first;
        }
        Matcher m = GCS_VIRTUAL_HOST.matcher(host);
        return m.matches() ? m.group(1) : null;
    }

    private static String firstNonBlank(Map<String, String> env, String... keys) {
        for (String key : keys) {
            String value = env.get(key);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private static String stripTrailingSlashes(String url) {
        return url == null ? null : url.replaceAll("/+$", "");
    }
}
