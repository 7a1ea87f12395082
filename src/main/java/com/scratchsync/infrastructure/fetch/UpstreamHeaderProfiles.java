package com.scratchsync.infrastructure.fetch;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Browser-like request headers, with a Referer chosen per upstream host.
 *
 * Some lottery CDNs refuse image requests carrying a foreign Referer, so each known host
 * gets its own site as Referer. Unknown hosts get their own origin.
 */
public class UpstreamHeaderProfiles {

    public static final String USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/125 Safari/537.36";

    // prefer PNG/JPEG so CDNs do not negotiate webp
    public static final String ACCEPT = "image/png,image/jpeg;q=0.9,*/*;q=0.7";
    public static final String ACCEPT_LANGUAGE = "en-US,en;q=0.9";

    private static final Map<String, String> BUILT_IN_REFERERS = Map.of(
        "nylottery.ny.gov", "https://nylottery.ny.gov/",
        "galottery.com", "https://www.galottery.com/",
        "flalottery.com", "https://www.flalottery.com/"
    );

    private final Map<String, String> referers = new LinkedHashMap<>();

    public UpstreamHeaderProfiles() {
        this(Map.of());
    }

    /**
     * @param extraReferers host suffix to Referer, overriding the built-in ones
     */
    public UpstreamHeaderProfiles(Map<String, String> extraReferers) {
        if (extraReferers != null) {
            extraReferers.forEach((host, referer) -> referers.put(host.toLowerCase(Locale.ROOT), referer));
        }
        BUILT_IN_REFERERS.forEach(referers::putIfAbsent);
    }

    /**
     * Default header set for a download from {@code url}.
     */
    public Map<String, String> headersFor(String url) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("User-Agent", USER_AGENT);
        headers.put("Accept", ACCEPT);
        headers.put("Accept-Language", ACCEPT_LANGUAGE);
        String referer = refererFor(url);
        if (referer != null) {
            headers.put("Referer", referer);
        }
        return headers;
    }

    String refererFor(String url) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            return null;
        }
        if (uri.getHost() == null) {
            return null;
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> entry : referers.entrySet()) {
            if (host.equals(entry.getKey()) || host.endsWith("." + entry.getKey())) {
                return entry.getValue();
            }
        }
        String origin = uri.getScheme() + "://" + uri.getRawAuthority();
        return origin + "/";
    }
}
