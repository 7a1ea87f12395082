package com.scratchsync.domain.service;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Validates asset source URLs before anything is downloaded.
 *
 * Only absolute http(s) URLs pass. Loopback hosts are rejected unless explicitly allowed,
 * and a non-empty host allow-list restricts sources to the listed upstream domains (suffix match).
 */
public class SourceUrlPolicy {

    private static final Set<String> LOOPBACK_HOSTS = Set.of("localhost", "127.0.0.1", "::1", "[::1]");

    private final boolean allowLocalhost;
    private final List<String> allowedHosts;

    public SourceUrlPolicy(boolean allowLocalhost, List<String> allowedHosts) {
        this.allowLocalhost = allowLocalhost;
        this.allowedHosts = allowedHosts == null ? List.of() : allowedHosts.stream()
            .map(h -> h.trim().toLowerCase(Locale.ROOT))
            .filter(h -> !h.isEmpty())
            .toList();
    }

    public static SourceUrlPolicy permissive() {
        return new SourceUrlPolicy(true, List.of());
    }

    /**
     * @throws IllegalArgumentException with the reason when the URL is not acceptable
     */
    public void check(String sourceUrl) {
        if (sourceUrl == null || sourceUrl.isBlank()) {
            throw new IllegalArgumentException("source URL is empty");
        }
        URI uri;
        try {
            uri = new URI(sourceUrl.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("malformed source URL: " + e.getMessage());
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("unsupported scheme '" + scheme + "'");
        }
        String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
        if (host.isEmpty()) {
            throw new IllegalArgumentException("source URL has no host");
        }
        if (!allowLocalhost && LOOPBACK_HOSTS.contains(host)) {
            throw new IllegalArgumentException("refusing to download from local host " + host);
        }
        if (!allowedHosts.isEmpty() && allowedHosts.stream().noneMatch(h -> host.equals(h) || host.endsWith("." + h))) {
            throw new IllegalArgumentException("host " + host + " is not an allowed upstream");
        }
    }
}
