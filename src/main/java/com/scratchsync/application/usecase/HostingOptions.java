package com.scratchsync.application.usecase;

import java.util.List;

/**
 * Run-wide switches of the ingestion pipeline.
 *
 * @param concurrency    worker threads rehosting entities
 * @param dryRun         never write to storage; manifest hits are trusted without a head check
 * @param rehostAll      ignore the manifest and re-download every source
 * @param onlyMissing    skip the upload when the content-addressed key already exists
 * @param allowLocalhost accept loopback source URLs (tests, local mirrors)
 * @param upstreamHosts  if not empty, the only hosts sources may come from
 */
public record HostingOptions(
    int concurrency,
    boolean dryRun,
    boolean rehostAll,
    boolean onlyMissing,
    boolean allowLocalhost,
    List<String> upstreamHosts
) {
    public static final int DEFAULT_CONCURRENCY = 6;

    public HostingOptions {
        concurrency = concurrency > 0 ? concurrency : DEFAULT_CONCURRENCY;
        upstreamHosts = upstreamHosts == null ? List.of() : List.copyOf(upstreamHosts);
    }

    public static HostingOptions defaults() {
        return new HostingOptions(DEFAULT_CONCURRENCY, false, false, true, false, List.of());
    }
}
