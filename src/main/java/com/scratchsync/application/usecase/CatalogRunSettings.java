package com.scratchsync.application.usecase;

/**
 * Switches of a catalog refresh run.
 *
 * @param dryRun         nothing is written to storage and the local manifest is left untouched
 * @param remoteMirror   load and save the manifest mirror stored next to the hosted assets
 * @param minCoverage    minimum hosted fraction per asset kind before the run is reported as failed
 * @param failOnGuard    report a tripped anti-truncation guard as a failed run
 */
public record CatalogRunSettings(
    boolean dryRun,
    boolean remoteMirror,
    double minCoverage,
    boolean failOnGuard
) {
    public static CatalogRunSettings defaults() {
        return new CatalogRunSettings(false, false, 0.0, false);
    }
}
