package com.scratchsync.application.usecase;

import com.scratchsync.domain.model.AssetKind;

import java.util.Map;

/**
 * Outcome of rehosting the assets of one catalog.
 *
 * @param namespace storage namespace of the catalog's assets
 * @param coverage  hosted versus referenced assets, per kind
 * @param failures  assets whose hosting failed; their entities keep the source URL
 * @param downloads upstream downloads performed
 * @param uploads   objects written to storage
 */
public record RehostReport(
    String namespace,
    Map<AssetKind, Coverage> coverage,
    int failures,
    int downloads,
    int uploads
) {
    public Coverage coverageOf(AssetKind kind) {
        return coverage.getOrDefault(kind, new Coverage(0, 0));
    }

    /**
     * @param hosted assets now served from storage
     * @param total  entities referencing an asset of this kind
     */
    public record Coverage(int hosted, int total) {

        /**
         * Hosted fraction in [0, 1]; 1 when nothing was referenced.
         */
        public double ratio() {
            return total == 0 ? 1.0 : (double) hosted / total;
        }

        @Override
        public String toString() {
            return hosted + "/" + total + " (" + Math.round(ratio() * 100) + "%)";
        }
    }
}
