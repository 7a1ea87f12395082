package com.scratchsync.domain.exception;

/**
 * The anti-truncation guard refused to overwrite a catalog's history.
 * Only raised when the run is configured to fail on a tripped guard.
 */
public class ReconciliationGuardTrippedException extends RuntimeException {

    private final String catalog;

    public ReconciliationGuardTrippedException(String catalog, String reason) {
        super("anti-truncation guard tripped for " + catalog + ": " + reason);
        this.catalog = catalog;
    }

    public String getCatalog() {
        return catalog;
    }
}
