package com.scratchsync.domain.service;

/**
 * What the anti-truncation guard compares, beyond the empty-snapshot check.
 */
public enum GuardMode {
    /** Refuse when the merged history would hold fewer records. */
    RECORD_COUNT,
    /** Refuse when the serialized merged history would be smaller in bytes. */
    BYTE_SIZE
}
