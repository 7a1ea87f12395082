package com.scratchsync.domain.service;

import com.scratchsync.domain.model.MergedHistory;

/**
 * Result of merging the current snapshot into history.
 * When the guard refused, {@code history} is the unchanged previous history and must not be rewritten.
 */
public record MergeOutcome(MergedHistory history, boolean refused, String reason) {

    public static MergeOutcome accepted(MergedHistory history) {
        return new MergeOutcome(history, false, null);
    }

    public static MergeOutcome refused(MergedHistory previous, String reason) {
        return new MergeOutcome(previous, true, reason);
    }
}
