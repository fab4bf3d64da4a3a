package com.scrapehub.jobs.model;

/**
 * Result of one execution as seen by a manual caller. {@code record} is null when the
 * history write failed and the attempt only exists in the logs.
 */
public record ExecutionOutcome(
    ExecutionRecord record,
    boolean historyWritten,
    boolean cacheUpdated
) {
    public boolean successful() {
        return record != null && record.successful();
    }
}
