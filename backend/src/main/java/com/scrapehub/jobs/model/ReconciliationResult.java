package com.scrapehub.jobs.model;

import java.time.Instant;
import java.util.List;

public record ReconciliationResult(
    ReconciliationStatus status,
    String reason,
    long generation,
    int jobsFetched,
    int triggersInstalled,
    List<SkippedJob> skipped,
    String error,
    Instant completedAt
) {
    public static ReconciliationResult superseded(String reason, long currentGeneration, int jobsFetched) {
        return new ReconciliationResult(
            ReconciliationStatus.SUPERSEDED,
            reason,
            currentGeneration,
            jobsFetched,
            0,
            List.of(),
            null,
            Instant.now()
        );
    }

    public static ReconciliationResult failed(String reason, long currentGeneration, String error) {
        return new ReconciliationResult(
            ReconciliationStatus.FAILED,
            reason,
            currentGeneration,
            0,
            0,
            List.of(),
            error,
            Instant.now()
        );
    }
}
