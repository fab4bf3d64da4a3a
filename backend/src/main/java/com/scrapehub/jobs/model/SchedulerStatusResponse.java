package com.scrapehub.jobs.model;

import java.time.Instant;
import java.util.List;

public record SchedulerStatusResponse(
    String timeZone,
    Integer pollIntervalSeconds,
    long generation,
    Instant lastAttemptAt,
    Instant lastSuccessAt,
    String lastError,
    ReconciliationResult lastResult,
    List<ActiveTrigger> activeTriggers
) {
}
