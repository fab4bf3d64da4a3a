package com.scrapehub.jobs.model;

import java.time.Instant;

public record ActiveTrigger(
    String jobId,
    String cronSchedule,
    long generation,
    long fireCount,
    Instant lastFiredAt,
    Instant nextFireAt
) {
}
