package com.scrapehub.jobs.model;

public record SkippedJob(
    String jobId,
    String cronSchedule,
    String reason
) {
}
