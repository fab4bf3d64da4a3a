package com.scrapehub.jobs.model;

public record JobUpsertRequest(
    String userId,
    String href,
    String selector,
    String description,
    String cronSchedule
) {
}
