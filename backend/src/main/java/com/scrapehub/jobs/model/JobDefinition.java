package com.scrapehub.jobs.model;

public record JobDefinition(
    String id,
    String userId,
    String href,
    String selector,
    String description,
    String cronSchedule
) {
}
