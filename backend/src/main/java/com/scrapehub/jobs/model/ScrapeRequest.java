package com.scrapehub.jobs.model;

public record ScrapeRequest(
    String href,
    String selector,
    String description
) {
}
