package com.scrapehub.jobs.scrape;

import com.fasterxml.jackson.databind.JsonNode;
import com.scrapehub.jobs.model.ScrapeRequest;

/**
 * Turns a target (href, CSS selector, extraction description) into structured JSON.
 * Failures are reported as {@link ScrapeException} subclasses.
 */
public interface ScrapeExecutor {

    JsonNode execute(ScrapeRequest request);
}
