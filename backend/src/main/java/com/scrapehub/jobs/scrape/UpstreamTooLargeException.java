package com.scrapehub.jobs.scrape;

/** Scraped text exceeded what the extraction model accepts. */
public class UpstreamTooLargeException extends ScrapeException {
    public UpstreamTooLargeException(String message) {
        super(message);
    }

    public UpstreamTooLargeException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorCode() {
        return "upstream_too_large";
    }
}
