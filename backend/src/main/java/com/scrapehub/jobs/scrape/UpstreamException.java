package com.scrapehub.jobs.scrape;

/** The scraper or one of its downstream services reported an error. */
public class UpstreamException extends ScrapeException {
    public UpstreamException(String message) {
        super(message);
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorCode() {
        return "upstream_error";
    }
}
