package com.scrapehub.jobs.scrape;

public abstract class ScrapeException extends RuntimeException {
    protected ScrapeException(String message) {
        super(message);
    }

    protected ScrapeException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Short machine-readable category, e.g. {@code fetch_error}. */
    public abstract String errorCode();
}
