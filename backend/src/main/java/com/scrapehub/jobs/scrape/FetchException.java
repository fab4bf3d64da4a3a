package com.scrapehub.jobs.scrape;

/** Target or scraper endpoint could not be reached. */
public class FetchException extends ScrapeException {
    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorCode() {
        return "fetch_error";
    }
}
