package com.scrapehub.jobs.scrape;

/** The scraper answered but its payload could not be turned into a result. */
public class ExtractionException extends ScrapeException {
    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorCode() {
        return "extraction_error";
    }
}
