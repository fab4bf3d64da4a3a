package com.scrapehub.jobs.persistence;

public class StoreUnavailableException extends JobStoreException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
