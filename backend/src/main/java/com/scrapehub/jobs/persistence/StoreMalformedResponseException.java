package com.scrapehub.jobs.persistence;

public class StoreMalformedResponseException extends JobStoreException {
    public StoreMalformedResponseException(String message) {
        super(message, null);
    }

    public StoreMalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
