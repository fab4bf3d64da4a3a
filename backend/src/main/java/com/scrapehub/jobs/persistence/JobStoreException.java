package com.scrapehub.jobs.persistence;

public abstract class JobStoreException extends RuntimeException {
    protected JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
