package com.scrapehub.jobs.model;

public enum ReconciliationStatus {
    COMPLETED,
    /** The fetched snapshot was older than one already installed and was discarded. */
    SUPERSEDED,
    FAILED
}
