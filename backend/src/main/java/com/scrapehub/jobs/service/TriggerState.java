package com.scrapehub.jobs.service;

public enum TriggerState {
    INSTALLED,
    CANCELLED
}
