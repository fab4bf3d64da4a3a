package com.scrapehub.jobs.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record ExecutionRecord(
    String id,
    String jobId,
    Instant startedAt,
    Instant endedAt,
    boolean successful,
    JsonNode content
) {
}
