package com.scrapehub.jobs.model;

import com.fasterxml.jackson.databind.JsonNode;

public record LatestContentResponse(
    String jobId,
    String source,
    JsonNode content
) {
}
