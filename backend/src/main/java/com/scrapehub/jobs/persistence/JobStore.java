package com.scrapehub.jobs.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.scrapehub.jobs.model.JobDefinition;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Source of truth for job definitions and the append-only execution history.
 */
public interface JobStore {

    /**
     * All job definitions, in a stable order.
     *
     * @throws StoreUnavailableException when the store cannot be reached
     * @throws StoreMalformedResponseException when a row cannot be mapped to a definition
     */
    List<JobDefinition> listJobs();

    Optional<JobDefinition> getJob(String id);

    /**
     * @return id of the new history record
     * @throws StoreUnavailableException when the record cannot be written
     */
    String appendHistory(String jobId, Instant startedAt, Instant endedAt, boolean successful, JsonNode content);
}
