package com.scrapehub.jobs.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scrapehub.jobs.cache.JobResultCache;
import com.scrapehub.jobs.model.ExecutionOutcome;
import com.scrapehub.jobs.model.ExecutionRecord;
import com.scrapehub.jobs.model.JobDefinition;
import com.scrapehub.jobs.model.ScrapeRequest;
import com.scrapehub.jobs.persistence.JobStore;
import com.scrapehub.jobs.scrape.ScrapeException;
import com.scrapehub.jobs.scrape.ScrapeExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Runs one firing of a job: scrape, append exactly one history record, then refresh the cache
 * on success. Nothing thrown by a collaborator escapes {@link #run}.
 */
@Service
public class ExecutionRunner {
    private static final Logger log = LoggerFactory.getLogger(ExecutionRunner.class);
    private static final String UNKNOWN_ERROR = "Unknown error";

    private final ScrapeExecutor scrapeExecutor;
    private final JobStore jobStore;
    private final JobResultCache resultCache;
    private final ObjectMapper objectMapper;

    public ExecutionRunner(
        ScrapeExecutor scrapeExecutor,
        JobStore jobStore,
        JobResultCache resultCache,
        ObjectMapper objectMapper
    ) {
        this.scrapeExecutor = scrapeExecutor;
        this.jobStore = jobStore;
        this.resultCache = resultCache;
        this.objectMapper = objectMapper;
    }

    public ExecutionOutcome run(JobDefinition job) {
        return run(job.id(), job.href(), job.selector(), job.description());
    }

    public ExecutionOutcome run(String jobId, String href, String selector, String description) {
        Instant startedAt = Instant.now();
        JsonNode content;
        boolean successful;
        try {
            content = scrapeExecutor.execute(new ScrapeRequest(href, selector, description));
            successful = true;
        } catch (ScrapeException e) {
            log.warn("Scrape for job {} failed ({}): {}", jobId, e.errorCode(), e.getMessage());
            content = errorPayload(e.getMessage());
            successful = false;
        } catch (RuntimeException e) {
            log.warn("Scrape for job {} failed unexpectedly", jobId, e);
            content = errorPayload(e.getMessage());
            successful = false;
        }
        Instant endedAt = Instant.now();

        ExecutionRecord record = null;
        try {
            String recordId = jobStore.appendHistory(jobId, startedAt, endedAt, successful, content);
            record = new ExecutionRecord(recordId, jobId, startedAt, endedAt, successful, content);
        } catch (RuntimeException e) {
            log.error(
                "Failed to record execution of job {} (startedAt={}, endedAt={}, successful={}); attempt is not in history",
                jobId,
                startedAt,
                endedAt,
                successful,
                e
            );
        }

        boolean cacheUpdated = false;
        if (successful) {
            try {
                resultCache.putLatest(jobId, content);
                cacheUpdated = true;
            } catch (RuntimeException e) {
                log.warn("Failed to cache latest result for job {}", jobId, e);
            }
        }

        log.info("Job {} finished: successful={}, recorded={}", jobId, successful, record != null);
        return new ExecutionOutcome(record, record != null, cacheUpdated);
    }

    private JsonNode errorPayload(String message) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("error", message == null || message.isBlank() ? UNKNOWN_ERROR : message);
        return payload;
    }
}
