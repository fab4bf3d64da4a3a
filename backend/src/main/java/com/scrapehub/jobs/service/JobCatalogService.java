package com.scrapehub.jobs.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.scrapehub.config.ScrapeHubProperties;
import com.scrapehub.jobs.cache.JobResultCache;
import com.scrapehub.jobs.model.ExecutionOutcome;
import com.scrapehub.jobs.model.ExecutionRecord;
import com.scrapehub.jobs.model.JobDefinition;
import com.scrapehub.jobs.model.JobUpsertRequest;
import com.scrapehub.jobs.model.LatestContentResponse;
import com.scrapehub.jobs.persistence.JdbcJobStore;
import com.scrapehub.jobs.util.CronExpressions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Optional;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@Service
public class JobCatalogService {
    private static final Logger log = LoggerFactory.getLogger(JobCatalogService.class);
    static final String SOURCE_CACHE = "cache";
    static final String SOURCE_HISTORY = "history";

    private final JdbcJobStore jobStore;
    private final JobResultCache resultCache;
    private final ReconciliationService reconciliationService;
    private final ExecutionRunner executionRunner;
    private final ScrapeHubProperties properties;

    public JobCatalogService(
        JdbcJobStore jobStore,
        JobResultCache resultCache,
        ReconciliationService reconciliationService,
        ExecutionRunner executionRunner,
        ScrapeHubProperties properties
    ) {
        this.jobStore = jobStore;
        this.resultCache = resultCache;
        this.reconciliationService = reconciliationService;
        this.executionRunner = executionRunner;
        this.properties = properties;
    }

    public List<JobDefinition> listJobs(String userId) {
        if (userId == null || userId.isBlank()) {
            return jobStore.listJobs();
        }
        return jobStore.listJobsByUser(userId.trim());
    }

    public JobDefinition getJob(String jobId) {
        return jobStore.getJob(jobId)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "Unknown scraping job: " + jobId));
    }

    public JobDefinition createJob(JobUpsertRequest request) {
        validate(request);
        JobDefinition created = jobStore.createJob(request);
        log.info("Created scraping job {} with schedule '{}'", created.id(), created.cronSchedule());
        reconciliationService.reconcileNow("job_created");
        return created;
    }

    public JobDefinition updateJob(String jobId, JobUpsertRequest request) {
        validate(request);
        JobDefinition updated = jobStore.updateJob(jobId, request)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "Unknown scraping job: " + jobId));
        log.info("Updated scraping job {} with schedule '{}'", jobId, updated.cronSchedule());
        reconciliationService.reconcileNow("job_updated");
        return updated;
    }

    public void deleteJob(String jobId) {
        if (!jobStore.deleteJob(jobId)) {
            throw new ResponseStatusException(NOT_FOUND, "Unknown scraping job: " + jobId);
        }
        try {
            resultCache.evict(jobId);
        } catch (RuntimeException e) {
            log.warn("Failed to evict cached result for deleted job {}", jobId, e);
        }
        log.info("Deleted scraping job {}", jobId);
        reconciliationService.reconcileNow("job_deleted");
    }

    public List<ExecutionRecord> getHistory(String jobId, Integer limit) {
        int max = properties.getApi().getMaxHistoryLimit();
        int safeLimit = limit == null ? properties.getApi().getDefaultHistoryLimit() : Math.max(1, Math.min(limit, max));
        return jobStore.findHistory(jobId, safeLimit);
    }

    /**
     * Latest successful result, from the cache when present, otherwise from history (which
     * then repopulates the cache).
     */
    public LatestContentResponse getLatestContent(String jobId) {
        Optional<JsonNode> cached = Optional.empty();
        try {
            cached = resultCache.getLatest(jobId);
        } catch (RuntimeException e) {
            log.warn("Cache read failed for job {}; falling back to history", jobId, e);
        }
        if (cached.isPresent()) {
            return new LatestContentResponse(jobId, SOURCE_CACHE, cached.get());
        }

        ExecutionRecord latest = jobStore.findLatestSuccessfulHistory(jobId)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "No successful result for scraping job: " + jobId));
        if (latest.content() != null) {
            try {
                resultCache.putLatest(jobId, latest.content());
            } catch (RuntimeException e) {
                log.warn("Failed to repopulate cache for job {}", jobId, e);
            }
        }
        return new LatestContentResponse(jobId, SOURCE_HISTORY, latest.content());
    }

    /** Runs a job immediately, outside its schedule, with the definition currently stored. */
    public ExecutionOutcome runJobNow(String jobId) {
        JobDefinition job = getJob(jobId);
        log.info("Manual run requested for job {}", jobId);
        return executionRunner.run(job);
    }

    private void validate(JobUpsertRequest request) {
        if (request == null) {
            throw new ResponseStatusException(BAD_REQUEST, "Request body is required");
        }
        if (isBlank(request.href())) {
            throw new ResponseStatusException(BAD_REQUEST, "href is required");
        }
        if (isBlank(request.selector())) {
            throw new ResponseStatusException(BAD_REQUEST, "selector is required");
        }
        if (isBlank(request.cronSchedule())) {
            throw new ResponseStatusException(BAD_REQUEST, "cronSchedule is required");
        }
        if (!CronExpressions.isValid(request.cronSchedule())) {
            throw new ResponseStatusException(BAD_REQUEST, "Invalid cronSchedule: " + request.cronSchedule());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
