package com.scrapehub.jobs.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scrapehub.config.ScrapeHubProperties;
import com.scrapehub.jobs.cache.JobResultCache;
import com.scrapehub.jobs.model.ExecutionRecord;
import com.scrapehub.jobs.model.JobDefinition;
import com.scrapehub.jobs.model.JobUpsertRequest;
import com.scrapehub.jobs.model.LatestContentResponse;
import com.scrapehub.jobs.persistence.JdbcJobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobCatalogServiceTest {
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private JdbcJobStore jobStore;
    @Mock
    private JobResultCache resultCache;
    @Mock
    private ReconciliationService reconciliationService;
    @Mock
    private ExecutionRunner executionRunner;

    private ScrapeHubProperties properties;
    private JobCatalogService service;

    @BeforeEach
    void setUp() {
        properties = new ScrapeHubProperties();
        service = new JobCatalogService(jobStore, resultCache, reconciliationService, executionRunner, properties);
    }

    @Test
    void latestContentPrefersCache() throws Exception {
        JsonNode cached = objectMapper.readTree("[\"a\"]");
        when(resultCache.getLatest("j1")).thenReturn(Optional.of(cached));

        LatestContentResponse response = service.getLatestContent("j1");

        assertThat(response.source()).isEqualTo("cache");
        assertThat(response.content()).isEqualTo(cached);
        verify(jobStore, never()).findLatestSuccessfulHistory(any());
    }

    @Test
    void latestContentFallsBackToHistoryAndRepopulatesCache() throws Exception {
        JsonNode stored = objectMapper.readTree("{\"title\":\"X\"}");
        when(resultCache.getLatest("j1")).thenReturn(Optional.empty());
        when(jobStore.findLatestSuccessfulHistory("j1")).thenReturn(Optional.of(
            new ExecutionRecord("rec-1", "j1", Instant.now().minusSeconds(5), Instant.now(), true, stored)
        ));

        LatestContentResponse response = service.getLatestContent("j1");

        assertThat(response.source()).isEqualTo("history");
        assertThat(response.content()).isEqualTo(stored);
        verify(resultCache).putLatest("j1", stored);
    }

    @Test
    void latestContentIsNotFoundWithoutAnySuccess() {
        when(resultCache.getLatest("j1")).thenReturn(Optional.empty());
        when(jobStore.findLatestSuccessfulHistory("j1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getLatestContent("j1"))
            .isInstanceOfSatisfying(ResponseStatusException.class, ex ->
                assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND));
    }

    @Test
    void createRejectsInvalidScheduleWithoutTouchingStore() {
        JobUpsertRequest request = new JobUpsertRequest("u1", "https://example.com", "h1", "titles", "every minute");

        assertThatThrownBy(() -> service.createJob(request))
            .isInstanceOfSatisfying(ResponseStatusException.class, ex ->
                assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST));
        verify(jobStore, never()).createJob(any());
        verify(reconciliationService, never()).reconcileNow(any());
    }

    @Test
    void createTriggersReconciliation() {
        JobUpsertRequest request = new JobUpsertRequest("u1", "https://example.com", "h1", "titles", "*/15 * * * *");
        when(jobStore.createJob(request))
            .thenReturn(new JobDefinition("j9", "u1", "https://example.com", "h1", "titles", "*/15 * * * *"));

        JobDefinition created = service.createJob(request);

        assertThat(created.id()).isEqualTo("j9");
        verify(reconciliationService).reconcileNow("job_created");
    }

    @Test
    void deleteEvictsCacheAndReconciles() {
        when(jobStore.deleteJob("j1")).thenReturn(true);

        service.deleteJob("j1");

        verify(resultCache).evict("j1");
        verify(reconciliationService).reconcileNow("job_deleted");
    }

    @Test
    void historyLimitIsClamped() {
        properties.getApi().setMaxHistoryLimit(50);

        service.getHistory("j1", 10_000);
        service.getHistory("j1", -3);

        verify(jobStore).findHistory("j1", 50);
        verify(jobStore).findHistory("j1", 1);
    }

    @Test
    void runNowUsesStoredDefinition() {
        JobDefinition job = new JobDefinition("j1", null, "https://example.com", "h1", "titles", "* * * * *");
        when(jobStore.getJob("j1")).thenReturn(Optional.of(job));

        service.runJobNow("j1");

        verify(executionRunner).run(job);
    }

    @Test
    void runNowForUnknownJobIsNotFound() {
        when(jobStore.getJob(eq("missing"))).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.runJobNow("missing"))
            .isInstanceOf(ResponseStatusException.class);
        verify(executionRunner, never()).run(any(JobDefinition.class));
        verify(jobStore, never()).findHistory(any(), anyInt());
    }
}
