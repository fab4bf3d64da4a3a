package com.scrapehub.jobs.service;

import com.scrapehub.config.ScrapeHubProperties;
import com.scrapehub.jobs.model.JobDefinition;
import com.scrapehub.jobs.model.ReconciliationResult;
import com.scrapehub.jobs.model.SchedulerStatusResponse;
import com.scrapehub.jobs.persistence.JobStore;
import com.scrapehub.jobs.persistence.JobStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Feeds fresh job snapshots to the {@link TriggerScheduler}: once at startup, then on the
 * configured polling interval, and whenever {@link #reconcileNow} is called.
 */
@Service
public class ReconciliationService {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);
    private static final int MAX_ERROR_LENGTH = 500;

    private final JobStore jobStore;
    private final TriggerScheduler triggerScheduler;
    private final ScrapeHubProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean everSucceeded = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private ScheduledExecutorService timer;
    private volatile Instant lastAttemptAt;
    private volatile Instant lastSuccessAt;
    private volatile String lastError;
    private volatile ReconciliationResult lastResult;

    public ReconciliationService(
        JobStore jobStore,
        TriggerScheduler triggerScheduler,
        ScrapeHubProperties properties
    ) {
        this.jobStore = jobStore;
        this.triggerScheduler = triggerScheduler;
        this.properties = properties;
    }

    @PostConstruct
    public void startIfEnabled() {
        ScrapeHubProperties.Reconciliation config = properties.getReconciliation();
        if (config.isRunOnStartup() || config.isPollingEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            ScrapeHubProperties.Reconciliation config = properties.getReconciliation();
            timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("reconciliation-loop");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            if (config.isPollingEnabled()) {
                long interval = config.getPollIntervalSeconds();
                long initialDelay = config.isRunOnStartup() ? 0L : interval;
                timer.scheduleWithFixedDelay(() -> reconcileQuietly("poll"), initialDelay, interval, TimeUnit.SECONDS);
                log.info("Reconciliation polling every {}s", interval);
            } else if (config.isRunOnStartup()) {
                timer.execute(() -> reconcileQuietly("startup"));
                log.info("Reconciliation polling disabled; reconciling once at startup");
            }
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (timer != null) {
                timer.shutdownNow();
                try {
                    timer.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                timer = null;
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Fetches all jobs and rebuilds the trigger set. A failed fetch leaves the current
     * generation installed and is reported in the returned result.
     */
    public ReconciliationResult reconcileNow(String reason) {
        lastAttemptAt = Instant.now();
        long sequence = triggerScheduler.beginSnapshot();
        List<JobDefinition> snapshot;
        try {
            snapshot = jobStore.listJobs();
        } catch (JobStoreException e) {
            return recordFailure(reason, e);
        } catch (RuntimeException e) {
            log.warn("Unexpected error fetching jobs for reconciliation", e);
            return recordFailure(reason, e);
        }

        ReconciliationResult result = triggerScheduler.reconcile(snapshot, reason, sequence);
        lastResult = result;
        lastSuccessAt = result.completedAt();
        lastError = null;
        everSucceeded.set(true);
        return result;
    }

    public SchedulerStatusResponse getStatus() {
        return new SchedulerStatusResponse(
            triggerScheduler.zone().getId(),
            properties.getReconciliation().getPollIntervalSeconds(),
            triggerScheduler.currentGeneration(),
            lastAttemptAt,
            lastSuccessAt,
            lastError,
            lastResult,
            triggerScheduler.listActiveTriggers()
        );
    }

    private void reconcileQuietly(String reason) {
        try {
            reconcileNow(reason);
        } catch (RuntimeException e) {
            log.warn("Reconciliation ({}) failed unexpectedly", reason, e);
        }
    }

    private ReconciliationResult recordFailure(String reason, Exception e) {
        String message = truncate(e.getClass().getSimpleName() + ": " + e.getMessage());
        if (everSucceeded.get()) {
            log.warn("Reconciliation ({}) could not fetch jobs; keeping generation {}: {}",
                reason, triggerScheduler.currentGeneration(), message);
        } else {
            log.error("Reconciliation ({}) could not fetch jobs and no schedule has been installed yet; "
                + "running with an empty trigger set until the job store is reachable: {}", reason, message);
        }
        ReconciliationResult result = ReconciliationResult.failed(reason, triggerScheduler.currentGeneration(), message);
        lastResult = result;
        lastError = message;
        return result;
    }

    private String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_LENGTH);
    }
}
