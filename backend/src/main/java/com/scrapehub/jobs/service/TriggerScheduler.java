package com.scrapehub.jobs.service;

import com.scrapehub.config.ScrapeHubProperties;
import com.scrapehub.jobs.model.ActiveTrigger;
import com.scrapehub.jobs.model.JobDefinition;
import com.scrapehub.jobs.model.ReconciliationResult;
import com.scrapehub.jobs.model.ReconciliationStatus;
import com.scrapehub.jobs.model.SkippedJob;
import com.scrapehub.jobs.util.CronExpressions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;

@Service
public class TriggerScheduler {
    private static final Logger log = LoggerFactory.getLogger(TriggerScheduler.class);

    private final TriggerRegistry registry;
    private final TaskScheduler taskScheduler;
    private final ExecutorService jobExecutor;
    private final ExecutionRunner executionRunner;
    private final ZoneId zone;
    private final AtomicLong snapshotSequence = new AtomicLong();

    public TriggerScheduler(
        TriggerRegistry registry,
        @Qualifier("triggerTaskScheduler") TaskScheduler taskScheduler,
        @Qualifier("jobExecutor") ExecutorService jobExecutor,
        ExecutionRunner executionRunner,
        ScrapeHubProperties properties
    ) {
        this.registry = registry;
        this.taskScheduler = taskScheduler;
        this.jobExecutor = jobExecutor;
        this.executionRunner = executionRunner;
        this.zone = properties.getZoneId();
    }

    public ReconciliationResult reconcile(List<JobDefinition> snapshot) {
        return reconcile(snapshot, "direct");
    }

    public ReconciliationResult reconcile(List<JobDefinition> snapshot, String reason) {
        return reconcile(snapshot, reason, beginSnapshot());
    }

    /**
     * Numbers a snapshot that is about to be fetched. Call before reading the job store, and pass
     * the number to {@link #reconcile(List, String, long)} so a slow fetch cannot overwrite the
     * result of a later one.
     */
    public long beginSnapshot() {
        return snapshotSequence.incrementAndGet();
    }

    /**
     * Tears down every active trigger and installs one per valid job in {@code snapshot}.
     * Jobs with an unparseable expression or a repeated id are skipped and reported. A snapshot
     * numbered lower than the one currently installed changes nothing and is reported as
     * {@link ReconciliationStatus#SUPERSEDED}.
     */
    public ReconciliationResult reconcile(List<JobDefinition> snapshot, String reason, long sequence) {
        List<JobDefinition> jobs = snapshot == null ? List.of() : snapshot;
        List<SkippedJob> skipped = new ArrayList<>();
        List<Candidate> candidates = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();

        for (JobDefinition job : jobs) {
            if (job == null || job.id() == null || job.id().isBlank()) {
                log.warn("Skipping job without id during reconciliation");
                skipped.add(new SkippedJob(null, job == null ? null : job.cronSchedule(), "missing_job_id"));
                continue;
            }
            if (!seen.add(job.id())) {
                log.warn("Skipping duplicate definition for job {}", job.id());
                skipped.add(new SkippedJob(job.id(), job.cronSchedule(), "duplicate_job_id"));
                continue;
            }
            try {
                String pattern = CronExpressions.toSpringPattern(job.cronSchedule());
                candidates.add(new Candidate(job, CronExpression.parse(pattern), pattern));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping job {}: invalid cron schedule '{}': {}", job.id(), job.cronSchedule(), e.getMessage());
                skipped.add(new SkippedJob(job.id(), job.cronSchedule(), "invalid_cron: " + e.getMessage()));
            }
        }

        Optional<TriggerGeneration> swapped = registry.replaceIfNewer(sequence, (previous, number) -> {
            previous.triggers().values().forEach(ScheduledTrigger::cancel);
            List<ScheduledTrigger> armed = new ArrayList<>(candidates.size());
            for (Candidate candidate : candidates) {
                ScheduledTrigger trigger = new ScheduledTrigger(candidate.job(), candidate.cron(), zone, number);
                try {
                    ScheduledFuture<?> future = taskScheduler.schedule(
                        () -> fire(trigger),
                        new CronTrigger(candidate.pattern(), zone)
                    );
                    trigger.attach(future);
                    armed.add(trigger);
                } catch (RuntimeException e) {
                    trigger.cancel();
                    log.warn("Skipping job {}: trigger could not be scheduled", candidate.job().id(), e);
                    skipped.add(new SkippedJob(candidate.job().id(), candidate.job().cronSchedule(), "schedule_rejected"));
                }
            }
            return armed;
        });

        if (swapped.isEmpty()) {
            long current = currentGeneration();
            log.info(
                "Discarding snapshot #{} ({}): a newer snapshot is already installed as generation {}",
                sequence,
                reason,
                current
            );
            return ReconciliationResult.superseded(reason, current, jobs.size());
        }
        TriggerGeneration installed = swapped.get();
        log.info(
            "Installed trigger generation {} ({}): {} active, {} skipped",
            installed.number(),
            reason,
            installed.size(),
            skipped.size()
        );
        return new ReconciliationResult(
            ReconciliationStatus.COMPLETED,
            reason,
            installed.number(),
            jobs.size(),
            installed.size(),
            List.copyOf(skipped),
            null,
            Instant.now()
        );
    }

    public List<ActiveTrigger> listActiveTriggers() {
        TriggerGeneration generation = registry.snapshot();
        Instant now = Instant.now();
        List<ActiveTrigger> views = new ArrayList<>(generation.size());
        for (ScheduledTrigger trigger : generation.triggers().values()) {
            views.add(trigger.toView(now));
        }
        return views;
    }

    public long currentGeneration() {
        return registry.snapshot().number();
    }

    public ZoneId zone() {
        return zone;
    }

    @PreDestroy
    public void cancelAll() {
        registry.replaceAll((previous, number) -> {
            previous.triggers().values().forEach(ScheduledTrigger::cancel);
            return List.of();
        });
    }

    void fire(ScheduledTrigger trigger) {
        if (!trigger.markFired(Instant.now())) {
            log.debug("Trigger for job {} fired after cancellation; ignoring", trigger.jobId());
            return;
        }
        JobDefinition job = trigger.job();
        try {
            jobExecutor.execute(() -> executionRunner.run(job));
        } catch (RejectedExecutionException e) {
            log.warn("Worker pool rejected execution of job {}", job.id(), e);
        }
    }

    private record Candidate(JobDefinition job, CronExpression cron, String pattern) {
    }
}
