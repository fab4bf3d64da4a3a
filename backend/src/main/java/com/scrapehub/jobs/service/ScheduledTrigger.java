package com.scrapehub.jobs.service;

import com.scrapehub.jobs.model.ActiveTrigger;
import com.scrapehub.jobs.model.JobDefinition;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.ScheduledFuture;

/**
 * One job's timer within a generation. Moves from {@link TriggerState#INSTALLED} to
 * {@link TriggerState#CANCELLED} exactly once and never back.
 */
public class ScheduledTrigger {
    private final JobDefinition job;
    private final CronExpression cron;
    private final ZoneId zone;
    private final long generation;

    private TriggerState state = TriggerState.INSTALLED;
    private ScheduledFuture<?> future;
    private long fireCount;
    private Instant lastFiredAt;

    ScheduledTrigger(JobDefinition job, CronExpression cron, ZoneId zone, long generation) {
        this.job = job;
        this.cron = cron;
        this.zone = zone;
        this.generation = generation;
    }

    public String jobId() {
        return job.id();
    }

    public JobDefinition job() {
        return job;
    }

    synchronized void attach(ScheduledFuture<?> future) {
        this.future = future;
        if (state == TriggerState.CANCELLED && future != null) {
            future.cancel(false);
        }
    }

    /**
     * Records a fire. Returns false when the trigger was cancelled before the fire started,
     * in which case the execution must not be dispatched.
     */
    synchronized boolean markFired(Instant firedAt) {
        if (state == TriggerState.CANCELLED) {
            return false;
        }
        fireCount++;
        lastFiredAt = firedAt;
        return true;
    }

    /** Stops future fires. Executions already dispatched keep running. */
    synchronized void cancel() {
        if (state == TriggerState.CANCELLED) {
            return;
        }
        state = TriggerState.CANCELLED;
        if (future != null) {
            future.cancel(false);
        }
    }

    public synchronized ActiveTrigger toView(Instant now) {
        ZonedDateTime next = cron.next(now.atZone(zone));
        return new ActiveTrigger(
            job.id(),
            job.cronSchedule(),
            generation,
            fireCount,
            lastFiredAt,
            next == null ? null : next.toInstant()
        );
    }
}
