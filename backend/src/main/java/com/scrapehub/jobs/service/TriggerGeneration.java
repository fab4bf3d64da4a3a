package com.scrapehub.jobs.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Triggers installed by one reconciliation pass, keyed by job id in snapshot order.
 */
public final class TriggerGeneration {
    static final TriggerGeneration EMPTY = new TriggerGeneration(0L, List.of());

    private final long number;
    private final Map<String, ScheduledTrigger> triggers;

    TriggerGeneration(long number, List<ScheduledTrigger> triggers) {
        Map<String, ScheduledTrigger> byJobId = new LinkedHashMap<>();
        for (ScheduledTrigger trigger : triggers) {
            if (byJobId.putIfAbsent(trigger.jobId(), trigger) != null) {
                throw new IllegalArgumentException("Duplicate trigger for job " + trigger.jobId());
            }
        }
        this.number = number;
        this.triggers = Collections.unmodifiableMap(byJobId);
    }

    public long number() {
        return number;
    }

    public Map<String, ScheduledTrigger> triggers() {
        return triggers;
    }

    public int size() {
        return triggers.size();
    }
}
