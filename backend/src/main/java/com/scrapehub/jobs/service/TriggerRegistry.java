package com.scrapehub.jobs.service;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Owns the job id to trigger mapping. The mapping is only ever replaced as a whole; readers
 * get the generation that was current when they asked and never see a rebuild in progress.
 */
@Component
public class TriggerRegistry {
    private final Object monitor = new Object();
    private TriggerGeneration current = TriggerGeneration.EMPTY;
    private long installedSnapshotSequence;

    /**
     * Swaps in a new generation built from the snapshot numbered {@code snapshotSequence}, unless
     * a snapshot taken later has already been installed. {@code rebuild} receives the outgoing
     * generation and the number assigned to the incoming one, and runs while the monitor is held
     * so that cancelling the old triggers and arming the new ones happens as one step.
     *
     * @return the installed generation, or empty when the snapshot was superseded
     */
    public Optional<TriggerGeneration> replaceIfNewer(
        long snapshotSequence,
        BiFunction<TriggerGeneration, Long, List<ScheduledTrigger>> rebuild
    ) {
        synchronized (monitor) {
            if (snapshotSequence <= installedSnapshotSequence) {
                return Optional.empty();
            }
            installedSnapshotSequence = snapshotSequence;
            return Optional.of(swap(rebuild));
        }
    }

    /** Unconditional swap, used to tear everything down on shutdown. */
    public TriggerGeneration replaceAll(BiFunction<TriggerGeneration, Long, List<ScheduledTrigger>> rebuild) {
        synchronized (monitor) {
            return swap(rebuild);
        }
    }

    public TriggerGeneration snapshot() {
        synchronized (monitor) {
            return current;
        }
    }

    private TriggerGeneration swap(BiFunction<TriggerGeneration, Long, List<ScheduledTrigger>> rebuild) {
        long nextNumber = current.number() + 1;
        List<ScheduledTrigger> triggers = rebuild.apply(current, nextNumber);
        current = new TriggerGeneration(nextNumber, triggers);
        return current;
    }
}
