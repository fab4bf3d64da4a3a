package com.scrapehub.jobs.service;

import java.util.List;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/** Runs dispatched executions on the firing thread; rejects work once shut down. */
final class InlineWorkerPool extends AbstractExecutorService {
    private final AtomicInteger executed = new AtomicInteger();
    private volatile boolean shutdown;

    int executedCount() {
        return executed.get();
    }

    @Override
    public void execute(Runnable command) {
        if (shutdown) {
            throw new RejectedExecutionException("worker pool is shut down");
        }
        executed.incrementAndGet();
        command.run();
    }

    @Override
    public void shutdown() {
        shutdown = true;
    }

    @Override
    public List<Runnable> shutdownNow() {
        shutdown = true;
        return List.of();
    }

    @Override
    public boolean isShutdown() {
        return shutdown;
    }

    @Override
    public boolean isTerminated() {
        return shutdown;
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) {
        return true;
    }
}
