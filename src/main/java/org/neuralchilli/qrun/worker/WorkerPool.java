package org.neuralchilli.qrun.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Bounded pool that runs tasks for the whole of a run.
 * <p>
 * Admission is a counting semaphore sized to the worker cap: a slot is
 * taken before work is handed to a thread and given back when the work
 * finishes, so no more than {@code workers} tasks are ever in flight,
 * whatever the number of levels or eligible tasks.
 */
public class WorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final int workers;
    private final Semaphore admission;
    private final ExecutorService executorService;
    private final AtomicInteger inFlight = new AtomicInteger(0);
    private final AtomicInteger peakInFlight = new AtomicInteger(0);
    private volatile boolean running = true;

    public WorkerPool(int workers, String threadPrefix) {
        if (workers < 1) {
            throw new IllegalArgumentException("Worker pool needs at least one worker, got: " + workers);
        }
        this.workers = workers;
        this.admission = new Semaphore(workers, true);
        this.executorService = Executors.newFixedThreadPool(workers, new WorkerThreadFactory(threadPrefix));
        log.debug("Worker pool started: {} workers", workers);
    }

    /**
     * Wait for a free slot, then run the work on a pool thread.
     *
     * @throws InterruptedException if interrupted while waiting for a slot
     */
    public <T> CompletableFuture<T> submit(Supplier<T> work) throws InterruptedException {
        if (!running) {
            throw new IllegalStateException("Worker pool is stopped");
        }

        admission.acquire();
        try {
            return CompletableFuture.supplyAsync(() -> {
                peakInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                try {
                    return work.get();
                } finally {
                    inFlight.decrementAndGet();
                    admission.release();
                }
            }, executorService);
        } catch (RejectedExecutionException e) {
            admission.release();
            throw e;
        }
    }

    /**
     * Stop the pool. In-flight work is allowed to finish.
     */
    @Override
    public void close() {
        if (!running) {
            return;
        }
        running = false;

        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(60, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not terminate in 60 seconds, forcing shutdown");
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.debug("Worker pool stopped (peak concurrency {})", peakInFlight.get());
    }

    public WorkerPoolStats getStats() {
        return new WorkerPoolStats(workers, inFlight.get(), peakInFlight.get(), running);
    }

    /**
     * Thread factory for creating named worker threads.
     */
    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);
        private final String prefix;

        WorkerThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setName(prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Worker pool statistics.
     */
    public record WorkerPoolStats(
            int totalWorkers,
            int busyWorkers,
            int peakBusyWorkers,
            boolean running
    ) {
    }
}
