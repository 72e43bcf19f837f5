package org.neuralchilli.qrun.monitoring;

import org.neuralchilli.qrun.domain.TaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters for a single run: what executed, what the cache saved, what failed.
 * Logged as a one-line summary when the run ends.
 */
public class RunMonitor {

    private static final Logger log = LoggerFactory.getLogger(RunMonitor.class);

    // Task outcomes
    private final LongAdder tasksExecuted = new LongAdder();
    private final LongAdder tasksSkipped = new LongAdder();
    private final LongAdder tasksFailed = new LongAdder();
    private final LongAdder tasksTimedOut = new LongAdder();

    // Cache
    private final LongAdder fingerprintsAdded = new LongAdder();

    // Timing
    private final LongAdder totalTaskMillis = new LongAdder();
    private final AtomicLong slowestTaskMillis = new AtomicLong(0);
    private volatile String slowestTask;

    public void recordResult(TaskResult result) {
        switch (result.status()) {
            case SKIPPED -> tasksSkipped.increment();
            case COMPLETED -> tasksExecuted.increment();
            case FAILED -> {
                tasksExecuted.increment();
                tasksFailed.increment();
            }
            case TIMED_OUT -> {
                tasksExecuted.increment();
                tasksTimedOut.increment();
            }
        }

        if (result.status().wasExecuted()) {
            recordTiming(result.taskId(), result.duration());
        }
    }

    public void recordFingerprintAdded() {
        fingerprintsAdded.increment();
    }

    private void recordTiming(String taskId, Duration duration) {
        long millis = duration.toMillis();
        totalTaskMillis.add(millis);
        if (millis > slowestTaskMillis.getAndAccumulate(millis, Math::max)) {
            slowestTask = taskId;
        }
    }

    public RunStats getStats() {
        return new RunStats(
                tasksExecuted.sum(),
                tasksSkipped.sum(),
                tasksFailed.sum(),
                tasksTimedOut.sum(),
                fingerprintsAdded.sum(),
                totalTaskMillis.sum(),
                slowestTask,
                slowestTaskMillis.get()
        );
    }

    public void logSummary(Duration wallClock) {
        RunStats stats = getStats();
        log.info("Run finished in {}ms: {} executed, {} skipped, {} failed, {} timed out, {} new fingerprint(s)",
                wallClock.toMillis(),
                stats.executed(),
                stats.skipped(),
                stats.failed(),
                stats.timedOut(),
                stats.fingerprintsAdded());
        if (stats.slowestTask() != null) {
            log.debug("Slowest task: {} ({}ms), total task time {}ms",
                    stats.slowestTask(), stats.slowestTaskMillis(), stats.totalTaskMillis());
        }
    }

    public record RunStats(
            long executed,
            long skipped,
            long failed,
            long timedOut,
            long fingerprintsAdded,
            long totalTaskMillis,
            String slowestTask,
            long slowestTaskMillis
    ) {
        public double cacheHitRate() {
            long total = executed + skipped;
            return total > 0 ? (double) skipped / total : 0.0;
        }
    }
}
