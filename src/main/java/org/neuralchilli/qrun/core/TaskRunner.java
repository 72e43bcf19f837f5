package org.neuralchilli.qrun.core;

import org.neuralchilli.qrun.domain.ExecutionLevel;
import org.neuralchilli.qrun.domain.OutputMode;
import org.neuralchilli.qrun.domain.Task;
import org.neuralchilli.qrun.domain.TaskResult;
import org.neuralchilli.qrun.monitoring.RunMonitor;
import org.neuralchilli.qrun.service.ChangeDetector;
import org.neuralchilli.qrun.service.FileException;
import org.neuralchilli.qrun.service.FileResolver;
import org.neuralchilli.qrun.service.Fingerprinter;
import org.neuralchilli.qrun.service.IncrementalCache;
import org.neuralchilli.qrun.service.OutputCleaner;
import org.neuralchilli.qrun.worker.CommandException;
import org.neuralchilli.qrun.worker.CommandExecutor;
import org.neuralchilli.qrun.worker.ConsoleSink;
import org.neuralchilli.qrun.worker.ProcessOutput;
import org.neuralchilli.qrun.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Executes task levels in ascending order with a hard barrier between them.
 * <p>
 * Within a level, every task that the change detector flags is dispatched
 * to a worker pool whose cap holds across the whole run. The next level
 * starts only after every task of the current one has terminated.
 * <p>
 * Results are collected on the calling thread, which is the only one that
 * touches the cache. A failure lets the rest of its level finish; later
 * levels are attempted only with {@code continueOnFailure}.
 */
public class TaskRunner {

    private static final Logger log = LoggerFactory.getLogger(TaskRunner.class);

    public static final String DEFAULT_THREAD_PREFIX = "qrun-worker";

    private final Map<String, Task> tasks;
    private final IncrementalCache cache;
    private final RunOptions options;
    private final FileResolver fileResolver;
    private final Fingerprinter fingerprinter;
    private final ChangeDetector changeDetector;
    private final OutputCleaner outputCleaner;
    private final CommandExecutor executor;
    private final ConsoleSink console;
    private final String threadPrefix;
    private final RunMonitor monitor = new RunMonitor();

    public TaskRunner(
            List<Task> tasks,
            IncrementalCache cache,
            RunOptions options,
            Path baseDirectory,
            CommandExecutor executor,
            ConsoleSink console
    ) {
        this(tasks, cache, options, baseDirectory, executor, console, DEFAULT_THREAD_PREFIX);
    }

    public TaskRunner(
            List<Task> tasks,
            IncrementalCache cache,
            RunOptions options,
            Path baseDirectory,
            CommandExecutor executor,
            ConsoleSink console,
            String threadPrefix
    ) {
        this.tasks = tasks.stream().collect(Collectors.toMap(Task::id, Function.identity()));
        this.cache = cache;
        this.options = options;
        this.fileResolver = new FileResolver(baseDirectory);
        this.fingerprinter = new Fingerprinter(fileResolver);
        this.changeDetector = new ChangeDetector(fileResolver, fingerprinter, cache);
        this.outputCleaner = new OutputCleaner(fileResolver);
        this.executor = executor;
        this.console = console;
        this.threadPrefix = threadPrefix;
    }

    /**
     * Run the given levels.
     *
     * @return the per-task results and whether the cache gained an entry
     */
    public RunReport run(List<ExecutionLevel> levels) {
        List<ExecutionLevel> ordered = levels.stream()
                .sorted(Comparator.comparingInt(ExecutionLevel::level))
                .toList();

        if (options.dryRun()) {
            return dryRun(ordered);
        }

        Instant start = Instant.now();
        List<TaskResult> results = new ArrayList<>();
        boolean cacheChanged = false;
        boolean aborted = false;

        try (WorkerPool pool = new WorkerPool(options.workers(), threadPrefix)) {
            for (ExecutionLevel level : ordered) {
                LevelOutcome outcome = runLevel(level, pool);
                results.addAll(outcome.results());
                cacheChanged |= outcome.cacheChanged();

                if (outcome.failed() && !options.continueOnFailure()) {
                    log.error("Stopping after level {} because a task failed", level.level());
                    aborted = true;
                    break;
                }
                if (outcome.failed()) {
                    log.warn("Level {} had failures, continuing with the next level", level.level());
                }
            }
        }

        monitor.logSummary(Duration.between(start, Instant.now()));
        return new RunReport(results, cacheChanged, aborted);
    }

    private LevelOutcome runLevel(ExecutionLevel level, WorkerPool pool) {
        log.debug("Starting level {} ({} task(s))", level.level(), level.size());

        List<TaskResult> results = new ArrayList<>();
        Map<String, CompletableFuture<TaskResult>> inFlight = new LinkedHashMap<>();
        boolean interrupted = false;

        for (String taskId : level.taskIds()) {
            Task task = lookup(taskId);

            if (!changeDetector.shouldRun(task)) {
                log.info("Skipping task: {} (up to date)", taskId);
                results.add(TaskResult.skipped(taskId));
                continue;
            }

            try {
                inFlight.put(taskId, pool.submit(() -> execute(task)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                results.add(TaskResult.failed(taskId, null, "Interrupted before start", Duration.ZERO));
                interrupted = true;
                break;
            }
        }

        // Barrier: every dispatched task terminates before the level is done
        for (Map.Entry<String, CompletableFuture<TaskResult>> entry : inFlight.entrySet()) {
            results.add(collect(entry.getKey(), entry.getValue()));
        }

        boolean cacheChanged = false;
        boolean failed = interrupted;
        for (TaskResult result : results) {
            monitor.recordResult(result);

            if (!result.isSuccess()) {
                failed = true;
                log.error("Task '{}' failed: {}", result.taskId(), result.error().orElse(result.status().name()));
                continue;
            }

            if (result.fingerprint().isPresent() && cache.insert(result.fingerprint().get())) {
                monitor.recordFingerprintAdded();
                cacheChanged = true;
            }
        }

        return new LevelOutcome(results, cacheChanged, failed);
    }

    private TaskResult collect(String taskId, CompletableFuture<TaskResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            log.error("Task '{}' crashed", taskId, e.getCause());
            return TaskResult.failed(taskId, null, String.valueOf(e.getCause()), Duration.ZERO);
        }
    }

    /**
     * Runs on a worker thread. Never mutates the cache; a fingerprint for
     * the cache travels back in the result.
     */
    private TaskResult execute(Task task) {
        log.info("Running task: {}", task.id());
        Instant start = Instant.now();
        Duration timeout = task.effectiveTimeout(options.defaultTimeout()).orElse(null);

        ProcessOutput output;
        try {
            output = executor.run(
                    task.command(),
                    fileResolver.baseDirectory(),
                    timeout,
                    options.outputMode() == OutputMode.STREAM
            );
        } catch (CommandException e) {
            Duration elapsed = Duration.between(start, Instant.now());
            if (e.isTimeout()) {
                return TaskResult.timedOut(task.id(), timeout, elapsed);
            }
            return TaskResult.failed(task.id(), null, e.getMessage(), elapsed);
        }

        if (options.outputMode() == OutputMode.GROUP) {
            console.printGroup(task.id(), output.stdout(), output.stderr());
        }

        Duration elapsed = Duration.between(start, Instant.now());

        if (!output.isSuccess()) {
            return TaskResult.failed(task.id(), output.exitCode(),
                    "exited with status " + output.exitCode(), elapsed);
        }

        String fingerprint = null;
        if (task.isCacheable()) {
            try {
                fingerprint = fingerprinter.fingerprint(task.inputs());
            } catch (FileException e) {
                log.warn("Could not fingerprint inputs of task '{}': {}", task.id(), e.getMessage());
            }
        }

        if ((options.removeOutputs() || task.autoRemove()) && task.hasOutputs()) {
            outputCleaner.cleanup(task.id(), task.outputs());
        }

        log.info("Completed task: {} ({}ms)", task.id(), elapsed.toMillis());
        return TaskResult.completed(task.id(), fingerprint, elapsed);
    }

    /**
     * List what a real run would do, without executing anything or touching the cache.
     */
    private RunReport dryRun(List<ExecutionLevel> levels) {
        log.info("═══════════════════════════════════════");
        log.info("DRY RUN - nothing will be executed");
        log.info("═══════════════════════════════════════");

        List<TaskResult> results = new ArrayList<>();
        for (ExecutionLevel level : levels) {
            for (String taskId : level.taskIds()) {
                Task task = lookup(taskId);
                ChangeDetector.Decision decision = changeDetector.evaluate(task);
                String timeout = task.effectiveTimeout(options.defaultTimeout())
                        .map(d -> " (timeout " + d.toMillis() + "ms)")
                        .orElse("");

                console.println(String.format("[level %d] %s %s: %s%s",
                        level.level(),
                        decision.mustRun() ? "RUN " : "SKIP",
                        taskId,
                        task.command(),
                        timeout));

                if (!decision.mustRun()) {
                    results.add(TaskResult.skipped(taskId));
                }
            }
        }
        return new RunReport(results, false, false);
    }

    private Task lookup(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null) {
            throw new IllegalStateException("Task '" + taskId + "' is scheduled but not defined");
        }
        return task;
    }

    public RunMonitor monitor() {
        return monitor;
    }

    private record LevelOutcome(List<TaskResult> results, boolean cacheChanged, boolean failed) {
    }
}
