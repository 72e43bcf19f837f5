package org.neuralchilli.qrun.cli;

import io.quarkus.picocli.runtime.annotations.TopCommand;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.qrun.config.ConfigException;
import org.neuralchilli.qrun.config.TaskConfigLoader;
import org.neuralchilli.qrun.core.DependencyException;
import org.neuralchilli.qrun.core.RunOptions;
import org.neuralchilli.qrun.core.RunReport;
import org.neuralchilli.qrun.core.TaskGraphService;
import org.neuralchilli.qrun.core.TaskNotFoundException;
import org.neuralchilli.qrun.core.TaskRunner;
import org.neuralchilli.qrun.domain.DagStatistics;
import org.neuralchilli.qrun.domain.ExecutionLevel;
import org.neuralchilli.qrun.domain.OutputMode;
import org.neuralchilli.qrun.domain.Task;
import org.neuralchilli.qrun.domain.TaskConfiguration;
import org.neuralchilli.qrun.domain.TaskResult;
import org.neuralchilli.qrun.service.CacheStore;
import org.neuralchilli.qrun.service.IncrementalCache;
import org.neuralchilli.qrun.util.DurationParser;
import org.neuralchilli.qrun.worker.ConsoleSink;
import org.neuralchilli.qrun.worker.ShellCommandExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.stream.Collectors;

/**
 * Command line entry point: load a task file, pick the tasks to run and run them.
 * <p>
 * Exit code 0 when every executed task succeeded (or nothing needed to run),
 * 1 on any task failure or configuration, dependency or target error.
 */
@TopCommand
@Command(name = "qrun",
        description = "Run tasks from a YAML file in dependency order, skipping work whose inputs have not changed.",
        mixinStandardHelpOptions = true,
        version = "qrun 1.0.0")
public class QrunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(QrunCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private static final String BASE_LOGGER = "org.neuralchilli.qrun";

    // Held so the level set in verbose mode is not lost to GC of the logger
    private static java.util.logging.Logger verboseLogger;

    @Spec
    CommandSpec spec;

    @Inject
    TaskConfigLoader configLoader;

    @Inject
    TaskGraphService graphService;

    @Inject
    CacheStore cacheStore;

    @ConfigProperty(name = "qrun.config.default-file", defaultValue = "qrun.yaml")
    String defaultConfigFile;

    @ConfigProperty(name = "qrun.worker.thread-prefix", defaultValue = TaskRunner.DEFAULT_THREAD_PREFIX)
    String threadPrefix;

    @Parameters(index = "0", arity = "0..1", paramLabel = "TASK",
            description = "Task id or alias to run, together with its dependencies")
    String target;

    @Option(names = {"-f", "--file"}, paramLabel = "FILE", description = "Task file (default: qrun.yaml)")
    Path file;

    @Option(names = {"-v", "--verbose"}, description = "Log change detection and graph details")
    boolean verbose;

    @Option(names = "--rm", description = "Remove declared outputs after each successful task")
    boolean removeOutputs;

    @Option(names = {"-j", "--workers"}, paramLabel = "N", description = "Maximum number of tasks running at once")
    Integer workers;

    @Option(names = {"-t", "--timeout"}, paramLabel = "DURATION",
            description = "Default task timeout, e.g. 30s or 5m; a task's own timeout wins")
    String timeout;

    @Option(names = "--dry-run", description = "Show what would run without executing anything")
    boolean dryRun;

    @Option(names = "--continue-on-failure", description = "Keep running later levels after a failure")
    boolean continueOnFailure;

    @Option(names = "--output", paramLabel = "MODE", defaultValue = "stream",
            description = "stream (live) or group (one block per task)")
    String output;

    @Override
    public Integer call() {
        if (verbose) {
            enableVerboseLogging();
        }

        Path configPath = file != null ? file : Path.of(defaultConfigFile);

        try {
            TaskConfiguration configuration = configLoader.load(configPath);
            List<Task> tasks = configuration.tasks();

            List<String> selected = selectTasks(configuration);
            if (selected.isEmpty()) {
                log.info("No tasks to run");
                return EXIT_OK;
            }

            List<ExecutionLevel> levels = graphService.calculateDependencyLevels(tasks, selected);
            RunOptions options = buildOptions(configuration);

            if (verbose) {
                describeGraph(tasks, options.workers());
            }

            Path cachePath = cacheStore.resolveCachePath(configuration.configFile(), configuration.cacheDir());
            IncrementalCache cache = cacheStore.load(cachePath);

            ConsoleSink console = ConsoleSink.system();
            RunReport report;
            try (ShellCommandExecutor executor = new ShellCommandExecutor(console)) {
                TaskRunner runner = new TaskRunner(tasks, cache, options,
                        configuration.baseDirectory(), executor, console, threadPrefix);
                report = runner.run(levels);
            }

            if (report.cacheChanged() && !options.dryRun()) {
                cacheStore.save(cache, cachePath);
            }

            if (!report.isSuccess()) {
                log.error("{} task(s) failed: {}", report.failures().size(),
                        report.failures().stream().map(TaskResult::taskId).collect(Collectors.joining(", ")));
                return EXIT_FAILURE;
            }
            return EXIT_OK;

        } catch (ConfigException | DependencyException | TaskNotFoundException | IllegalArgumentException e) {
            // IllegalArgumentException: bad -j, -t or --output values
            log.debug("Run aborted", e);
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            spec.commandLine().getErr().flush();
            return EXIT_FAILURE;
        }
    }

    /**
     * Explicit target, else the configured default, else every task.
     */
    private List<String> selectTasks(TaskConfiguration configuration) {
        String effectiveTarget = target != null ? target : configuration.defaultTaskOpt().orElse(null);
        if (effectiveTarget == null) {
            return graphService.sortTopologically(configuration.tasks());
        }
        return graphService.getRequiredTasks(configuration.tasks(), effectiveTarget);
    }

    private RunOptions buildOptions(TaskConfiguration configuration) {
        int workerCount = workers != null
                ? workers
                : configuration.workersOpt().orElse(RunOptions.defaultWorkers());
        if (workerCount < 1) {
            throw new IllegalArgumentException("Workers must be at least 1, got: " + workerCount);
        }

        Duration defaultTimeout = timeout != null
                ? DurationParser.parse(timeout)
                : configuration.defaultTimeout();

        return RunOptions.builder()
                .workers(workerCount)
                .defaultTimeout(defaultTimeout)
                .continueOnFailure(continueOnFailure)
                .outputMode(OutputMode.fromString(output))
                .removeOutputs(removeOutputs)
                .dryRun(dryRun)
                .build();
    }

    private void describeGraph(List<Task> tasks, int workerCount) {
        DagStatistics statistics = graphService.getStatistics(tasks);
        log.debug("Graph: {}", statistics);

        if (statistics.isSequential()) {
            log.debug("Every level holds a single task; tasks run one at a time");
        } else if (statistics.usefulWorkers(workerCount) < workerCount) {
            log.debug("At most {} of {} workers can be busy at once",
                    statistics.usefulWorkers(workerCount), workerCount);
        }

        Map<String, List<String>> orderingOnly = graphService.findOrderingOnlyDependencies(tasks);
        orderingOnly.forEach((taskId, dependencies) ->
                log.debug("Task '{}' depends on {} for ordering only (no declared output feeds its inputs)",
                        taskId, dependencies));
    }

    private static void enableVerboseLogging() {
        verboseLogger = java.util.logging.Logger.getLogger(BASE_LOGGER);
        verboseLogger.setLevel(Level.FINE);
    }
}
