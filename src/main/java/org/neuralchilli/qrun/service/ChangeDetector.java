package org.neuralchilli.qrun.service;

import org.neuralchilli.qrun.domain.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a task has to run.
 * <p>
 * Checks, in order, stopping at the first reason to run:
 * no declared inputs, a declared output missing, an input newer than the
 * oldest output, an input fingerprint absent from the cache.
 * Resolution problems never fail the run; they resolve to "must run".
 */
public class ChangeDetector {

    private static final Logger log = LoggerFactory.getLogger(ChangeDetector.class);

    /**
     * Why a task runs or is skipped.
     */
    public enum Decision {
        NO_INPUTS(true, "no inputs, always run"),
        OUTPUTS_MISSING(true, "outputs missing, must run"),
        OUTPUTS_OUTDATED(true, "outputs older than inputs, must run"),
        TIMESTAMPS_UNKNOWN(true, "timestamps unavailable, must run"),
        INPUTS_CHANGED(true, "input content changed, must run"),
        RESOLUTION_FAILED(true, "could not process inputs, must run"),
        UP_TO_DATE(false, "outputs up-to-date, skipping");

        private final boolean mustRun;
        private final String description;

        Decision(boolean mustRun, String description) {
            this.mustRun = mustRun;
            this.description = description;
        }

        public boolean mustRun() {
            return mustRun;
        }

        public String description() {
            return description;
        }
    }

    private final FileResolver fileResolver;
    private final Fingerprinter fingerprinter;
    private final IncrementalCache cache;

    public ChangeDetector(FileResolver fileResolver, Fingerprinter fingerprinter, IncrementalCache cache) {
        this.fileResolver = fileResolver;
        this.fingerprinter = fingerprinter;
        this.cache = cache;
    }

    public boolean shouldRun(Task task) {
        return evaluate(task).mustRun();
    }

    public Decision evaluate(Task task) {
        Decision decision = decide(task);
        log.debug("Task '{}': {}", task.id(), decision.description());
        return decision;
    }

    private Decision decide(Task task) {
        if (!task.isCacheable()) {
            return Decision.NO_INPUTS;
        }

        try {
            List<Path> inputs = fileResolver.resolveInputs(task.inputs());

            if (task.hasOutputs()) {
                for (String pattern : task.outputs()) {
                    if (fileResolver.resolvePattern(pattern).isEmpty()) {
                        return Decision.OUTPUTS_MISSING;
                    }
                }

                List<Path> outputs = fileResolver.resolveOutputs(task.outputs());

                Optional<FileTime> newestInput = newestTimestamp(inputs);
                Optional<FileTime> oldestOutput = oldestTimestamp(outputs);

                if (newestInput.isEmpty() || oldestOutput.isEmpty()) {
                    return Decision.TIMESTAMPS_UNKNOWN;
                }

                if (newestInput.get().compareTo(oldestOutput.get()) > 0) {
                    return Decision.OUTPUTS_OUTDATED;
                }
            }

            String fingerprint = fingerprinter.fingerprintFiles(inputs);
            if (!cache.contains(fingerprint)) {
                return Decision.INPUTS_CHANGED;
            }
        } catch (FileException e) {
            log.warn("Could not process inputs for task '{}': {}", task.id(), e.getMessage());
            return Decision.RESOLUTION_FAILED;
        }

        return Decision.UP_TO_DATE;
    }

    private Optional<FileTime> newestTimestamp(List<Path> paths) {
        return paths.stream()
                .map(this::modifiedTime)
                .flatMap(Optional::stream)
                .max(FileTime::compareTo);
    }

    private Optional<FileTime> oldestTimestamp(List<Path> paths) {
        return paths.stream()
                .map(this::modifiedTime)
                .flatMap(Optional::stream)
                .min(FileTime::compareTo);
    }

    private Optional<FileTime> modifiedTime(Path path) {
        try {
            return Optional.of(Files.getLastModifiedTime(fileResolver.toAbsolute(path)));
        } catch (IOException e) {
            log.debug("Cannot read modification time of '{}': {}", path, e.getMessage());
            return Optional.empty();
        }
    }
}
