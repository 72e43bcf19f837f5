package org.neuralchilli.qrun.core;

import org.neuralchilli.qrun.domain.OutputMode;

import java.time.Duration;

/**
 * Run-wide settings for the task runner.
 */
public record RunOptions(
        int workers,
        Duration defaultTimeout,   // null means no default timeout
        boolean continueOnFailure,
        OutputMode outputMode,
        boolean removeOutputs,
        boolean dryRun
) {
    public RunOptions {
        if (workers < 1) {
            throw new IllegalArgumentException("Workers must be at least 1, got: " + workers);
        }
        if (outputMode == null) {
            outputMode = OutputMode.STREAM;
        }
    }

    public static int defaultWorkers() {
        return Runtime.getRuntime().availableProcessors();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int workers = defaultWorkers();
        private Duration defaultTimeout;
        private boolean continueOnFailure = false;
        private OutputMode outputMode = OutputMode.STREAM;
        private boolean removeOutputs = false;
        private boolean dryRun = false;

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public Builder continueOnFailure(boolean continueOnFailure) {
            this.continueOnFailure = continueOnFailure;
            return this;
        }

        public Builder outputMode(OutputMode outputMode) {
            this.outputMode = outputMode;
            return this;
        }

        public Builder removeOutputs(boolean removeOutputs) {
            this.removeOutputs = removeOutputs;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public RunOptions build() {
            return new RunOptions(workers, defaultTimeout, continueOnFailure, outputMode, removeOutputs, dryRun);
        }
    }
}
