package org.neuralchilli.qrun.domain;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Represents a task definition: a shell command plus the files it reads and writes.
 * Immutable once built; graph-level rules (unique ids, existing dependencies,
 * alias collisions, cycles) are checked by the graph service, not here.
 */
public record Task(
        String id,
        String command,
        List<String> dependencies,
        List<String> aliases,
        List<String> inputs,   // literal paths or glob patterns
        List<String> outputs,  // literal paths or glob patterns
        boolean autoRemove,
        Duration timeout       // null means no task-specific timeout
) {
    public Task {
        // Validation
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task id cannot be null or empty");
        }

        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("Task '" + id + "' must define a command");
        }

        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException(
                    "Task '" + id + "' timeout must be positive, got: " + timeout
            );
        }

        // Defaults
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        aliases = aliases != null ? List.copyOf(aliases) : List.of();
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
    }

    /**
     * Tasks without declared inputs can never be proven up to date.
     */
    public boolean isCacheable() {
        return !inputs.isEmpty();
    }

    public boolean hasOutputs() {
        return !outputs.isEmpty();
    }

    public boolean hasDependencies() {
        return !dependencies.isEmpty();
    }

    /**
     * The task's own timeout, falling back to the run-wide default.
     */
    public Optional<Duration> effectiveTimeout(Duration defaultTimeout) {
        return Optional.ofNullable(timeout != null ? timeout : defaultTimeout);
    }

    /**
     * Builder for creating tasks fluently
     */
    public static Builder builder(String id) {
        return new Builder(id);
    }

    public Builder toBuilder() {
        return new Builder(id)
                .command(command)
                .dependencies(dependencies)
                .aliases(aliases)
                .inputs(inputs)
                .outputs(outputs)
                .autoRemove(autoRemove)
                .timeout(timeout);
    }

    public static class Builder {
        private String id;
        private String command;
        private List<String> dependencies = List.of();
        private List<String> aliases = List.of();
        private List<String> inputs = List.of();
        private List<String> outputs = List.of();
        private boolean autoRemove = false;
        private Duration timeout;

        public Builder(String id) {
            this.id = id;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder command(String command) {
            this.command = command;
            return this;
        }

        public Builder dependencies(List<String> dependencies) {
            this.dependencies = dependencies;
            return this;
        }

        public Builder dependsOn(String... dependencies) {
            this.dependencies = List.of(dependencies);
            return this;
        }

        public Builder aliases(List<String> aliases) {
            this.aliases = aliases;
            return this;
        }

        public Builder inputs(List<String> inputs) {
            this.inputs = inputs;
            return this;
        }

        public Builder outputs(List<String> outputs) {
            this.outputs = outputs;
            return this;
        }

        public Builder autoRemove(boolean autoRemove) {
            this.autoRemove = autoRemove;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Task build() {
            return new Task(id, command, dependencies, aliases, inputs, outputs, autoRemove, timeout);
        }
    }
}
