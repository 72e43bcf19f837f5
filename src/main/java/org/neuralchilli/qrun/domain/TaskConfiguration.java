package org.neuralchilli.qrun.domain;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * A fully resolved configuration file: validated tasks plus the global section.
 */
public record TaskConfiguration(
        Path configFile,
        List<Task> tasks,
        String defaultTask,
        String cacheDir,
        Integer workers,
        Duration defaultTimeout
) {
    public TaskConfiguration {
        if (configFile == null) {
            throw new IllegalArgumentException("Config file path cannot be null");
        }
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
        if (workers != null && workers < 1) {
            throw new IllegalArgumentException("Workers must be at least 1, got: " + workers);
        }
    }

    /**
     * Directory that relative task paths and commands are resolved against.
     */
    public Path baseDirectory() {
        Path parent = configFile.toAbsolutePath().getParent();
        return parent != null ? parent : Path.of("").toAbsolutePath();
    }

    public Optional<String> defaultTaskOpt() {
        return Optional.ofNullable(defaultTask).filter(s -> !s.isBlank());
    }

    public Optional<Integer> workersOpt() {
        return Optional.ofNullable(workers);
    }
}
