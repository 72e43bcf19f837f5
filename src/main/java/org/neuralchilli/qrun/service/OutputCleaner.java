package org.neuralchilli.qrun.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Deletes a task's outputs after it succeeds ({@code auto_remove} or the global remove flag).
 * Directories are removed recursively. Failures are logged, never thrown.
 */
public class OutputCleaner {

    private static final Logger log = LoggerFactory.getLogger(OutputCleaner.class);

    private final FileResolver fileResolver;

    public OutputCleaner(FileResolver fileResolver) {
        this.fileResolver = fileResolver;
    }

    /**
     * @return number of paths removed
     */
    public int cleanup(String taskId, List<String> outputPatterns) {
        if (outputPatterns.isEmpty()) {
            return 0;
        }

        List<Path> outputs;
        try {
            outputs = fileResolver.resolveOutputs(outputPatterns);
        } catch (FileException e) {
            log.warn("Cleanup failed for task '{}': {}", taskId, e.getMessage());
            return 0;
        }

        int removed = 0;
        for (Path output : outputs) {
            Path absolute = fileResolver.toAbsolute(output);
            try {
                if (Files.isDirectory(absolute)) {
                    deleteRecursively(absolute);
                } else {
                    Files.deleteIfExists(absolute);
                }
                removed++;
                log.debug("Removed: {}", output);
            } catch (IOException | UncheckedIOException e) {
                log.warn("Failed to remove '{}': {}", output, e.getMessage());
            }
        }
        return removed;
    }

    private static void deleteRecursively(Path directory) throws IOException {
        try (Stream<Path> walk = Files.walk(directory)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
            for (Path path : paths) {
                Files.delete(path);
            }
        }
    }
}
