package org.neuralchilli.qrun.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Expands declared input/output patterns into concrete files.
 * <p>
 * Resolved paths keep the form they were declared in (relative patterns
 * stay relative), so fingerprints do not depend on where the project lives.
 * The base directory is only used to reach the filesystem.
 */
public class FileResolver {

    private static final Logger log = LoggerFactory.getLogger(FileResolver.class);

    private final Path baseDirectory;

    public FileResolver(Path baseDirectory) {
        if (baseDirectory == null) {
            throw new IllegalArgumentException("Base directory cannot be null");
        }
        this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
    }

    /**
     * Resolve input patterns. Missing literal inputs are dropped with a warning.
     */
    public List<Path> resolveInputs(List<String> patterns) {
        return resolve(patterns, true);
    }

    /**
     * Resolve output patterns. Missing literal outputs are normal before a
     * first run, so they are dropped quietly.
     */
    public List<Path> resolveOutputs(List<String> patterns) {
        return resolve(patterns, false);
    }

    /**
     * Expand every pattern and deduplicate across all of them.
     * Glob matches are restricted to regular files; literal paths are kept
     * when they exist at all (file or directory).
     *
     * @throws FileException if a pattern is invalid or a glob cannot be expanded
     */
    public List<Path> resolve(List<String> patterns, boolean warnOnMissing) {
        Set<Path> seen = new LinkedHashSet<>();

        for (String pattern : patterns) {
            if (GlobPattern.isGlob(pattern)) {
                seen.addAll(expandGlob(pattern));
            } else {
                Path literal = literalPath(pattern);
                if (Files.exists(toAbsolute(literal))) {
                    seen.add(literal);
                } else if (warnOnMissing) {
                    log.warn("Input file '{}' does not exist", pattern);
                } else {
                    log.trace("Path '{}' does not exist", pattern);
                }
            }
        }

        return new ArrayList<>(seen);
    }

    private static Path literalPath(String pattern) {
        try {
            return Path.of(pattern).normalize();
        } catch (InvalidPathException e) {
            throw FileException.invalidPattern(pattern, e);
        }
    }

    /**
     * Resolve a single pattern; empty when nothing matches or the literal path is absent.
     */
    public List<Path> resolvePattern(String pattern) {
        return resolve(List.of(pattern), false);
    }

    /**
     * Expand one glob into the regular files it matches, sorted by path string.
     */
    public List<Path> expandGlob(String pattern) {
        GlobPattern glob = GlobPattern.compile(pattern);
        Path root = toAbsolute(glob.base());

        if (!Files.isDirectory(root)) {
            return List.of();
        }

        try (Stream<Path> walk = Files.walk(root, glob.depth())) {
            return walk
                    .filter(Files::isRegularFile)
                    .map(file -> glob.base().resolve(root.relativize(file)))
                    .filter(glob::matches)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw FileException.expansionFailed(pattern, e);
        }
    }

    /**
     * Filesystem location of a resolved path.
     */
    public Path toAbsolute(Path resolved) {
        return baseDirectory.resolve(resolved);
    }

    public Path baseDirectory() {
        return baseDirectory;
    }
}
