package org.neuralchilli.qrun.service;

import java.nio.file.FileSystems;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A compiled file glob.
 * <p>
 * Uses the java.nio glob dialect, with one extension: each {@code **}{@code /} also
 * matches zero directories, so {@code src/**}{@code /*.c} matches {@code src/main.c}.
 * The pattern is split into a literal base directory (the leading segments
 * without metacharacters) and the part that has to be matched while walking.
 */
public final class GlobPattern {

    private final String pattern;
    private final Path base;
    private final int depth;
    private final List<PathMatcher> matchers;

    private GlobPattern(String pattern, Path base, int depth, List<PathMatcher> matchers) {
        this.pattern = pattern;
        this.base = base;
        this.depth = depth;
        this.matchers = matchers;
    }

    /**
     * A pattern is treated as a glob if it contains any of {@code * ? [}.
     */
    public static boolean isGlob(String pattern) {
        return pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0 || pattern.indexOf('[') >= 0;
    }

    public static GlobPattern compile(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw FileException.invalidPattern(String.valueOf(pattern),
                    new IllegalArgumentException("pattern is empty"));
        }

        String normalized = pattern.replace('\\', '/');
        String[] segments = normalized.split("/", -1);

        StringBuilder baseBuilder = new StringBuilder();
        int literalSegments = 0;
        for (String segment : segments) {
            if (isGlob(segment) || segment.indexOf('{') >= 0) {
                break;
            }
            if (literalSegments > 0) {
                baseBuilder.append('/');
            }
            baseBuilder.append(segment);
            literalSegments++;
        }

        // The last segment is always matched, even when it is literal
        if (literalSegments == segments.length) {
            literalSegments--;
            baseBuilder.setLength(Math.max(0, baseBuilder.lastIndexOf("/")));
        }

        boolean recursive = normalized.contains("**");
        int depth = recursive ? Integer.MAX_VALUE : segments.length - literalSegments;

        List<PathMatcher> matchers = new ArrayList<>();
        try {
            for (String variant : zeroDirectoryVariants(normalized)) {
                matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + variant));
            }
        } catch (IllegalArgumentException e) {
            // PatternSyntaxException included
            throw FileException.invalidPattern(pattern, e);
        }

        String baseString = baseBuilder.toString();
        Path base;
        try {
            base = baseString.isEmpty() && normalized.startsWith("/")
                    ? Path.of("/")
                    : Path.of(baseString);
        } catch (InvalidPathException e) {
            throw FileException.invalidPattern(pattern, e);
        }

        return new GlobPattern(pattern, base, depth, matchers);
    }

    /**
     * Every combination of keeping or dropping each {@code **}{@code /}, the full pattern first.
     */
    static List<String> zeroDirectoryVariants(String pattern) {
        Set<String> variants = new LinkedHashSet<>();
        collectVariants(pattern, 0, variants);
        return new ArrayList<>(variants);
    }

    private static void collectVariants(String pattern, int from, Set<String> variants) {
        int index = pattern.indexOf("**/", from);
        if (index < 0) {
            variants.add(pattern);
            return;
        }
        collectVariants(pattern, index + 3, variants);
        collectVariants(pattern.substring(0, index) + pattern.substring(index + 3), index, variants);
    }

    /**
     * Check a path, in the same relative or absolute form as the pattern.
     */
    public boolean matches(Path path) {
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(path)) {
                return true;
            }
        }
        return false;
    }

    public boolean matches(String path) {
        return matches(Path.of(path));
    }

    /**
     * Literal leading directory of the pattern; empty path when the first segment is a glob.
     */
    public Path base() {
        return base;
    }

    /**
     * Maximum walk depth below {@link #base()} needed to find every match.
     */
    public int depth() {
        return depth;
    }

    public String pattern() {
        return pattern;
    }

    @Override
    public String toString() {
        return "GlobPattern[" + pattern + "]";
    }
}
