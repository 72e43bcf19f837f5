package org.neuralchilli.qrun.service;

/**
 * Failure while resolving or reading task files.
 * Never fatal to a run: callers downgrade it to a warning and treat the
 * affected task as needing to run.
 */
public class FileException extends RuntimeException {

    public enum Kind {
        GLOB_PATTERN,
        GLOB_EXPANSION,
        IO
    }

    private final Kind kind;

    public FileException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static FileException invalidPattern(String pattern, Throwable cause) {
        return new FileException(Kind.GLOB_PATTERN,
                "Invalid glob pattern '" + pattern + "': " + cause.getMessage(), cause);
    }

    public static FileException expansionFailed(String pattern, Throwable cause) {
        return new FileException(Kind.GLOB_EXPANSION,
                "Failed to expand glob '" + pattern + "': " + cause.getMessage(), cause);
    }

    public static FileException io(String path, Throwable cause) {
        return new FileException(Kind.IO,
                "IO error on '" + path + "': " + cause.getMessage(), cause);
    }

    public Kind kind() {
        return kind;
    }
}
