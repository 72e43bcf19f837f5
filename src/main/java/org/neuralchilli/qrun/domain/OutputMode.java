package org.neuralchilli.qrun.domain;

/**
 * How task output reaches the console.
 */
public enum OutputMode {
    /**
     * Write output live as it arrives
     */
    STREAM,

    /**
     * Print each task's captured output as one block after it completes
     */
    GROUP;

    public static OutputMode fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Output mode cannot be null");
        }
        return switch (value.toLowerCase()) {
            case "stream" -> STREAM;
            case "group" -> GROUP;
            default -> throw new IllegalArgumentException(
                    "Unknown output mode: " + value + " (expected stream or group)");
        };
    }
}
