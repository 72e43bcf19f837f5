package org.neuralchilli.qrun.domain;

/**
 * Final status of a task within one run.
 */
public enum TaskStatus {
    /**
     * Inputs unchanged and outputs fresh, command not executed
     */
    SKIPPED,

    /**
     * Command exited with the success status
     */
    COMPLETED,

    /**
     * Command exited with a non-zero status or could not be started
     */
    FAILED,

    /**
     * Command exceeded its deadline and was killed
     */
    TIMED_OUT;

    public boolean isFailure() {
        return this == FAILED || this == TIMED_OUT;
    }

    public boolean wasExecuted() {
        return this != SKIPPED;
    }
}
