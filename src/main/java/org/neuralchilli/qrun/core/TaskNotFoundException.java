package org.neuralchilli.qrun.core;

/**
 * Thrown when a requested target is neither a task id nor an alias.
 */
public class TaskNotFoundException extends RuntimeException {

    private final String target;

    public TaskNotFoundException(String target) {
        super("Task '" + target + "' not found");
        this.target = target;
    }

    public String target() {
        return target;
    }
}
