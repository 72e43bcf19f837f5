package org.neuralchilli.qrun.core;

/**
 * Thrown when a task graph is structurally invalid: a missing or self
 * dependency, an alias collision, a duplicate id, or a cycle.
 * Raised while validating the graph, before any task is executed.
 */
public class DependencyException extends RuntimeException {

    public DependencyException(String message) {
        super(message);
    }

    public DependencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
