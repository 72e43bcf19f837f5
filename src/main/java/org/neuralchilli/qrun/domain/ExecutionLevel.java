package org.neuralchilli.qrun.domain;

import java.util.List;

/**
 * A group of tasks sharing the same longest-path distance from the graph's sources.
 * Every dependency of a task in level N lives in some level below N.
 */
public record ExecutionLevel(int level, List<String> taskIds) {

    public ExecutionLevel {
        if (level < 0) {
            throw new IllegalArgumentException("Level cannot be negative, got: " + level);
        }
        taskIds = taskIds != null ? List.copyOf(taskIds) : List.of();
    }

    public int size() {
        return taskIds.size();
    }

    public boolean contains(String taskId) {
        return taskIds.contains(taskId);
    }
}
