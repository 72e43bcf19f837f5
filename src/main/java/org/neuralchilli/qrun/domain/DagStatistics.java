package org.neuralchilli.qrun.domain;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Shape of a task graph as the runner schedules it: one width per dependency level.
 */
public record DagStatistics(
        int tasks,
        int dependencies,
        int roots,
        int leaves,
        List<Integer> levelWidths
) {
    public DagStatistics {
        if (tasks < 0 || dependencies < 0 || roots < 0 || leaves < 0) {
            throw new IllegalArgumentException("Graph counts cannot be negative");
        }
        levelWidths = levelWidths != null ? List.copyOf(levelWidths) : List.of();

        int scheduled = levelWidths.stream().mapToInt(Integer::intValue).sum();
        if (scheduled != tasks) {
            throw new IllegalArgumentException(
                    "Level widths add up to " + scheduled + " task(s), expected " + tasks);
        }
    }

    public int levels() {
        return levelWidths.size();
    }

    public int widestLevel() {
        return levelWidths.stream().mapToInt(Integer::intValue).max().orElse(0);
    }

    /**
     * Every level holds a single task, so tasks can only ever run one at a time.
     */
    public boolean isSequential() {
        return !levelWidths.isEmpty() && widestLevel() == 1;
    }

    /**
     * Workers that can be busy at once; the rest of a larger pool stays idle.
     */
    public int usefulWorkers(int workers) {
        return Math.min(workers, Math.max(1, widestLevel()));
    }

    @Nonnull
    @Override
    public String toString() {
        return "tasks=" + tasks
                + " dependencies=" + dependencies
                + " levels=" + levelWidths.size()
                + " widths=" + levelWidths
                + " roots=" + roots
                + " leaves=" + leaves;
    }
}
