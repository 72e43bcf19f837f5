package org.neuralchilli.qrun.core;

import org.neuralchilli.qrun.domain.TaskResult;
import org.neuralchilli.qrun.domain.TaskStatus;

import java.util.List;
import java.util.Optional;

/**
 * What happened in a run.
 *
 * @param results      one entry per task that was considered, in level order
 * @param cacheChanged at least one new fingerprint was added; the caller should persist the cache
 * @param aborted      later levels were not attempted because of a failure
 */
public record RunReport(List<TaskResult> results, boolean cacheChanged, boolean aborted) {

    public RunReport {
        results = results != null ? List.copyOf(results) : List.of();
    }

    public boolean isSuccess() {
        return !aborted && results.stream().allMatch(TaskResult::isSuccess);
    }

    public List<TaskResult> failures() {
        return results.stream().filter(r -> !r.isSuccess()).toList();
    }

    public List<String> taskIdsWithStatus(TaskStatus status) {
        return results.stream()
                .filter(r -> r.status() == status)
                .map(TaskResult::taskId)
                .toList();
    }

    public Optional<TaskResult> resultFor(String taskId) {
        return results.stream().filter(r -> r.taskId().equals(taskId)).findFirst();
    }
}
