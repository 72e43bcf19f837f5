package org.neuralchilli.qrun.domain;

import java.time.Duration;
import java.util.Optional;

/**
 * Outcome of one task in a run.
 * A completed task may carry the fingerprint of its inputs, which the runner
 * adds to the cache once the result has been collected.
 */
public final class TaskResult {

    private final String taskId;
    private final TaskStatus status;
    private final Integer exitCode;
    private final String fingerprint;
    private final String error;
    private final Duration duration;

    private TaskResult(
            String taskId,
            TaskStatus status,
            Integer exitCode,
            String fingerprint,
            String error,
            Duration duration
    ) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("Task id cannot be null or empty");
        }
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        this.taskId = taskId;
        this.status = status;
        this.exitCode = exitCode;
        this.fingerprint = fingerprint;
        this.error = error;
        this.duration = duration != null ? duration : Duration.ZERO;
    }

    public static TaskResult skipped(String taskId) {
        return new TaskResult(taskId, TaskStatus.SKIPPED, null, null, null, Duration.ZERO);
    }

    public static TaskResult completed(String taskId, String fingerprint, Duration duration) {
        return new TaskResult(taskId, TaskStatus.COMPLETED, 0, fingerprint, null, duration);
    }

    public static TaskResult failed(String taskId, Integer exitCode, String error, Duration duration) {
        return new TaskResult(taskId, TaskStatus.FAILED, exitCode, null, error, duration);
    }

    public static TaskResult timedOut(String taskId, Duration timeout, Duration duration) {
        return new TaskResult(taskId, TaskStatus.TIMED_OUT, null, null,
                "Timed out after " + timeout.toMillis() + "ms", duration);
    }

    public String taskId() {
        return taskId;
    }

    public TaskStatus status() {
        return status;
    }

    public Optional<Integer> exitCode() {
        return Optional.ofNullable(exitCode);
    }

    public Optional<String> fingerprint() {
        return Optional.ofNullable(fingerprint);
    }

    public Optional<String> error() {
        return Optional.ofNullable(error);
    }

    public Duration duration() {
        return duration;
    }

    public boolean isSuccess() {
        return !status.isFailure();
    }

    @Override
    public String toString() {
        return "TaskResult[taskId=" + taskId + ", status=" + status +
                (exitCode != null ? ", exitCode=" + exitCode : "") +
                (error != null ? ", error=" + error : "") +
                ", duration=" + duration.toMillis() + "ms]";
    }
}
