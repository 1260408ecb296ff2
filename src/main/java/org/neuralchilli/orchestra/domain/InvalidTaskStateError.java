package org.neuralchilli.orchestra.domain;

import java.util.Map;

/**
 * Thrown when an operation is attempted while the task is in a status that forbids it,
 * e.g. executing a task that is already RUNNING.
 */
public class InvalidTaskStateError extends TaskException {

    private final TaskStatus status;

    public InvalidTaskStateError(String taskId, TaskStatus status, String operation) {
        super(
                "Task " + taskId + " is in invalid state for " + operation + ": " + status,
                taskId,
                Map.of("status", status.name(), "operation", operation)
        );
        this.status = status;
    }

    public TaskStatus status() {
        return status;
    }
}
