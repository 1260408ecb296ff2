package org.neuralchilli.orchestra.domain;

import java.util.Map;

/**
 * Thrown when an operation references an unknown task id.
 */
public class TaskNotFoundError extends TaskException {

    public TaskNotFoundError(String taskId) {
        super("Task " + taskId + " not found", taskId, Map.of());
    }
}
