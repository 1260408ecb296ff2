package org.neuralchilli.orchestra.domain;

import java.util.Map;

/**
 * Thrown when cancellation was requested but could not be honored,
 * e.g. the executor could not interrupt a body that was already running.
 */
public class TaskCancellationError extends TaskException {

    public TaskCancellationError(String message, String taskId, Map<String, Object> details) {
        super(message, taskId, details);
    }
}
