package org.neuralchilli.orchestra.domain;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wraps whatever the task body raised during one attempt.
 */
public class TaskExecutionError extends TaskException {

    public TaskExecutionError(String message, String taskId, Throwable cause) {
        super(message, taskId, describe(cause), cause);
    }

    public static TaskExecutionError of(String taskId, Throwable cause) {
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new TaskExecutionError("Task " + taskId + " execution failed: " + reason, taskId, cause);
    }

    private static Map<String, Object> describe(Throwable cause) {
        if (cause == null) {
            return Map.of();
        }
        Map<String, Object> original = new LinkedHashMap<>();
        original.put("type", cause.getClass().getName());
        original.put("message", String.valueOf(cause.getMessage()));
        return Map.of("original_error", original);
    }
}
