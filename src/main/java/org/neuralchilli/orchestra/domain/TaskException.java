package org.neuralchilli.orchestra.domain;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base type for every error raised by the task engine.
 * Carries the id of the task involved (may be null) and structured details
 * suitable for logging or returning through an API layer.
 */
public abstract class TaskException extends RuntimeException {

    private final String taskId;
    private final Map<String, Object> details;

    protected TaskException(String message, String taskId, Map<String, Object> details) {
        this(message, taskId, details, null);
    }

    protected TaskException(String message, String taskId, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.taskId = taskId;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }

    public String taskId() {
        return taskId;
    }

    public Map<String, Object> details() {
        return details;
    }

    /**
     * Structured representation: error type, message, task id and details.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("error_type", getClass().getSimpleName());
        map.put("message", getMessage());
        map.put("task_id", taskId);
        map.put("details", details);
        return map;
    }
}
