package org.neuralchilli.orchestra.domain;

import java.time.Duration;
import java.util.Map;

/**
 * Thrown when a single execution attempt exceeds the task's timeout.
 * Counts as a failed attempt for retry purposes.
 */
public class TaskTimeoutError extends TaskException {

    private final Duration timeout;

    public TaskTimeoutError(String taskId, Duration timeout) {
        super(
                "Task " + taskId + " timed out after " + timeout.toMillis() + "ms",
                taskId,
                Map.of("timeout_ms", timeout.toMillis())
        );
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
