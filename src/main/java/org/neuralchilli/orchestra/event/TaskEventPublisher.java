package org.neuralchilli.orchestra.event;

import org.neuralchilli.orchestra.domain.TaskEventType;

import java.util.Map;

/**
 * Fire-and-forget sink for task lifecycle events.
 * Implementations may throw; the task manager logs and swallows every failure.
 */
@FunctionalInterface
public interface TaskEventPublisher {

    /**
     * Publisher that drops every event.
     */
    TaskEventPublisher NOOP = (type, taskId, payload) -> {
    };

    void publish(TaskEventType type, String taskId, Map<String, Object> payload);
}
