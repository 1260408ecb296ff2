package org.neuralchilli.orchestra.domain;

import java.util.Map;

/**
 * Thrown when a task references a dependency that does not exist,
 * or when a dependency can no longer complete.
 * The offending task is never added to the registry.
 */
public class TaskDependencyError extends TaskException {

    public TaskDependencyError(String message, String taskId, Map<String, Object> details) {
        super(message, taskId, details);
    }

    public static TaskDependencyError missing(String taskId, String dependencyId) {
        return new TaskDependencyError(
                "Dependency " + dependencyId + " does not exist",
                taskId,
                Map.of("dependency_id", dependencyId)
        );
    }
}
