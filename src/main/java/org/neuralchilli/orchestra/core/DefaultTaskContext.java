package org.neuralchilli.orchestra.core;

import org.neuralchilli.orchestra.domain.CancellationToken;
import org.neuralchilli.orchestra.domain.TaskContext;

/**
 * Context handed to a job for one attempt. Progress reports go back through
 * the manager so they are clamped, stored and published like any other update.
 */
class DefaultTaskContext implements TaskContext {

    private final String taskId;
    private final int attempt;
    private final TaskManager taskManager;
    private final CancellationToken cancellationToken;

    DefaultTaskContext(String taskId, int attempt, TaskManager taskManager) {
        this.taskId = taskId;
        this.attempt = attempt;
        this.taskManager = taskManager;
        this.cancellationToken = new CancellationToken(taskId);
    }

    @Override
    public String taskId() {
        return taskId;
    }

    @Override
    public int attempt() {
        return attempt;
    }

    @Override
    public void updateProgress(double progress, String message) {
        taskManager.updateProgress(taskId, progress, message);
    }

    @Override
    public CancellationToken cancellationToken() {
        return cancellationToken;
    }
}
