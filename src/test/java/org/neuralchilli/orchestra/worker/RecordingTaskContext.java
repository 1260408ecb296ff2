package org.neuralchilli.orchestra.worker;

import org.neuralchilli.orchestra.domain.CancellationToken;
import org.neuralchilli.orchestra.domain.TaskContext;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Stand-alone context for driving executors without a task manager.
 */
class RecordingTaskContext implements TaskContext {

    private final String taskId;
    private final CancellationToken token;
    final List<Double> progressUpdates = new CopyOnWriteArrayList<>();

    RecordingTaskContext(String taskId) {
        this.taskId = taskId;
        this.token = new CancellationToken(taskId);
    }

    @Override
    public String taskId() {
        return taskId;
    }

    @Override
    public int attempt() {
        return 1;
    }

    @Override
    public void updateProgress(double progress, String message) {
        progressUpdates.add(progress);
    }

    @Override
    public CancellationToken cancellationToken() {
        return token;
    }
}
