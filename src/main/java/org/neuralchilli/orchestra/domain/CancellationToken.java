package org.neuralchilli.orchestra.domain;

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation flag shared between an executor and the job it runs.
 */
public final class CancellationToken {

    private final String taskId;
    private volatile boolean cancellationRequested;

    public CancellationToken(String taskId) {
        this.taskId = taskId;
    }

    public void cancel() {
        cancellationRequested = true;
    }

    public boolean isCancellationRequested() {
        return cancellationRequested;
    }

    public void throwIfCancellationRequested() {
        if (cancellationRequested) {
            throw new CancellationException("Task " + taskId + " was cancelled");
        }
    }
}
