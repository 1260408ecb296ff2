package org.neuralchilli.orchestra.domain;

/**
 * Lifecycle status of a registered task.
 */
public enum TaskStatus {
    /**
     * Task is ready to be dispatched (or awaiting a scheduled retry)
     */
    PENDING,

    /**
     * Task is waiting for its dependencies to complete
     */
    WAITING,

    /**
     * An executor is currently running the task
     */
    RUNNING,

    /**
     * Task completed successfully
     */
    COMPLETED,

    /**
     * Task failed and has no retries left
     */
    FAILED,

    /**
     * Task was cancelled before or during execution
     */
    CANCELLED;

    /**
     * Check if this is a terminal state (task finished)
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Check if the task may still be started by the scheduler or a caller
     */
    public boolean isRunnable() {
        return this == PENDING || this == WAITING;
    }
}
