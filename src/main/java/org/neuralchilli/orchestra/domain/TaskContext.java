package org.neuralchilli.orchestra.domain;

import java.util.concurrent.CancellationException;

/**
 * Per-attempt view of a running task handed to its job.
 */
public interface TaskContext {

    String taskId();

    /**
     * 1-based number of this attempt.
     */
    int attempt();

    /**
     * Report progress. Values outside [0, 1] are clamped.
     */
    void updateProgress(double progress, String message);

    CancellationToken cancellationToken();

    default boolean isCancellationRequested() {
        return cancellationToken().isCancellationRequested();
    }

    /**
     * Declared suspension point: a job calls this between units of work so
     * a pending cancellation can take effect.
     *
     * @throws CancellationException if cancellation was requested
     */
    default void checkpoint() {
        cancellationToken().throwIfCancellationRequested();
    }
}
