package org.neuralchilli.orchestra.worker;

import org.neuralchilli.orchestra.domain.ExecutorType;
import org.neuralchilli.orchestra.domain.Task;
import org.neuralchilli.orchestra.domain.TaskContext;
import org.neuralchilli.orchestra.domain.TaskExecutionError;
import org.neuralchilli.orchestra.domain.TaskTimeoutError;

import java.util.concurrent.CancellationException;

/**
 * Concurrency strategy that runs a task's job.
 * All implementations share the same contract; they differ only in where the
 * job runs and how far cancellation can reach into it.
 */
public interface TaskExecutor {

    ExecutorType type();

    /**
     * Run the task's job once, blocking the caller until the attempt finishes.
     *
     * @param task    snapshot of the task being run
     * @param context per-attempt context handed to the job
     * @return the job's result
     * @throws TaskTimeoutError      if the task's timeout elapsed first
     * @throws TaskExecutionError    wrapping any failure raised by the job
     * @throws CancellationException if the attempt was cancelled
     */
    Object execute(Task task, TaskContext context);

    /**
     * Best-effort cancellation of an in-flight attempt.
     *
     * @return true only if the attempt was interrupted or prevented from starting
     */
    boolean cancel(Task task);

    /**
     * Stop accepting work. When {@code wait} is false, in-flight attempts are cancelled.
     */
    void shutdown(boolean wait);

    ExecutorMetrics metrics();
}
