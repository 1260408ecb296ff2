package org.neuralchilli.orchestra.domain;

/**
 * The body of a task. The engine only knows this execution contract,
 * never what the job actually does.
 */
@FunctionalInterface
public interface TaskJob {

    /**
     * Run the job once.
     *
     * @param context per-attempt context for progress reporting and cancellation checks
     * @return the result of the attempt (may be null)
     * @throws Exception any failure; the executor wraps it in a {@link TaskExecutionError}
     */
    Object run(TaskContext context) throws Exception;
}
