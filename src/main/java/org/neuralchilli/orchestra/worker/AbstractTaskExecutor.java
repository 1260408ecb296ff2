package org.neuralchilli.orchestra.worker;

import org.neuralchilli.orchestra.domain.ExecutorType;
import org.neuralchilli.orchestra.domain.Task;
import org.neuralchilli.orchestra.domain.TaskException;
import org.neuralchilli.orchestra.domain.TaskExecutionError;
import org.neuralchilli.orchestra.domain.TaskTimeoutError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Shared plumbing for executors: shutdown flag, timeout racing and
 * translation of job failures into the engine's error taxonomy.
 */
public abstract class AbstractTaskExecutor implements TaskExecutor {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final ExecutorType type;
    private volatile boolean accepting = true;

    protected AbstractTaskExecutor(ExecutorType type) {
        this.type = type;
    }

    @Override
    public ExecutorType type() {
        return type;
    }

    public boolean isAccepting() {
        return accepting;
    }

    /**
     * Flip the executor to non-accepting. Returns false if it was already shut down.
     */
    protected boolean markShutdown() {
        if (!accepting) {
            return false;
        }
        accepting = false;
        log.info("Shutting down {} executor", type.key());
        return true;
    }

    protected void ensureAccepting(Task task) {
        if (!accepting) {
            throw new TaskExecutionError(
                    "Executor " + type.key() + " is shut down, cannot run task " + task.id(),
                    task.id(),
                    null
            );
        }
    }

    /**
     * Wait for a submitted attempt, racing it against the task's timeout.
     * On timeout the attempt is detached (interrupted, late result discarded).
     */
    protected Object await(Task task, Future<?> future) {
        try {
            if (task.timeout() == null) {
                return future.get();
            }
            return future.get(task.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Task {} ({}) timed out after {}ms on {} executor",
                    task.id(), task.name(), task.timeout().toMillis(), type.key());
            throw new TaskTimeoutError(task.id(), task.timeout());
        } catch (ExecutionException e) {
            throw translate(task, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new CancellationException("Interrupted while waiting for task " + task.id());
        }
    }

    /**
     * Map a failure raised by a job onto the error taxonomy.
     * Cancellation and engine errors pass through unchanged.
     */
    protected RuntimeException translate(Task task, Throwable failure) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }

        if (cause instanceof CancellationException) {
            return (CancellationException) cause;
        }
        if (cause instanceof TaskException) {
            return (TaskException) cause;
        }
        if (cause instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return new CancellationException("Task " + task.id() + " was interrupted");
        }

        return TaskExecutionError.of(task.id(), cause);
    }
}
