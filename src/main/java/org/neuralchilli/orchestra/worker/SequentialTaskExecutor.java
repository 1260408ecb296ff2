package org.neuralchilli.orchestra.worker;

import org.neuralchilli.orchestra.domain.CancellationToken;
import org.neuralchilli.orchestra.domain.ExecutorType;
import org.neuralchilli.orchestra.domain.Task;
import org.neuralchilli.orchestra.domain.TaskContext;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs one task at a time in the calling thread.
 *
 * Callers queue on a fair lock, so concurrent execute calls are served in
 * arrival order. A task with a timeout runs on a detached helper thread that
 * is raced against the timer; a body that ignores interrupts keeps running
 * after a timeout but its result is discarded.
 */
public class SequentialTaskExecutor extends AbstractTaskExecutor {

    private final ReentrantLock executionLock = new ReentrantLock(true);
    private final ExecutorService timedRunner =
            Executors.newCachedThreadPool(new WorkerThreadFactory("sequential-timed", true));

    private volatile Task runningTask;
    private volatile CancellationToken runningToken;

    public SequentialTaskExecutor() {
        super(ExecutorType.SEQUENTIAL);
    }

    @Override
    public Object execute(Task task, TaskContext context) {
        ensureAccepting(task);

        try {
            executionLock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting to run task " + task.id());
        }

        try {
            runningTask = task;
            runningToken = context.cancellationToken();

            // Cancelled while queued behind another task
            context.checkpoint();

            Object result = task.timeout() == null
                    ? runInline(task, context)
                    : await(task, timedRunner.submit(() -> task.job().run(context)));

            // Cancellation requested mid-run: the body could not be stopped, drop its result
            context.checkpoint();
            return result;
        } finally {
            runningTask = null;
            runningToken = null;
            executionLock.unlock();
        }
    }

    private Object runInline(Task task, TaskContext context) {
        try {
            return task.job().run(context);
        } catch (Exception e) {
            throw translate(task, e);
        }
    }

    /**
     * Only the task currently holding the executor can be cancelled, and only by flag:
     * the body keeps running until it reaches a checkpoint or returns.
     */
    @Override
    public boolean cancel(Task task) {
        Task current = runningTask;
        CancellationToken token = runningToken;

        if (current == null || token == null || !current.id().equals(task.id())) {
            log.debug("Task {} is not running on the sequential executor", task.id());
            return false;
        }

        token.cancel();
        log.info("Cancellation flagged for sequential task {} ({})", task.id(), task.name());
        return true;
    }

    @Override
    public void shutdown(boolean wait) {
        if (!markShutdown()) {
            return;
        }

        Task current = runningTask;
        if (current != null && !wait) {
            cancel(current);
        }

        if (wait) {
            timedRunner.shutdown();
        } else {
            timedRunner.shutdownNow();
        }
    }

    @Override
    public ExecutorMetrics metrics() {
        int active = runningTask != null ? 1 : 0;
        return new ExecutorMetrics(type(), 1, active, 1 - active, isAccepting());
    }

    /**
     * Id of the task currently holding the executor, or null when idle.
     */
    public String runningTaskId() {
        Task current = runningTask;
        return current != null ? current.id() : null;
    }
}
