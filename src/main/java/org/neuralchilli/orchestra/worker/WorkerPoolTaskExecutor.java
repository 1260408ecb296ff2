package org.neuralchilli.orchestra.worker;

import org.neuralchilli.orchestra.domain.CancellationToken;
import org.neuralchilli.orchestra.domain.ExecutorType;
import org.neuralchilli.orchestra.domain.Task;
import org.neuralchilli.orchestra.domain.TaskContext;
import org.neuralchilli.orchestra.domain.TaskExecutionError;

import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size pool of OS worker threads.
 *
 * Each execute call submits one unit and blocks on its future. A unit can be
 * cancelled only while it is still queued: once a worker thread has claimed it,
 * cancel reports false and the body runs to completion (or to its timeout).
 */
public class WorkerPoolTaskExecutor extends AbstractTaskExecutor {

    private final int workerThreads;
    private final ExecutorService executorService;
    private final Map<String, Unit> inFlight = new ConcurrentHashMap<>();
    private final AtomicInteger busyThreads = new AtomicInteger(0);

    public WorkerPoolTaskExecutor() {
        this(Runtime.getRuntime().availableProcessors());
    }

    public WorkerPoolTaskExecutor(int workerThreads) {
        this(workerThreads, "worker-pool");
    }

    public WorkerPoolTaskExecutor(int workerThreads, String workerId) {
        super(ExecutorType.WORKER_POOL);
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("Worker threads must be > 0, got: " + workerThreads);
        }

        this.workerThreads = workerThreads;
        this.executorService = Executors.newFixedThreadPool(
                workerThreads,
                new WorkerThreadFactory(workerId, true)
        );

        log.info("Worker pool started: {} threads, worker ID: {}", workerThreads, workerId);
    }

    @Override
    public Object execute(Task task, TaskContext context) {
        ensureAccepting(task);

        // Whoever flips this first owns the unit: a worker thread starting it or cancel() stopping it
        AtomicBoolean claimed = new AtomicBoolean(false);

        Future<Object> future;
        try {
            future = executorService.submit(() -> {
                if (!claimed.compareAndSet(false, true)) {
                    throw new CancellationException("Task " + task.id() + " was cancelled before it started");
                }
                busyThreads.incrementAndGet();
                try {
                    String threadName = Thread.currentThread().getName();
                    log.debug("[{}] Executing: {} ({})", threadName, task.id(), task.name());
                    return task.job().run(context);
                } finally {
                    busyThreads.decrementAndGet();
                }
            });
        } catch (RejectedExecutionException e) {
            throw new TaskExecutionError("Worker pool rejected task " + task.id(), task.id(), e);
        }

        Unit unit = new Unit(future, claimed, context.cancellationToken());
        inFlight.put(task.id(), unit);

        try {
            return await(task, future);
        } finally {
            inFlight.remove(task.id(), unit);
        }
    }

    @Override
    public boolean cancel(Task task) {
        Unit unit = inFlight.get(task.id());
        if (unit == null) {
            return false;
        }

        if (!unit.claimed().compareAndSet(false, true)) {
            log.info("Task {} ({}) already started on a worker thread, cannot cancel", task.id(), task.name());
            return false;
        }

        unit.token().cancel();
        unit.future().cancel(false);
        log.info("Cancelled queued task {} ({})", task.id(), task.name());
        return true;
    }

    /**
     * Stop the worker pool. With {@code wait}, in-flight units are allowed to complete.
     */
    @Override
    public void shutdown(boolean wait) {
        if (!markShutdown()) {
            return;
        }

        if (!wait) {
            inFlight.values().forEach(unit -> {
                unit.token().cancel();
                unit.future().cancel(true);
            });
            executorService.shutdownNow();
            log.info("Worker pool stopped, in-flight units cancelled");
            return;
        }

        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(60, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not terminate in 60 seconds, forcing shutdown");
                executorService.shutdownNow();
                if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                    log.error("Worker pool did not terminate after forced shutdown");
                }
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }

        log.info("Worker pool stopped");
    }

    @Override
    public ExecutorMetrics metrics() {
        int active = inFlight.size();
        return new ExecutorMetrics(
                type(),
                workerThreads,
                active,
                Math.max(0, workerThreads - busyThreads.get()),
                isAccepting()
        );
    }

    public int workerThreads() {
        return workerThreads;
    }

    private record Unit(Future<Object> future, AtomicBoolean claimed, CancellationToken token) {
    }
}
