package org.neuralchilli.orchestra.worker;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.subscription.Cancellable;
import org.neuralchilli.orchestra.domain.AsyncTaskJob;
import org.neuralchilli.orchestra.domain.CancellationToken;
import org.neuralchilli.orchestra.domain.ExecutorType;
import org.neuralchilli.orchestra.domain.Task;
import org.neuralchilli.orchestra.domain.TaskContext;
import org.neuralchilli.orchestra.domain.TaskJob;
import org.neuralchilli.orchestra.domain.TaskTimeoutError;

import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Bounded set of cooperative units multiplexed onto a few carrier threads.
 *
 * Each unit is a Mutiny pipeline. An {@link AsyncTaskJob} only gives up its
 * carrier at stage boundaries; a plain {@link TaskJob} holds its carrier for
 * the whole body. A semaphore caps the number of units in flight.
 *
 * Deadlines run on a dedicated timer thread that task bodies never occupy;
 * a plain job hogging every carrier still loses the race against its timeout.
 *
 * Cancellation is cooperative: the unit's token is flagged and its
 * subscription cancelled, which takes effect at the next stage boundary or
 * {@link TaskContext#checkpoint()}. The caller waiting in execute is released
 * immediately with a {@link CancellationException}.
 */
public class CooperativeTaskExecutor extends AbstractTaskExecutor {

    public static final int DEFAULT_CARRIER_THREADS = 2;

    private final int maxConcurrency;
    private final Semaphore permits;
    private final ScheduledExecutorService carriers;
    private final ScheduledExecutorService timer;
    private final Map<String, Unit> units = new ConcurrentHashMap<>();

    public CooperativeTaskExecutor(int maxConcurrency) {
        this(maxConcurrency, DEFAULT_CARRIER_THREADS);
    }

    public CooperativeTaskExecutor(int maxConcurrency, int carrierThreads) {
        super(ExecutorType.COOPERATIVE_ASYNC);
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("Max concurrency must be > 0, got: " + maxConcurrency);
        }
        if (carrierThreads <= 0) {
            throw new IllegalArgumentException("Carrier threads must be > 0, got: " + carrierThreads);
        }

        this.maxConcurrency = maxConcurrency;
        this.permits = new Semaphore(maxConcurrency, true);
        this.carriers = Executors.newScheduledThreadPool(
                carrierThreads,
                new WorkerThreadFactory("async-carrier", true)
        );
        this.timer = Executors.newSingleThreadScheduledExecutor(
                new WorkerThreadFactory("async-timer", true)
        );

        log.info("Cooperative executor started: max concurrency {}, {} carrier threads",
                maxConcurrency, carrierThreads);
    }

    @Override
    public Object execute(Task task, TaskContext context) {
        ensureAccepting(task);

        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for a slot for task " + task.id());
        }

        Unit unit = new Unit(context.cancellationToken(), new CompletableFuture<>(), new AtomicReference<>());
        units.put(task.id(), unit);

        try {
            Cancellable subscription = pipeline(task, context)
                    .runSubscriptionOn(carriers)
                    .subscribe().with(
                            unit.done()::complete,
                            unit.done()::completeExceptionally
                    );
            unit.subscription().set(subscription);

            ScheduledFuture<?> deadline = task.timeout() == null
                    ? null
                    : timer.schedule(() -> expire(task, unit), task.timeout().toMillis(), TimeUnit.MILLISECONDS);
            try {
                return awaitUnit(task, unit);
            } finally {
                if (deadline != null) {
                    deadline.cancel(false);
                }
            }
        } finally {
            units.remove(task.id(), unit);
            permits.release();
        }
    }

    /**
     * Armed from the calling thread, so the deadline holds even while the
     * unit is still queued behind busy carriers.
     */
    private void expire(Task task, Unit unit) {
        if (unit.done().completeExceptionally(new TaskTimeoutError(task.id(), task.timeout()))) {
            unit.token().cancel();
            Cancellable subscription = unit.subscription().get();
            if (subscription != null) {
                subscription.cancel();
            }
        }
    }

    private Uni<Object> pipeline(Task task, TaskContext context) {
        TaskJob job = task.job();

        if (job instanceof AsyncTaskJob) {
            AsyncTaskJob asyncJob = (AsyncTaskJob) job;
            return Uni.createFrom().<Object>deferred(() -> {
                context.checkpoint();
                return asyncJob.runAsync(context);
            }).onItem().invoke(item -> context.checkpoint());
        }

        return Uni.createFrom().emitter(emitter -> {
            try {
                context.checkpoint();
                emitter.complete(job.run(context));
            } catch (Throwable t) {
                emitter.fail(t);
            }
        });
    }

    private Object awaitUnit(Task task, Unit unit) {
        try {
            return unit.done().get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof TaskTimeoutError) {
                log.warn("Task {} ({}) timed out after {}ms on async executor",
                        task.id(), task.name(), task.timeout().toMillis());
            }
            throw translate(task, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelUnit(unit, "Interrupted while waiting for task " + task.id());
            throw new CancellationException("Interrupted while waiting for task " + task.id());
        }
    }

    @Override
    public boolean cancel(Task task) {
        Unit unit = units.get(task.id());
        if (unit == null || unit.done().isDone()) {
            return false;
        }

        boolean cancelled = cancelUnit(unit, "Task " + task.id() + " was cancelled");
        if (cancelled) {
            log.info("Cancellation requested for async task {} ({})", task.id(), task.name());
        }
        return cancelled;
    }

    private boolean cancelUnit(Unit unit, String reason) {
        unit.token().cancel();
        Cancellable subscription = unit.subscription().get();
        if (subscription != null) {
            subscription.cancel();
        }
        return unit.done().completeExceptionally(new CancellationException(reason));
    }

    @Override
    public void shutdown(boolean wait) {
        if (!markShutdown()) {
            return;
        }

        if (!wait) {
            units.values().forEach(unit -> cancelUnit(unit, "Executor shut down"));
            carriers.shutdownNow();
            timer.shutdownNow();
            log.info("Cooperative executor stopped, in-flight units cancelled");
            return;
        }

        CompletableFuture<?>[] pending = units.values().stream()
                .map(Unit::done)
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(pending).get(60, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            // Failures were already reported to the callers waiting on each unit
            log.debug("In-flight unit finished with failure during shutdown: {}", e.getCause().toString());
        } catch (TimeoutException e) {
            log.warn("Cooperative executor did not drain in 60 seconds, cancelling {} units", units.size());
            units.values().forEach(unit -> cancelUnit(unit, "Executor shut down"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        carriers.shutdown();
        timer.shutdown();
        log.info("Cooperative executor stopped");
    }

    @Override
    public ExecutorMetrics metrics() {
        return new ExecutorMetrics(
                type(),
                maxConcurrency,
                units.size(),
                permits.availablePermits(),
                isAccepting()
        );
    }

    private record Unit(
            CancellationToken token,
            CompletableFuture<Object> done,
            AtomicReference<Cancellable> subscription
    ) {
    }
}
