package org.neuralchilli.orchestra.core;

import org.neuralchilli.orchestra.domain.ExecutorType;
import org.neuralchilli.orchestra.domain.InvalidTaskStateError;
import org.neuralchilli.orchestra.domain.Task;
import org.neuralchilli.orchestra.domain.TaskCancellationError;
import org.neuralchilli.orchestra.domain.TaskDependencyError;
import org.neuralchilli.orchestra.domain.TaskEventType;
import org.neuralchilli.orchestra.domain.TaskException;
import org.neuralchilli.orchestra.domain.TaskExecutionError;
import org.neuralchilli.orchestra.domain.TaskNotFoundError;
import org.neuralchilli.orchestra.domain.TaskProgress;
import org.neuralchilli.orchestra.domain.TaskSpec;
import org.neuralchilli.orchestra.domain.TaskStatus;
import org.neuralchilli.orchestra.domain.TaskTimeoutError;
import org.neuralchilli.orchestra.event.TaskEventPublisher;
import org.neuralchilli.orchestra.monitoring.TaskThroughputMonitor;
import org.neuralchilli.orchestra.worker.CooperativeTaskExecutor;
import org.neuralchilli.orchestra.worker.ExecutorMetrics;
import org.neuralchilli.orchestra.worker.SequentialTaskExecutor;
import org.neuralchilli.orchestra.worker.TaskExecutor;
import org.neuralchilli.orchestra.worker.WorkerPoolTaskExecutor;
import org.neuralchilli.orchestra.worker.WorkerThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Registry and scheduler for tasks.
 *
 * Owns every registered task, resolves dependencies, assigns each task to an
 * executor and runs a periodic scheduling loop that promotes WAITING tasks and
 * dispatches PENDING ones by priority, up to a global concurrency ceiling.
 *
 * All registry state is guarded by a single lock held only for the duration of
 * a state transition. Executors are always called outside the lock. Task
 * snapshots are immutable and replaced on every transition.
 */
public class TaskManager {

    private static final Logger log = LoggerFactory.getLogger(TaskManager.class);

    static final String CANCELLED_REASON = "cancelled";
    static final String CANCELLED_BY_USER_REASON = "cancelled by user";

    private static final Comparator<Task> DISPATCH_ORDER =
            Comparator.comparing(Task::priority, Comparator.reverseOrder())
                    .thenComparingLong(Task::sequence);

    private final int maxConcurrentTasks;
    private final ExecutorType defaultExecutor;
    private final Map<ExecutorType, TaskExecutor> executors;
    private final TaskEventPublisher eventPublisher;
    private final Duration schedulerTick;
    private final Duration dependencyPollInterval;
    private final TaskThroughputMonitor monitor = new TaskThroughputMonitor();

    // Registry state, guarded by lock
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final Set<String> runningTasks = new LinkedHashSet<>();
    private final Set<String> completedTasks = new LinkedHashSet<>();
    private final Set<String> failedTasks = new LinkedHashSet<>();
    private final Set<String> cancelledTasks = new LinkedHashSet<>();
    private final Set<String> waitingTasks = new LinkedHashSet<>();
    private final Set<String> callerDrivenTasks = new HashSet<>();
    private final DependencyGraph dependencyGraph = new DependencyGraph();
    private final AtomicLong sequence = new AtomicLong(0);

    private final ExecutorService dispatchPool =
            Executors.newCachedThreadPool(new WorkerThreadFactory("task-dispatch", true));

    private volatile boolean running = false;
    private volatile boolean shutDown = false;
    private Thread schedulerThread;

    TaskManager(Builder builder) {
        if (builder.maxConcurrentTasks <= 0) {
            throw new IllegalArgumentException("Max concurrent tasks must be > 0, got: " + builder.maxConcurrentTasks);
        }
        if (builder.schedulerTick.isNegative() || builder.schedulerTick.isZero()) {
            throw new IllegalArgumentException("Scheduler tick must be positive");
        }
        if (builder.dependencyPollInterval.isNegative() || builder.dependencyPollInterval.isZero()) {
            throw new IllegalArgumentException("Dependency poll interval must be positive");
        }

        this.maxConcurrentTasks = builder.maxConcurrentTasks;
        this.defaultExecutor = builder.defaultExecutor;
        this.eventPublisher = builder.eventPublisher;
        this.schedulerTick = builder.schedulerTick;
        this.dependencyPollInterval = builder.dependencyPollInterval;

        Map<ExecutorType, TaskExecutor> resolved = new EnumMap<>(builder.executors);
        resolved.computeIfAbsent(ExecutorType.SEQUENTIAL, type -> new SequentialTaskExecutor());
        resolved.computeIfAbsent(ExecutorType.WORKER_POOL, type -> new WorkerPoolTaskExecutor(
                builder.workerPoolThreads != null
                        ? builder.workerPoolThreads
                        : Runtime.getRuntime().availableProcessors()));
        resolved.computeIfAbsent(ExecutorType.COOPERATIVE_ASYNC, type -> new CooperativeTaskExecutor(
                builder.asyncMaxConcurrency != null ? builder.asyncMaxConcurrency : maxConcurrentTasks,
                builder.asyncCarrierThreads));
        this.executors = resolved;

        log.info("Task manager initialized with {} max concurrent tasks, default executor: {}",
                maxConcurrentTasks, defaultExecutor.key());
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------------
    // Registration
    // ---------------------------------------------------------------------

    /**
     * Register a task.
     *
     * @param spec what to run and under which policy
     * @return the id assigned to the task (a fresh one if the requested id is taken)
     * @throws TaskDependencyError if a dependency is not registered; the task is not added
     */
    public String register(TaskSpec spec) {
        if (spec == null) {
            throw new IllegalArgumentException("Task spec cannot be null");
        }
        ensureNotShutDown();

        Task task;
        lock.lock();
        try {
            String taskId = spec.id() != null ? spec.id() : newTaskId();
            if (tasks.containsKey(taskId)) {
                log.warn("Task ID {} already exists, generating a new one", taskId);
                taskId = newTaskId();
            }

            for (String dependencyId : spec.dependencies()) {
                if (!tasks.containsKey(dependencyId)) {
                    throw TaskDependencyError.missing(taskId, dependencyId);
                }
            }

            boolean ready = completedTasks.containsAll(spec.dependencies());
            task = Task.create(
                    taskId,
                    spec,
                    resolveExecutor(spec.executorType()),
                    sequence.incrementAndGet(),
                    ready ? TaskStatus.PENDING : TaskStatus.WAITING
            );

            tasks.put(taskId, task);
            dependencyGraph.addTask(taskId, spec.dependencies());
            if (!ready) {
                waitingTasks.add(taskId);
            }
        } finally {
            lock.unlock();
        }

        monitor.recordTaskRegistered();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", task.name());
        payload.put("priority", task.priority().name());
        payload.put("dependencies", new ArrayList<>(task.dependencies()));
        payload.put("executor_type", task.executorType().key());
        publish(TaskEventType.TASK_CREATED, task.id(), payload);

        log.info("Task registered: {} ({}) status={}", task.id(), task.name(), task.status());
        return task.id();
    }

    private ExecutorType resolveExecutor(ExecutorType requested) {
        if (requested == null) {
            return defaultExecutor;
        }
        if (!executors.containsKey(requested)) {
            log.warn("Executor type {} not found, using default {}", requested.key(), defaultExecutor.key());
            return defaultExecutor;
        }
        return requested;
    }

    private static String newTaskId() {
        return UUID.randomUUID().toString();
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    public Optional<Task> getTask(String taskId) {
        lock.lock();
        try {
            return Optional.ofNullable(tasks.get(taskId));
        } finally {
            lock.unlock();
        }
    }

    public Optional<TaskStatus> getStatus(String taskId) {
        return getTask(taskId).map(Task::status);
    }

    /**
     * Result of a COMPLETED task; empty for unknown, unfinished or failed tasks.
     */
    public Optional<Object> getResult(String taskId) {
        return getTask(taskId)
                .filter(task -> task.status() == TaskStatus.COMPLETED)
                .map(Task::result);
    }

    /**
     * Error of a FAILED task; empty otherwise.
     */
    public Optional<TaskException> getError(String taskId) {
        return getTask(taskId)
                .filter(task -> task.status() == TaskStatus.FAILED)
                .map(Task::error);
    }

    public TaskProgress getProgress(String taskId) {
        return getTask(taskId).map(TaskProgress::of).orElse(TaskProgress.NONE);
    }

    public List<Task> getTasks() {
        return findTasks(task -> true);
    }

    public List<Task> getTasksByStatus(TaskStatus status) {
        return findTasks(task -> task.status() == status);
    }

    public List<Task> getTasksByTag(String tag) {
        return findTasks(task -> task.tags().contains(tag));
    }

    public List<Task> getTasksByMetadata(String key, Object value) {
        return findTasks(task -> task.metadata().containsKey(key)
                && Objects.equals(task.metadata().get(key), value));
    }

    /**
     * Ids of the tasks that list the given task as a direct dependency.
     */
    public Set<String> getDependents(String taskId) {
        lock.lock();
        try {
            return Set.copyOf(dependencyGraph.dependentsOf(taskId));
        } finally {
            lock.unlock();
        }
    }

    private List<Task> findTasks(Predicate<Task> filter) {
        lock.lock();
        try {
            return tasks.values().stream().filter(filter).collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------------
    // Progress
    // ---------------------------------------------------------------------

    /**
     * Update the progress of a task. Values outside [0, 1] are clamped.
     *
     * @return false if the task is unknown or already finished
     */
    public boolean updateProgress(String taskId, double progress, String message) {
        Task updated;
        lock.lock();
        try {
            Task task = tasks.get(taskId);
            if (task == null) {
                return false;
            }
            if (task.isFinished()) {
                log.debug("Ignoring progress update for finished task {} ({})", taskId, task.status());
                return false;
            }
            updated = task.updateProgress(progress, message);
            tasks.put(taskId, updated);
        } finally {
            lock.unlock();
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", updated.name());
        payload.put("progress", updated.progress());
        payload.put("progress_message", updated.progressMessage());
        publish(TaskEventType.TASK_PROGRESS, taskId, payload);
        return true;
    }

    // ---------------------------------------------------------------------
    // Execution
    // ---------------------------------------------------------------------

    /**
     * Manually trigger a task, bypassing the concurrency ceiling.
     *
     * With {@code wait}, the calling thread waits for the dependencies, runs
     * every attempt itself (sleeping the backoff between them) and returns the
     * result. Without it, a ready task is dispatched in the background; one with
     * unmet dependencies or a retry still backing off is left for the scheduler
     * loop. {@code null} is returned.
     *
     * @throws TaskNotFoundError     if the task is unknown
     * @throws InvalidTaskStateError if the task is not PENDING or WAITING
     * @throws TaskDependencyError   if, while waiting, a dependency failed or was cancelled
     * @throws TaskExecutionError    if retries are exhausted (wait only)
     * @throws TaskTimeoutError      if the last attempt timed out (wait only)
     * @throws CancellationException if the task was cancelled (wait only)
     */
    public Object execute(String taskId, boolean wait) {
        ensureNotShutDown();

        Task started = null;
        lock.lock();
        try {
            Task task = tasks.get(taskId);
            if (task == null) {
                throw new TaskNotFoundError(taskId);
            }
            if (!task.status().isRunnable() || callerDrivenTasks.contains(taskId)) {
                throw new InvalidTaskStateError(taskId, task.status(), "execute");
            }

            boolean ready = task.isReady(completedTasks);
            if (wait) {
                callerDrivenTasks.add(taskId);
            } else if (!ready) {
                log.debug("Task {} has unmet dependencies, leaving it to the scheduler", taskId);
                return null;
            } else if (!task.isDueAt(Instant.now())) {
                log.debug("Task {} has a retry due at {}, leaving it to the scheduler", taskId, task.retryAt());
                return null;
            } else {
                started = markRunning(task);
            }
        } finally {
            lock.unlock();
        }

        if (!wait) {
            dispatch(started);
            return null;
        }

        try {
            awaitDependencies(taskId);
            Task claimed = startCallerDriven(taskId);
            onStarted(claimed);
            return runAttempts(claimed, true);
        } finally {
            lock.lock();
            try {
                callerDrivenTasks.remove(taskId);
            } finally {
                lock.unlock();
            }
        }
    }

    private void awaitDependencies(String taskId) {
        while (true) {
            lock.lock();
            try {
                Task task = tasks.get(taskId);
                if (task.status() == TaskStatus.CANCELLED) {
                    throw new CancellationException("Task " + taskId + " was cancelled");
                }
                if (task.isReady(completedTasks)) {
                    return;
                }
                for (String dependencyId : task.dependencies()) {
                    TaskStatus dependencyStatus = tasks.get(dependencyId).status();
                    if (dependencyStatus == TaskStatus.FAILED || dependencyStatus == TaskStatus.CANCELLED) {
                        throw new TaskDependencyError(
                                "Dependency " + dependencyId + " of task " + taskId + " ended " + dependencyStatus,
                                taskId,
                                Map.of("dependency_id", dependencyId, "dependency_status", dependencyStatus.name())
                        );
                    }
                }
            } finally {
                lock.unlock();
            }

            sleep(dependencyPollInterval, taskId);
        }
    }

    private Task startCallerDriven(String taskId) {
        lock.lock();
        try {
            Task task = tasks.get(taskId);
            if (task.status() == TaskStatus.CANCELLED) {
                throw new CancellationException("Task " + taskId + " was cancelled");
            }
            if (!task.status().isRunnable()) {
                throw new InvalidTaskStateError(taskId, task.status(), "execute");
            }
            return markRunning(task);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Transition to RUNNING. Caller must hold the lock.
     */
    private Task markRunning(Task task) {
        Task started = task.start();
        tasks.put(task.id(), started);
        waitingTasks.remove(task.id());
        runningTasks.add(task.id());
        return started;
    }

    private void onStarted(Task task) {
        monitor.recordTaskDispatched();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", task.name());
        payload.put("executor_type", task.executorType().key());
        payload.put("attempt", task.attempt());
        publish(TaskEventType.TASK_STARTED, task.id(), payload);

        log.info("Task started: {} ({}) on {} executor, attempt {}",
                task.id(), task.name(), task.executorType().key(), task.attempt());
    }

    private void dispatch(Task task) {
        onStarted(task);
        try {
            dispatchPool.execute(() -> runDispatched(task));
        } catch (RejectedExecutionException e) {
            log.warn("Dispatch pool rejected task {} ({}), cancelling it", task.id(), task.name());
            finishCancelled(task, CANCELLED_REASON);
        }
    }

    private void runDispatched(Task task) {
        try {
            runAttempts(task, false);
        } catch (RuntimeException e) {
            log.error("Unexpected error running task {} ({})", task.id(), task.name(), e);
        }
    }

    /**
     * Run attempts until the task completes, fails for good or is cancelled.
     * Scheduler-driven tasks return after scheduling a retry; the loop re-dispatches them.
     */
    private Object runAttempts(Task task, boolean callerDriven) {
        Task current = task;

        while (true) {
            TaskExecutor executor = executors.get(current.executorType());
            DefaultTaskContext context = new DefaultTaskContext(current.id(), current.attempt(), this);
            long attemptStart = System.nanoTime();

            try {
                Object result = executor.execute(current, context);
                recordAttempt(current, attemptStart);
                finishSuccess(current, result);
                return result;

            } catch (CancellationException e) {
                recordAttempt(current, attemptStart);
                finishCancelled(current, CANCELLED_REASON);
                if (callerDriven) {
                    throw e;
                }
                return null;

            } catch (RuntimeException e) {
                recordAttempt(current, attemptStart);
                TaskException error = e instanceof TaskException
                        ? (TaskException) e
                        : TaskExecutionError.of(current.id(), e);
                if (error instanceof TaskTimeoutError) {
                    monitor.recordAttemptTimedOut();
                }

                Task next = handleFailure(current, error);
                if (next == null) {
                    // Cancelled while the attempt was failing
                    if (callerDriven) {
                        throw new CancellationException("Task " + current.id() + " was cancelled");
                    }
                    return null;
                }
                if (next.status() == TaskStatus.FAILED) {
                    if (callerDriven) {
                        throw error;
                    }
                    return null;
                }
                if (!callerDriven) {
                    return null;
                }

                sleep(next.spec().backoff(next.retryCount()), next.id());
                current = startCallerDriven(next.id());
                onStarted(current);
            }
        }
    }

    private void recordAttempt(Task task, long attemptStartNanos) {
        monitor.recordAttempt(task.executorType(), Duration.ofNanos(System.nanoTime() - attemptStartNanos));
    }

    /**
     * Whether the snapshot still describes the live attempt. Caller must hold the lock.
     */
    private boolean isCurrentAttempt(Task latest, Task attempt) {
        return latest != null
                && latest.status() == TaskStatus.RUNNING
                && latest.attempt() == attempt.attempt();
    }

    private void finishSuccess(Task attempt, Object result) {
        Task completed;
        List<String> promoted;
        lock.lock();
        try {
            Task latest = tasks.get(attempt.id());
            if (!isCurrentAttempt(latest, attempt)) {
                log.debug("Discarding result of task {}: no longer running", attempt.id());
                return;
            }
            completed = latest.complete(result);
            tasks.put(completed.id(), completed);
            runningTasks.remove(completed.id());
            completedTasks.add(completed.id());
            promoted = promoteDependents(completed.id());
        } finally {
            lock.unlock();
        }

        monitor.recordTaskCompleted();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", completed.name());
        payload.put("execution_time", completed.executionTime().toMillis() / 1000.0);
        publish(TaskEventType.TASK_COMPLETED, completed.id(), payload);

        log.info("Task completed: {} ({}) in {}ms",
                completed.id(), completed.name(), completed.executionTime().toMillis());
        if (!promoted.isEmpty()) {
            log.debug("Task {} unblocked dependents: {}", completed.id(), promoted);
        }
    }

    /**
     * Record a failed attempt: schedule a retry or fail the task for good.
     *
     * @return the new snapshot (PENDING or FAILED), or null if the attempt is no longer live
     */
    private Task handleFailure(Task attempt, TaskException error) {
        Task next;
        lock.lock();
        try {
            Task latest = tasks.get(attempt.id());
            if (!isCurrentAttempt(latest, attempt)) {
                log.debug("Ignoring failure of task {}: no longer running", attempt.id());
                return null;
            }

            runningTasks.remove(latest.id());
            if (latest.canRetry()) {
                Duration backoff = latest.spec().backoff(latest.retryCount() + 1);
                next = latest.retry(error, Instant.now().plus(backoff));
            } else {
                next = latest.fail(error);
                failedTasks.add(latest.id());
            }
            tasks.put(next.id(), next);
        } finally {
            lock.unlock();
        }

        if (next.status() == TaskStatus.PENDING) {
            monitor.recordTaskRetried();
            log.warn("Task {} ({}) failed, retrying ({}/{}) in {}ms: {}",
                    next.id(), next.name(), next.retryCount(), next.maxRetries(),
                    next.spec().backoff(next.retryCount()).toMillis(), error.getMessage());
            return next;
        }

        monitor.recordTaskFailed();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", next.name());
        payload.put("error", error.getMessage());
        payload.put("error_type", error.getClass().getSimpleName());
        payload.put("retry_count", next.retryCount());
        publish(TaskEventType.TASK_FAILED, next.id(), payload);

        log.error("Task failed: {} ({}): {}", next.id(), next.name(), error.getMessage());
        return next;
    }

    private void finishCancelled(Task attempt, String reason) {
        Task cancelled;
        lock.lock();
        try {
            Task latest = tasks.get(attempt.id());
            if (!isCurrentAttempt(latest, attempt)) {
                return;
            }
            cancelled = recordCancelled(latest);
        } finally {
            lock.unlock();
        }
        onCancelled(cancelled, reason);
    }

    /**
     * Transition to CANCELLED. Caller must hold the lock.
     */
    private Task recordCancelled(Task task) {
        Task cancelled = task.cancel();
        tasks.put(cancelled.id(), cancelled);
        runningTasks.remove(cancelled.id());
        waitingTasks.remove(cancelled.id());
        cancelledTasks.add(cancelled.id());
        return cancelled;
    }

    private void onCancelled(Task task, String reason) {
        monitor.recordTaskCancelled();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", task.name());
        payload.put("reason", reason);
        publish(TaskEventType.TASK_CANCELLED, task.id(), payload);

        log.info("Task cancelled: {} ({})", task.id(), task.name());
    }

    // ---------------------------------------------------------------------
    // Cancellation
    // ---------------------------------------------------------------------

    /**
     * Cancel a task.
     *
     * PENDING and WAITING tasks are cancelled immediately. A RUNNING task is
     * only cancelled if its executor confirms the attempt was interrupted or
     * prevented from starting; otherwise it stays RUNNING.
     *
     * @return true if the task is now CANCELLED because of this call
     */
    public boolean cancel(String taskId) {
        Task snapshot;
        Task cancelledBeforeStart = null;
        lock.lock();
        try {
            Task task = tasks.get(taskId);
            if (task == null) {
                log.warn("Task {} not found for cancellation", taskId);
                return false;
            }
            if (task.status().isRunnable()) {
                cancelledBeforeStart = recordCancelled(task);
            } else if (task.status() != TaskStatus.RUNNING) {
                log.warn("Cannot cancel task {} with status {}", taskId, task.status());
                return false;
            }
            snapshot = task;
        } finally {
            lock.unlock();
        }

        if (cancelledBeforeStart != null) {
            onCancelled(cancelledBeforeStart, CANCELLED_BY_USER_REASON);
            return true;
        }

        TaskExecutor executor = executors.get(snapshot.executorType());
        if (!executor.cancel(snapshot)) {
            log.warn("Failed to cancel task {} ({}): {} executor could not interrupt it",
                    taskId, snapshot.name(), snapshot.executorType().key());
            return false;
        }

        Task cancelled;
        lock.lock();
        try {
            Task latest = tasks.get(taskId);
            if (latest.status() == TaskStatus.CANCELLED) {
                // The attempt already observed the cancellation and finalized it
                return true;
            }
            if (!isCurrentAttempt(latest, snapshot)) {
                return false;
            }
            cancelled = recordCancelled(latest);
        } finally {
            lock.unlock();
        }

        onCancelled(cancelled, CANCELLED_BY_USER_REASON);
        return true;
    }

    /**
     * Cancel a task, failing loudly when the cancellation cannot be honored.
     *
     * @throws TaskNotFoundError     if the task is unknown
     * @throws TaskCancellationError if the task could not be cancelled
     */
    public void cancelOrThrow(String taskId) {
        Task task = getTask(taskId).orElseThrow(() -> new TaskNotFoundError(taskId));
        if (!cancel(taskId)) {
            TaskStatus status = getStatus(taskId).orElse(task.status());
            throw new TaskCancellationError(
                    "Task " + taskId + " could not be cancelled (status " + status + ")",
                    taskId,
                    Map.of("status", status.name(), "executor_type", task.executorType().key())
            );
        }
    }

    // ---------------------------------------------------------------------
    // Scheduler loop
    // ---------------------------------------------------------------------

    /**
     * Start the scheduler loop.
     */
    public void start() {
        ensureNotShutDown();
        synchronized (this) {
            if (running) {
                log.warn("Task manager is already running");
                return;
            }
            running = true;
            schedulerThread = new Thread(this::schedulerLoop, "task-scheduler");
            schedulerThread.setDaemon(true);
            schedulerThread.start();
        }
        log.info("Task manager started: tick {}ms, {} max concurrent tasks",
                schedulerTick.toMillis(), maxConcurrentTasks);
    }

    /**
     * Stop the scheduler loop. Running tasks are left alone; see {@link #shutdown(boolean)}.
     */
    public void stop() {
        Thread thread;
        synchronized (this) {
            if (!running) {
                log.warn("Task manager is not running");
                return;
            }
            running = false;
            thread = schedulerThread;
            schedulerThread = null;
        }

        thread.interrupt();
        try {
            thread.join(schedulerTick.multipliedBy(10).toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Task scheduler stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void schedulerLoop() {
        log.info("Task scheduler loop started");

        while (running) {
            try {
                scheduleTasks();
                Thread.sleep(schedulerTick.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Error in task scheduler", e);
            }
        }

        log.info("Task scheduler loop exited");
    }

    /**
     * One scheduler tick: promote WAITING tasks whose dependencies completed,
     * then dispatch eligible PENDING tasks by priority (FIFO within a priority)
     * up to the free capacity.
     */
    void scheduleTasks() {
        List<Task> toDispatch = new ArrayList<>();

        lock.lock();
        try {
            promoteWaiting();

            int capacity = maxConcurrentTasks - runningTasks.size();
            if (capacity <= 0) {
                log.trace("No free capacity: {} running", runningTasks.size());
                return;
            }

            Instant now = Instant.now();
            List<Task> eligible = tasks.values().stream()
                    .filter(task -> task.status() == TaskStatus.PENDING)
                    .filter(task -> !callerDrivenTasks.contains(task.id()))
                    .filter(task -> task.isDueAt(now))
                    .sorted(DISPATCH_ORDER)
                    .limit(capacity)
                    .collect(Collectors.toList());

            for (Task task : eligible) {
                toDispatch.add(markRunning(task));
            }
        } finally {
            lock.unlock();
        }

        if (!toDispatch.isEmpty()) {
            log.debug("Dispatching {} tasks", toDispatch.size());
        }
        toDispatch.forEach(this::dispatch);
    }

    /**
     * Promote every WAITING task whose dependencies are all COMPLETED. Caller must hold the lock.
     */
    private List<String> promoteWaiting() {
        return promote(new ArrayList<>(waitingTasks));
    }

    /**
     * Re-check the direct dependents of a task that just completed. Caller must hold the lock.
     */
    private List<String> promoteDependents(String taskId) {
        return promote(dependencyGraph.dependentsOf(taskId));
    }

    private List<String> promote(Iterable<String> candidates) {
        List<String> promoted = new ArrayList<>();
        for (String candidateId : candidates) {
            Task candidate = tasks.get(candidateId);
            if (candidate.status() == TaskStatus.WAITING && candidate.isReady(completedTasks)) {
                tasks.put(candidateId, candidate.withStatus(TaskStatus.PENDING));
                waitingTasks.remove(candidateId);
                promoted.add(candidateId);
            }
        }
        return promoted;
    }

    // ---------------------------------------------------------------------
    // Shutdown & metrics
    // ---------------------------------------------------------------------

    /**
     * Stop the scheduler loop, cancel every RUNNING task and shut down all executors.
     *
     * @param wait whether executors should let in-flight attempts finish
     */
    public void shutdown(boolean wait) {
        synchronized (this) {
            if (shutDown) {
                return;
            }
            shutDown = true;
        }

        log.info("Shutting down task manager (wait={})", wait);
        if (running) {
            stop();
        }

        List<String> inFlight;
        lock.lock();
        try {
            inFlight = new ArrayList<>(runningTasks);
        } finally {
            lock.unlock();
        }
        for (String taskId : inFlight) {
            if (!cancel(taskId)) {
                log.warn("Task {} could not be cancelled during shutdown", taskId);
            }
        }

        executors.values().forEach(executor -> executor.shutdown(wait));

        if (wait) {
            dispatchPool.shutdown();
            try {
                if (!dispatchPool.awaitTermination(60, TimeUnit.SECONDS)) {
                    log.warn("Dispatch pool did not terminate in 60 seconds, forcing shutdown");
                    dispatchPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                dispatchPool.shutdownNow();
                Thread.currentThread().interrupt();
            }
        } else {
            dispatchPool.shutdownNow();
        }

        monitor.logReport();
        log.info("Task manager stopped");
    }

    public ManagerMetrics metrics() {
        Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, 0);
        }

        int total;
        DependencyGraphStatistics graphStatistics;
        lock.lock();
        try {
            tasks.values().forEach(task -> counts.merge(task.status(), 1, Integer::sum));
            total = tasks.size();
            graphStatistics = dependencyGraph.statistics();
        } finally {
            lock.unlock();
        }

        Map<ExecutorType, ExecutorMetrics> executorMetrics = new EnumMap<>(ExecutorType.class);
        executors.forEach((type, executor) -> executorMetrics.put(type, executor.metrics()));

        return new ManagerMetrics(
                running,
                maxConcurrentTasks,
                defaultExecutor,
                total,
                counts,
                executorMetrics,
                graphStatistics,
                monitor.getReport()
        );
    }

    public int maxConcurrentTasks() {
        return maxConcurrentTasks;
    }

    public ExecutorType defaultExecutor() {
        return defaultExecutor;
    }

    private void publish(TaskEventType type, String taskId, Map<String, Object> payload) {
        try {
            eventPublisher.publish(type, taskId, payload);
        } catch (Exception e) {
            log.warn("Failed to publish {} event for task {}: {}", type, taskId, e.getMessage());
        }
    }

    private void ensureNotShutDown() {
        if (shutDown) {
            throw new IllegalStateException("Task manager is shut down");
        }
    }

    private static void sleep(Duration duration, String taskId) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting on task " + taskId);
        }
    }

    /**
     * Builder for task managers. Executors not supplied explicitly are created with defaults.
     */
    public static class Builder {
        private int maxConcurrentTasks = 4;
        private ExecutorType defaultExecutor = ExecutorType.COOPERATIVE_ASYNC;
        private final Map<ExecutorType, TaskExecutor> executors = new EnumMap<>(ExecutorType.class);
        private Integer workerPoolThreads;
        private Integer asyncMaxConcurrency;
        private int asyncCarrierThreads = CooperativeTaskExecutor.DEFAULT_CARRIER_THREADS;
        private TaskEventPublisher eventPublisher = TaskEventPublisher.NOOP;
        private Duration schedulerTick = Duration.ofMillis(100);
        private Duration dependencyPollInterval = Duration.ofMillis(100);

        public Builder maxConcurrentTasks(int maxConcurrentTasks) {
            this.maxConcurrentTasks = maxConcurrentTasks;
            return this;
        }

        public Builder defaultExecutor(ExecutorType defaultExecutor) {
            this.defaultExecutor = Objects.requireNonNull(defaultExecutor, "defaultExecutor");
            return this;
        }

        /**
         * Use the given executor for its type instead of the default implementation.
         */
        public Builder executor(TaskExecutor executor) {
            this.executors.put(executor.type(), executor);
            return this;
        }

        public Builder workerPoolThreads(int workerPoolThreads) {
            this.workerPoolThreads = workerPoolThreads;
            return this;
        }

        public Builder asyncMaxConcurrency(int asyncMaxConcurrency) {
            this.asyncMaxConcurrency = asyncMaxConcurrency;
            return this;
        }

        public Builder asyncCarrierThreads(int asyncCarrierThreads) {
            this.asyncCarrierThreads = asyncCarrierThreads;
            return this;
        }

        public Builder eventPublisher(TaskEventPublisher eventPublisher) {
            this.eventPublisher = Objects.requireNonNull(eventPublisher, "eventPublisher");
            return this;
        }

        public Builder schedulerTick(Duration schedulerTick) {
            this.schedulerTick = Objects.requireNonNull(schedulerTick, "schedulerTick");
            return this;
        }

        public Builder dependencyPollInterval(Duration dependencyPollInterval) {
            this.dependencyPollInterval = Objects.requireNonNull(dependencyPollInterval, "dependencyPollInterval");
            return this;
        }

        public TaskManager build() {
            return new TaskManager(this);
        }
    }
}
