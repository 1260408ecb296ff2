package org.neuralchilli.orchestra.domain;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Snapshot of a registered task.
 * Immutable: the manager replaces the snapshot on every state transition,
 * so callers holding a reference never observe a half-applied change.
 */
public record Task(
        String id,
        TaskSpec spec,
        ExecutorType executorType,
        long sequence,  // registration order, FIFO tie-breaker
        TaskStatus status,
        int retryCount,
        int attempt,
        double progress,
        String progressMessage,
        Object result,
        TaskException error,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        Instant retryAt  // earliest dispatch of a scheduled retry
) {

    public static final String COMPLETED_MESSAGE = "Task completed";

    public Task {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task ID cannot be null or empty");
        }
        if (spec == null) {
            throw new IllegalArgumentException("Task spec cannot be null");
        }
        if (executorType == null) {
            throw new IllegalArgumentException("Executor type cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("Created at cannot be null");
        }
        if (result != null && error != null) {
            throw new IllegalArgumentException("Task cannot have both a result and an error");
        }

        progress = clamp(progress);
        if (progressMessage == null) {
            progressMessage = "";
        }
    }

    /**
     * Create the initial snapshot for a newly registered task.
     */
    public static Task create(String id, TaskSpec spec, ExecutorType executorType,
                              long sequence, TaskStatus initialStatus) {
        return new Task(
                id, spec, executorType, sequence, initialStatus,
                0, 0, 0.0, "", null, null,
                Instant.now(), null, null, null
        );
    }

    /**
     * Update status
     */
    public Task withStatus(TaskStatus newStatus) {
        return new Task(
                id, spec, executorType, sequence, newStatus, retryCount, attempt,
                progress, progressMessage, result, error,
                createdAt, startedAt, completedAt, retryAt
        );
    }

    /**
     * Mark as running for a new attempt
     */
    public Task start() {
        return new Task(
                id, spec, executorType, sequence, TaskStatus.RUNNING, retryCount, attempt + 1,
                progress, progressMessage, null, error,
                createdAt, Instant.now(), null, null
        );
    }

    /**
     * Mark as completed
     */
    public Task complete(Object taskResult) {
        return new Task(
                id, spec, executorType, sequence, TaskStatus.COMPLETED, retryCount, attempt,
                1.0, COMPLETED_MESSAGE, taskResult, null,
                createdAt, startedAt, Instant.now(), null
        );
    }

    /**
     * Mark as failed with no retries left
     */
    public Task fail(TaskException taskError) {
        return new Task(
                id, spec, executorType, sequence, TaskStatus.FAILED, retryCount, attempt,
                progress, progressMessage, null, taskError,
                createdAt, startedAt, Instant.now(), null
        );
    }

    /**
     * Return a failed attempt to PENDING, consuming one retry.
     */
    public Task retry(TaskException taskError, Instant notBefore) {
        if (!canRetry()) {
            throw new IllegalStateException(
                    "Cannot retry task " + id + ": " + retryCount + "/" + spec.maxRetries() + " retries used"
            );
        }

        return new Task(
                id, spec, executorType, sequence, TaskStatus.PENDING, retryCount + 1, attempt,
                progress, progressMessage, null, taskError,
                createdAt, startedAt, null, notBefore
        );
    }

    /**
     * Mark as cancelled
     */
    public Task cancel() {
        return new Task(
                id, spec, executorType, sequence, TaskStatus.CANCELLED, retryCount, attempt,
                progress, progressMessage, null, null,
                createdAt, startedAt, Instant.now(), null
        );
    }

    /**
     * Update progress, clamping the value to [0, 1].
     */
    public Task updateProgress(double value, String message) {
        return new Task(
                id, spec, executorType, sequence, status, retryCount, attempt,
                clamp(value), message, result, error,
                createdAt, startedAt, completedAt, retryAt
        );
    }

    /**
     * True iff every dependency is in the given set of completed task ids.
     */
    public boolean isReady(Collection<String> completedIds) {
        return completedIds.containsAll(spec.dependencies());
    }

    public boolean canRetry() {
        return retryCount < spec.maxRetries();
    }

    /**
     * Check if a scheduled retry may be dispatched at the given instant
     */
    public boolean isDueAt(Instant now) {
        return retryAt == null || !retryAt.isAfter(now);
    }

    public boolean isFinished() {
        return status.isTerminal();
    }

    /**
     * Duration of the last attempt, zero until the task has finished.
     */
    public Duration executionTime() {
        if (startedAt == null || completedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, completedAt);
    }

    public String name() {
        return spec.name();
    }

    public String description() {
        return spec.description();
    }

    public TaskPriority priority() {
        return spec.priority();
    }

    public Set<String> dependencies() {
        return spec.dependencies();
    }

    public Set<String> tags() {
        return spec.tags();
    }

    public Map<String, Object> metadata() {
        return spec.metadata();
    }

    public int maxRetries() {
        return spec.maxRetries();
    }

    public Duration timeout() {
        return spec.timeout();
    }

    public TaskJob job() {
        return spec.job();
    }

    /**
     * JSON-friendly view of the task for API and dashboard layers.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("task_id", id);
        map.put("name", name());
        map.put("priority", priority().name());
        map.put("status", status.name());
        map.put("executor_type", executorType.key());
        map.put("dependencies", new ArrayList<>(dependencies()));
        map.put("created_at", createdAt.toString());
        map.put("started_at", startedAt != null ? startedAt.toString() : null);
        map.put("completed_at", completedAt != null ? completedAt.toString() : null);
        map.put("retry_count", retryCount);
        map.put("max_retries", maxRetries());
        map.put("progress", progress);
        map.put("progress_message", progressMessage);
        map.put("description", description());
        map.put("tags", new ArrayList<>(tags()));
        map.put("metadata", metadata());
        map.put("error", error != null ? error.getMessage() : null);
        return map;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    @Nonnull
    @Override
    public String toString() {
        return String.format("Task[%s, %s, %s, priority=%s]", id, name(), status, priority());
    }
}
