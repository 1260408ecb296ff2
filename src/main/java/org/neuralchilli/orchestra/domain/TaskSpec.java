package org.neuralchilli.orchestra.domain;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Registration request for a task: what to run and under which policy.
 * Immutable; the manager turns it into a {@link Task} on registration.
 */
public record TaskSpec(
        String id,  // requested id, generated when null or already taken
        String name,
        String description,
        Set<String> tags,
        Map<String, Object> metadata,
        TaskPriority priority,
        Set<String> dependencies,
        int maxRetries,
        Duration retryDelay,
        Duration timeout,  // null = no limit
        ExecutorType executorType,  // null = manager default
        TaskJob job
) {
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);

    public TaskSpec {
        // Validation
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Task name cannot be null or empty");
        }

        if (id != null && id.isBlank()) {
            throw new IllegalArgumentException("Task id cannot be blank");
        }

        if (job == null) {
            throw new IllegalArgumentException("Task job cannot be null");
        }

        if (maxRetries < 0) {
            throw new IllegalArgumentException("Max retries cannot be negative, got: " + maxRetries);
        }

        if (retryDelay != null && retryDelay.isNegative()) {
            throw new IllegalArgumentException("Retry delay cannot be negative, got: " + retryDelay);
        }

        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("Timeout must be positive, got: " + timeout);
        }

        // Defaults
        if (description == null) {
            description = "";
        }
        if (priority == null) {
            priority = TaskPriority.NORMAL;
        }
        if (retryDelay == null) {
            retryDelay = DEFAULT_RETRY_DELAY;
        }

        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        dependencies = dependencies == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));

        if (id != null && dependencies.contains(id)) {
            throw new IllegalArgumentException("Task " + id + " cannot depend on itself");
        }
    }

    /**
     * Exponential backoff before the given retry: {@code retryDelay * 2^(retryNumber - 1)}.
     *
     * @param retryNumber 1-based retry number
     */
    public Duration backoff(int retryNumber) {
        if (retryNumber < 1) {
            return Duration.ZERO;
        }
        int exponent = Math.min(retryNumber - 1, 30);
        return retryDelay.multipliedBy(1L << exponent);
    }

    /**
     * Builder for creating task specs fluently
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private String id;
        private String description = "";
        private Set<String> tags = new LinkedHashSet<>();
        private Map<String, Object> metadata = new LinkedHashMap<>();
        private TaskPriority priority = TaskPriority.NORMAL;
        private Set<String> dependencies = new LinkedHashSet<>();
        private int maxRetries = 0;
        private Duration retryDelay = DEFAULT_RETRY_DELAY;
        private Duration timeout;
        private ExecutorType executorType;
        private TaskJob job;

        public Builder(String name) {
            this.name = name;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder tags(Collection<String> tags) {
            this.tags = new LinkedHashSet<>(tags);
            return this;
        }

        public Builder tag(String tag) {
            this.tags.add(tag);
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = new LinkedHashMap<>(metadata);
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder priority(TaskPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder dependsOn(Collection<String> dependencies) {
            this.dependencies = new LinkedHashSet<>(dependencies);
            return this;
        }

        public Builder dependsOn(String... dependencies) {
            Collections.addAll(this.dependencies, dependencies);
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder executor(ExecutorType executorType) {
            this.executorType = executorType;
            return this;
        }

        public Builder job(TaskJob job) {
            this.job = job;
            return this;
        }

        public TaskSpec build() {
            return new TaskSpec(id, name, description, tags, metadata, priority, dependencies,
                    maxRetries, retryDelay, timeout, executorType, job);
        }
    }
}
