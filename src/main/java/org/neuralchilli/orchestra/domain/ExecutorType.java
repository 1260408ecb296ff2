package org.neuralchilli.orchestra.domain;

import java.util.Locale;

/**
 * Concurrency strategies a task can be assigned to.
 */
public enum ExecutorType {
    /**
     * One task at a time in the calling thread
     */
    SEQUENTIAL("sequential"),

    /**
     * Bounded pool of OS threads
     */
    WORKER_POOL("thread_pool"),

    /**
     * Bounded set of cooperative units sharing a few carrier threads
     */
    COOPERATIVE_ASYNC("async");

    private final String key;

    ExecutorType(String key) {
        this.key = key;
    }

    /**
     * Short name used in configuration, metrics and event payloads.
     */
    public String key() {
        return key;
    }

    /**
     * Parse either the short key ("thread_pool") or the enum name ("WORKER_POOL").
     */
    public static ExecutorType fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Executor type cannot be null or empty");
        }

        String normalized = value.trim();
        for (ExecutorType type : values()) {
            if (type.key.equalsIgnoreCase(normalized)
                    || type.name().equalsIgnoreCase(normalized.replace('-', '_'))) {
                return type;
            }
        }

        throw new IllegalArgumentException(
                "Unknown executor type: " + value.toLowerCase(Locale.ROOT)
        );
    }
}
