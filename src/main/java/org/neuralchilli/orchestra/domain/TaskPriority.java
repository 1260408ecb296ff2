package org.neuralchilli.orchestra.domain;

/**
 * Task priority levels, ordered from lowest to highest.
 * Declaration order is the scheduling order, so {@link #compareTo} can be used directly.
 */
public enum TaskPriority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL;

    public boolean isHigherThan(TaskPriority other) {
        return compareTo(other) > 0;
    }
}
