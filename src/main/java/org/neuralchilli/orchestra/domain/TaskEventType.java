package org.neuralchilli.orchestra.domain;

/**
 * Lifecycle transitions reported to the event publisher.
 */
public enum TaskEventType {
    TASK_CREATED("task.created"),
    TASK_STARTED("task.started"),
    TASK_PROGRESS("task.progress"),
    TASK_COMPLETED("task.completed"),
    TASK_FAILED("task.failed"),
    TASK_CANCELLED("task.cancelled");

    private final String address;

    TaskEventType(String address) {
        this.address = address;
    }

    /**
     * Event bus address the event is published on.
     */
    public String address() {
        return address;
    }
}
