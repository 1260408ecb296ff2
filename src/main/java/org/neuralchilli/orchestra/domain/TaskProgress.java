package org.neuralchilli.orchestra.domain;

/**
 * Progress of a task: a value in [0, 1] and an optional human-readable message.
 */
public record TaskProgress(double value, String message) {

    public static final TaskProgress NONE = new TaskProgress(0.0, "");

    public TaskProgress {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException("Progress must be within [0, 1], got: " + value);
        }
        if (message == null) {
            message = "";
        }
    }

    public static TaskProgress of(Task task) {
        return new TaskProgress(task.progress(), task.progressMessage());
    }

    public boolean isDone() {
        return value >= 1.0;
    }
}
