package org.neuralchilli.orchestra.worker;

import org.neuralchilli.orchestra.domain.ExecutorType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time snapshot of an executor's load.
 */
public record ExecutorMetrics(
        ExecutorType type,
        int capacity,
        int activeTasks,
        int availableSlots,
        boolean accepting
) {
    public ExecutorMetrics {
        if (type == null) {
            throw new IllegalArgumentException("Executor type cannot be null");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be > 0");
        }
        if (activeTasks < 0) {
            throw new IllegalArgumentException("Active tasks cannot be negative");
        }
        if (availableSlots < 0) {
            throw new IllegalArgumentException("Available slots cannot be negative");
        }
    }

    public boolean idle() {
        return activeTasks == 0;
    }

    public double utilization() {
        return (double) Math.min(activeTasks, capacity) / capacity;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("executor_type", type.key());
        map.put("capacity", capacity);
        map.put("active_tasks", activeTasks);
        map.put("available_slots", availableSlots);
        map.put("is_idle", idle());
        map.put("utilization", utilization());
        map.put("accepting", accepting);
        return map;
    }
}
