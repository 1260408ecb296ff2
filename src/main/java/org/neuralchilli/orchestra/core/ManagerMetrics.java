package org.neuralchilli.orchestra.core;

import org.neuralchilli.orchestra.domain.ExecutorType;
import org.neuralchilli.orchestra.domain.TaskStatus;
import org.neuralchilli.orchestra.monitoring.TaskThroughputMonitor.ThroughputReport;
import org.neuralchilli.orchestra.worker.ExecutorMetrics;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Snapshot of the task manager: scheduler state, task counts per status,
 * per-executor load, dependency graph shape and throughput counters.
 */
public record ManagerMetrics(
        boolean running,
        int maxConcurrentTasks,
        ExecutorType defaultExecutor,
        int totalTasks,
        Map<TaskStatus, Integer> statusCounts,
        Map<ExecutorType, ExecutorMetrics> executors,
        DependencyGraphStatistics dependencyGraph,
        ThroughputReport throughput
) {
    public ManagerMetrics {
        statusCounts = Map.copyOf(statusCounts);
        executors = Map.copyOf(executors);
    }

    public int count(TaskStatus status) {
        return statusCounts.getOrDefault(status, 0);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("is_running", running);
        map.put("max_concurrent_tasks", maxConcurrentTasks);
        map.put("default_executor_type", defaultExecutor.key());
        map.put("total_tasks", totalTasks);
        for (TaskStatus status : TaskStatus.values()) {
            map.put(status.name().toLowerCase(Locale.ROOT) + "_tasks", count(status));
        }

        Map<String, Object> executorMap = new LinkedHashMap<>();
        executors.forEach((type, metrics) -> executorMap.put(type.key(), metrics.toMap()));
        map.put("executors", executorMap);
        map.put("dependency_graph", dependencyGraph.toMap());
        return map;
    }
}
