package org.neuralchilli.orchestra.core;

import javax.annotation.Nonnull;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shape of the dependency graph formed by all registered tasks.
 */
public record DependencyGraphStatistics(
        int tasks,
        int dependencies,
        int rootTasks,
        int leafTasks,
        int executionLevels,
        int maxParallelism
) {
    public static final DependencyGraphStatistics EMPTY = new DependencyGraphStatistics(0, 0, 0, 0, 0, 0);

    public DependencyGraphStatistics {
        if (tasks < 0 || dependencies < 0 || rootTasks < 0 || leafTasks < 0
                || executionLevels < 0 || maxParallelism < 0) {
            throw new IllegalArgumentException("Graph statistics cannot be negative");
        }
        if (rootTasks > tasks || leafTasks > tasks) {
            throw new IllegalArgumentException("Root and leaf counts cannot exceed the task count");
        }
    }

    /**
     * True when at least two tasks could run side by side
     */
    public boolean hasParallelism() {
        return maxParallelism > 1;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("tasks", tasks);
        map.put("dependencies", dependencies);
        map.put("root_tasks", rootTasks);
        map.put("leaf_tasks", leafTasks);
        map.put("execution_levels", executionLevels);
        map.put("max_parallelism", maxParallelism);
        return map;
    }

    @Nonnull
    @Override
    public String toString() {
        return String.format(
                "DependencyGraphStatistics[tasks=%d, edges=%d, levels=%d, max_parallel=%d, roots=%d, leaves=%d]",
                tasks, dependencies, executionLevels, maxParallelism, rootTasks, leafTasks
        );
    }
}
