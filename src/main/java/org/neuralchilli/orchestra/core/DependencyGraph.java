package org.neuralchilli.orchestra.core;

import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.jgrapht.traverse.TopologicalOrderIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * "Must complete before" relations among registered tasks, backed by a JGraphT DAG.
 * Edge direction is from dependency to dependent.
 *
 * Not thread-safe: the task manager only touches it while holding its lock.
 * Since dependencies must already be registered, the graph can never contain a cycle.
 */
class DependencyGraph {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraph.class);

    private final DirectedAcyclicGraph<String, DefaultEdge> dag =
            new DirectedAcyclicGraph<>(DefaultEdge.class);

    boolean contains(String taskId) {
        return dag.containsVertex(taskId);
    }

    /**
     * Add a task and its edges. Every dependency must already be in the graph.
     */
    void addTask(String taskId, Collection<String> dependencies) {
        for (String dependency : dependencies) {
            if (!dag.containsVertex(dependency)) {
                throw new IllegalStateException(
                        "Task '" + taskId + "' depends on '" + dependency + "' which is not in the graph"
                );
            }
        }

        dag.addVertex(taskId);
        for (String dependency : dependencies) {
            dag.addEdge(dependency, taskId);
            log.trace("Added edge: {} -> {}", dependency, taskId);
        }
    }

    /**
     * Immediate dependents of a task (tasks listing it as a dependency).
     */
    Set<String> dependentsOf(String taskId) {
        if (!dag.containsVertex(taskId)) {
            return Set.of();
        }
        return dag.outgoingEdgesOf(taskId).stream()
                .map(dag::getEdgeTarget)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Every task that directly or transitively depends on the given one.
     */
    Set<String> transitiveDependentsOf(String taskId) {
        if (!dag.containsVertex(taskId)) {
            return Set.of();
        }
        return dag.getDescendants(taskId);
    }

    List<String> topologicalOrder() {
        List<String> order = new ArrayList<>();
        TopologicalOrderIterator<String, DefaultEdge> iterator = new TopologicalOrderIterator<>(dag);
        while (iterator.hasNext()) {
            order.add(iterator.next());
        }
        return order;
    }

    DependencyGraphStatistics statistics() {
        if (dag.vertexSet().isEmpty()) {
            return DependencyGraphStatistics.EMPTY;
        }

        // Level of a task = 1 + deepest level among its dependencies
        Map<String, Integer> levels = new HashMap<>();
        for (String taskId : topologicalOrder()) {
            int level = dag.incomingEdgesOf(taskId).stream()
                    .map(dag::getEdgeSource)
                    .mapToInt(levels::get)
                    .max()
                    .orElse(0) + 1;
            levels.put(taskId, level);
        }

        Map<Integer, Long> widths = levels.values().stream()
                .collect(Collectors.groupingBy(level -> level, Collectors.counting()));

        int rootTasks = (int) dag.vertexSet().stream().filter(v -> dag.inDegreeOf(v) == 0).count();
        int leafTasks = (int) dag.vertexSet().stream().filter(v -> dag.outDegreeOf(v) == 0).count();

        return new DependencyGraphStatistics(
                dag.vertexSet().size(),
                dag.edgeSet().size(),
                rootTasks,
                leafTasks,
                widths.size(),
                widths.values().stream().mapToInt(Long::intValue).max().orElse(0)
        );
    }
}
