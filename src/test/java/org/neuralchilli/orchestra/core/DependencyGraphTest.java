package org.neuralchilli.orchestra.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DependencyGraphTest {

    @Test
    void shouldTrackDirectAndTransitiveDependents() {
        DependencyGraph graph = new DependencyGraph();
        graph.addTask("extract", List.of());
        graph.addTask("transform", List.of("extract"));
        graph.addTask("load", List.of("transform"));
        graph.addTask("audit", List.of("extract"));

        assertThat(graph.contains("load")).isTrue();
        assertThat(graph.dependentsOf("extract")).containsExactlyInAnyOrder("transform", "audit");
        assertThat(graph.transitiveDependentsOf("extract")).containsExactlyInAnyOrder("transform", "load", "audit");
        assertThat(graph.dependentsOf("unknown")).isEmpty();
    }

    @Test
    void shouldOrderDependenciesFirst() {
        DependencyGraph graph = new DependencyGraph();
        graph.addTask("a", List.of());
        graph.addTask("b", List.of("a"));
        graph.addTask("c", List.of("a", "b"));

        assertThat(graph.topologicalOrder()).containsExactly("a", "b", "c");
    }

    @Test
    void shouldRejectUnknownDependency() {
        DependencyGraph graph = new DependencyGraph();

        assertThatThrownBy(() -> graph.addTask("b", Set.of("a")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'a'");
        assertThat(graph.contains("b")).isFalse();
    }

    @Test
    void shouldComputeStatistics() {
        DependencyGraph graph = new DependencyGraph();
        assertThat(graph.statistics()).isEqualTo(DependencyGraphStatistics.EMPTY);

        graph.addTask("a", List.of());
        graph.addTask("b", List.of());
        graph.addTask("c", List.of("a", "b"));
        graph.addTask("d", List.of("a"));

        DependencyGraphStatistics stats = graph.statistics();

        assertThat(stats.tasks()).isEqualTo(4);
        assertThat(stats.dependencies()).isEqualTo(3);
        assertThat(stats.rootTasks()).isEqualTo(2);
        assertThat(stats.leafTasks()).isEqualTo(2);
        assertThat(stats.executionLevels()).isEqualTo(2);
        assertThat(stats.maxParallelism()).isEqualTo(2);
        assertThat(stats.hasParallelism()).isTrue();
    }
}
