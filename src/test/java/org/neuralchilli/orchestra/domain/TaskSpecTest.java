package org.neuralchilli.orchestra.domain;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskSpecTest {

    private static final TaskJob NOOP = context -> null;

    @Test
    void shouldApplyDefaults() {
        TaskSpec spec = TaskSpec.builder("report").job(NOOP).build();

        assertThat(spec.id()).isNull();
        assertThat(spec.description()).isEmpty();
        assertThat(spec.priority()).isEqualTo(TaskPriority.NORMAL);
        assertThat(spec.maxRetries()).isZero();
        assertThat(spec.retryDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(spec.timeout()).isNull();
        assertThat(spec.executorType()).isNull();
        assertThat(spec.dependencies()).isEmpty();
        assertThat(spec.tags()).isEmpty();
        assertThat(spec.metadata()).isEmpty();
    }

    @Test
    void shouldKeepDependencyOrderAndDropDuplicates() {
        TaskSpec spec = TaskSpec.builder("merge")
                .job(NOOP)
                .dependsOn("b", "a", "b")
                .tag("nightly")
                .metadata("owner", "data-team")
                .build();

        assertThat(spec.dependencies()).containsExactly("b", "a");
        assertThat(spec.tags()).containsExactly("nightly");
        assertThat(spec.metadata()).containsEntry("owner", "data-team");
    }

    @Test
    void shouldExposeImmutableCollections() {
        TaskSpec spec = TaskSpec.builder("x").job(NOOP).dependsOn(List.of("a")).build();

        assertThatThrownBy(() -> spec.dependencies().add("b"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldComputeExponentialBackoff() {
        TaskSpec spec = TaskSpec.builder("flaky")
                .job(NOOP)
                .retryDelay(Duration.ofMillis(100))
                .build();

        assertThat(spec.backoff(1)).isEqualTo(Duration.ofMillis(100));
        assertThat(spec.backoff(2)).isEqualTo(Duration.ofMillis(200));
        assertThat(spec.backoff(3)).isEqualTo(Duration.ofMillis(400));
        assertThat(spec.backoff(0)).isEqualTo(Duration.ZERO);
    }

    @Test
    void shouldRejectBlankName() {
        assertThatThrownBy(() -> TaskSpec.builder(" ").job(NOOP).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("name");
    }

    @Test
    void shouldRejectMissingJob() {
        assertThatThrownBy(() -> TaskSpec.builder("x").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("job");
    }

    @Test
    void shouldRejectNegativeRetries() {
        assertThatThrownBy(() -> TaskSpec.builder("x").job(NOOP).maxRetries(-1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("retries");
    }

    @Test
    void shouldRejectNonPositiveTimeout() {
        assertThatThrownBy(() -> TaskSpec.builder("x").job(NOOP).timeout(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Timeout");
    }

    @Test
    void shouldRejectSelfDependency() {
        assertThatThrownBy(() -> TaskSpec.builder("x").id("x-1").job(NOOP).dependsOn("x-1").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("itself");
    }
}
