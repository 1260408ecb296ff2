package org.neuralchilli.orchestra.domain;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskTest {

    private static Task newTask(TaskSpec spec) {
        return Task.create("t-1", spec, ExecutorType.WORKER_POOL, 1, TaskStatus.PENDING);
    }

    private static TaskSpec.Builder spec() {
        return TaskSpec.builder("job").job(context -> "ok");
    }

    @Test
    void shouldStartNewAttempt() {
        Task running = newTask(spec().build()).start();

        assertThat(running.status()).isEqualTo(TaskStatus.RUNNING);
        assertThat(running.attempt()).isEqualTo(1);
        assertThat(running.startedAt()).isNotNull();
        assertThat(running.retryAt()).isNull();
    }

    @Test
    void shouldCompleteWithFullProgress() {
        Task done = newTask(spec().build()).start().updateProgress(0.4, "halfway").complete(42);

        assertThat(done.status()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(done.result()).isEqualTo(42);
        assertThat(done.progress()).isEqualTo(1.0);
        assertThat(done.progressMessage()).isEqualTo(Task.COMPLETED_MESSAGE);
        assertThat(done.error()).isNull();
        assertThat(done.isFinished()).isTrue();
        assertThat(done.executionTime()).isGreaterThanOrEqualTo(Duration.ZERO);
    }

    @Test
    void shouldClampProgress() {
        Task task = newTask(spec().build());

        assertThat(task.updateProgress(-0.2, "below").progress()).isEqualTo(0.0);
        assertThat(task.updateProgress(1.5, "above").progress()).isEqualTo(1.0);
        assertThat(task.updateProgress(Double.NaN, "nan").progress()).isEqualTo(0.0);
        assertThat(task.updateProgress(0.25, "quarter").progressMessage()).isEqualTo("quarter");
    }

    @Test
    void shouldConsumeRetriesUntilExhausted() {
        TaskExecutionError error = TaskExecutionError.of("t-1", new IllegalStateException("boom"));
        Instant notBefore = Instant.now().plusSeconds(5);

        Task retried = newTask(spec().maxRetries(1).build()).start().retry(error, notBefore);

        assertThat(retried.status()).isEqualTo(TaskStatus.PENDING);
        assertThat(retried.retryCount()).isEqualTo(1);
        assertThat(retried.error()).isSameAs(error);
        assertThat(retried.isDueAt(Instant.now())).isFalse();
        assertThat(retried.isDueAt(notBefore)).isTrue();
        assertThat(retried.canRetry()).isFalse();

        Task rerun = retried.start();
        assertThatThrownBy(() -> rerun.retry(error, notBefore))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldBeReadyOnlyWhenAllDependenciesCompleted() {
        Task task = newTask(spec().dependsOn("a", "b").build());

        assertThat(task.isReady(Set.of("a"))).isFalse();
        assertThat(task.isReady(Set.of("a", "b", "c"))).isTrue();
        assertThat(newTask(spec().build()).isReady(Set.of())).isTrue();
    }

    @Test
    void shouldRejectResultAndErrorTogether() {
        Task task = newTask(spec().build());

        assertThatThrownBy(() -> new Task(
                task.id(), task.spec(), task.executorType(), task.sequence(), TaskStatus.COMPLETED,
                0, 1, 1.0, "", "result", TaskExecutionError.of("t-1", new RuntimeException("x")),
                task.createdAt(), null, null, null
        )).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRenderJsonFriendlyMap() {
        Task task = newTask(spec().dependsOn("a").tag("etl").priority(TaskPriority.HIGH).build());

        Map<String, Object> map = task.toMap();

        assertThat(map)
                .containsEntry("task_id", "t-1")
                .containsEntry("name", "job")
                .containsEntry("priority", "HIGH")
                .containsEntry("status", "PENDING")
                .containsEntry("executor_type", "thread_pool")
                .containsEntry("dependencies", List.of("a"))
                .containsEntry("tags", List.of("etl"))
                .containsEntry("started_at", null);
        assertThat(map.get("created_at")).isInstanceOf(String.class);
    }
}
