package org.neuralchilli.orchestra.worker;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.orchestra.domain.ExecutorType;
import org.neuralchilli.orchestra.domain.Task;
import org.neuralchilli.orchestra.domain.TaskExecutionError;
import org.neuralchilli.orchestra.domain.TaskTimeoutError;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.neuralchilli.orchestra.worker.ExecutorTestTasks.running;

class WorkerPoolTaskExecutorTest {

    private WorkerPoolTaskExecutor executor;
    private ExecutorService callers;

    @BeforeEach
    void setup() {
        executor = new WorkerPoolTaskExecutor(1, "test-pool");
        callers = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void cleanup() {
        executor.shutdown(false);
        callers.shutdownNow();
    }

    @Test
    void shouldRunOnWorkerThread() {
        Task task = running("pooled", ExecutorType.WORKER_POOL, context -> Thread.currentThread().getName());

        Object result = executor.execute(task, new RecordingTaskContext(task.id()));

        assertThat((String) result).startsWith("test-pool-thread-");
        assertThat(executor.workerThreads()).isEqualTo(1);
    }

    @Test
    void shouldWrapJobFailure() {
        Task task = running("broken", ExecutorType.WORKER_POOL, context -> {
            throw new IOException("connection reset");
        });

        assertThatThrownBy(() -> executor.execute(task, new RecordingTaskContext(task.id())))
                .isInstanceOf(TaskExecutionError.class)
                .hasMessageContaining("connection reset");
    }

    @Test
    void shouldTimeOutAndFreeWorker() {
        Task slow = running("slow", ExecutorType.WORKER_POOL, context -> {
            Thread.sleep(10_000);
            return null;
        }, Duration.ofMillis(100));

        assertThatThrownBy(() -> executor.execute(slow, new RecordingTaskContext(slow.id())))
                .isInstanceOf(TaskTimeoutError.class);

        // The interrupted worker is free for the next unit
        Task next = running("next", ExecutorType.WORKER_POOL, context -> "ok");
        assertThat(executor.execute(next, new RecordingTaskContext(next.id()))).isEqualTo("ok");
    }

    @Test
    void shouldCancelQueuedUnitButNotStartedOne() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Task blocker = running("blocker", ExecutorType.WORKER_POOL, context -> {
            started.countDown();
            release.await();
            return "blocker-done";
        });
        AtomicBoolean queuedRan = new AtomicBoolean(false);
        Task queued = running("queued", ExecutorType.WORKER_POOL, context -> {
            queuedRan.set(true);
            return null;
        });

        Future<Object> blockerFuture = callers.submit(() -> executor.execute(blocker, new RecordingTaskContext(blocker.id())));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        Future<Object> queuedFuture = callers.submit(() -> executor.execute(queued, new RecordingTaskContext(queued.id())));
        await().atMost(Duration.ofSeconds(2)).until(() -> executor.metrics().activeTasks() == 2);

        assertThat(executor.cancel(blocker)).isFalse();
        assertThat(executor.cancel(queued)).isTrue();

        release.countDown();
        assertThat(blockerFuture.get(5, TimeUnit.SECONDS)).isEqualTo("blocker-done");
        assertThatThrownBy(() -> queuedFuture.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(CancellationException.class);
        assertThat(queuedRan).isFalse();
    }

    @Test
    void shouldReportCapacity() {
        ExecutorMetrics metrics = executor.metrics();

        assertThat(metrics.type()).isEqualTo(ExecutorType.WORKER_POOL);
        assertThat(metrics.capacity()).isEqualTo(1);
        assertThat(metrics.availableSlots()).isEqualTo(1);
        assertThat(metrics.toMap()).containsEntry("executor_type", "thread_pool");
    }
}
