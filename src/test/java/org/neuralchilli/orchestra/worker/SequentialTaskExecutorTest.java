package org.neuralchilli.orchestra.worker;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.orchestra.domain.ExecutorType;
import org.neuralchilli.orchestra.domain.Task;
import org.neuralchilli.orchestra.domain.TaskExecutionError;
import org.neuralchilli.orchestra.domain.TaskTimeoutError;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.neuralchilli.orchestra.worker.ExecutorTestTasks.running;

class SequentialTaskExecutorTest {

    private SequentialTaskExecutor executor;
    private ExecutorService callers;

    @BeforeEach
    void setup() {
        executor = new SequentialTaskExecutor();
        callers = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void cleanup() {
        executor.shutdown(false);
        callers.shutdownNow();
    }

    @Test
    void shouldRunInCallingThread() {
        String caller = Thread.currentThread().getName();
        Task task = running("inline", ExecutorType.SEQUENTIAL, context -> Thread.currentThread().getName());

        Object result = executor.execute(task, new RecordingTaskContext(task.id()));

        assertThat(result).isEqualTo(caller);
        assertThat(executor.metrics().idle()).isTrue();
    }

    @Test
    void shouldWrapJobFailure() {
        Task task = running("broken", ExecutorType.SEQUENTIAL, context -> {
            throw new IllegalStateException("bad input");
        });

        assertThatThrownBy(() -> executor.execute(task, new RecordingTaskContext(task.id())))
                .isInstanceOf(TaskExecutionError.class)
                .hasCauseInstanceOf(IllegalStateException.class)
                .hasMessageContaining("bad input");
    }

    @Test
    void shouldTimeOutSlowJob() {
        Task task = running("slow", ExecutorType.SEQUENTIAL, context -> {
            Thread.sleep(5_000);
            return "late";
        }, Duration.ofMillis(100));

        assertThatThrownBy(() -> executor.execute(task, new RecordingTaskContext(task.id())))
                .isInstanceOf(TaskTimeoutError.class);
    }

    @Test
    void shouldRunOneTaskAtATime() throws Exception {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();

        List<Future<Object>> futures = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            Task task = running("seq-" + i, ExecutorType.SEQUENTIAL, context -> {
                maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                Thread.sleep(30);
                active.decrementAndGet();
                return null;
            });
            futures.add(callers.submit(() -> executor.execute(task, new RecordingTaskContext(task.id()))));
        }
        for (Future<Object> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }

        assertThat(maxActive.get()).isEqualTo(1);
    }

    @Test
    void shouldOnlyCancelTheRunningTask() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Task task = running("blocking", ExecutorType.SEQUENTIAL, context -> {
            started.countDown();
            release.await();
            return "done";
        });
        Task other = running("other", ExecutorType.SEQUENTIAL, context -> null);

        assertThat(executor.cancel(task)).isFalse();

        Future<Object> future = callers.submit(() -> executor.execute(task, new RecordingTaskContext(task.id())));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(executor.runningTaskId()).isEqualTo("blocking");
        assertThat(executor.cancel(other)).isFalse();
        assertThat(executor.cancel(task)).isTrue();

        release.countDown();
        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(CancellationException.class);
        await().atMost(Duration.ofSeconds(2)).until(() -> executor.runningTaskId() == null);
    }

    @Test
    void shouldRejectWorkAfterShutdown() {
        executor.shutdown(true);
        Task task = running("late", ExecutorType.SEQUENTIAL, context -> null);

        assertThatThrownBy(() -> executor.execute(task, new RecordingTaskContext(task.id())))
                .isInstanceOf(TaskExecutionError.class)
                .hasMessageContaining("shut down");
        assertThat(executor.metrics().accepting()).isFalse();
    }
}
