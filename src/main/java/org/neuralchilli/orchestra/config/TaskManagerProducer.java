package org.neuralchilli.orchestra.config;

import io.vertx.mutiny.core.eventbus.EventBus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.orchestra.core.TaskManager;
import org.neuralchilli.orchestra.domain.ExecutorType;
import org.neuralchilli.orchestra.event.EventBusTaskEventPublisher;
import org.neuralchilli.orchestra.event.TaskEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Configures and produces the application's task manager.
 *
 * Executors are sized from {@code orchestrator.tasks.*}; lifecycle events go
 * to the Vert.x event bus unless {@code orchestrator.tasks.events.enabled} is false.
 */
@ApplicationScoped
public class TaskManagerProducer {

    private static final Logger log = LoggerFactory.getLogger(TaskManagerProducer.class);

    @Inject
    EventBus eventBus;

    @ConfigProperty(name = "orchestrator.tasks.max-concurrent-tasks", defaultValue = "4")
    int maxConcurrentTasks;

    @ConfigProperty(name = "orchestrator.tasks.default-executor", defaultValue = "async")
    String defaultExecutor;

    @ConfigProperty(name = "orchestrator.tasks.scheduler-tick-ms", defaultValue = "100")
    long schedulerTickMs;

    @ConfigProperty(name = "orchestrator.tasks.dependency-poll-ms", defaultValue = "100")
    long dependencyPollMs;

    @ConfigProperty(name = "orchestrator.tasks.worker-pool.threads")
    Optional<Integer> workerPoolThreads;

    @ConfigProperty(name = "orchestrator.tasks.async.max-concurrency")
    Optional<Integer> asyncMaxConcurrency;

    @ConfigProperty(name = "orchestrator.tasks.async.carrier-threads", defaultValue = "2")
    int asyncCarrierThreads;

    @ConfigProperty(name = "orchestrator.tasks.events.enabled", defaultValue = "true")
    boolean eventsEnabled;

    @Produces
    @Singleton
    public TaskManager taskManager() {
        ExecutorType executorType = ExecutorType.fromString(defaultExecutor);
        log.info("Initializing task manager: {} max concurrent tasks, default executor {}, events {}",
                maxConcurrentTasks, executorType.key(), eventsEnabled ? "enabled" : "disabled");

        TaskEventPublisher publisher = eventsEnabled
                ? new EventBusTaskEventPublisher(eventBus)
                : TaskEventPublisher.NOOP;

        TaskManager.Builder builder = TaskManager.builder()
                .maxConcurrentTasks(maxConcurrentTasks)
                .defaultExecutor(executorType)
                .schedulerTick(Duration.ofMillis(schedulerTickMs))
                .dependencyPollInterval(Duration.ofMillis(dependencyPollMs))
                .asyncCarrierThreads(asyncCarrierThreads)
                .eventPublisher(publisher);

        workerPoolThreads.ifPresent(builder::workerPoolThreads);
        asyncMaxConcurrency.ifPresent(builder::asyncMaxConcurrency);

        return builder.build();
    }
}
