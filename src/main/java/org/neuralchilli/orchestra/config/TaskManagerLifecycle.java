package org.neuralchilli.orchestra.config;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.orchestra.core.TaskManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the scheduler loop with the application and tears the manager down on exit.
 */
@ApplicationScoped
public class TaskManagerLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TaskManagerLifecycle.class);

    @Inject
    TaskManager taskManager;

    @ConfigProperty(name = "orchestrator.tasks.auto-start", defaultValue = "true")
    boolean autoStart;

    void onStart(@Observes StartupEvent event) {
        if (!autoStart) {
            log.info("Task scheduler auto-start disabled");
            return;
        }
        taskManager.start();
    }

    /**
     * In-flight attempts are cancelled rather than drained so shutdown is not held up by long bodies.
     */
    void onStop(@Observes ShutdownEvent event) {
        taskManager.shutdown(false);
    }
}
