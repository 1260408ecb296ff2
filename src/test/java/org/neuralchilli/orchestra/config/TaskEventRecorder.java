package org.neuralchilli.orchestra.config;

import io.quarkus.vertx.ConsumeEvent;
import io.vertx.core.json.JsonObject;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Collects lifecycle events published on the event bus during tests.
 */
@ApplicationScoped
public class TaskEventRecorder {

    private final List<JsonObject> completed = new CopyOnWriteArrayList<>();

    @ConsumeEvent("task.completed")
    void onCompleted(JsonObject event) {
        completed.add(event);
    }

    public List<JsonObject> completed() {
        return completed;
    }
}
