package org.neuralchilli.orchestra.event;

import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.eventbus.EventBus;
import org.neuralchilli.orchestra.domain.TaskEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;

/**
 * Publishes task lifecycle events on the Vert.x event bus.
 *
 * Each event is a {@link JsonObject} sent to the address of its type
 * ({@code task.created}, {@code task.completed}, ...), so consumers such as
 * webhook delivery or dashboards can subscribe with {@code @ConsumeEvent}.
 */
public class EventBusTaskEventPublisher implements TaskEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(EventBusTaskEventPublisher.class);

    private final EventBus eventBus;

    public EventBusTaskEventPublisher(EventBus eventBus) {
        if (eventBus == null) {
            throw new IllegalArgumentException("Event bus cannot be null");
        }
        this.eventBus = eventBus;
    }

    @Override
    public void publish(TaskEventType type, String taskId, Map<String, Object> payload) {
        JsonObject event = new JsonObject()
                .put("type", type.name())
                .put("task_id", taskId)
                .put("timestamp", Instant.now().toString());

        payload.forEach(event::put);

        eventBus.publish(type.address(), event);
        log.trace("Published {} for task {} to {}", type, taskId, type.address());
    }
}
