package org.neuralchilli.orchestra.event;

import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.eventbus.EventBus;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.neuralchilli.orchestra.domain.TaskEventType;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class EventBusTaskEventPublisherTest {

    @Test
    void shouldPublishJsonToTypeAddress() {
        EventBus eventBus = mock(EventBus.class);
        TaskEventPublisher publisher = new EventBusTaskEventPublisher(eventBus);

        publisher.publish(TaskEventType.TASK_CREATED, "t-1", Map.of(
                "name", "nightly-export",
                "dependencies", List.of("t-0")
        ));

        ArgumentCaptor<Object> message = ArgumentCaptor.forClass(Object.class);
        verify(eventBus).publish(eq("task.created"), message.capture());

        assertThat(message.getValue()).isInstanceOf(JsonObject.class);
        JsonObject json = (JsonObject) message.getValue();
        assertThat(json.getString("type")).isEqualTo("TASK_CREATED");
        assertThat(json.getString("task_id")).isEqualTo("t-1");
        assertThat(json.getString("name")).isEqualTo("nightly-export");
        assertThat(json.getString("timestamp")).isNotBlank();
        assertThat(json.getJsonArray("dependencies").getList()).containsExactly("t-0");
    }

    @Test
    void shouldUseOneAddressPerEventType() {
        assertThat(TaskEventType.TASK_PROGRESS.address()).isEqualTo("task.progress");
        assertThat(TaskEventType.TASK_CANCELLED.address()).isEqualTo("task.cancelled");
    }

    @Test
    void shouldRequireEventBus() {
        assertThatThrownBy(() -> new EventBusTaskEventPublisher(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
