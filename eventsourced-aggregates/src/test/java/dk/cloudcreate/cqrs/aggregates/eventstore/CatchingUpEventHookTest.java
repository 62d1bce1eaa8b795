package dk.cloudcreate.cqrs.aggregates.eventstore;

import dk.cloudcreate.cqrs.aggregates.event.Event;
import dk.cloudcreate.cqrs.aggregates.test_data.OrderEvents;
import dk.cloudcreate.cqrs.aggregates.test_data.OrderEvents.*;
import dk.cloudcreate.cqrs.common.types.EventId;
import org.junit.jupiter.api.Test;

import java.util.*;

import static dk.cloudcreate.cqrs.aggregates.test_data.TestEvents.event;
import static org.assertj.core.api.Assertions.assertThat;

class CatchingUpEventHookTest {
    private static final List<EventId> ORDER_EVENTS = List.of(OrderEvents.ORDER_ADDED, OrderEvents.PRODUCT_ADDED, OrderEvents.ACCEPTED);

    @Test
    void events_saved_after_the_history_was_read_are_projected_after_the_history() {
        // Given
        var historic   = event(OrderEvents.ORDER_ADDED, "a1", 0, new OrderAdded("customer-1"));
        var concurrent = event(OrderEvents.ORDER_ADDED, "a2", 1, new OrderAdded("customer-2"));
        var eventStore = new InMemoryEventStore() {
            @Override
            public List<Event<?>> loadEventsOfType(Collection<EventId> eventIds) {
                var history = super.loadEventsOfType(eventIds);
                save(List.of(concurrent));
                return history;
            }
        };
        eventStore.save(List.of(historic));
        var projection = new RecordingProjection();

        // When
        var projected = projection.catchUp(eventStore, ORDER_EVENTS);

        // Then
        assertThat(projected).isEqualTo(2);
        assertThat(projection.projected).containsExactly(historic, concurrent);
    }

    @Test
    void an_event_both_in_the_history_and_received_meanwhile_is_projected_once() {
        // Given
        var historic   = event(OrderEvents.ORDER_ADDED, "a1", 0, new OrderAdded("customer-1"));
        var concurrent = event(OrderEvents.ACCEPTED, "a1", 1, new OrderAccepted());
        var eventStore = new InMemoryEventStore() {
            @Override
            public List<Event<?>> loadEventsOfType(Collection<EventId> eventIds) {
                save(List.of(concurrent));
                return super.loadEventsOfType(eventIds);
            }
        };
        eventStore.save(List.of(historic));
        var projection = new RecordingProjection();

        // When
        var projected = projection.catchUp(eventStore, ORDER_EVENTS);

        // Then
        assertThat(projected).isEqualTo(2);
        assertThat(projection.projected).containsExactly(historic, concurrent);
    }

    @Test
    void once_caught_up_events_are_projected_as_they_are_saved() {
        // Given
        var eventStore = new InMemoryEventStore();
        var projection = new RecordingProjection();
        projection.catchUp(eventStore, ORDER_EVENTS);
        var added = event(OrderEvents.ORDER_ADDED, "a1", 0, new OrderAdded("customer-1"));

        // When
        eventStore.save(List.of(added));

        // Then
        assertThat(projection.projected).containsExactly(added);
    }

    private static class RecordingProjection extends CatchingUpEventHook {
        final List<Event<?>> projected = new ArrayList<>();

        @Override
        protected void project(Event<?> event) {
            projected.add(event);
        }
    }
}
