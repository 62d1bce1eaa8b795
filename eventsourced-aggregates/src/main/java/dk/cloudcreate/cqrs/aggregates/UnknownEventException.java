package dk.cloudcreate.cqrs.aggregates;

import dk.cloudcreate.cqrs.aggregates.event.Event;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown by {@link AggregateRoot#apply(boolean, Event)} when the event payload isn't one the aggregate knows how to apply
 */
public class UnknownEventException extends AggregateException {
    public UnknownEventException(String message) {
        super(message);
    }

    public static UnknownEventException forEvent(Event<?> event, AggregateRoot aggregateRoot) {
        return new UnknownEventException(msg("Aggregate '{}' can't apply event '{}' with payload type '{}'",
                                             aggregateRoot.getClass().getName(),
                                             event.eventId(),
                                             event.payload().getClass().getName()));
    }
}
