package dk.cloudcreate.cqrs.aggregates.event;

import dk.cloudcreate.cqrs.aggregates.command.Command;
import dk.cloudcreate.cqrs.common.types.*;

import java.time.*;
import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * An immutable fact that happened to a single aggregate.<br>
 * An event is made up of an {@link EventEnvelope} and an {@link EventPayload}. Events created while handling a
 * {@link Command} inherit the command's aggregate type and correlation id.
 *
 * @param <P> the payload type
 */
public final class Event<P extends EventPayload> {
    private final EventEnvelope envelope;
    private final P             payload;

    public Event(EventEnvelope envelope, P payload) {
        this.envelope = requireNonNull(envelope, "No envelope provided");
        this.payload = requireNonNull(payload, "No payload provided");
    }

    /**
     * Create a new event caused by <code>command</code>, timestamped now (UTC)
     *
     * @param eventId     the event identifier
     * @param command     the command that caused the event
     * @param aggregateId the id of the aggregate the event belongs to (must not be empty)
     * @param payload     the event payload
     */
    public static <P extends EventPayload> Event<P> of(EventId eventId, Command<?> command, String aggregateId, P payload) {
        return of(eventId, command, aggregateId, payload, Clock.systemUTC());
    }

    public static <P extends EventPayload> Event<P> of(EventId eventId, Command<?> command, String aggregateId, P payload, Clock clock) {
        requireNonNull(command, "No command provided");
        return new Event<>(new EventEnvelope(eventId,
                                             aggregateId,
                                             command.aggregateType(),
                                             EventEnvelope.now(clock),
                                             command.correlationId()),
                           payload);
    }

    public EventEnvelope envelope() {
        return envelope;
    }

    public P payload() {
        return payload;
    }

    public EventId eventId() {
        return envelope.eventId();
    }

    public String aggregateId() {
        return envelope.aggregateId();
    }

    public AggregateType aggregateType() {
        return envelope.aggregateType();
    }

    public OffsetDateTime createdAt() {
        return envelope.createdAt();
    }

    public CorrelationId correlationId() {
        return envelope.correlationId();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Event)) return false;
        Event<?> event = (Event<?>) o;
        return envelope.equals(event.envelope) && payload.equals(event.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(envelope, payload);
    }

    @Override
    public String toString() {
        return "Event{" +
                "envelope=" + envelope +
                ", payload=" + payload +
                '}';
    }
}
