package dk.cloudcreate.cqrs.eventstore.postgresql;

import dk.cloudcreate.cqrs.aggregates.event.*;
import dk.cloudcreate.cqrs.aggregates.serialization.SerializationRegistry;
import dk.cloudcreate.cqrs.common.types.*;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.*;
import java.time.OffsetDateTime;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Maps a row of the events table back to an {@link Event}. The payload is decoded through the {@link SerializationRegistry}
 * using the event identifier stored next to it
 */
class EventRowMapper implements RowMapper<Event<?>> {
    private final SerializationRegistry serializationRegistry;

    EventRowMapper(SerializationRegistry serializationRegistry) {
        this.serializationRegistry = requireNonNull(serializationRegistry, "No serializationRegistry provided");
    }

    @Override
    public Event<?> map(ResultSet rs, StatementContext ctx) throws SQLException {
        var eventId = EventId.of(rs.getString("event_id"));
        return new Event<>(new EventEnvelope(eventId,
                                             rs.getString("aggregate_id"),
                                             AggregateType.of(rs.getString("aggregate_type")),
                                             rs.getObject("created_at", OffsetDateTime.class),
                                             CorrelationId.of(rs.getString("correlation_id"))),
                           serializationRegistry.deserializeEventPayload(eventId, rs.getString("payload")));
    }
}
