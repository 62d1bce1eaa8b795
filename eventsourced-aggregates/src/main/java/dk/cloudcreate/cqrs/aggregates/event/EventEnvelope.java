package dk.cloudcreate.cqrs.aggregates.event;

import dk.cloudcreate.cqrs.common.types.*;

import java.time.*;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * The metadata every {@link Event} carries.<br>
 * The aggregate id is never empty and the creation timestamp is always in UTC.
 * Timestamps are kept with microsecond precision so they survive a round trip through the event store unchanged.
 */
public final class EventEnvelope {
    private final EventId        eventId;
    private final String         aggregateId;
    private final AggregateType  aggregateType;
    private final OffsetDateTime createdAt;
    private final CorrelationId  correlationId;

    public EventEnvelope(EventId eventId,
                         String aggregateId,
                         AggregateType aggregateType,
                         OffsetDateTime createdAt,
                         CorrelationId correlationId) {
        this.eventId = requireNonNull(eventId, "No eventId provided");
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        requireTrue(!aggregateId.isEmpty(), "An event must belong to an aggregate with a non empty aggregateId");
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.createdAt = requireNonNull(createdAt, "No createdAt provided").withOffsetSameInstant(ZoneOffset.UTC);
        this.correlationId = requireNonNull(correlationId, "No correlationId provided");
    }

    /**
     * The current time in UTC, truncated to microseconds
     */
    public static OffsetDateTime now(Clock clock) {
        return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS);
    }

    public EventId eventId() {
        return eventId;
    }

    public String aggregateId() {
        return aggregateId;
    }

    public AggregateType aggregateType() {
        return aggregateType;
    }

    public OffsetDateTime createdAt() {
        return createdAt;
    }

    public CorrelationId correlationId() {
        return correlationId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventEnvelope)) return false;
        EventEnvelope that = (EventEnvelope) o;
        return eventId.equals(that.eventId) &&
                aggregateId.equals(that.aggregateId) &&
                aggregateType.equals(that.aggregateType) &&
                createdAt.isEqual(that.createdAt) &&
                correlationId.equals(that.correlationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, aggregateId, aggregateType, createdAt.toInstant(), correlationId);
    }

    @Override
    public String toString() {
        return "EventEnvelope{" +
                "eventId=" + eventId +
                ", aggregateId='" + aggregateId + '\'' +
                ", aggregateType=" + aggregateType +
                ", createdAt=" + createdAt +
                ", correlationId=" + correlationId +
                '}';
    }
}
