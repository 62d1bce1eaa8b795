package dk.cloudcreate.cqrs.aggregates.event;

/**
 * Marker for the data carried by an {@link Event}. Event payloads are pure data
 */
public interface EventPayload {
}
