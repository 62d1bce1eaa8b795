package dk.cloudcreate.cqrs.aggregates.eventstore;

import dk.cloudcreate.cqrs.aggregates.event.Event;
import dk.cloudcreate.cqrs.common.types.EventId;

import java.util.*;

/**
 * Append only storage of {@link Event}'s grouped per aggregate id.
 * <p>
 * Guarantees:
 * <ul>
 *     <li>{@link #save(List)} is atomic per batch: either every event in the batch becomes visible to {@link #load(String)} or none does</li>
 *     <li>{@link #load(String)} returns the events of an aggregate ordered by creation timestamp, oldest first</li>
 *     <li>Registered {@link EventHook}'s are invoked once per event after the batch has been persisted</li>
 * </ul>
 * The store doesn't check for concurrent modifications of the same aggregate: two commands for the same aggregate
 * that load the same history can both append their events.
 */
public interface EventStore {
    /**
     * Load all events related to the aggregate with the given id
     *
     * @param aggregateId the aggregate id
     * @return the events ordered by creation timestamp or an empty list if the aggregate is unknown
     * @throws EventStoreException in case the events couldn't be loaded
     */
    List<Event<?>> load(String aggregateId);

    /**
     * Persist a batch of events atomically and afterwards notify the registered {@link EventHook}'s
     *
     * @param events the events to persist
     * @throws EventStoreException in case the events couldn't be persisted. None of the events are persisted in that case
     */
    void save(List<Event<?>> events);

    /**
     * Register a hook that is called for every event after it has been saved
     *
     * @param hook the hook
     * @return this event store instance
     */
    EventStore addAfterSaveHook(EventHook hook);

    /**
     * Load all events, across every aggregate, whose {@link Event#eventId()} is one of the given identifiers.<br>
     * Used to initialize auxiliary indexes such as uniqueness validators and read models
     *
     * @param eventIds the event identifiers to include
     * @return the matching events ordered by creation timestamp
     */
    List<Event<?>> loadEventsOfType(Collection<EventId> eventIds);
}
