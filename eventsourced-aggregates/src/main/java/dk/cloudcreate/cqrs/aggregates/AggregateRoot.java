package dk.cloudcreate.cqrs.aggregates;

import dk.cloudcreate.cqrs.aggregates.command.Command;
import dk.cloudcreate.cqrs.aggregates.event.Event;
import dk.cloudcreate.cqrs.aggregates.repository.Repository;

import java.util.List;

/**
 * A consistency boundary whose state is derived entirely by applying its events in order.<br>
 * An aggregate root is created empty (without identity) by an {@link AggregateRootFactory}, rebuilt by the
 * {@link Repository} through {@link #apply(boolean, Event)} with <code>isNew == false</code> for every historic
 * event, and changed by {@link #handleCommand(Command)} which applies new events with <code>isNew == true</code>.
 * New events are kept as {@link #uncommittedChanges()} until the {@link Repository} has persisted them.
 * <p>
 * Implementations must be deterministic: replaying the same events in the same order always yields the same state.
 *
 * @see AbstractAggregateRoot
 */
public interface AggregateRoot {
    /**
     * The aggregate id of an aggregate that hasn't been initialized yet
     */
    String NO_AGGREGATE_ID = "";

    /**
     * @return the aggregate id or {@link #NO_AGGREGATE_ID} if the aggregate hasn't been initialized
     */
    String aggregateId();

    /**
     * @return true if the aggregate has been initialized, i.e. {@link #aggregateId()} isn't empty
     */
    default boolean hasIdentity() {
        return !aggregateId().isEmpty();
    }

    /**
     * Decide which events the command results in and apply them as new events
     *
     * @param command the command to handle
     * @throws UnknownCommandException if the command payload isn't supported by this aggregate
     */
    void handleCommand(Command<?> command);

    /**
     * Apply an event to the aggregate state
     *
     * @param isNew true if the event is a new, not yet persisted, event. Only new events are added to {@link #uncommittedChanges()}
     * @param event the event to apply
     * @throws UnknownEventException if the event payload isn't supported by this aggregate
     */
    void apply(boolean isNew, Event<?> event);

    /**
     * The events that have been applied as new events but haven't been persisted yet, in the order they were applied
     */
    List<Event<?>> uncommittedChanges();

    /**
     * Clear the {@link #uncommittedChanges()}, marking them as persisted
     */
    void markChangesAsCommitted();
}
