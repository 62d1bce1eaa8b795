package dk.cloudcreate.cqrs.aggregates.eventstore;

import dk.cloudcreate.cqrs.aggregates.event.Event;

/**
 * Callback invoked by an {@link EventStore} once for every event after the batch containing it has been persisted.<br>
 * Hooks are best effort: an exception thrown by a hook is logged by the {@link EventStore} and never undoes the save
 */
@FunctionalInterface
public interface EventHook {
    void afterSave(Event<?> event);
}
