package dk.cloudcreate.cqrs.aggregates;

import dk.cloudcreate.cqrs.aggregates.command.Command;
import dk.cloudcreate.cqrs.aggregates.event.*;
import dk.cloudcreate.cqrs.common.types.EventId;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Base class for {@link AggregateRoot} implementations that takes care of identity and uncommitted changes.<br>
 * The aggregate id is taken from the first event ever applied to the aggregate (typically the creation event) and never changes after that.
 * Every following event must belong to the same aggregate id.
 * <p>
 * Subclasses implement {@link #handleCommand(Command)} and {@link #applyEventToTheAggregate(Event)}. To produce a new event
 * from a command handler call {@link #applyNewEvent(EventId, Command, EventPayload)}.
 * <p>
 * Instances may be created by {@link AggregateRootFactory#objenesis(Class)} which doesn't run constructors or field initializers,
 * so fields in this class are initialized lazily.
 */
public abstract class AbstractAggregateRoot implements AggregateRoot {
    private String         aggregateId;
    private List<Event<?>> uncommittedChanges;

    @Override
    public String aggregateId() {
        return aggregateId == null ? NO_AGGREGATE_ID : aggregateId;
    }

    @Override
    public final void apply(boolean isNew, Event<?> event) {
        requireNonNull(event, "You must supply an event");
        if (aggregateId != null && !aggregateId.equals(event.aggregateId())) {
            throw new AggregateException(msg("Aggregate Id's do not match! Cannot apply Event '{}' with aggregateId '{}' to Aggregate '{}' with aggregateId '{}'",
                                             event.eventId(),
                                             event.aggregateId(),
                                             this.getClass().getName(),
                                             aggregateId));
        }
        if (aggregateId == null && !isCreatedBy(event)) {
            throw new AggregateException(msg("Cannot apply Event '{}' with aggregateId '{}' to Aggregate '{}' without identity. The first event must be a creation event",
                                             event.eventId(),
                                             event.aggregateId(),
                                             this.getClass().getName()));
        }
        applyEventToTheAggregate(event);
        if (aggregateId == null) {
            aggregateId = event.aggregateId();
        }
        if (isNew) {
            _uncommittedChanges().add(event);
        }
    }

    /**
     * Create a new event caused by <code>command</code> for this aggregate and apply it as a new event
     *
     * @param eventId the event identifier
     * @param command the command being handled
     * @param payload the event payload
     * @return the applied event
     */
    protected <P extends EventPayload> Event<P> applyNewEvent(EventId eventId, Command<?> command, P payload) {
        return applyNewEvent(eventId, command, aggregateId(), payload);
    }

    /**
     * Variant of {@link #applyNewEvent(EventId, Command, EventPayload)} used by creation command handlers where the
     * aggregate doesn't have an identity yet
     */
    protected <P extends EventPayload> Event<P> applyNewEvent(EventId eventId, Command<?> command, String aggregateId, P payload) {
        var event = Event.of(eventId, command, aggregateId, payload);
        apply(true, event);
        return event;
    }

    /**
     * Can the event start the history of the aggregate and give it its identity?<br>
     * Any event can by default; aggregates with a dedicated creation event override this
     */
    protected boolean isCreatedBy(Event<?> event) {
        return true;
    }

    /**
     * Update the aggregate state to reflect the event. Must not have any side effects besides changing the aggregate state.
     *
     * @param event the event to apply
     * @throws UnknownEventException if the event isn't supported
     */
    protected abstract void applyEventToTheAggregate(Event<?> event);

    @Override
    public List<Event<?>> uncommittedChanges() {
        return Collections.unmodifiableList(new ArrayList<>(_uncommittedChanges()));
    }

    @Override
    public void markChangesAsCommitted() {
        uncommittedChanges = new ArrayList<>();
    }

    private List<Event<?>> _uncommittedChanges() {
        if (uncommittedChanges == null) {
            uncommittedChanges = new ArrayList<>();
        }
        return uncommittedChanges;
    }
}
