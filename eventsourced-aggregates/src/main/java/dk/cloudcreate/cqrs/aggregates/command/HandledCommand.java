package dk.cloudcreate.cqrs.aggregates.command;

import dk.cloudcreate.cqrs.aggregates.event.Event;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The result of a successfully handled {@link Command}: the id of the changed (or created) aggregate and the events that were persisted
 */
public final class HandledCommand {
    private final String         aggregateId;
    private final List<Event<?>> persistedEvents;

    public HandledCommand(String aggregateId, List<Event<?>> persistedEvents) {
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.persistedEvents = List.copyOf(requireNonNull(persistedEvents, "No persistedEvents provided"));
    }

    public String aggregateId() {
        return aggregateId;
    }

    public List<Event<?>> persistedEvents() {
        return persistedEvents;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HandledCommand)) return false;
        HandledCommand that = (HandledCommand) o;
        return aggregateId.equals(that.aggregateId) && persistedEvents.equals(that.persistedEvents);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateId, persistedEvents);
    }

    @Override
    public String toString() {
        return "HandledCommand{" +
                "aggregateId='" + aggregateId + '\'' +
                ", persistedEvents=" + persistedEvents.size() +
                '}';
    }
}
