package dk.cloudcreate.cqrs.bus.test_data;

import dk.cloudcreate.cqrs.aggregates.*;
import dk.cloudcreate.cqrs.aggregates.command.*;
import dk.cloudcreate.cqrs.aggregates.event.*;
import dk.cloudcreate.cqrs.aggregates.serialization.SerializationRegistry;
import dk.cloudcreate.cqrs.common.types.*;

import java.util.*;

/**
 * Minimal aggregate used to drive commands through the bus
 */
public class Counter extends AbstractAggregateRoot {
    public static final AggregateType COUNTERS = AggregateType.of("counter");

    public static final CommandId CREATE    = CommandId.of("counter.create");
    public static final CommandId INCREMENT = CommandId.of("counter.increment");
    /**
     * Produces no event, so it leaves a new counter without identity
     */
    public static final CommandId TOUCH     = CommandId.of("counter.touch");

    public static final EventId CREATED     = EventId.of("counter.created");
    public static final EventId INCREMENTED = EventId.of("counter.incremented");

    public long value;

    public static SerializationRegistry serializationRegistry() {
        return new SerializationRegistry().registerCommand(CREATE, CreateCounter.class)
                                          .registerCommand(INCREMENT, Increment.class)
                                          .registerCommand(TOUCH, Touch.class)
                                          .registerEvent(CREATED, CounterCreated.class)
                                          .registerEvent(INCREMENTED, Incremented.class);
    }

    @Override
    public void handleCommand(Command<?> command) {
        var payload = command.payload();
        if (payload instanceof CreateCounter) {
            applyNewEvent(CREATED, command, UUID.randomUUID().toString(), new CounterCreated());
        } else if (payload instanceof Increment) {
            applyNewEvent(INCREMENTED, command, new Incremented(((Increment) payload).getBy()));
        } else if (!(payload instanceof Touch)) {
            throw UnknownCommandException.forCommand(command, this);
        }
    }

    @Override
    protected void applyEventToTheAggregate(Event<?> event) {
        var payload = event.payload();
        if (payload instanceof CounterCreated) {
            value = 0;
        } else if (payload instanceof Incremented) {
            value += ((Incremented) payload).getBy();
        } else {
            throw UnknownEventException.forEvent(event, this);
        }
    }

    public static class CreateCounter implements CommandPayload {
        public CreateCounter() {
        }

        @Override
        public void validate(Command<?> command, AggregateRoot aggregateRoot) {
            if (aggregateRoot.hasIdentity()) {
                throw new CommandValidationException("Counter already exists");
            }
        }

        @Override
        public boolean equals(Object o) {
            return o != null && getClass() == o.getClass();
        }

        @Override
        public int hashCode() {
            return CreateCounter.class.hashCode();
        }

        @Override
        public String toString() {
            return "CreateCounter{}";
        }
    }

    public static class Increment implements CommandPayload {
        private long by;

        public Increment() {
        }

        public Increment(long by) {
            this.by = by;
        }

        public long getBy() {
            return by;
        }

        @Override
        public void validate(Command<?> command, AggregateRoot aggregateRoot) {
            if (!aggregateRoot.hasIdentity()) {
                throw new CommandValidationException("Counter doesn't exist");
            }
            if (by <= 0) {
                throw new CommandValidationException("Increment must be positive");
            }
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Increment that = (Increment) o;
            return by == that.by;
        }

        @Override
        public int hashCode() {
            return Objects.hash(by);
        }

        @Override
        public String toString() {
            return "Increment{" + "by=" + by + "}";
        }
    }

    public static class Touch implements CommandPayload {
        public Touch() {
        }

        @Override
        public boolean equals(Object o) {
            return o != null && getClass() == o.getClass();
        }

        @Override
        public int hashCode() {
            return Touch.class.hashCode();
        }

        @Override
        public String toString() {
            return "Touch{}";
        }
    }

    public static class CounterCreated implements EventPayload {
        public CounterCreated() {
        }

        @Override
        public boolean equals(Object o) {
            return o != null && getClass() == o.getClass();
        }

        @Override
        public int hashCode() {
            return CounterCreated.class.hashCode();
        }

        @Override
        public String toString() {
            return "CounterCreated{}";
        }
    }

    public static class Incremented implements EventPayload {
        private long by;

        public Incremented() {
        }

        public Incremented(long by) {
            this.by = by;
        }

        public long getBy() {
            return by;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Incremented that = (Incremented) o;
            return by == that.by;
        }

        @Override
        public int hashCode() {
            return Objects.hash(by);
        }

        @Override
        public String toString() {
            return "Incremented{" + "by=" + by + "}";
        }
    }
}
