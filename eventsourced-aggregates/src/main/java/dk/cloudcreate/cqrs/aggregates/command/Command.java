package dk.cloudcreate.cqrs.aggregates.command;

import dk.cloudcreate.cqrs.aggregates.AggregateRoot;
import dk.cloudcreate.cqrs.common.types.*;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * An immutable request to change a single aggregate.<br>
 * A command is made up of a {@link CommandEnvelope} with the routing and correlation metadata and a
 * {@link CommandPayload} with the command specific data.
 *
 * @param <P> the payload type
 */
public final class Command<P extends CommandPayload> {
    private final CommandEnvelope envelope;
    private final P               payload;

    public Command(CommandEnvelope envelope, P payload) {
        this.envelope = requireNonNull(envelope, "No envelope provided");
        this.payload = requireNonNull(payload, "No payload provided");
    }

    /**
     * Create a command targeting an existing aggregate
     */
    public static <P extends CommandPayload> Command<P> of(CommandId commandId,
                                                           AggregateType aggregateType,
                                                           String aggregateId,
                                                           CorrelationId correlationId,
                                                           P payload) {
        return new Command<>(new CommandEnvelope(commandId, aggregateId, aggregateType, correlationId), payload);
    }

    /**
     * Create a command that creates a new aggregate (the aggregate id is empty)
     */
    public static <P extends CommandPayload> Command<P> creating(CommandId commandId,
                                                                 AggregateType aggregateType,
                                                                 CorrelationId correlationId,
                                                                 P payload) {
        return of(commandId, aggregateType, AggregateRoot.NO_AGGREGATE_ID, correlationId, payload);
    }

    /**
     * Run the payload's own validation against the loaded target aggregate
     *
     * @param aggregateRoot the loaded target aggregate
     * @throws CommandValidationException if the command is invalid
     */
    public void validate(AggregateRoot aggregateRoot) {
        requireNonNull(aggregateRoot, "No aggregateRoot provided");
        payload.validate(this, aggregateRoot);
    }

    public CommandEnvelope envelope() {
        return envelope;
    }

    public P payload() {
        return payload;
    }

    public CommandId commandId() {
        return envelope.commandId();
    }

    public String aggregateId() {
        return envelope.aggregateId();
    }

    public AggregateType aggregateType() {
        return envelope.aggregateType();
    }

    public CorrelationId correlationId() {
        return envelope.correlationId();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Command)) return false;
        Command<?> command = (Command<?>) o;
        return envelope.equals(command.envelope) && payload.equals(command.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(envelope, payload);
    }

    @Override
    public String toString() {
        return "Command{" +
                "envelope=" + envelope +
                ", payload=" + payload +
                '}';
    }
}
