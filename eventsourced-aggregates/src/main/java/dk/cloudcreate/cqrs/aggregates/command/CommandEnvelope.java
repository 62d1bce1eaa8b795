package dk.cloudcreate.cqrs.aggregates.command;

import dk.cloudcreate.cqrs.common.types.*;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The metadata shared by all commands: which command shape it is, which aggregate it targets and
 * the correlation id the outcome will be reported under.<br>
 * The aggregate id is an empty string for commands that create a new aggregate.
 */
public final class CommandEnvelope {
    private final CommandId     commandId;
    private final String        aggregateId;
    private final AggregateType aggregateType;
    private final CorrelationId correlationId;

    public CommandEnvelope(CommandId commandId,
                           String aggregateId,
                           AggregateType aggregateType,
                           CorrelationId correlationId) {
        this.commandId = requireNonNull(commandId, "No commandId provided");
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided (use an empty string for creation commands)");
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.correlationId = requireNonNull(correlationId, "No correlationId provided");
    }

    public CommandId commandId() {
        return commandId;
    }

    public String aggregateId() {
        return aggregateId;
    }

    public AggregateType aggregateType() {
        return aggregateType;
    }

    public CorrelationId correlationId() {
        return correlationId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CommandEnvelope)) return false;
        CommandEnvelope that = (CommandEnvelope) o;
        return commandId.equals(that.commandId) &&
                aggregateId.equals(that.aggregateId) &&
                aggregateType.equals(that.aggregateType) &&
                correlationId.equals(that.correlationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commandId, aggregateId, aggregateType, correlationId);
    }

    @Override
    public String toString() {
        return "CommandEnvelope{" +
                "commandId=" + commandId +
                ", aggregateId='" + aggregateId + '\'' +
                ", aggregateType=" + aggregateType +
                ", correlationId=" + correlationId +
                '}';
    }
}
