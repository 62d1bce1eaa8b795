package dk.cloudcreate.cqrs.aggregates.command;

import dk.cloudcreate.cqrs.aggregates.AggregateRoot;

/**
 * Marker for the data carried by a {@link Command}. Every concrete command shape is a {@link CommandPayload}
 * registered with a {@link dk.cloudcreate.cqrs.common.types.CommandId} in the
 * {@link dk.cloudcreate.cqrs.aggregates.serialization.SerializationRegistry}
 */
public interface CommandPayload {
    /**
     * Self validation of the command against the current state of the target aggregate, performed
     * after the aggregate has been loaded and before any cross-cutting {@link CommandValidator} runs.<br>
     * The default implementation accepts every command.
     *
     * @param command       the command carrying this payload
     * @param aggregateRoot the loaded (possibly empty) target aggregate
     * @throws CommandValidationException if the command isn't valid
     */
    default void validate(Command<?> command, AggregateRoot aggregateRoot) {
    }
}
