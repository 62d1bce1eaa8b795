package dk.cloudcreate.cqrs.aggregates;

import dk.cloudcreate.cqrs.aggregates.command.Command;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown by {@link AggregateRoot#handleCommand(Command)} when the command payload isn't one the aggregate knows how to handle
 */
public class UnknownCommandException extends AggregateException {
    public UnknownCommandException(String message) {
        super(message);
    }

    public static UnknownCommandException forCommand(Command<?> command, AggregateRoot aggregateRoot) {
        return new UnknownCommandException(msg("Aggregate '{}' doesn't support command '{}' with payload type '{}'",
                                               aggregateRoot.getClass().getName(),
                                               command.commandId(),
                                               command.payload().getClass().getName()));
    }
}
