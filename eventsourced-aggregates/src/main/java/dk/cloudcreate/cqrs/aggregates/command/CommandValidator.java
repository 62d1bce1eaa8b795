package dk.cloudcreate.cqrs.aggregates.command;

import dk.cloudcreate.cqrs.aggregates.AggregateRoot;

/**
 * Cross-cutting validation performed by the {@link CommandHandler} after the command's own validation,
 * e.g. uniqueness checks that span many aggregates.<br>
 * All registered validators are run for every command and all their failures are reported together.
 */
@FunctionalInterface
public interface CommandValidator {
    /**
     * @param command       the command to validate
     * @param aggregateRoot the loaded target aggregate
     * @throws RuntimeException (typically {@link CommandValidationException}) describing why the command is rejected
     */
    void validate(Command<?> command, AggregateRoot aggregateRoot);
}
