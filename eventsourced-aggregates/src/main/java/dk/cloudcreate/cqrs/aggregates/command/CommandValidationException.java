package dk.cloudcreate.cqrs.aggregates.command;

import dk.cloudcreate.cqrs.aggregates.AggregateException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a {@link Command} is rejected, either by its own {@link CommandPayload#validate(Command, dk.cloudcreate.cqrs.aggregates.AggregateRoot)}
 * or by one or more registered {@link CommandValidator}'s.<br>
 * When several validators reject the same command the individual failures are available through {@link #getSuppressed()}
 */
public class CommandValidationException extends AggregateException {
    public CommandValidationException(String message) {
        super(message);
    }

    public CommandValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Combine all validation failures into a single exception
     *
     * @param failures the failures reported by the validators (must contain at least one)
     * @return the combined exception
     */
    public static CommandValidationException combine(List<? extends RuntimeException> failures) {
        if (failures.size() == 1 && failures.get(0) instanceof CommandValidationException) {
            return (CommandValidationException) failures.get(0);
        }
        var combined = new CommandValidationException(failures.stream()
                                                              .map(Throwable::getMessage)
                                                              .collect(Collectors.joining("; ")));
        failures.forEach(combined::addSuppressed);
        return combined;
    }
}
