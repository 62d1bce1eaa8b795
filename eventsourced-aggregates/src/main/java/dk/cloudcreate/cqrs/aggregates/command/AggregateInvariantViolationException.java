package dk.cloudcreate.cqrs.aggregates.command;

import dk.cloudcreate.cqrs.aggregates.AggregateException;

/**
 * Internal error: an aggregate finished handling a command without having an identity
 */
public class AggregateInvariantViolationException extends AggregateException {
    public AggregateInvariantViolationException(String message) {
        super(message);
    }
}
