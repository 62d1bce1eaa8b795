package dk.cloudcreate.cqrs.bus.outcome;

import dk.cloudcreate.cqrs.bus.CommandBusException;
import dk.cloudcreate.cqrs.common.types.CorrelationId;

/**
 * The command was handled and failed. {@link #getMessage()} is the error message published by the handling side
 */
public class RemoteCommandException extends CommandBusException {
    public final CorrelationId correlationId;

    public RemoteCommandException(CorrelationId correlationId, String message) {
        super(message);
        this.correlationId = correlationId;
    }
}
