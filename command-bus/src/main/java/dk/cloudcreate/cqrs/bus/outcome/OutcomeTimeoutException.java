package dk.cloudcreate.cqrs.bus.outcome;

import dk.cloudcreate.cqrs.bus.CommandBusException;
import dk.cloudcreate.cqrs.common.types.CorrelationId;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * No outcome arrived before the deadline. The command may still complete afterwards
 */
public class OutcomeTimeoutException extends CommandBusException {
    public final CorrelationId correlationId;

    public OutcomeTimeoutException(CorrelationId correlationId, long timeoutMillis) {
        super(msg("Timed out after {} ms waiting for the outcome of correlation id '{}'", timeoutMillis, correlationId));
        this.correlationId = correlationId;
    }
}
